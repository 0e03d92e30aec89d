package planviz.zonemap.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import planviz.zonemap.detect.Candidate;
import planviz.zonemap.edit.EditSession;
import planviz.zonemap.edit.EditTool;
import planviz.zonemap.model.Fixtures;
import planviz.zonemap.model.PixelBuffer;
import planviz.zonemap.model.ZoneType;
import planviz.zonemap.overlay.GeoBounds;
import planviz.zonemap.overlay.OverlayParser;
import planviz.zonemap.overlay.RoadClass;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RenderPipelineTest {

    /** One primary road straight across the middle of the box. */
    private static final String ROAD = "{\"primary_roads\": {\"features\": ["
            + "{\"geometry\": {\"type\": \"LineString\", \"coordinates\": [[0.0, 0.5], [1.0, 0.5]]},"
            + " \"properties\": {\"road_type\": \"primary\"}}]}}";

    private static final GeoBounds UNIT = new GeoBounds(0, 1, 0, 1);

    private static RenderPipeline withRoad() {
        RenderPipeline p = new RenderPipeline();
        p.setRoadNetwork(OverlayParser.parseRoadNetwork(ROAD));
        p.setPolygonBounds(UNIT);
        return p;
    }

    @Test
    @DisplayName("export draws roads over the canvas")
    void exportWithRoads() {
        PixelBuffer canvas = Fixtures.white(200, 100);

        BufferedImage out = withRoad().renderExport(canvas);

        assertThat(out.getRGB(100, 50)).isNotEqualTo(Fixtures.WHITE);
        assertThat(out.getRGB(100, 10)).isEqualTo(Fixtures.WHITE);
    }

    @Test
    @DisplayName("hidden road classes and the master switch suppress drawing")
    void hiddenRoads() {
        RenderPipeline p = withRoad();
        p.setRoadVisible(RoadClass.PRIMARY, false);
        assertThat(p.renderExport(Fixtures.white(200, 100)).getRGB(100, 50)).isEqualTo(Fixtures.WHITE);

        p.setRoadVisible(RoadClass.PRIMARY, true);
        p.setShowRoads(false);
        assertThat(p.renderExport(Fixtures.white(200, 100)).getRGB(100, 50)).isEqualTo(Fixtures.WHITE);
    }

    @Test
    @DisplayName("roads fall back to their own extent when no polygon is set")
    void roadsOwnExtent() {
        String twoRoads = "{\"local_roads\": {\"features\": ["
                + "{\"geometry\": {\"type\": \"LineString\", \"coordinates\": [[0.0, 0.0], [1.0, 1.0]]}}]}}";
        RenderPipeline p = new RenderPipeline();
        p.setRoadNetwork(OverlayParser.parseRoadNetwork(twoRoads));

        assertThat(p.transformFor(100, 100).hasGeoBounds()).isTrue();
    }

    @Test
    @DisplayName("no usable bounds means no roads are drawn")
    void noBounds() {
        String oneVertical = "{\"local_roads\": {\"features\": ["
                + "{\"geometry\": {\"type\": \"LineString\", \"coordinates\": [[0.5, 0.0], [0.5, 1.0]]}}]}}";
        RenderPipeline p = new RenderPipeline();
        p.setRoadNetwork(OverlayParser.parseRoadNetwork(oneVertical));

        BufferedImage img = new BufferedImage(50, 50, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            assertThat(p.drawRoads(g, 50, 50)).isZero();
        } finally {
            g.dispose();
        }
    }

    @Test
    @DisplayName("export leaves out the move-tool outlines the display shows")
    void exportHasNoDecorations() {
        Rectangle r = new Rectangle(20, 20, 60, 40);
        EditSession session = new EditSession();
        session.loadImage(Fixtures.white(200, 100));
        session.setBlocks(List.of(new Candidate(r, r, ZoneType.RESIDENTIAL, Fixtures.BLUE)));
        session.selectTool(EditTool.MOVE);
        RenderPipeline p = new RenderPipeline();

        BufferedImage display = new BufferedImage(200, 100, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = display.createGraphics();
        try {
            p.renderDisplay(g, session);
        } finally {
            g.dispose();
        }
        BufferedImage export = p.renderExport(session.getCanvas());

        assertThat(display.getRGB(r.x, r.y)).isNotEqualTo(Fixtures.WHITE);
        assertThat(export.getRGB(r.x, r.y)).isEqualTo(Fixtures.WHITE);
    }
}
