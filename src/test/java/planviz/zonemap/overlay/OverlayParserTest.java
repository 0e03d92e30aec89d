package planviz.zonemap.overlay;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OverlayParserTest {

    static final String NETWORK = "{"
            + "\"primary_roads\": {\"type\": \"FeatureCollection\", \"features\": ["
            + "  {\"geometry\": {\"type\": \"LineString\", \"coordinates\": [[73.0, 33.5], [73.1, 33.5]]},"
            + "   \"properties\": {\"road_type\": \"primary\"}}"
            + "]},"
            + "\"local_roads\": {\"type\": \"FeatureCollection\", \"features\": ["
            + "  {\"geometry\": {\"type\": \"MultiLineString\", \"coordinates\": [[[73.0, 33.4], [73.05, 33.45]], [[73.06, 33.4], [73.1, 33.6]]]},"
            + "   \"properties\": {}},"
            + "  {\"geometry\": {\"type\": \"Point\", \"coordinates\": [73.0, 33.4]}},"
            + "  {\"geometry\": {\"type\": \"LineString\", \"coordinates\": [[73.0, \"x\"], [73.1, 33.5]]}}"
            + "]}"
            + "}";

    @Test
    @DisplayName("polygon bounds come from the outer ring")
    void polygonBounds() {
        String json = "{\"geojson\": {\"type\": \"Polygon\", \"coordinates\": "
                + "[[[73.0, 33.4], [73.2, 33.4], [73.2, 33.6], [73.0, 33.6], [73.0, 33.4]]]}}";

        GeoBounds b = OverlayParser.parsePolygonBounds(json);

        assertThat(b).isNotNull();
        assertThat(b.getMinLon()).isEqualTo(73.0);
        assertThat(b.getMaxLon()).isEqualTo(73.2);
        assertThat(b.getMinLat()).isEqualTo(33.4);
        assertThat(b.getMaxLat()).isEqualTo(33.6);
    }

    @Test
    @DisplayName("bare geometry and wrapped geometry are both accepted")
    void polygonShapes() {
        String ring = "[[[1, 2], [3, 4], [1, 4]]]";
        assertThat(OverlayParser.parsePolygonBounds("{\"coordinates\": " + ring + "}")).isNotNull();
        assertThat(OverlayParser.parsePolygonBounds("{\"geometry\": {\"coordinates\": " + ring + "}}")).isNotNull();
    }

    @Test
    @DisplayName("bad polygon input gives no bounds")
    void badPolygon() {
        assertThat(OverlayParser.parsePolygonBounds(null)).isNull();
        assertThat(OverlayParser.parsePolygonBounds("not json")).isNull();
        assertThat(OverlayParser.parsePolygonBounds("{\"geojson\": {}}")).isNull();
        assertThat(OverlayParser.parsePolygonBounds("{\"coordinates\": [[[1, 2], [1, 2]]]}")).isNull();
    }

    @Test
    @DisplayName("road network keeps line features and skips the rest")
    void roadNetwork() {
        RoadNetwork rn = OverlayParser.parseRoadNetwork(NETWORK);

        assertThat(rn.count(RoadClass.PRIMARY)).isEqualTo(1);
        assertThat(rn.count(RoadClass.LOCAL)).isEqualTo(1);
        assertThat(rn.totalCount()).isEqualTo(2);

        RoadFeature local = rn.features(RoadClass.LOCAL).get(0);
        assertThat(local.getKind()).isEqualTo(GeometryKind.MULTI_LINE_STRING);
        assertThat(local.getParts()).hasSize(2);
        assertThat(local.getStyleClass()).isEqualTo(RoadClass.LOCAL);
        assertThat(rn.features(RoadClass.PRIMARY).get(0).getStyleClass()).isEqualTo(RoadClass.PRIMARY);
    }

    @Test
    @DisplayName("a road_network wrapper is unwrapped")
    void wrapper() {
        RoadNetwork rn = OverlayParser.parseRoadNetwork("{\"road_network\": " + NETWORK + "}");
        assertThat(rn.totalCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("garbage gives an empty network")
    void garbage() {
        assertThat(OverlayParser.parseRoadNetwork("[1, 2")).isSameAs(RoadNetwork.empty());
        assertThat(OverlayParser.parseRoadNetwork("")).isSameAs(RoadNetwork.empty());
    }

    @Test
    @DisplayName("the network for a polygon is picked by id")
    void selectById() {
        String list = "{\"road_networks\": ["
                + "{\"polygon_id\": 7, \"road_network\": {}},"
                + "{\"polygon_id\": \"12\", \"road_network\": " + NETWORK + "}"
                + "]}";

        assertThat(OverlayParser.selectForPolygon(list, "12").totalCount()).isEqualTo(2);
        assertThat(OverlayParser.selectForPolygon(list, "7").isEmpty()).isTrue();
        assertThat(OverlayParser.selectForPolygon(list, "99")).isNull();
    }
}
