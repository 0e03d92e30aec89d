package planviz.zonemap.overlay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One road geometry. A LineString has exactly one part, a MultiLineString one or more.
 * Every coordinate is a finite {@code [lon, lat]} pair.
 */
public final class RoadFeature {

    private final RoadClass category;
    private final RoadClass styleClass;
    private final GeometryKind kind;
    private final List<List<double[]>> parts;

    /**
     * @param category   collection the feature was listed under (drives visibility)
     * @param styleClass from the feature's {@code road_type} (drives the stroke style)
     */
    public RoadFeature(RoadClass category, RoadClass styleClass, GeometryKind kind, List<List<double[]>> parts) {
        if (kind == null) throw new IllegalArgumentException("kind is null");
        if (parts == null || parts.isEmpty()) throw new IllegalArgumentException("Road feature has no lines.");
        if (kind == GeometryKind.LINE_STRING && parts.size() != 1) {
            throw new IllegalArgumentException("A LineString has exactly one part.");
        }
        this.category = category;
        this.styleClass = (styleClass == null) ? RoadClass.LOCAL : styleClass;
        this.kind = kind;
        List<List<double[]>> copy = new ArrayList<>(parts.size());
        for (List<double[]> p : parts) {
            List<double[]> line = new ArrayList<>(p.size());
            for (double[] c : p) line.add(new double[]{c[0], c[1]});
            copy.add(Collections.unmodifiableList(line));
        }
        this.parts = Collections.unmodifiableList(copy);
    }

    public RoadClass getCategory() { return category; }
    public RoadClass getStyleClass() { return styleClass; }
    public GeometryKind getKind() { return kind; }
    public List<List<double[]>> getParts() { return parts; }

    public int pointCount() {
        int n = 0;
        for (List<double[]> p : parts) n += p.size();
        return n;
    }
}
