package planviz.zonemap.overlay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Road features grouped by the collection they were listed under. Read-only once parsed. */
public final class RoadNetwork {

    private static final RoadNetwork EMPTY = new RoadNetwork(new EnumMap<>(RoadClass.class));

    private final Map<RoadClass, List<RoadFeature>> byCategory;

    public RoadNetwork(Map<RoadClass, List<RoadFeature>> features) {
        EnumMap<RoadClass, List<RoadFeature>> m = new EnumMap<>(RoadClass.class);
        if (features != null) {
            for (Map.Entry<RoadClass, List<RoadFeature>> e : features.entrySet()) {
                m.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
            }
        }
        this.byCategory = Collections.unmodifiableMap(m);
    }

    public static RoadNetwork empty() { return EMPTY; }

    public List<RoadFeature> features(RoadClass category) {
        return byCategory.getOrDefault(category, List.of());
    }

    public int count(RoadClass category) {
        return features(category).size();
    }

    public int totalCount() {
        int n = 0;
        for (List<RoadFeature> l : byCategory.values()) n += l.size();
        return n;
    }

    public boolean isEmpty() { return totalCount() == 0; }

    /** Features whose collection is in {@code visible}, in {@link RoadClass} order. */
    public List<RoadFeature> visibleFeatures(Set<RoadClass> visible) {
        List<RoadFeature> out = new ArrayList<>();
        for (RoadClass c : RoadClass.values()) {
            if (visible == null || visible.contains(c)) out.addAll(features(c));
        }
        return out;
    }

    /** Box around every road coordinate, or null when there are none. */
    public GeoBounds featureBounds() {
        GeoBounds.Builder b = new GeoBounds.Builder();
        for (List<RoadFeature> l : byCategory.values()) {
            for (RoadFeature f : l) {
                for (List<double[]> part : f.getParts()) {
                    for (double[] c : part) b.add(c[0], c[1]);
                }
            }
        }
        return b.build();
    }

    /** Polygon box when usable, else the roads' own box, else null (full-canvas fallback). */
    public GeoBounds resolveBounds(GeoBounds polygonBounds) {
        if (polygonBounds != null && polygonBounds.isUsable()) return polygonBounds;
        GeoBounds fb = featureBounds();
        return (fb != null && fb.isUsable()) ? fb : null;
    }
}
