package planviz.zonemap.overlay;

import java.util.Locale;

/**
 * Road categories. {@code key} is the FeatureCollection name in a road-network document,
 * {@code tag} is the {@code road_type} value a feature carries.
 */
public enum RoadClass {
    PRIMARY("primary_roads", "primary", "Primary"),
    SECONDARY("secondary_roads", "secondary", "Secondary"),
    LOCAL("local_roads", "local", "Local"),
    RESIDENTIAL("residential_roads", "residential", "Residential"),
    PEDESTRIAN("pedestrian_network", "pedestrian", "Pedestrian"),
    BIKE("bike_network", "bike", "Bike"),
    EMERGENCY("emergency_routes", "emergency", "Emergency");

    private final String key;
    private final String tag;
    private final String label;

    RoadClass(String key, String tag, String label) {
        this.key = key;
        this.tag = tag;
        this.label = label;
    }

    public String getKey() { return key; }
    public String getTag() { return tag; }
    public String getLabel() { return label; }

    /** Class named by a {@code road_type} tag; unknown or missing tags are local roads. */
    public static RoadClass fromTag(String tag) {
        if (tag == null) return LOCAL;
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (RoadClass c : values()) {
            if (c.tag.equals(t) || c.key.equals(t)) return c;
        }
        return LOCAL;
    }
}
