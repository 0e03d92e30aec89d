package planviz.zonemap.overlay;

public enum GeometryKind {
    LINE_STRING("LineString"),
    MULTI_LINE_STRING("MultiLineString");

    private final String geoJsonName;

    GeometryKind(String geoJsonName) {
        this.geoJsonName = geoJsonName;
    }

    public String getGeoJsonName() { return geoJsonName; }

    /** Null for anything that is not a line geometry. */
    public static GeometryKind fromGeoJson(String type) {
        if (type == null) return null;
        for (GeometryKind k : values()) {
            if (k.geoJsonName.equals(type)) return k;
        }
        return null;
    }
}
