package planviz.zonemap.model;

public enum ZoneType {
    // Area zones (large blocks)
    RESIDENTIAL(false, "Residential"),
    COMMERCIAL(false, "Commercial"),
    PARK(false, "Park"),
    GREEN_SPACE(false, "Green Space"),

    // Overlay zones (point amenities drawn on top of area zones)
    AMENITIES(true, "Amenities"),
    MOSQUE(true, "Mosque"),
    HOSPITAL(true, "Hospital"),
    SCHOOL(true, "School"),
    GRID_STATION(true, "Grid Station"),

    // Stamped by the operator, never detected
    CUSTOM(false, "Custom");

    private final boolean overlay;
    private final String label;

    ZoneType(boolean overlay, String label) {
        this.overlay = overlay;
        this.label = label;
    }

    /** Overlay zones are small markers and get a smaller minimum size. */
    public boolean isOverlay() { return overlay; }
    public String getLabel()   { return label; }

    /**
     * Safe parser for enum names or display labels ("GRID_STATION", "Grid Station").
     * Returns null if unknown.
     */
    public static ZoneType fromName(String name) {
        if (name == null) return null;
        String t = name.trim();
        for (ZoneType z : values()) {
            if (z.name().equalsIgnoreCase(t) || z.label.equalsIgnoreCase(t)) return z;
        }
        return null;
    }
}
