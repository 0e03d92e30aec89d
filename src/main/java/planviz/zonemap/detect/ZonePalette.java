package planviz.zonemap.detect;

import planviz.zonemap.model.ZoneType;

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Zone palette in scan priority order. Specific zones (commercial, parks, amenities) come
 * before the broad residential tints so a similar-looking pixel is not claimed by the wrong zone.
 */
public final class ZonePalette {

    /** Best palette hit for a pixel. */
    public static final class Match {
        private final PaletteEntry entry;
        private final Color color;
        private final double distance;

        Match(PaletteEntry entry, Color color, double distance) {
            this.entry = entry;
            this.color = color;
            this.distance = distance;
        }

        public PaletteEntry getEntry() { return entry; }
        public Color getColor() { return color; }
        public double getDistance() { return distance; }
    }

    private final List<PaletteEntry> entries;

    public ZonePalette(List<PaletteEntry> entriesInPriorityOrder) {
        if (entriesInPriorityOrder == null || entriesInPriorityOrder.isEmpty()) {
            throw new IllegalArgumentException("Palette is empty.");
        }
        this.entries = Collections.unmodifiableList(new ArrayList<>(entriesInPriorityOrder));
    }

    /** Colors of the generated zoning renders. */
    public static ZonePalette defaults() {
        List<PaletteEntry> list = new ArrayList<>();

        list.add(PaletteEntry.of(ZoneType.COMMERCIAL, 60,
                new int[]{255, 107, 107}, new int[]{255, 115, 115}, new int[]{255, 100, 100},
                new int[]{250, 110, 110}, new int[]{245, 105, 105}, new int[]{240, 100, 100},
                new int[]{230, 95, 95},
                new int[]{251, 191, 138},   // steep-slope warning tint
                new int[]{251, 146, 60},    // very steep
                new int[]{201, 42, 42}));   // edge

        list.add(PaletteEntry.of(ZoneType.PARK, 35,
                new int[]{45, 212, 191}, new int[]{50, 220, 200}, new int[]{40, 200, 180},
                new int[]{20, 184, 166}, new int[]{16, 185, 129}, new int[]{30, 200, 175}));

        list.add(PaletteEntry.of(ZoneType.GREEN_SPACE, 30,
                new int[]{50, 205, 50}, new int[]{34, 139, 34}, new int[]{124, 252, 0}));

        list.add(PaletteEntry.of(ZoneType.AMENITIES, 65,
                new int[]{244, 114, 182}, new int[]{250, 130, 195}, new int[]{238, 100, 170},
                new int[]{251, 113, 133}, new int[]{255, 125, 145}, new int[]{245, 100, 120},
                new int[]{56, 189, 248}, new int[]{70, 200, 255}, new int[]{45, 175, 235},
                new int[]{250, 204, 21}, new int[]{255, 215, 35}, new int[]{245, 195, 15},
                // amenity markers alpha-blended over commercial red
                new int[]{200, 120, 140}, new int[]{180, 110, 120},
                new int[]{150, 150, 200}, new int[]{220, 160, 80}));

        list.add(PaletteEntry.of(ZoneType.MOSQUE, 40,
                new int[]{244, 114, 182}, new int[]{250, 125, 190}, new int[]{240, 105, 175},
                new int[]{236, 72, 153}, new int[]{219, 39, 119}, new int[]{230, 90, 165}));

        list.add(PaletteEntry.of(ZoneType.HOSPITAL, 40,
                new int[]{251, 113, 133}, new int[]{255, 125, 145}, new int[]{245, 100, 120},
                new int[]{244, 63, 94}, new int[]{225, 29, 72}, new int[]{235, 85, 110}));

        list.add(PaletteEntry.of(ZoneType.SCHOOL, 40,
                new int[]{56, 189, 248}, new int[]{70, 200, 255}, new int[]{45, 175, 235},
                new int[]{14, 165, 233}, new int[]{2, 132, 199}, new int[]{30, 180, 240}));

        list.add(PaletteEntry.of(ZoneType.GRID_STATION, 40,
                new int[]{250, 204, 21}, new int[]{255, 215, 35}, new int[]{245, 195, 15},
                new int[]{234, 179, 8}, new int[]{202, 138, 4}, new int[]{240, 190, 12}));

        list.add(PaletteEntry.of(ZoneType.RESIDENTIAL, 25,
                new int[]{219, 234, 254}, new int[]{191, 219, 254}, new int[]{147, 197, 253},
                new int[]{59, 130, 246}));  // editor default stamp/draw blue

        return new ZonePalette(list);
    }

    public List<PaletteEntry> getEntries() { return entries; }

    public PaletteEntry entryFor(ZoneType type) {
        for (PaletteEntry e : entries) {
            if (e.getType() == type) return e;
        }
        return null;
    }

    /** Copy with per-zone tolerances replaced; zones missing from the map keep theirs. */
    public ZonePalette withTolerances(Map<ZoneType, Double> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        List<PaletteEntry> list = new ArrayList<>(entries.size());
        for (PaletteEntry e : entries) {
            Double t = overrides.get(e.getType());
            list.add(t == null ? e : e.withTolerance(t));
        }
        return new ZonePalette(list);
    }

    /**
     * Closest reference color within its entry's tolerance, across all entries.
     * On equal distance the entry earlier in priority order wins. Null if nothing matches.
     */
    public Match closest(int r, int g, int b) {
        Match best = null;
        for (PaletteEntry e : entries) {
            for (Color c : e.getColors()) {
                double d = ColorMatcher.distance(r, g, b, c.getRed(), c.getGreen(), c.getBlue());
                if (d < e.getTolerance() && (best == null || d < best.distance)) {
                    best = new Match(e, c, d);
                }
            }
        }
        return best;
    }
}
