package planviz.zonemap.render;

import planviz.zonemap.overlay.RoadClass;

import java.awt.BasicStroke;
import java.awt.Color;
import java.util.EnumMap;
import java.util.Map;

/** Stroke appearance per road class. */
public final class RoadStyle {

    private static final Map<RoadClass, RoadStyle> STYLES = new EnumMap<>(RoadClass.class);

    static {
        STYLES.put(RoadClass.PRIMARY, new RoadStyle(new Color(0xdc2626), 6, 0.9f, null));
        STYLES.put(RoadClass.SECONDARY, new RoadStyle(new Color(0x2563eb), 4, 0.8f, null));
        STYLES.put(RoadClass.LOCAL, new RoadStyle(new Color(0x16a34a), 3, 0.7f, null));
        STYLES.put(RoadClass.RESIDENTIAL, new RoadStyle(new Color(0xca8a04), 2, 0.6f, null));
        STYLES.put(RoadClass.PEDESTRIAN, new RoadStyle(new Color(0x9333ea), 2, 0.5f, new float[]{5f, 5f}));
        STYLES.put(RoadClass.BIKE, new RoadStyle(new Color(0x0891b2), 2, 0.6f, new float[]{10f, 5f}));
        STYLES.put(RoadClass.EMERGENCY, new RoadStyle(new Color(0xea580c), 5, 0.8f, null));
    }

    private final Color color;
    private final float width;
    private final float opacity;
    private final float[] dash;

    private RoadStyle(Color color, float width, float opacity, float[] dash) {
        this.color = color;
        this.width = width;
        this.opacity = opacity;
        this.dash = dash;
    }

    /** Unknown (null) classes draw as local roads. */
    public static RoadStyle forClass(RoadClass c) {
        RoadStyle s = (c == null) ? null : STYLES.get(c);
        return (s == null) ? STYLES.get(RoadClass.LOCAL) : s;
    }

    public Color getColor() { return color; }
    public float getWidth() { return width; }
    public float getOpacity() { return opacity; }
    public boolean isDashed() { return dash != null; }

    public BasicStroke toStroke() {
        if (dash == null) {
            return new BasicStroke(width, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND);
        }
        return new BasicStroke(width, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND, 10f, dash.clone(), 0f);
    }
}
