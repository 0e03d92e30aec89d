package planviz.zonemap.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planviz.zonemap.detect.DetectionParams;
import planviz.zonemap.detect.ZonePalette;
import planviz.zonemap.io.RasterSource;
import planviz.zonemap.model.ZoneType;

import java.awt.Color;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Editor settings from {@code zonemap.properties}: the bundled defaults on the classpath,
 * optionally overlaid by a file. Unparsable values fall back to the default with a warning.
 */
public final class EditorConfig {

    private static final Logger logger = LoggerFactory.getLogger(EditorConfig.class);

    public static final String RESOURCE = "/zonemap.properties";
    public static final String TOLERANCE_PREFIX = "palette.tolerance.";

    private final Properties props;

    private EditorConfig(Properties props) {
        this.props = props;
    }

    /** Bundled defaults only. */
    public static EditorConfig load() throws IOException {
        return load(null);
    }

    /** Bundled defaults, then {@code override} when it is an existing file. */
    public static EditorConfig load(File override) throws IOException {
        Properties p = new Properties();
        try (InputStream in = EditorConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    p.load(r);
                }
            } else {
                logger.warn("{} not found on the classpath; using built-in defaults", RESOURCE);
            }
        }

        if (override != null) {
            if (override.isFile()) {
                try (Reader r = new InputStreamReader(new FileInputStream(override), StandardCharsets.UTF_8)) {
                    p.load(r);
                }
                logger.info("Loaded settings override {}", override.getAbsolutePath());
            } else {
                logger.warn("Settings override {} does not exist; ignored", override.getAbsolutePath());
            }
        }
        return new EditorConfig(p);
    }

    public static EditorConfig of(Properties props) {
        Properties copy = new Properties();
        if (props != null) copy.putAll(props);
        return new EditorConfig(copy);
    }

    // ==========================================================
    // Typed views
    // ==========================================================

    public DetectionParams detectionParams() {
        DetectionParams d = new DetectionParams();
        d.maxDimension = intValue("detect.maxDimension", d.maxDimension);
        d.minStride = intValue("detect.minStride", d.minStride);
        d.strideDivisor = intValue("detect.strideDivisor", d.strideDivisor);
        d.chunkRows = intValue("detect.chunkRows", d.chunkRows);
        d.minBlockSizeFloor = intValue("detect.minBlockSize.floor", d.minBlockSizeFloor);
        d.minBlockSizeBase = intValue("detect.minBlockSize.base", d.minBlockSizeBase);
        d.seedToleranceFactor = doubleValue("detect.seedToleranceFactor", d.seedToleranceFactor);
        d.boundaryToleranceFactor = doubleValue("detect.boundaryToleranceFactor", d.boundaryToleranceFactor);
        d.crossTypeOverlap = doubleValue("detect.crossTypeOverlap", d.crossTypeOverlap);
        d.sameTypeOverlap = doubleValue("detect.sameTypeOverlap", d.sameTypeOverlap);
        d.sameCenterFactor = doubleValue("detect.sameCenterFactor", d.sameCenterFactor);
        d.replaceAreaFactor = doubleValue("detect.replaceAreaFactor", d.replaceAreaFactor);
        d.visitStepFactor = doubleValue("detect.visitStepFactor", d.visitStepFactor);
        d.addBlockSize = intValue("edit.addBlockSize", d.addBlockSize);
        d.dragMoveThreshold = intValue("edit.dragMoveThreshold", d.dragMoveThreshold);
        return d;
    }

    /** Default palette with any {@code palette.tolerance.<ZONE>} overrides applied. */
    public ZonePalette palette() {
        Map<ZoneType, Double> overrides = new EnumMap<>(ZoneType.class);
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith(TOLERANCE_PREFIX)) continue;
            String zone = key.substring(TOLERANCE_PREFIX.length());
            ZoneType t = ZoneType.fromName(zone);
            if (t == null) {
                logger.warn("Unknown zone in {}; ignored", key);
                continue;
            }
            double v = doubleValue(key, -1);
            if (v < 0) {
                logger.warn("Tolerance {} must be >= 0; ignored", key);
                continue;
            }
            overrides.put(t, v);
        }
        return ZonePalette.defaults().withTolerances(overrides);
    }

    public RasterSource rasterSource() {
        return new RasterSource(
                intValue("load.connectTimeoutMs", 10_000),
                intValue("load.readTimeoutMs", 30_000),
                string("load.origin", "http://localhost"),
                intValue("load.pdfDpi", 150));
    }

    public Color drawColor() { return colorValue("edit.color", new Color(0x3b82f6)); }
    public int brushSize() { return intValue("edit.brushSize", 10); }
    public int historyLimit() { return Math.max(1, intValue("edit.historyLimit", 100)); }

    public double zoomMin() { return doubleValue("view.zoomMin", 0.5); }
    public double zoomMax() { return doubleValue("view.zoomMax", 3.0); }
    public double zoomStep() { return doubleValue("view.zoomStep", 0.1); }

    /** Delay between detection chunks. */
    public int detectionTickMs() { return intValue("detect.tickMs", 16); }

    // ==========================================================
    // Raw access
    // ==========================================================

    public String string(String key, String def) {
        String v = props.getProperty(key);
        return (v == null || v.trim().isEmpty()) ? def : v.trim();
    }

    int intValue(String key, int def) {
        String v = props.getProperty(key);
        if (v == null || v.trim().isEmpty()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException ex) {
            logger.warn("Setting {}='{}' is not an integer; using {}", key, v, def);
            return def;
        }
    }

    double doubleValue(String key, double def) {
        String v = props.getProperty(key);
        if (v == null || v.trim().isEmpty()) return def;
        try {
            double d = Double.parseDouble(v.trim());
            if (!Double.isFinite(d)) throw new NumberFormatException("not finite");
            return d;
        } catch (NumberFormatException ex) {
            logger.warn("Setting {}='{}' is not a number; using {}", key, v, def);
            return def;
        }
    }

    Color colorValue(String key, Color def) {
        String v = props.getProperty(key);
        if (v == null || v.trim().isEmpty()) return def;
        String s = v.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("#")) s = s.substring(1);
        try {
            if (s.length() != 6) throw new NumberFormatException("expected 6 hex digits");
            return new Color(Integer.parseInt(s, 16));
        } catch (NumberFormatException ex) {
            logger.warn("Setting {}='{}' is not a #rrggbb color; using default", key, v);
            return def;
        }
    }
}
