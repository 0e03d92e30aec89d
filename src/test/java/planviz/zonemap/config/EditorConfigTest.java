package planviz.zonemap.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import planviz.zonemap.detect.DetectionParams;
import planviz.zonemap.detect.ZonePalette;
import planviz.zonemap.model.ZoneType;

import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class EditorConfigTest {

    @TempDir
    Path dir;

    private static EditorConfig with(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i < kv.length; i += 2) p.setProperty(kv[i], kv[i + 1]);
        return EditorConfig.of(p);
    }

    @Test
    @DisplayName("bundled defaults match the built-in values")
    void bundledDefaults() throws IOException {
        EditorConfig cfg = EditorConfig.load();
        DetectionParams d = cfg.detectionParams();

        assertThat(d.maxDimension).isEqualTo(1500);
        assertThat(d.chunkRows).isEqualTo(100);
        assertThat(d.crossTypeOverlap).isEqualTo(0.6);
        assertThat(cfg.drawColor()).isEqualTo(new Color(0x3b82f6));
        assertThat(cfg.brushSize()).isEqualTo(10);
        assertThat(cfg.historyLimit()).isEqualTo(100);
        assertThat(cfg.detectionTickMs()).isEqualTo(16);
    }

    @Test
    @DisplayName("an override file replaces only the keys it sets")
    void overrideFile() throws IOException {
        Path f = dir.resolve("editor.properties");
        Files.write(f, "detect.chunkRows=25\nedit.color=#ff0000\n".getBytes(StandardCharsets.UTF_8));

        EditorConfig cfg = EditorConfig.load(f.toFile());

        assertThat(cfg.detectionParams().chunkRows).isEqualTo(25);
        assertThat(cfg.detectionParams().maxDimension).isEqualTo(1500);
        assertThat(cfg.drawColor()).isEqualTo(Color.RED);
    }

    @Test
    @DisplayName("a missing override file is ignored")
    void missingOverride() throws IOException {
        EditorConfig cfg = EditorConfig.load(new File(dir.toFile(), "absent.properties"));
        assertThat(cfg.brushSize()).isEqualTo(10);
    }

    @Test
    @DisplayName("bad values fall back to defaults")
    void badValues() {
        EditorConfig cfg = with(
                "edit.brushSize", "big",
                "detect.sameTypeOverlap", "NaN",
                "edit.color", "blue",
                "edit.historyLimit", "-3");

        assertThat(cfg.brushSize()).isEqualTo(10);
        assertThat(cfg.detectionParams().sameTypeOverlap).isEqualTo(0.5);
        assertThat(cfg.drawColor()).isEqualTo(new Color(0x3b82f6));
        assertThat(cfg.historyLimit()).isEqualTo(1);
    }

    @Test
    @DisplayName("per-zone tolerances override the palette")
    void tolerances() {
        EditorConfig cfg = with(
                "palette.tolerance.RESIDENTIAL", "40",
                "palette.tolerance.park", "10",
                "palette.tolerance.NOWHERE", "5",
                "palette.tolerance.SCHOOL", "-1");

        ZonePalette p = cfg.palette();

        assertThat(p.entryFor(ZoneType.RESIDENTIAL).getTolerance()).isEqualTo(40.0);
        assertThat(p.entryFor(ZoneType.PARK).getTolerance()).isEqualTo(10.0);
        assertThat(p.entryFor(ZoneType.SCHOOL).getTolerance()).isEqualTo(40.0);
        assertThat(p.entryFor(ZoneType.COMMERCIAL).getTolerance()).isEqualTo(60.0);
    }

    @Test
    @DisplayName("blank strings use the default")
    void blankString() {
        assertThat(with("load.origin", "  ").string("load.origin", "http://localhost")).isEqualTo("http://localhost");
    }
}
