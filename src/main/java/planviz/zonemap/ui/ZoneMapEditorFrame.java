package planviz.zonemap.ui;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planviz.zonemap.config.EditorConfig;
import planviz.zonemap.io.SavePayload;

import javax.swing.*;
import java.awt.*;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Standalone window around {@link ZoneMapEditorPanel}.
 * <pre>
 * zonemap-editor [image-url-or-path] [--config file] [--target id]
 *                [--polygon polygon.json] [--roads roads.json]
 * </pre>
 * Saves are written as JSON files in the working directory.
 */
public class ZoneMapEditorFrame extends JFrame {

    private static final Logger logger = LoggerFactory.getLogger(ZoneMapEditorFrame.class);

    private final ZoneMapEditorPanel editor;

    public ZoneMapEditorFrame(EditorConfig config) {
        super("Zone Map Editor");
        setDefaultCloseOperation(DISPOSE_ON_CLOSE);
        setLayout(new BorderLayout());

        editor = new ZoneMapEditorPanel(config);
        editor.setOnSave(this::writeSave);
        add(editor, BorderLayout.CENTER);

        addWindowListener(new WindowAdapter() {
            @Override public void windowClosed(WindowEvent e) {
                editor.shutdown();
            }
        });

        setSize(1280, 860);
        setLocationRelativeTo(null);
    }

    public ZoneMapEditorPanel getEditor() { return editor; }

    private void writeSave(SavePayload p) {
        String base = "customized_polygon_" + (p.getTargetId() == null || p.getTargetId().isEmpty() ? "unknown" : p.getTargetId())
                + "_" + p.getTimestamp() + ".json";
        File out = new File(base.replaceAll("[^A-Za-z0-9._-]", "_"));
        try {
            Files.writeString(out.toPath(), p.toJson(), StandardCharsets.UTF_8);
            logger.info("Saved customization to {}", out.getAbsolutePath());
            JOptionPane.showMessageDialog(this, "Saved to " + out.getAbsolutePath(), "Save", JOptionPane.INFORMATION_MESSAGE);
        } catch (IOException ex) {
            logger.error("Could not write {}", out, ex);
            JOptionPane.showMessageDialog(this, "Save failed:\n" + ex.getMessage(), "Save", JOptionPane.ERROR_MESSAGE);
        }
    }

    // ==========================================================
    // Entry point
    // ==========================================================

    public static void main(String[] args) {
        String image = null;
        File configFile = null;
        String target = null;
        File polygon = null;
        File roads = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            boolean hasValue = i + 1 < args.length;
            if ("--config".equals(a) && hasValue) configFile = new File(args[++i]);
            else if ("--target".equals(a) && hasValue) target = args[++i];
            else if ("--polygon".equals(a) && hasValue) polygon = new File(args[++i]);
            else if ("--roads".equals(a) && hasValue) roads = new File(args[++i]);
            else if (!a.startsWith("--") && image == null) image = a;
            else logger.warn("Ignoring argument {}", a);
        }

        EditorConfig config;
        try {
            config = EditorConfig.load(configFile);
        } catch (IOException ex) {
            logger.error("Could not read settings", ex);
            System.exit(2);
            return;
        }

        final String imageArg = image;
        final String targetArg = target;
        final File polygonArg = polygon;
        final File roadsArg = roads;

        SwingUtilities.invokeLater(() -> {
            ZoneMapEditorFrame f = new ZoneMapEditorFrame(config);
            f.setVisible(true);

            ZoneMapEditorPanel ed = f.getEditor();
            if (targetArg != null) ed.setTargetId(targetArg);
            try {
                if (polygonArg != null) ed.applyPolygon(Files.readString(polygonArg.toPath(), StandardCharsets.UTF_8));
                if (roadsArg != null) ed.applyRoads(Files.readString(roadsArg.toPath(), StandardCharsets.UTF_8));
            } catch (IOException ex) {
                logger.error("Could not read overlay file", ex);
                JOptionPane.showMessageDialog(f, "Could not read overlay file:\n" + ex.getMessage(),
                        "Overlay", JOptionPane.ERROR_MESSAGE);
            }
            if (imageArg != null) ed.loadImage(imageArg);
        });
    }
}
