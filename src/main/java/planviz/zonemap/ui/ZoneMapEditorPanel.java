package planviz.zonemap.ui;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planviz.zonemap.config.EditorConfig;
import planviz.zonemap.detect.BlockDetectionJob;
import planviz.zonemap.detect.DetectionParams;
import planviz.zonemap.detect.ZonePalette;
import planviz.zonemap.edit.EditSession;
import planviz.zonemap.edit.EditTool;
import planviz.zonemap.io.ImageExporter;
import planviz.zonemap.io.RasterSource;
import planviz.zonemap.io.SavePayload;
import planviz.zonemap.model.PixelBuffer;
import planviz.zonemap.model.ZoneType;
import planviz.zonemap.overlay.GeoBounds;
import planviz.zonemap.overlay.OverlayParser;
import planviz.zonemap.overlay.RoadClass;
import planviz.zonemap.overlay.RoadNetwork;
import planviz.zonemap.render.RenderPipeline;

import javax.swing.*;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * The editor: toolbar rows on top, zoomable canvas in the middle, status line at the bottom.
 * Image loading runs on a {@link SwingWorker}; block detection runs one chunk per
 * {@link Timer} tick on the EDT.
 */
public class ZoneMapEditorPanel extends JPanel {

    private static final Logger logger = LoggerFactory.getLogger(ZoneMapEditorPanel.class);

    private final EditorConfig config;
    private final DetectionParams params;
    private final ZonePalette palette;
    private final RasterSource rasterSource;

    private final EditSession session;
    private final RenderPipeline pipeline = new RenderPipeline();
    private final ZoneMapCanvas canvas;

    // source controls
    private final JButton openFileBtn = new JButton("Open Image...");
    private final JButton openUrlBtn = new JButton("Open URL...");
    private final JButton loadPolygonBtn = new JButton("Load Polygon...");
    private final JButton loadRoadsBtn = new JButton("Load Roads...");
    private final JTextField targetIdField = new JTextField(8);
    private final JButton redetectBtn = new JButton("Re-detect Blocks");

    // tools
    private final JToggleButton drawBtn = new JToggleButton(EditTool.DRAW.getLabel());
    private final JToggleButton eraseBtn = new JToggleButton(EditTool.ERASE.getLabel());
    private final JToggleButton moveBtn = new JToggleButton(EditTool.MOVE.getLabel());
    private final JToggleButton addBlockBtn = new JToggleButton(EditTool.ADD_BLOCK.getLabel());
    private final JButton colorBtn = new JButton("Color");
    private final JSpinner brushSpinner;
    private final JButton undoBtn = new JButton("Undo");
    private final JButton redoBtn = new JButton("Redo");
    private final JButton zoomOutBtn = new JButton("-");
    private final JButton zoomInBtn = new JButton("+");
    private final JLabel zoomLabel = new JLabel("100%");

    // output
    private final JButton downloadBtn = new JButton("Download PNG");
    private final JButton saveBtn = new JButton("Save");

    // roads
    private final JCheckBox showRoadsToggle = new JCheckBox("Roads", true);
    private final Map<RoadClass, JCheckBox> roadToggles = new EnumMap<>(RoadClass.class);

    private final JLabel statusLabel = new JLabel("No image loaded.");
    private final JProgressBar detectProgress = new JProgressBar(0, 100);

    private SwingWorker<PixelBuffer, Void> loadWorker;
    private BlockDetectionJob detectionJob;
    private Timer detectionTimer;

    private Consumer<SavePayload> onSave;
    private String currentSource;

    public ZoneMapEditorPanel(EditorConfig config) {
        super(new BorderLayout(8, 8));
        this.config = config;
        this.params = config.detectionParams();
        this.palette = config.palette();
        this.rasterSource = config.rasterSource();

        this.session = new EditSession(params, config.historyLimit());
        session.setColor(config.drawColor());
        session.setBrushSize(config.brushSize());

        this.canvas = new ZoneMapCanvas(session, pipeline);
        canvas.setZoomBounds(config.zoomMin(), config.zoomMax());

        this.brushSpinner = new JSpinner(new SpinnerNumberModel(config.brushSize(), 1, 100, 1));

        add(buildControlsNorth(), BorderLayout.NORTH);
        add(new JScrollPane(canvas), BorderLayout.CENTER);
        add(buildBottomStatus(), BorderLayout.SOUTH);

        session.setOnChanged(() -> {
            canvas.repaint();
            updateButtons();
        });

        hookEvents();
        drawBtn.setSelected(true);
        session.selectTool(EditTool.DRAW);
        updateColorButton();
        updateButtons();
    }

    // ==========================================================
    // Layout
    // ==========================================================

    private JComponent buildControlsNorth() {
        JPanel controls = new JPanel();
        controls.setLayout(new BoxLayout(controls, BoxLayout.Y_AXIS));
        controls.add(buildRowSource());
        controls.add(buildRowTools());
        controls.add(buildRowRoads());

        JScrollPane scroller = new JScrollPane(
                controls,
                JScrollPane.VERTICAL_SCROLLBAR_NEVER,
                JScrollPane.HORIZONTAL_SCROLLBAR_AS_NEEDED
        );
        scroller.setBorder(BorderFactory.createEmptyBorder());
        scroller.getHorizontalScrollBar().setUnitIncrement(16);
        return scroller;
    }

    private JComponent buildRowSource() {
        JPanel r = new JPanel(new FlowLayout(FlowLayout.LEFT, 10, 6));
        r.add(openFileBtn);
        r.add(openUrlBtn);
        r.add(Box.createHorizontalStrut(12));
        r.add(new JLabel("Target id:"));
        r.add(targetIdField);
        r.add(loadPolygonBtn);
        r.add(loadRoadsBtn);
        r.add(Box.createHorizontalStrut(12));
        r.add(redetectBtn);
        r.add(Box.createHorizontalStrut(12));
        r.add(downloadBtn);
        r.add(saveBtn);
        return r;
    }

    private JComponent buildRowTools() {
        JPanel r = new JPanel(new FlowLayout(FlowLayout.LEFT, 10, 6));

        ButtonGroup tools = new ButtonGroup();
        tools.add(drawBtn);
        tools.add(eraseBtn);
        tools.add(moveBtn);
        tools.add(addBlockBtn);

        r.add(new JLabel("Tools:"));
        r.add(drawBtn);
        r.add(eraseBtn);
        r.add(moveBtn);
        r.add(addBlockBtn);

        r.add(Box.createHorizontalStrut(10));
        r.add(colorBtn);
        r.add(new JLabel("Brush(px):"));
        r.add(brushSpinner);

        r.add(Box.createHorizontalStrut(10));
        r.add(undoBtn);
        r.add(redoBtn);

        r.add(Box.createHorizontalStrut(10));
        r.add(new JLabel("Zoom:"));
        r.add(zoomOutBtn);
        r.add(zoomLabel);
        r.add(zoomInBtn);
        return r;
    }

    private JComponent buildRowRoads() {
        JPanel r = new JPanel(new FlowLayout(FlowLayout.LEFT, 10, 6));
        r.add(showRoadsToggle);
        for (RoadClass c : RoadClass.values()) {
            JCheckBox cb = new JCheckBox(c.getLabel(), true);
            cb.addActionListener(e -> {
                pipeline.setRoadVisible(c, cb.isSelected());
                canvas.repaint();
            });
            roadToggles.put(c, cb);
            r.add(cb);
        }
        return r;
    }

    private JComponent buildBottomStatus() {
        JPanel p = new JPanel(new BorderLayout(10, 0));
        p.setBorder(BorderFactory.createEmptyBorder(2, 8, 4, 8));
        detectProgress.setStringPainted(true);
        detectProgress.setVisible(false);
        p.add(statusLabel, BorderLayout.CENTER);
        p.add(detectProgress, BorderLayout.EAST);
        return p;
    }

    // ==========================================================
    // Events
    // ==========================================================

    private void hookEvents() {
        openFileBtn.addActionListener(e -> chooseImageFile());
        openUrlBtn.addActionListener(e -> {
            String url = JOptionPane.showInputDialog(this, "Image URL:", "Open URL", JOptionPane.PLAIN_MESSAGE);
            if (url != null && !url.trim().isEmpty()) loadImage(url.trim());
        });
        loadPolygonBtn.addActionListener(e -> chooseOverlayFile(true));
        loadRoadsBtn.addActionListener(e -> chooseOverlayFile(false));
        redetectBtn.addActionListener(e -> startDetection());

        drawBtn.addActionListener(e -> session.selectTool(EditTool.DRAW));
        eraseBtn.addActionListener(e -> session.selectTool(EditTool.ERASE));
        moveBtn.addActionListener(e -> session.selectTool(EditTool.MOVE));
        addBlockBtn.addActionListener(e -> session.selectTool(EditTool.ADD_BLOCK));

        colorBtn.addActionListener(e -> {
            Color c = JColorChooser.showDialog(this, "Draw Color", session.getColor());
            if (c != null) {
                session.setColor(c);
                updateColorButton();
            }
        });
        brushSpinner.addChangeListener(e -> session.setBrushSize(((Number) brushSpinner.getValue()).intValue()));

        undoBtn.addActionListener(e -> session.undo());
        redoBtn.addActionListener(e -> session.redo());

        zoomInBtn.addActionListener(e -> stepZoom(+1));
        zoomOutBtn.addActionListener(e -> stepZoom(-1));

        showRoadsToggle.addActionListener(e -> {
            pipeline.setShowRoads(showRoadsToggle.isSelected());
            for (JCheckBox cb : roadToggles.values()) cb.setEnabled(showRoadsToggle.isSelected());
            canvas.repaint();
        });

        downloadBtn.addActionListener(e -> downloadPng());
        saveBtn.addActionListener(e -> save());
    }

    private void stepZoom(int dir) {
        canvas.setZoom(canvas.getZoom() + dir * config.zoomStep());
        zoomLabel.setText(Math.round(canvas.getZoom() * 100) + "%");
    }

    private void updateColorButton() {
        Color c = session.getColor();
        colorBtn.setBackground(c);
        colorBtn.setForeground((c.getRed() + c.getGreen() + c.getBlue()) > 382 ? Color.BLACK : Color.WHITE);
        colorBtn.setOpaque(true);
    }

    private void updateButtons() {
        boolean img = session.hasImage();
        undoBtn.setEnabled(session.canUndo());
        redoBtn.setEnabled(session.canRedo());
        downloadBtn.setEnabled(img);
        saveBtn.setEnabled(img && onSave != null);
        redetectBtn.setEnabled(img && !isDetecting());
    }

    // ==========================================================
    // Loading
    // ==========================================================

    private void chooseImageFile() {
        JFileChooser fc = new JFileChooser();
        fc.setFileFilter(new FileNameExtensionFilter("Images and PDF", "png", "jpg", "jpeg", "pdf"));
        if (fc.showOpenDialog(this) == JFileChooser.APPROVE_OPTION) {
            loadImage(fc.getSelectedFile().getAbsolutePath());
        }
    }

    /** Loads an image (URL or path) off the EDT, then starts block detection. */
    public void loadImage(String location) {
        cancelDetection();
        if (loadWorker != null) loadWorker.cancel(true);

        currentSource = location;
        statusLabel.setText("Loading " + location + " ...");

        loadWorker = new SwingWorker<>() {
            @Override
            protected PixelBuffer doInBackground() throws Exception {
                return rasterSource.load(location);
            }

            @Override
            protected void done() {
                if (isCancelled()) return;
                try {
                    PixelBuffer img = get();
                    session.loadImage(img);
                    canvas.revalidate();
                    statusLabel.setText("Loaded " + img.getWidth() + "x" + img.getHeight() + ".");
                    startDetection();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                    logger.error("Could not load image {}", location, cause);
                    session.unloadImage();
                    canvas.revalidate();
                    statusLabel.setText("Failed to load image.");
                    JOptionPane.showMessageDialog(ZoneMapEditorPanel.this,
                            cause.getMessage(), "Image Load Failed", JOptionPane.ERROR_MESSAGE);
                }
            }
        };
        loadWorker.execute();
    }

    private void chooseOverlayFile(boolean polygon) {
        JFileChooser fc = new JFileChooser();
        fc.setFileFilter(new FileNameExtensionFilter("JSON", "json", "geojson"));
        if (fc.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) return;

        File f = fc.getSelectedFile();
        try {
            String json = Files.readString(f.toPath(), StandardCharsets.UTF_8);
            if (polygon) applyPolygon(json);
            else applyRoads(json);
        } catch (IOException ex) {
            logger.error("Could not read {}", f, ex);
            JOptionPane.showMessageDialog(this,
                    "Could not read " + f.getName() + ":\n" + ex.getMessage(),
                    "Overlay", JOptionPane.ERROR_MESSAGE);
        }
    }

    public void applyPolygon(String json) {
        GeoBounds b = OverlayParser.parsePolygonBounds(json);
        pipeline.setPolygonBounds(b);
        statusLabel.setText(b == null
                ? "Polygon has no usable bounds; roads use their own extent."
                : "Polygon bounds loaded.");
        canvas.repaint();
    }

    /**
     * Accepts a single road network, or a result list from which the entry for the
     * target id is picked.
     */
    public void applyRoads(String json) {
        String target = targetIdField.getText().trim();
        RoadNetwork rn = null;
        if (!target.isEmpty()) rn = OverlayParser.selectForPolygon(json, target);
        if (rn == null) rn = OverlayParser.parseRoadNetwork(json);

        pipeline.setRoadNetwork(rn);
        for (Map.Entry<RoadClass, JCheckBox> e : roadToggles.entrySet()) {
            e.getValue().setText(e.getKey().getLabel() + " (" + rn.count(e.getKey()) + ")");
        }
        if (session.hasImage() && !pipeline.transformFor(1, 1).hasGeoBounds() && !rn.isEmpty()) {
            logger.warn("No usable geo bounds; roads will not be drawn");
        }
        statusLabel.setText(rn.totalCount() + " road features loaded.");
        canvas.repaint();
    }

    public void setTargetId(String id) {
        targetIdField.setText(id == null ? "" : id);
    }

    // ==========================================================
    // Detection
    // ==========================================================

    public boolean isDetecting() {
        return detectionTimer != null && detectionTimer.isRunning();
    }

    private void startDetection() {
        if (!session.hasImage()) return;
        cancelDetection();

        // the job copies the canvas; editing stays locked until it finishes
        detectionJob = new BlockDetectionJob(session.getCanvas(), palette, params);
        final BlockDetectionJob job = detectionJob;
        session.setInputLocked(true);

        detectProgress.setValue(0);
        detectProgress.setVisible(true);
        statusLabel.setText("Detecting blocks...");

        detectionTimer = new Timer(config.detectionTickMs(), null);
        detectionTimer.addActionListener(e -> {
            if (job != detectionJob) return;
            boolean more = job.processNextChunk();
            detectProgress.setValue((int) Math.round(job.progress() * 100));
            if (!more) finishDetection(job);
        });
        detectionTimer.start();
        updateButtons();
    }

    private void finishDetection(BlockDetectionJob job) {
        if (detectionTimer != null) detectionTimer.stop();
        detectionTimer = null;
        detectProgress.setVisible(false);
        session.setInputLocked(false);

        switch (job.getStatus()) {
            case DONE:
            case FAILED:
                session.setBlocks(job.getCandidates());
                statusLabel.setText(describeBlocks()
                        + (job.getStatus() == BlockDetectionJob.Status.FAILED ? " (detection stopped early)" : ""));
                break;
            default:
                statusLabel.setText("Detection cancelled.");
                break;
        }
        updateButtons();
    }

    private void cancelDetection() {
        if (detectionJob != null) detectionJob.cancel();
        if (detectionTimer != null) detectionTimer.stop();
        detectionTimer = null;
        detectionJob = null;
        detectProgress.setVisible(false);
        if (session.isInputLocked()) session.setInputLocked(false);
    }

    private String describeBlocks() {
        Map<ZoneType, Integer> counts = session.getRegistry().countByType();
        if (counts.isEmpty()) return "No colored blocks detected.";
        StringBuilder sb = new StringBuilder();
        sb.append(session.getRegistry().size()).append(" blocks: ");
        boolean first = true;
        for (Map.Entry<ZoneType, Integer> e : counts.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey().getLabel()).append(' ').append(e.getValue());
            first = false;
        }
        return sb.toString();
    }

    // ==========================================================
    // Output
    // ==========================================================

    private BufferedImage exportImage() {
        return pipeline.renderExport(session.getCanvas());
    }

    private void downloadPng() {
        if (!session.hasImage()) return;
        JFileChooser fc = new JFileChooser();
        fc.setSelectedFile(new File(ImageExporter.downloadFileName(targetIdField.getText(), System.currentTimeMillis())));
        if (fc.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) return;

        try {
            File out = ImageExporter.writePng(exportImage(), fc.getSelectedFile());
            statusLabel.setText("Saved " + out.getName());
        } catch (IOException ex) {
            logger.error("PNG export failed", ex);
            JOptionPane.showMessageDialog(this,
                    "Export failed:\n" + ex.getMessage(), "Download", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void save() {
        if (!session.hasImage() || onSave == null) return;
        try {
            SavePayload p = new SavePayload(
                    targetIdField.getText().trim(),
                    ImageExporter.toDataUri(exportImage()),
                    canvas.getZoom(),
                    System.currentTimeMillis());
            onSave.accept(p);
        } catch (IOException ex) {
            logger.error("Could not encode image for save", ex);
            JOptionPane.showMessageDialog(this,
                    "Save failed:\n" + ex.getMessage(), "Save", JOptionPane.ERROR_MESSAGE);
        }
    }

    public void setOnSave(Consumer<SavePayload> cb) {
        this.onSave = cb;
        updateButtons();
    }

    // ==========================================================
    // Lifecycle
    // ==========================================================

    /** Stops background work; call when the window closes. */
    public void shutdown() {
        cancelDetection();
        if (loadWorker != null) loadWorker.cancel(true);
        loadWorker = null;
    }

    public EditSession getSession() { return session; }
    public String getCurrentSource() { return currentSource; }
}
