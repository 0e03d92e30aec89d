package planviz.zonemap.edit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import planviz.zonemap.detect.BlockDetectionJob;
import planviz.zonemap.detect.Candidate;
import planviz.zonemap.detect.DetectionParams;
import planviz.zonemap.detect.ZonePalette;
import planviz.zonemap.model.Block;
import planviz.zonemap.model.Fixtures;
import planviz.zonemap.model.PixelBuffer;
import planviz.zonemap.model.PixelPatch;
import planviz.zonemap.model.ZoneType;

import java.awt.Color;
import java.awt.Point;
import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EditSessionTest {

    private static final Rectangle A = new Rectangle(20, 20, 80, 60);
    private static final Rectangle B = new Rectangle(200, 150, 80, 60);

    private PixelBuffer base;
    private EditSession session;

    @BeforeEach
    void setUp() {
        base = Fixtures.gradient(400, 300);
        session = new EditSession();
        session.loadImage(base);
        session.setBlocks(List.of(
                new Candidate(A, A, ZoneType.RESIDENTIAL, Fixtures.BLUE),
                new Candidate(B, B, ZoneType.PARK, Fixtures.PARK_TEAL)));
    }

    private void drag(Point from, Point... path) {
        session.selectTool(EditTool.MOVE);
        session.pointerDown(from);
        for (int i = 0; i < path.length - 1; i++) session.pointerMove(path[i]);
        session.pointerUp(path[path.length - 1]);
    }

    // =========================
    // Move tool
    // =========================

    @Test
    @DisplayName("dragging a block away and back leaves the canvas bit-for-bit unchanged")
    void dragAwayAndBack() {
        drag(new Point(40, 40), new Point(140, 100), new Point(300, 40), new Point(40, 40));

        assertThat(session.getCanvas().sameContent(base)).isTrue();
        assertThat(session.getRegistry().byId("B1").getBounds()).isEqualTo(A);
        assertThat(session.getState()).isEqualTo(EditState.HOVERING);
    }

    @Test
    @DisplayName("moved block keeps its pixels and its original position")
    void moveCarriesPixels() {
        drag(new Point(40, 40), new Point(140, 120), new Point(140, 120));

        Block a = session.getRegistry().byId("B1");
        Rectangle at = a.getBounds();
        assertThat(at).isEqualTo(new Rectangle(120, 100, 80, 60));
        assertThat(a.isMoved()).isTrue();
        assertThat(a.getOriginalBounds()).isEqualTo(A);

        PixelBuffer canvas = session.getCanvas();
        for (int y = 0; y < at.height; y += 7) {
            for (int x = 0; x < at.width; x += 7) {
                assertThat(canvas.getArgb(at.x + x, at.y + y)).isEqualTo(base.getArgb(A.x + x, A.y + y));
            }
        }
        // vacated area outside the new position shows the base image again
        assertThat(canvas.getArgb(25, 25)).isEqualTo(base.getArgb(25, 25));
    }

    @Test
    @DisplayName("dropping a block onto another removes the covered block")
    void dropOntoOther() {
        drag(new Point(40, 40), new Point(220, 170), new Point(220, 170));

        List<Block> blocks = session.getBlocks();
        assertThat(blocks).extracting(Block::getId).containsExactly("B1");
        assertThat(blocks.get(0).getBounds()).isEqualTo(B);

        PixelBuffer canvas = session.getCanvas();
        for (int y = 0; y < B.height; y += 5) {
            for (int x = 0; x < B.width; x += 5) {
                int argb = canvas.getArgb(B.x + x, B.y + y);
                assertThat(argb >>> 24).isEqualTo(0xFF);
                assertThat(argb).isEqualTo(base.getArgb(A.x + x, A.y + y));
            }
        }
    }

    @Test
    @DisplayName("moves under the threshold are ignored")
    void moveThreshold() {
        session.selectTool(EditTool.MOVE);
        session.pointerDown(new Point(40, 40));
        session.pointerMove(new Point(41, 41));

        assertThat(session.getState()).isEqualTo(EditState.DRAGGING);
        assertThat(session.getDragBounds()).isEqualTo(A);

        session.pointerMove(new Point(45, 40));
        assertThat(session.getDragBounds()).isEqualTo(new Rectangle(25, 20, 80, 60));
    }

    @Test
    @DisplayName("hover follows the pointer in move mode")
    void hover() {
        session.selectTool(EditTool.MOVE);

        session.pointerMove(new Point(30, 30));
        assertThat(session.getHoveredBlockId()).isEqualTo("B1");
        assertThat(session.getState()).isEqualTo(EditState.HOVERING);

        session.pointerMove(new Point(390, 290));
        assertThat(session.getHoveredBlockId()).isNull();
        assertThat(session.getState()).isEqualTo(EditState.IDLE);
    }

    @Test
    @DisplayName("a block deleted mid-drag aborts the drag")
    void blockVanishes() {
        session.selectTool(EditTool.MOVE);
        session.pointerDown(new Point(40, 40));
        session.getRegistry().remove("B1");
        session.pointerMove(new Point(200, 200));

        assertThat(session.getState()).isEqualTo(EditState.IDLE);
        assertThat(session.getDraggedBlockId()).isNull();
        assertThat(session.getCanvas().sameContent(base)).isTrue();
    }

    // =========================
    // Brushes + add block
    // =========================

    @Test
    @DisplayName("draw paints opaque color along the stroke")
    void draw() {
        session.selectTool(EditTool.DRAW);
        session.setColor(Color.RED);
        session.setBrushSize(6);
        session.pointerDown(new Point(50, 250));
        session.pointerMove(new Point(100, 250));
        session.pointerUp(null);

        assertThat(session.getCanvas().getArgb(75, 250)).isEqualTo(0xFFFF0000);
        assertThat(session.getCanvas().getArgb(75, 270)).isEqualTo(base.getArgb(75, 270));
        assertThat(session.getHistory().current().getLabel()).isEqualTo("draw");
    }

    @Test
    @DisplayName("erase clears pixels to transparent")
    void erase() {
        session.selectTool(EditTool.ERASE);
        session.setBrushSize(8);
        session.pointerDown(new Point(300, 50));
        session.pointerUp(new Point(320, 50));

        assertThat(session.getCanvas().alpha(310, 50)).isZero();
        assertThat(session.getHistory().current().getLabel()).isEqualTo("erase");
    }

    @Test
    @DisplayName("add block stamps a clamped custom block")
    void addBlock() {
        session.selectTool(EditTool.ADD_BLOCK);
        session.setColor(Color.ORANGE);
        session.pointerDown(new Point(10, 10));

        Block added = session.getRegistry().byId("B3");
        assertThat(added.getType()).isEqualTo(ZoneType.CUSTOM);
        assertThat(added.getBounds()).isEqualTo(new Rectangle(0, 0, 100, 100));
        assertThat(session.getCanvas().getArgb(50, 50)).isEqualTo(Color.ORANGE.getRGB());
        assertThat(session.canUndo()).isTrue();
    }

    // =========================
    // History
    // =========================

    @Test
    @DisplayName("N undos return to the detected state and each redo reproduces the matching edit")
    void undoRedoSequence() {
        List<PixelBuffer> states = new ArrayList<>();
        List<Rectangle> b2At = new ArrayList<>();
        states.add(session.getCanvas().copy());
        b2At.add(session.getRegistry().byId("B2").getBounds());

        session.selectTool(EditTool.DRAW);
        session.setColor(Color.RED);
        for (int i = 0; i < 3; i++) {
            session.pointerDown(new Point(50 + i * 40, 100));
            session.pointerUp(new Point(60 + i * 40, 120));
            states.add(session.getCanvas().copy());
            b2At.add(session.getRegistry().byId("B2").getBounds());
        }
        drag(new Point(220, 170), new Point(320, 250), new Point(320, 250));
        states.add(session.getCanvas().copy());
        b2At.add(session.getRegistry().byId("B2").getBounds());

        for (int i = 3; i >= 0; i--) {
            assertThat(session.undo()).isTrue();
            assertThat(session.getCanvas().sameContent(states.get(i))).as("after undo to %d", i).isTrue();
            assertThat(session.getRegistry().byId("B2").getBounds()).isEqualTo(b2At.get(i));
        }
        assertThat(session.canUndo()).isFalse();
        assertThat(session.getCanvas().sameContent(base)).isTrue();

        for (int i = 1; i <= 4; i++) {
            assertThat(session.redo()).isTrue();
            assertThat(session.getCanvas().sameContent(states.get(i))).as("after redo to %d", i).isTrue();
            assertThat(session.getRegistry().byId("B2").getBounds()).isEqualTo(b2At.get(i));
        }
        assertThat(session.canRedo()).isFalse();
        assertThat(session.getRegistry().byId("B2").isMoved()).isTrue();
    }

    @Test
    @DisplayName("history entries stay compressed across many strokes")
    void historyIsCompact() {
        EditSession big = new EditSession();
        PixelBuffer blank = Fixtures.white(600, 600);
        big.loadImage(blank);
        big.selectTool(EditTool.DRAW);
        big.setBrushSize(20);
        for (int i = 0; i < 40; i++) {
            big.pointerDown(new Point(10 + i * 14, 50));
            big.pointerUp(new Point(10 + i * 14, 550));
        }
        PixelBuffer last = big.getCanvas().copy();

        assertThat(big.getHistory().size()).isEqualTo(41);
        long raw = 41L * 600 * 600 * 4;
        assertThat(big.getHistory().retainedBytes()).isLessThan(raw / 10);

        for (int i = 0; i < 40; i++) big.undo();
        assertThat(big.getCanvas().sameContent(blank)).isTrue();
        for (int i = 0; i < 40; i++) big.redo();
        assertThat(big.getCanvas().sameContent(last)).isTrue();
    }

    // =========================
    // Re-detection
    // =========================

    @Test
    @DisplayName("re-detecting after a move finds the block where it now sits and can be undone")
    void redetectAfterMove() {
        PixelBuffer img = Fixtures.white(600, 400);
        Fixtures.fillRect(img, new Rectangle(50, 50, 150, 100), Fixtures.BLUE);
        session = new EditSession();
        session.loadImage(img);
        session.setBlocks(detect(session.getCanvas()));
        assertThat(session.getBlocks()).hasSize(1);
        assertThat(session.canUndo()).isFalse();

        drag(new Point(100, 100), new Point(400, 250));
        Rectangle moved = new Rectangle(350, 200, 150, 100);
        assertThat(session.getRegistry().byId("B1").getBounds()).isEqualTo(moved);

        session.setBlocks(detect(session.getCanvas()));

        Block found = session.getRegistry().topmostAt(new Point(400, 250));
        assertThat(found).isNotNull();
        assertThat(found.getBounds()).isEqualTo(moved);
        assertThat(found.getType()).isEqualTo(ZoneType.RESIDENTIAL);
        assertThat(session.getHistory().current().getLabel()).isEqualTo("detect");
        assertThat(session.canUndo()).isTrue();

        assertThat(session.undo()).isTrue();
        assertThat(session.getBlocks()).hasSize(1);
        Block back = session.getRegistry().byId("B1");
        assertThat(back.getBounds()).isEqualTo(moved);
        assertThat(back.isMoved()).isTrue();
    }

    @Test
    @DisplayName("detected snapshots come from the working canvas")
    void snapshotsFromCanvas() {
        session.selectTool(EditTool.DRAW);
        session.setColor(Color.RED);
        session.setBrushSize(6);
        session.pointerDown(new Point(30, 40));
        session.pointerUp(new Point(90, 40));

        session.setBlocks(List.of(new Candidate(A, A, ZoneType.RESIDENTIAL, Fixtures.BLUE)));

        PixelPatch snap = session.getBlocks().get(0).getSnapshot();
        assertThat(snap.getArgb(40, 20)).isEqualTo(0xFFFF0000);
        assertThat(snap.getArgb(40, 50)).isEqualTo(base.getArgb(A.x + 40, A.y + 50));
    }

    @Test
    @DisplayName("locked input ignores pointer events and undo")
    void inputLock() {
        session.selectTool(EditTool.DRAW);
        session.pointerDown(new Point(300, 50));
        session.pointerUp(new Point(320, 60));
        PixelBuffer before = session.getCanvas().copy();

        session.setInputLocked(true);
        session.pointerDown(new Point(50, 250));
        session.pointerMove(new Point(100, 250));
        session.pointerUp(new Point(100, 250));

        assertThat(session.getCanvas().sameContent(before)).isTrue();
        assertThat(session.getState()).isEqualTo(EditState.IDLE);
        assertThat(session.canUndo()).isFalse();
        assertThat(session.undo()).isFalse();

        session.setInputLocked(false);
        assertThat(session.canUndo()).isTrue();
    }

    @Test
    @DisplayName("locking mid-drag puts the held block back")
    void lockDuringDrag() {
        session.selectTool(EditTool.MOVE);
        session.pointerDown(new Point(40, 40));
        session.pointerMove(new Point(140, 140));

        session.setInputLocked(true);

        assertThat(session.getState()).isEqualTo(EditState.IDLE);
        assertThat(session.getRegistry().byId("B1").getBounds()).isEqualTo(A);
        assertThat(session.getCanvas().sameContent(base)).isTrue();
    }

    private static List<Candidate> detect(PixelBuffer img) {
        return new BlockDetectionJob(img, ZonePalette.defaults(), new DetectionParams()).runToCompletion();
    }

    @Test
    @DisplayName("undo is refused while a gesture is in progress")
    void undoDuringGesture() {
        session.selectTool(EditTool.DRAW);
        session.pointerDown(new Point(50, 50));
        session.pointerUp(new Point(60, 60));

        session.selectTool(EditTool.MOVE);
        session.pointerDown(new Point(40, 40));

        assertThat(session.canUndo()).isFalse();
        assertThat(session.undo()).isFalse();
        assertThat(session.getState()).isEqualTo(EditState.DRAGGING);
    }

    @Test
    @DisplayName("change listener fires on edits")
    void listener() {
        int[] calls = {0};
        session.setOnChanged(() -> calls[0]++);
        session.selectTool(EditTool.ADD_BLOCK);
        session.pointerDown(new Point(200, 100));

        assertThat(calls[0]).isGreaterThanOrEqualTo(2);
    }
}
