package planviz.zonemap.edit;

public enum EditState {
    IDLE,
    /** Move tool over a block, nothing held. */
    HOVERING,
    DRAGGING,
    /** Brush stroke (draw or erase) in progress. */
    DRAWING
}
