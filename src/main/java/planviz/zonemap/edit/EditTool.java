package planviz.zonemap.edit;

public enum EditTool {
    DRAW("Draw"),
    ERASE("Erase"),
    MOVE("Move Blocks"),
    ADD_BLOCK("Add Block");

    private final String label;

    EditTool(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public boolean isBrush() {
        return this == DRAW || this == ERASE;
    }

    @Override
    public String toString() { return label; }
}
