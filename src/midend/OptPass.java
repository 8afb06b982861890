package midend;

public enum OptPass {
    CONSTANT_FOLDING,
    DEAD_CODE_ELIMINATION,
    ALL,
}
