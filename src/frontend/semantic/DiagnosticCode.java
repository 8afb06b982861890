package frontend.semantic;

public enum DiagnosticCode {
    UNDEFINED_SYMBOL(1),
    REDEFINED_SYMBOL(2),
    TYPE_MISMATCH(3),
    INVALID_OPERATION(4),
    MISSING_ARGUMENT(5),
    TOO_MANY_ARGUMENTS(6),
    ;

    private final int code;

    DiagnosticCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
