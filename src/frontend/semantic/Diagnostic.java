package frontend.semantic;

import frontend.lexer.Position;

/**
 * 一条语义错误, 只追加不撤回
 */
public class Diagnostic {
    private final String message;
    private final Position position;
    private final DiagnosticCode code;

    public Diagnostic(String message, Position position, DiagnosticCode code) {
        this.message = message;
        this.position = position == null ? Position.UNKNOWN : position;
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public Position getPosition() {
        return position;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return String.format("Semantic error at line %d, column %d: %s",
                position.getLine(), position.getColumn(), message);
    }
}
