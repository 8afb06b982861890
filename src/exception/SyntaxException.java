package exception;

import frontend.lexer.Position;

/**
 * 编译器前端发生的异常(词法分析和语法分析阶段)
 */
public class SyntaxException extends Exception {
    private final Position position;

    public SyntaxException(String message) {
        this(message, Position.UNKNOWN);
    }

    public SyntaxException(String message, Position position) {
        super(message);
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }

    public ErrorKind getKind() {
        return ErrorKind.SYNTAX;
    }
}
