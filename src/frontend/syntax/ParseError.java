package frontend.syntax;

import frontend.lexer.Position;

/**
 * 一条语法错误记录, 恢复后继续分析
 */
public class ParseError {
    private final String message;
    private final Position position;

    public ParseError(String message, Position position) {
        this.message = message;
        this.position = position == null ? Position.UNKNOWN : position;
    }

    public String getMessage() {
        return message;
    }

    public Position getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return String.format("Syntax error at line %d, column %d: %s",
                position.getLine(), position.getColumn(), message);
    }
}
