package frontend.lexer;

import java.util.Objects;

/**
 * 源码位置, 用于报错
 */
public final class Position {
    public static final Position UNKNOWN = new Position(0, 0, "<unknown>");

    private final int line;
    private final int column;
    private final String sourceName;

    public Position(int line, int column, String sourceName) {
        this.line = line;
        this.column = column;
        this.sourceName = sourceName == null ? "<unknown>" : sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getSourceName() {
        return sourceName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position that = (Position) o;
        return line == that.line && column == that.column && sourceName.equals(that.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, sourceName);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
