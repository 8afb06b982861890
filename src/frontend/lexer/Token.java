package frontend.lexer;

import java.util.Arrays;

public class Token {
    private final TokenType type;
    private final String content;
    private final Position position;
    private final Object value; // String for STRING, Double for NUMBER, Boolean for true/false

    public Token(final TokenType type, final String content, final Position position) {
        this(type, content, position, null);
    }

    public Token(final TokenType type, final String content, final Position position, final Object value) {
        this.type = type;
        this.content = content;
        this.position = position;
        this.value = value;
    }

    public TokenType getType() {
        return this.type;
    }

    public String getContent() {
        return this.content;
    }

    public Position getPosition() {
        return position;
    }

    public boolean isOf(TokenType... types) {
        return Arrays.asList(types).contains(type);
    }

    public String getStringValue() {
        if (type != TokenType.STRING) {
            throw new IllegalStateException("not a string literal: " + this);
        }
        return (String) value;
    }

    public double getNumberValue() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("not a number literal: " + this);
        }
        return (Double) value;
    }

    public boolean getBoolValue() {
        if (type != TokenType.TRUE && type != TokenType.FALSE) {
            throw new IllegalStateException("not a boolean literal: " + this);
        }
        return (Boolean) value;
    }

    @Override
    public String toString() {
        return "<" + type + " " + content + ">";
    }
}
