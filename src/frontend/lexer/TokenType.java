package frontend.lexer;

import java.util.HashMap;
import java.util.Map;

public enum TokenType {
    // keyword (case sensitive, resolved after the identifier scan)
    PROMPT("PROMPT", true),
    VAR("VAR", true),
    TEMPLATE("TEMPLATE", true),
    CONSTRAINT("CONSTRAINT", true),
    OUTPUT("OUTPUT", true),
    IF("IF", true),
    ELSE("ELSE", true),
    FOR("FOR", true),
    WHILE("WHILE", true),
    IN("IN", true),
    AS("AS", true),
    AND("AND", true),
    OR("OR", true),
    NOT("NOT", true),
    RAW("RAW", true),
    TRUE("true", true),
    FALSE("false", true),
    // ident and literals
    IDENTIFIER("IDENTIFIER"),
    STRING("STRING"),
    NUMBER("NUMBER"),
    // operator (double char)
    EQ("=="),
    NE("!="),
    LE("<="),
    GE(">="),
    // operator (single char)
    LT("<"),
    GT(">"),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    POW("^"),
    ASSIGN("="),
    // punctuation
    LBRACE("{"),
    RBRACE("}"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    DOT("."),
    // sigil tokens
    VARIABLE_REF("VARIABLE_REF"),
    TEMPLATE_CALL("TEMPLATE_CALL"),
    EOF("EOF"),
    ERROR("ERROR"),
    ;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.keyword) {
                KEYWORDS.put(type.text, type);
            }
        }
    }

    private final String text;      // keyword spelling, operator text or display name

    private final boolean keyword;  // keyword

    TokenType(final String text, final boolean keyword) {
        this.text = text;
        this.keyword = keyword;
    }

    TokenType(String text) {
        this(text, false);
    }

    public String getText() {
        return text;
    }

    public boolean isKeyword() {
        return keyword;
    }

    // IDENTIFIER if the word is not reserved
    public static TokenType ofWord(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
    }
}
