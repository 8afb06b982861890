package frontend.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static frontend.lexer.TokenType.*;

/**
 * 词法分析: 源码 -> Token 序列
 * 序列总以唯一的 EOF 结尾; 出错时在 EOF 前放一个 ERROR 并停止扫描
 */
public class Lexer {
    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final String filename;
    private final TokenList tokenList = new TokenList();

    private int pos = 0;
    private int line = 1;
    private int column = 1;

    // start of the token being scanned
    private int startLine;
    private int startColumn;

    private String errorMessage = null;
    private Position errorPosition = null;
    private boolean done = false;

    public Lexer(String source, String filename) {
        if (source == null) {
            throw new NullPointerException("source");
        }
        this.source = source;
        this.filename = filename == null ? "<unknown>" : filename;
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char advance() {
        if (atEnd()) {
            return '\0';
        }
        char c = source.charAt(pos++);
        column++;
        if (c == '\n') {
            line++;
            column = 1;
        }
        return c;
    }

    private boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private boolean isDigital(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private void markStart() {
        startLine = line;
        startColumn = column;
    }

    private Position start() {
        return new Position(startLine, startColumn, filename);
    }

    private void emit(TokenType type, String content) {
        tokenList.append(new Token(type, content, start()));
    }

    private void emit(TokenType type, String content, Object value) {
        tokenList.append(new Token(type, content, start(), value));
    }

    private void fail(String message, String offending) {
        errorMessage = message;
        errorPosition = start();
        tokenList.append(new Token(ERROR, offending, errorPosition));
        log.debug("lexing {} stopped at {}: {}", filename, errorPosition, message);
    }

    private void skipComment() {
        if (peek(1) == '/') {
            while (!atEnd()) {
                if (advance() == '\n') {
                    break;
                }
            }
        } else {
            advance(); // '/'
            advance(); // '*'
            while (!atEnd()) {
                char c = advance();
                if (c == '*' && peek(0) == '/') {
                    advance();
                    break;
                }
            }
        }
    }

    private String scanWord() {
        int begin = pos;
        while (!atEnd() && (isLetter(peek(0)) || isDigital(peek(0)))) {
            advance();
        }
        return source.substring(begin, pos);
    }

    private void lexWord() {
        String word = scanWord();
        TokenType type = TokenType.ofWord(word);
        switch (type) {
            case TRUE -> emit(TRUE, word, Boolean.TRUE);
            case FALSE -> emit(FALSE, word, Boolean.FALSE);
            default -> emit(type, word);
        }
    }

    // '$' and '@' share the identifier scanner, the token kind comes from the sigil
    private boolean lexSigil(TokenType kind) {
        char sigil = advance();
        if (!isLetter(peek(0))) {
            fail("Expected identifier after '" + sigil + "'", String.valueOf(sigil));
            return false;
        }
        emit(kind, scanWord());
        return true;
    }

    private void lexNumber() {
        int begin = pos;
        while (isDigital(peek(0))) {
            advance();
        }
        if (peek(0) == '.') {
            advance();
            while (isDigital(peek(0))) {
                advance();
            }
        }
        String text = source.substring(begin, pos);
        emit(NUMBER, text, Double.parseDouble(text));
    }

    private boolean lexString() {
        int begin = pos;
        char quote = advance();
        StringBuilder value = new StringBuilder();
        while (true) {
            char c = peek(0);
            if (atEnd() || c == '\n') {
                fail("Unterminated string literal", source.substring(begin, pos));
                return false;
            }
            if (c == quote) {
                advance();
                break;
            }
            if (c == '\\') {
                advance();
                if (atEnd() || peek(0) == '\n') {
                    fail("Unterminated string literal", source.substring(begin, pos));
                    return false;
                }
                char escaped = advance();
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> escaped;
                });
            } else {
                value.append(advance());
            }
        }
        emit(STRING, source.substring(begin, pos), value.toString());
        return true;
    }

    private boolean lexOperator() {
        char c = peek(0);
        char next = peek(1);
        TokenType type;
        switch (c) {
            case '=' -> type = next == '=' ? EQ : ASSIGN;
            case '!' -> type = next == '=' ? NE : NOT;
            case '<' -> type = next == '=' ? LE : LT;
            case '>' -> type = next == '=' ? GE : GT;
            case '+' -> type = ADD;
            case '-' -> type = SUB;
            case '*' -> type = MUL;
            case '/' -> type = DIV;
            case '%' -> type = MOD;
            case '^' -> type = POW;
            case '{' -> type = LBRACE;
            case '}' -> type = RBRACE;
            case '(' -> type = LPAREN;
            case ')' -> type = RPAREN;
            case '[' -> type = LBRACKET;
            case ']' -> type = RBRACKET;
            case ',' -> type = COMMA;
            case ';' -> type = SEMICOLON;
            case ':' -> type = COLON;
            case '.' -> type = DOT;
            default -> {
                fail("Unexpected character '" + c + "'", String.valueOf(c));
                return false;
            }
        }
        int len = (type == EQ || type == NE || type == LE || type == GE) ? 2 : 1;
        String text = source.substring(pos, pos + len);
        for (int i = 0; i < len; i++) {
            advance();
        }
        emit(type, text);
        return true;
    }

    /**
     * 扫描整个源码, 重复调用返回同一个结果
     */
    public TokenList tokenize() {
        if (done) {
            return tokenList;
        }
        done = true;
        boolean ok = true;
        while (ok) {
            while (!atEnd() && isSpace(peek(0))) {
                advance();
            }
            if (atEnd()) {
                break;
            }
            char c = peek(0);
            if (c == '/' && (peek(1) == '/' || peek(1) == '*')) {
                skipComment();
                continue;
            }
            markStart();
            if (c == '$') {
                ok = lexSigil(VARIABLE_REF);
            } else if (c == '@') {
                ok = lexSigil(TEMPLATE_CALL);
            } else if (c == '"' || c == '\'') {
                ok = lexString();
            } else if (isDigital(c)) {
                lexNumber();
            } else if (isLetter(c)) {
                lexWord();
            } else {
                ok = lexOperator();
            }
        }
        markStart();
        emit(EOF, "");
        log.debug("lexed {}: {} tokens", filename, tokenList.size());
        return tokenList;
    }

    public boolean hasError() {
        return errorMessage != null;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Position getErrorPosition() {
        return errorPosition;
    }

    public String getFilename() {
        return filename;
    }
}
