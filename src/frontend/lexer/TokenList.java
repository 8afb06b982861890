package frontend.lexer;

import exception.SyntaxException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Token 序列, 由 Lexer 生成; Parser 只按下标读取, 不修改
 */
public class TokenList {
    private final ArrayList<Token> tokens = new ArrayList<>();

    public void append(Token token) {
        tokens.add(token);
    }

    public int size() {
        return tokens.size();
    }

    // null when out of range
    public Token get(int index) {
        if (index < 0 || index >= tokens.size()) {
            return null;
        }
        return tokens.get(index);
    }

    public Token last() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    public String dump() {
        StringBuilder sb = new StringBuilder("Tokens:\n");
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            sb.append(String.format("  [%d] %s: '%s' (line %d, col %d)%n", i, t.getType(), t.getContent(),
                    t.getPosition().getLine(), t.getPosition().getColumn()));
        }
        return sb.toString();
    }

    /**
     * 读取游标, 每个 Parser 持有一个
     */
    public class Cursor {
        private int index = 0;

        public Token get() {
            return ahead(0);
        }

        // clamps to the trailing EOF
        public Token ahead(int count) {
            int i = Math.min(index + count, tokens.size() - 1);
            return tokens.get(i);
        }

        public boolean atEof() {
            return get().isOf(TokenType.EOF);
        }

        public Token consume() {
            Token token = get();
            if (!atEof()) {
                index++;
            }
            return token;
        }

        // Usage: cursor.consumeExpected(TokenType.IDENTIFIER)
        public Token consumeExpected(TokenType... types) throws SyntaxException {
            Token token = get();
            for (TokenType type : types) {
                if (token.getType() == type) {
                    return consume();
                }
            }
            throw new SyntaxException("Expected " + Arrays.toString(types) + " but got " + describe(token),
                    token.getPosition());
        }

        public int getIndex() {
            return index;
        }
    }

    public Cursor cursor() {
        if (tokens.isEmpty() || !last().isOf(TokenType.EOF)) {
            throw new IllegalStateException("token list is not terminated by EOF");
        }
        return new Cursor();
    }

    public static String describe(Token token) {
        return switch (token.getType()) {
            case EOF -> "end of input";
            case ERROR -> "invalid input '" + token.getContent() + "'";
            default -> "'" + token.getContent() + "'";
        };
    }
}
