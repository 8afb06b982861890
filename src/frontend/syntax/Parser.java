package frontend.syntax;

import exception.SyntaxException;
import frontend.lexer.Position;
import frontend.lexer.Token;
import frontend.lexer.TokenList;
import frontend.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 递归下降语法分析器
 * 出错的语句记录一条 ParseError, 跳到下一个语句开头后继续; 块内出错则在块内恢复
 */
public class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final TokenList.Cursor tokenList;
    private final ArrayList<ParseError> errors = new ArrayList<>();

    public Parser(TokenList tokenList) {
        this.tokenList = tokenList.cursor();
    }

    public Ast.Program parseProgram() throws SyntaxException {
        Position begin = tokenList.get().getPosition();
        ArrayList<Ast.Node> statements = new ArrayList<>();
        while (!tokenList.atEof()) {
            int start = tokenList.getIndex();
            try {
                statements.add(parseStmt());
            } catch (SyntaxException e) {
                recordError(e);
                synchronize(start);
            }
        }
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            sb.append(errors.size()).append(errors.size() == 1 ? " syntax error" : " syntax errors");
            for (ParseError error : errors) {
                sb.append("\n  ").append(error);
            }
            throw new SyntaxException(sb.toString(), errors.get(0).getPosition());
        }
        return new Ast.Program(statements, begin);
    }

    public List<ParseError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    private static boolean isStmtStart(Token token) {
        return token.isOf(TokenType.PROMPT, TokenType.VAR, TokenType.TEMPLATE, TokenType.CONSTRAINT,
                TokenType.OUTPUT, TokenType.IF, TokenType.FOR, TokenType.WHILE);
    }

    // 跳过 token 直到下一个语句关键字, 或刚吃掉 ';' / '}', 或 EOF
    private void synchronize(int start) {
        if (tokenList.getIndex() == start) {
            tokenList.consume(); // 保证前进
        }
        int skipped = 0;
        while (!tokenList.atEof() && !isStmtStart(tokenList.get())) {
            Token token = tokenList.consume();
            skipped++;
            if (token.isOf(TokenType.SEMICOLON, TokenType.RBRACE)) {
                break;
            }
        }
        log.debug("recovered at {} after skipping {} tokens", tokenList.get().getPosition(), skipped);
    }

    private static boolean isElemStart(Token token) {
        return token.isOf(TokenType.STRING, TokenType.RAW, TokenType.VARIABLE_REF, TokenType.TEMPLATE_CALL,
                TokenType.IF, TokenType.FOR, TokenType.WHILE);
    }

    // 块内出错: 跳到块内下一项的开头, 或停在本块的 '}' 前, 嵌套的 {} 整体跳过
    private void synchronizeInBlock(int start, boolean element) {
        int depth = 0;
        int skipped = 0;
        if (tokenList.getIndex() == start) {
            // 保证前进
            if (tokenList.consume().isOf(TokenType.LBRACE)) {
                depth++;
            }
            skipped++;
        }
        while (!tokenList.atEof()) {
            Token token = tokenList.get();
            if (depth == 0) {
                if (token.isOf(TokenType.RBRACE)) {
                    break;
                }
                if (element ? isElemStart(token) : isStmtStart(token)) {
                    break;
                }
            }
            tokenList.consume();
            skipped++;
            if (token.isOf(TokenType.LBRACE)) {
                depth++;
            } else if (token.isOf(TokenType.RBRACE)) {
                depth--;
            } else if (depth == 0 && !element && token.isOf(TokenType.SEMICOLON)) {
                break;
            }
        }
        log.debug("recovered in block at {} after skipping {} tokens", tokenList.get().getPosition(), skipped);
    }

    private void recordError(SyntaxException e) {
        errors.add(new ParseError(e.getMessage(), e.getPosition()));
    }

    private Ast.Node parseStmt() throws SyntaxException {
        Token token = tokenList.get();
        switch (token.getType()) {
            case PROMPT:
                return parsePromptDef();
            case VAR:
                return parseVarDecl();
            case TEMPLATE:
                return parseTemplateDef();
            case CONSTRAINT:
                return parseConstraintDef();
            case OUTPUT:
                return parseOutputSpec();
            case IF:
                return parseIf(false);
            case FOR:
                return parseFor(false);
            case WHILE:
                return parseWhile(false);
            case SEMICOLON:
                tokenList.consume();
                return new Ast.Empty(token.getPosition());
            default:
                throw new SyntaxException("Unexpected " + TokenList.describe(token) + ", expected a statement",
                        token.getPosition());
        }
    }

    private Ast.ListNode parseStmtBlock() throws SyntaxException {
        Token lbrace = tokenList.consumeExpected(TokenType.LBRACE);
        ArrayList<Ast.Node> items = new ArrayList<>();
        while (!tokenList.get().isOf(TokenType.RBRACE, TokenType.EOF)) {
            int start = tokenList.getIndex();
            try {
                items.add(parseStmt());
            } catch (SyntaxException e) {
                recordError(e);
                synchronizeInBlock(start, false);
            }
        }
        tokenList.consumeExpected(TokenType.RBRACE);
        return new Ast.ListNode(Ast.NodeType.STATEMENT_LIST, items, lbrace.getPosition());
    }

    private Ast.ListNode parseElemBlock() throws SyntaxException {
        Token lbrace = tokenList.consumeExpected(TokenType.LBRACE);
        ArrayList<Ast.Node> items = new ArrayList<>();
        while (!tokenList.get().isOf(TokenType.RBRACE, TokenType.EOF)) {
            int start = tokenList.getIndex();
            try {
                items.add(parseElement());
            } catch (SyntaxException e) {
                recordError(e);
                synchronizeInBlock(start, true);
            }
        }
        tokenList.consumeExpected(TokenType.RBRACE);
        return new Ast.ListNode(Ast.NodeType.ELEMENT_LIST, items, lbrace.getPosition());
    }

    private Ast.ListNode parseBlock(boolean element) throws SyntaxException {
        return element ? parseElemBlock() : parseStmtBlock();
    }

    private Ast.PromptDef parsePromptDef() throws SyntaxException {
        Token keyword = tokenList.consumeExpected(TokenType.PROMPT);
        Token ident = tokenList.consumeExpected(TokenType.IDENTIFIER);
        Ast.ListNode body = parseElemBlock();
        return new Ast.PromptDef(ident.getContent(), body, keyword.getPosition());
    }

    private Ast.VarDecl parseVarDecl() throws SyntaxException {
        Token keyword = tokenList.consumeExpected(TokenType.VAR);
        Token ident = tokenList.consumeExpected(TokenType.IDENTIFIER);
        Ast.Node init = null;
        if (tokenList.get().isOf(TokenType.ASSIGN)) {
            tokenList.consume();
            init = parseExpr();
        }
        if (tokenList.get().isOf(TokenType.SEMICOLON)) {
            tokenList.consume();
        }
        return new Ast.VarDecl(ident.getContent(), init, keyword.getPosition());
    }

    private Ast.TemplateDef parseTemplateDef() throws SyntaxException {
        Token keyword = tokenList.consumeExpected(TokenType.TEMPLATE);
        Token ident = tokenList.consumeExpected(TokenType.IDENTIFIER);
        ArrayList<String> params = new ArrayList<>();
        if (tokenList.get().isOf(TokenType.LPAREN)) {
            tokenList.consume();
            if (!tokenList.get().isOf(TokenType.RPAREN)) {
                params.add(tokenList.consumeExpected(TokenType.IDENTIFIER).getContent());
                while (tokenList.get().isOf(TokenType.COMMA)) {
                    tokenList.consume();
                    params.add(tokenList.consumeExpected(TokenType.IDENTIFIER).getContent());
                }
            }
            tokenList.consumeExpected(TokenType.RPAREN);
        }
        Ast.ListNode body = parseElemBlock();
        return new Ast.TemplateDef(ident.getContent(), params, body, keyword.getPosition());
    }

    private Ast.ConstraintDef parseConstraintDef() throws SyntaxException {
        Token keyword = tokenList.consumeExpected(TokenType.CONSTRAINT);
        Token ident = tokenList.consumeExpected(TokenType.IDENTIFIER);
        Token lbrace = tokenList.consumeExpected(TokenType.LBRACE);
        ArrayList<Ast.Node> constraints = new ArrayList<>();
        while (!tokenList.get().isOf(TokenType.RBRACE, TokenType.EOF)) {
            constraints.add(parseConstraint());
            if (tokenList.get().isOf(TokenType.SEMICOLON, TokenType.COMMA)) {
                tokenList.consume();
            }
        }
        tokenList.consumeExpected(TokenType.RBRACE);
        Ast.ListNode list = new Ast.ListNode(Ast.NodeType.CONSTRAINT_LIST, constraints, lbrace.getPosition());
        return new Ast.ConstraintDef(ident.getContent(), list, keyword.getPosition());
    }

    private Ast.ConstraintExpr parseConstraint() throws SyntaxException {
        Token variable = tokenList.consumeExpected(TokenType.IDENTIFIER, TokenType.VARIABLE_REF);
        Token op = tokenList.get();
        TokenType operator;
        if (op.getType().isComparison() || op.isOf(TokenType.IN)) {
            tokenList.consume();
            operator = op.getType();
        } else if (op.isOf(TokenType.NOT)) {
            tokenList.consume();
            tokenList.consumeExpected(TokenType.IN);
            operator = TokenType.NOT;
        } else {
            throw new SyntaxException("Expected comparison operator but got " + TokenList.describe(op),
                    op.getPosition());
        }
        Ast.Node value = parseExpr();
        return new Ast.ConstraintExpr(variable.getContent(), operator, value, variable.getPosition());
    }

    private Ast.OutputSpec parseOutputSpec() throws SyntaxException {
        Token keyword = tokenList.consumeExpected(TokenType.OUTPUT);
        Token ident = tokenList.consumeExpected(TokenType.IDENTIFIER);
        String format = null;
        if (tokenList.get().isOf(TokenType.AS)) {
            tokenList.consume();
            format = tokenList.consumeExpected(TokenType.IDENTIFIER).getContent();
        }
        if (tokenList.get().isOf(TokenType.SEMICOLON)) {
            tokenList.consume();
        }
        return new Ast.OutputSpec(ident.getContent(), format, keyword.getPosition());
    }

    // element 与 statement 共用控制流的写法, 只是块内容不同
    private Ast.IfStmt parseIf(boolean element) throws SyntaxException {
        Token keyword = tokenList.consumeExpected(TokenType.IF);
        Ast.Node cond = parseExpr();
        Ast.Node thenBranch = parseBlock(element);
        Ast.Node elseBranch = null;
        if (tokenList.get().isOf(TokenType.ELSE)) {
            tokenList.consume();
            if (tokenList.get().isOf(TokenType.IF)) {
                elseBranch = parseIf(element);
            } else {
                elseBranch = parseBlock(element);
            }
        }
        return new Ast.IfStmt(cond, thenBranch, elseBranch, keyword.getPosition());
    }

    private Ast.ForStmt parseFor(boolean element) throws SyntaxException {
        Token keyword = tokenList.consumeExpected(TokenType.FOR);
        Token ident = tokenList.consumeExpected(TokenType.IDENTIFIER);
        tokenList.consumeExpected(TokenType.IN);
        Ast.Node iterable = parseExpr();
        Ast.Node body = parseBlock(element);
        return new Ast.ForStmt(ident.getContent(), iterable, body, keyword.getPosition());
    }

    private Ast.WhileStmt parseWhile(boolean element) throws SyntaxException {
        Token keyword = tokenList.consumeExpected(TokenType.WHILE);
        Ast.Node cond = parseExpr();
        Ast.Node body = parseBlock(element);
        return new Ast.WhileStmt(cond, body, keyword.getPosition());
    }

    private Ast.Node parseElement() throws SyntaxException {
        Token token = tokenList.get();
        switch (token.getType()) {
            case STRING:
                tokenList.consume();
                return new Ast.TextElement(token.getStringValue(), false, token.getPosition());
            case RAW: {
                tokenList.consume();
                Token text = tokenList.consumeExpected(TokenType.STRING);
                return new Ast.TextElement(text.getStringValue(), true, token.getPosition());
            }
            case VARIABLE_REF:
                tokenList.consume();
                return new Ast.VariableRef(token.getContent(), token.getPosition());
            case TEMPLATE_CALL:
                return parseTemplateCall();
            case IF:
                return parseIf(true);
            case FOR:
                return parseFor(true);
            case WHILE:
                return parseWhile(true);
            default:
                throw new SyntaxException("Unexpected " + TokenList.describe(token) + " in element block",
                        token.getPosition());
        }
    }

    private Ast.Call parseTemplateCall() throws SyntaxException {
        Token call = tokenList.consumeExpected(TokenType.TEMPLATE_CALL);
        Ast.ListNode args;
        if (tokenList.get().isOf(TokenType.LPAREN)) {
            args = parseArgs();
        } else {
            args = new Ast.ListNode(Ast.NodeType.ARGUMENT_LIST, new ArrayList<>(), call.getPosition());
        }
        return new Ast.Call(Ast.NodeType.TEMPLATE_CALL, call.getContent(), args, call.getPosition());
    }

    private Ast.ListNode parseArgs() throws SyntaxException {
        Token lparen = tokenList.consumeExpected(TokenType.LPAREN);
        ArrayList<Ast.Node> args = new ArrayList<>();
        if (!tokenList.get().isOf(TokenType.RPAREN)) {
            args.add(parseExpr());
            while (tokenList.get().isOf(TokenType.COMMA)) {
                tokenList.consume();
                args.add(parseExpr());
            }
        }
        tokenList.consumeExpected(TokenType.RPAREN);
        return new Ast.ListNode(Ast.NodeType.ARGUMENT_LIST, args, lparen.getPosition());
    }

    private Ast.Node parsePrimary() throws SyntaxException {
        Token temp = tokenList.get();
        switch (temp.getType()) {
            case LPAREN: {
                tokenList.consume();
                Ast.Node exp = parseExpr();
                tokenList.consumeExpected(TokenType.RPAREN);
                return exp;
            }
            case NUMBER:
                tokenList.consume();
                return new Ast.NumberLiteral(temp.getNumberValue(), temp.getPosition());
            case STRING:
                tokenList.consume();
                return new Ast.StringLiteral(temp.getStringValue(), temp.getPosition());
            case TRUE:
            case FALSE:
                tokenList.consume();
                return new Ast.BooleanLiteral(temp.getBoolValue(), temp.getPosition());
            case VARIABLE_REF:
                tokenList.consume();
                return new Ast.VariableRef(temp.getContent(), temp.getPosition());
            case TEMPLATE_CALL:
                return parseTemplateCall();
            case IDENTIFIER:
                tokenList.consume();
                if (tokenList.get().isOf(TokenType.LPAREN)) {
                    Ast.ListNode args = parseArgs();
                    return new Ast.Call(Ast.NodeType.FUNCTION_CALL, temp.getContent(), args, temp.getPosition());
                }
                return new Ast.Identifier(temp.getContent(), temp.getPosition());
            case LBRACKET: {
                tokenList.consume();
                ArrayList<Ast.Node> items = new ArrayList<>();
                if (!tokenList.get().isOf(TokenType.RBRACKET)) {
                    items.add(parseExpr());
                    while (tokenList.get().isOf(TokenType.COMMA)) {
                        tokenList.consume();
                        items.add(parseExpr());
                    }
                }
                tokenList.consumeExpected(TokenType.RBRACKET);
                return new Ast.ListNode(Ast.NodeType.EXPRESSION_LIST, items, temp.getPosition());
            }
            default:
                throw new SyntaxException("Unexpected " + TokenList.describe(temp) + " in expression",
                        temp.getPosition());
        }
    }

    // 二元表达式的种类, 优先级从低到高
    private enum BinaryExpType {
        LOR(TokenType.OR),
        LAND(TokenType.AND),
        EQ(TokenType.EQ, TokenType.NE),
        REL(TokenType.GT, TokenType.LT, TokenType.GE, TokenType.LE),
        ADD(TokenType.ADD, TokenType.SUB),
        MUL(TokenType.MUL, TokenType.DIV, TokenType.MOD),
        ;

        private final List<TokenType> types;

        BinaryExpType(TokenType... types) {
            this.types = List.of(types);
        }

        public boolean contains(TokenType type) {
            return types.contains(type);
        }
    }

    // 解析二元表达式的下一层表达式
    private Ast.Node parseSubBinaryExp(BinaryExpType expType) throws SyntaxException {
        return switch (expType) {
            case LOR -> parseBinaryExp(BinaryExpType.LAND);
            case LAND -> parseBinaryExp(BinaryExpType.EQ);
            case EQ -> parseBinaryExp(BinaryExpType.REL);
            case REL -> parseBinaryExp(BinaryExpType.ADD);
            case ADD -> parseBinaryExp(BinaryExpType.MUL);
            case MUL -> parsePowerExp();
        };
    }

    // 左结合: 每个运算符一个节点, 位置取左操作数的开头
    private Ast.Node parseBinaryExp(BinaryExpType expType) throws SyntaxException {
        Ast.Node left = parseSubBinaryExp(expType);
        while (expType.contains(tokenList.get().getType())) {
            Token op = tokenList.consume(); // 取得当前层次的运算符
            Ast.Node right = parseSubBinaryExp(expType);
            left = new Ast.BinaryExpr(op.getType(), left, right, left.getPosition());
        }
        return left;
    }

    // '^' 右结合
    private Ast.Node parsePowerExp() throws SyntaxException {
        Ast.Node base = parseUnaryExp();
        if (tokenList.get().isOf(TokenType.POW)) {
            tokenList.consume();
            Ast.Node exponent = parsePowerExp();
            return new Ast.BinaryExpr(TokenType.POW, base, exponent, base.getPosition());
        }
        return base;
    }

    private Ast.Node parseUnaryExp() throws SyntaxException {
        Token token = tokenList.get();
        if (token.isOf(TokenType.SUB, TokenType.NOT)) {
            tokenList.consume();
            Ast.Node operand = parseUnaryExp();
            return new Ast.UnaryExpr(token.getType(), operand, token.getPosition());
        }
        return parsePrimary();
    }

    public Ast.Node parseExpr() throws SyntaxException {
        return parseBinaryExp(BinaryExpType.LOR);
    }
}
