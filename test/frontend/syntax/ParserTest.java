package frontend.syntax;

import exception.SyntaxException;
import frontend.lexer.Lexer;
import frontend.lexer.Position;
import frontend.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ParserTest {

    private static Ast.Program parse(String src) throws SyntaxException {
        return new Parser(new Lexer(src, "t.pcc").tokenize()).parseProgram();
    }

    private static Ast.Node expr(String src) throws SyntaxException {
        return new Parser(new Lexer(src, "t.pcc").tokenize()).parseExpr();
    }

    @Test
    void promptWithTextAndVariable() throws SyntaxException {
        Ast.Program program = parse("PROMPT greet { \"Hello, \" $name }");
        assertEquals(1, program.getStatements().size());
        Ast.PromptDef def = (Ast.PromptDef) program.getStatements().get(0);
        assertEquals("greet", def.getName());
        assertEquals(Ast.NodeType.ELEMENT_LIST, def.getBody().getType());
        List<Ast.Node> body = def.getBody().getElements();
        assertEquals("Hello, ", ((Ast.TextElement) body.get(0)).getText());
        assertFalse(((Ast.TextElement) body.get(0)).isRaw());
        assertEquals("name", ((Ast.VariableRef) body.get(1)).getName());
        assertTrue(Ast.isTree(program));
    }

    @Test
    void multiplicationBindsTighterThanAddition() throws SyntaxException {
        Ast.BinaryExpr add = (Ast.BinaryExpr) expr("2 + 3 * 4");
        assertEquals(TokenType.ADD, add.getOperator());
        assertEquals(2.0, ((Ast.NumberLiteral) add.getLeft()).getValue());
        Ast.BinaryExpr mul = (Ast.BinaryExpr) add.getRight();
        assertEquals(TokenType.MUL, mul.getOperator());
    }

    @Test
    void subtractionIsLeftAssociative() throws SyntaxException {
        Ast.BinaryExpr outer = (Ast.BinaryExpr) expr("1 - 2 - 3");
        assertTrue(outer.getLeft() instanceof Ast.BinaryExpr);
        assertEquals(3.0, ((Ast.NumberLiteral) outer.getRight()).getValue());
    }

    @Test
    void powerIsRightAssociative() throws SyntaxException {
        Ast.BinaryExpr outer = (Ast.BinaryExpr) expr("2 ^ 3 ^ 2");
        assertEquals(TokenType.POW, outer.getOperator());
        assertTrue(outer.getLeft() instanceof Ast.NumberLiteral);
        assertEquals(TokenType.POW, ((Ast.BinaryExpr) outer.getRight()).getOperator());
    }

    @Test
    void logicalOperatorsHaveLowestPrecedence() throws SyntaxException {
        Ast.BinaryExpr or = (Ast.BinaryExpr) expr("$a == 1 OR NOT $b AND $c");
        assertEquals(TokenType.OR, or.getOperator());
        assertEquals(TokenType.EQ, ((Ast.BinaryExpr) or.getLeft()).getOperator());
        Ast.BinaryExpr and = (Ast.BinaryExpr) or.getRight();
        assertEquals(TokenType.AND, and.getOperator());
        assertEquals(TokenType.NOT, ((Ast.UnaryExpr) and.getLeft()).getOperator());
    }

    @Test
    void binaryNodeStartsAtItsLeftOperand() throws SyntaxException {
        Ast.Node node = expr("1 +\n  2");
        assertEquals(new Position(1, 1, "t.pcc"), node.getPosition());
        Ast.BinaryExpr pow = (Ast.BinaryExpr) expr("  $a ^ 2");
        assertEquals(new Position(1, 3, "t.pcc"), pow.getPosition());
    }

    @Test
    void callsListsAndIdentifiers() throws SyntaxException {
        Ast.BinaryExpr add = (Ast.BinaryExpr) expr("len($x) + n");
        Ast.Call call = (Ast.Call) add.getLeft();
        assertEquals(Ast.NodeType.FUNCTION_CALL, call.getType());
        assertEquals(1, call.getArguments().size());
        assertEquals(Ast.NodeType.IDENTIFIER, add.getRight().getType());

        Ast.ListNode list = (Ast.ListNode) expr("[1, \"two\", true]");
        assertEquals(Ast.NodeType.EXPRESSION_LIST, list.getType());
        assertEquals(3, list.size());
    }

    @Test
    void templateParametersAndCalls() throws SyntaxException {
        Ast.Program program = parse("TEMPLATE t(a, b) { $a RAW \"{raw}\" }\nPROMPT p { @t(1, 2) @t }");
        Ast.TemplateDef def = (Ast.TemplateDef) program.getStatements().get(0);
        assertEquals(List.of("a", "b"), def.getParameters());
        assertTrue(((Ast.TextElement) def.getBody().getElements().get(1)).isRaw());
        Ast.PromptDef prompt = (Ast.PromptDef) program.getStatements().get(1);
        Ast.Call withArgs = (Ast.Call) prompt.getBody().getElements().get(0);
        Ast.Call bare = (Ast.Call) prompt.getBody().getElements().get(1);
        assertEquals(Ast.NodeType.TEMPLATE_CALL, withArgs.getType());
        assertEquals(2, withArgs.getArguments().size());
        assertEquals(0, bare.getArguments().size());
    }

    @Test
    void constraintOperators() throws SyntaxException {
        Ast.Program program = parse("CONSTRAINT c { length <= 100; tone IN [\"a\", \"b\"], $x NOT IN [1] }");
        Ast.ConstraintDef def = (Ast.ConstraintDef) program.getStatements().get(0);
        List<Ast.Node> items = def.getConstraints().getElements();
        assertEquals(3, items.size());
        assertEquals(TokenType.LE, ((Ast.ConstraintExpr) items.get(0)).getOperator());
        assertEquals("IN", ((Ast.ConstraintExpr) items.get(1)).getOperatorText());
        Ast.ConstraintExpr notIn = (Ast.ConstraintExpr) items.get(2);
        assertEquals("x", notIn.getVariable());
        assertEquals("NOT IN", notIn.getOperatorText());
    }

    @Test
    void outputWithFormat() throws SyntaxException {
        Ast.Program program = parse("OUTPUT p AS markdown; OUTPUT q");
        assertEquals("markdown", ((Ast.OutputSpec) program.getStatements().get(0)).getFormat());
        assertNull(((Ast.OutputSpec) program.getStatements().get(1)).getFormat());
    }

    @Test
    void elseIfChains() throws SyntaxException {
        Ast.Program program = parse("IF true { VAR a } ELSE IF false { VAR b } ELSE { VAR c }");
        Ast.IfStmt first = (Ast.IfStmt) program.getStatements().get(0);
        assertEquals(Ast.NodeType.STATEMENT_LIST, first.getThenBranch().getType());
        Ast.IfStmt second = (Ast.IfStmt) first.getElseBranch();
        assertEquals(Ast.NodeType.STATEMENT_LIST, second.getElseBranch().getType());
    }

    @Test
    void controlFlowInsideElements() throws SyntaxException {
        Ast.Program program = parse("PROMPT p { FOR item IN $items { $item } WHILE $more { \"x\" } }");
        Ast.PromptDef def = (Ast.PromptDef) program.getStatements().get(0);
        Ast.ForStmt loop = (Ast.ForStmt) def.getBody().getElements().get(0);
        assertEquals("item", loop.getVariable());
        assertEquals(Ast.NodeType.ELEMENT_LIST, loop.getBody().getType());
        assertEquals(Ast.NodeType.WHILE_STMT, def.getBody().getElements().get(1).getType());
    }

    @Test
    void recoversAndReportsEveryBadStatement() {
        Parser parser = new Parser(new Lexer("PROMPT { }\nVAR = 3;\nOUTPUT p\nTEMPLATE 5 {}", "t.pcc").tokenize());
        SyntaxException e = assertThrows(SyntaxException.class, parser::parseProgram);
        assertEquals(3, parser.getErrors().size());
        assertTrue(e.getMessage().startsWith("3 syntax errors"), e.getMessage());
        assertEquals(1, parser.getErrors().get(0).getPosition().getLine());
        assertEquals(2, parser.getErrors().get(1).getPosition().getLine());
        assertEquals(4, parser.getErrors().get(2).getPosition().getLine());
    }

    @Test
    void badElementInNestedBlockIsReportedOnce() {
        Parser parser = new Parser(new Lexer("PROMPT a { IF $c { 5 } \"y\" }\nPROMPT b { \"ok\" }", "t.pcc").tokenize());
        assertThrows(SyntaxException.class, parser::parseProgram);
        assertEquals(1, parser.getErrors().size());
        assertEquals("Unexpected '5' in element block", parser.getErrors().get(0).getMessage());
    }

    @Test
    void blockRecoveryStopsAtNextElement() {
        Parser parser = new Parser(new Lexer("PROMPT a { \"x\" 5 IF $c { \"y\" } }\nPROMPT b {\"ok\"}", "t.pcc").tokenize());
        assertThrows(SyntaxException.class, parser::parseProgram);
        assertEquals(1, parser.getErrors().size());
        assertEquals(new Position(1, 16, "t.pcc"), parser.getErrors().get(0).getPosition());
    }

    @Test
    void statementBlockSkipsNestedBraces() {
        Parser parser = new Parser(new Lexer("IF true { 7 { VAR a } VAR b }\nVAR c", "t.pcc").tokenize());
        assertThrows(SyntaxException.class, parser::parseProgram);
        assertEquals(1, parser.getErrors().size());
        assertTrue(parser.getErrors().get(0).getMessage().contains("expected a statement"));
    }

    @Test
    void unclosedBlockReportsEndOfInput() {
        Parser parser = new Parser(new Lexer("PROMPT p { \"x\"", null).tokenize());
        assertThrows(SyntaxException.class, parser::parseProgram);
        assertEquals(1, parser.getErrors().size());
        assertTrue(parser.getErrors().get(0).getMessage().contains("end of input"));
    }

    @Test
    void sharedNodeIsNotATree() {
        Ast.VariableRef shared = new Ast.VariableRef("x", null);
        ArrayList<Ast.Node> items = new ArrayList<>();
        items.add(shared);
        items.add(shared);
        Ast.ListNode list = new Ast.ListNode(Ast.NodeType.ELEMENT_LIST, items, null);
        assertFalse(Ast.isTree(list));
        assertEquals(Position.UNKNOWN, shared.getPosition());
    }

    @Test
    void printerShowsKindsAndNames() throws SyntaxException {
        String dump = AstPrinter.print(parse("PROMPT greet { $name }"));
        assertTrue(dump.startsWith("PROGRAM"), dump);
        assertTrue(dump.contains("  PROMPT_DEF greet (line 1, col 1)"), dump);
        assertTrue(dump.contains("      VARIABLE_REF $name"), dump);
    }
}
