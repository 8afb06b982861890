package midend;

import backend.CodeGen;
import backend.OutputFormat;
import exception.SyntaxException;
import frontend.lexer.Lexer;
import frontend.lexer.TokenType;
import frontend.syntax.Ast;
import frontend.syntax.Parser;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

final class MidEndRunnerTest {

    private static Ast.Program parse(String src) throws SyntaxException {
        return new Parser(new Lexer(src, "t.pcc").tokenize()).parseProgram();
    }

    private static Ast.Node expr(String src) throws SyntaxException {
        return new Parser(new Lexer(src, "t.pcc").tokenize()).parseExpr();
    }

    private static double number(Ast.Node node) {
        return ((Ast.NumberLiteral) node).getValue();
    }

    @Test
    void foldsNestedArithmeticOncePerOperator() throws SyntaxException {
        Ast.Node root = expr("2 + 3 * 4");
        OptContext ctx = OptContext.all();
        Ast.Node folded = MidEndRunner.optimize(root, ctx);
        assertEquals(14.0, number(folded));
        assertEquals(2, ctx.getApplied());
        assertEquals(root.getPosition(), folded.getPosition());
    }

    @Test
    void secondRunChangesNothing() throws SyntaxException {
        Ast.Program program = parse("VAR x\nIF false { VAR y } IF 1 + 1 > $x { VAR z }");
        OptContext ctx = OptContext.all();
        MidEndRunner.optimize(program, ctx);
        int first = ctx.getApplied();
        assertTrue(first > 0);
        String once = new CodeGen(OutputFormat.JSON).generate(program);
        ctx.reset();
        MidEndRunner.optimize(program, ctx);
        assertEquals(0, ctx.getApplied());
        assertEquals(once, new CodeGen(OutputFormat.JSON).generate(program));
    }

    @Test
    void divisionByZeroIsKept() throws SyntaxException {
        OptContext ctx = OptContext.all();
        Ast.Node node = MidEndRunner.optimize(expr("10 / 0"), ctx);
        assertEquals(Ast.NodeType.BINARY_EXPR, node.getType());
        assertEquals(0, ctx.getApplied());
        node = MidEndRunner.optimize(expr("10 % 0"), ctx);
        assertEquals(Ast.NodeType.BINARY_EXPR, node.getType());
    }

    @Test
    void remainderPowerAndNegation() throws SyntaxException {
        OptContext ctx = OptContext.all();
        assertEquals(1.5, number(MidEndRunner.optimize(expr("7.5 % 2"), ctx)));
        assertEquals(512.0, number(MidEndRunner.optimize(expr("2 ^ 3 ^ 2"), ctx)));
        assertEquals(-4.0, number(MidEndRunner.optimize(expr("-(1 + 3)"), ctx)));
        Ast.Node not = MidEndRunner.optimize(expr("NOT true"), ctx);
        assertFalse(((Ast.BooleanLiteral) not).getValue());
    }

    @Test
    void comparisonsAndStringsAreNotFolded() throws SyntaxException {
        OptContext ctx = OptContext.all();
        Ast.BinaryExpr cmp = (Ast.BinaryExpr) MidEndRunner.optimize(expr("1 + 1 < 3"), ctx);
        assertEquals(TokenType.LT, cmp.getOperator());
        assertEquals(2.0, number(cmp.getLeft()));
        assertEquals(1, ctx.getApplied());
        Ast.Node concat = MidEndRunner.optimize(expr("\"a\" + \"b\""), ctx);
        assertEquals(Ast.NodeType.BINARY_EXPR, concat.getType());
    }

    @Test
    void constantTrueKeepsThenBranch() throws SyntaxException {
        Ast.Program program = parse("IF true { VAR a VAR b } ELSE { VAR c }\nOUTPUT p");
        OptContext ctx = OptContext.all();
        MidEndRunner.optimize(program, ctx);
        assertEquals(3, program.getStatements().size());
        assertEquals("a", ((Ast.VarDecl) program.getStatements().get(0)).getName());
        assertEquals("b", ((Ast.VarDecl) program.getStatements().get(1)).getName());
        assertEquals(1, ctx.getApplied());
        assertTrue(Ast.isTree(program));
    }

    @Test
    void constantFalseWithoutElseIsRemoved() throws SyntaxException {
        Ast.Program program = parse("IF false { VAR a }\nVAR b");
        MidEndRunner.optimize(program, OptContext.all());
        assertEquals(1, program.getStatements().size());
        assertEquals("b", ((Ast.VarDecl) program.getStatements().get(0)).getName());
    }

    @Test
    void foldedConditionFeedsDeadCodeElimination() throws SyntaxException {
        Ast.Program program = parse("IF NOT false { VAR a } ELSE { VAR b }");
        OptContext ctx = OptContext.all();
        MidEndRunner.optimize(program, ctx);
        assertEquals(1, program.getStatements().size());
        assertEquals("a", ((Ast.VarDecl) program.getStatements().get(0)).getName());
        assertEquals(2, ctx.getApplied());
    }

    @Test
    void elseIfChainCollapses() throws SyntaxException {
        Ast.Program program = parse("IF $x { VAR a } ELSE IF false { VAR b }");
        MidEndRunner.optimize(program, OptContext.all());
        Ast.IfStmt stmt = (Ast.IfStmt) program.getStatements().get(0);
        assertNull(stmt.getElseBranch());
    }

    @Test
    void disabledFoldingStillEliminatesDeadCode() throws SyntaxException {
        Ast.Program program = parse("IF true { VAR a = 1 + 2 }");
        OptContext ctx = new OptContext(OptPass.DEAD_CODE_ELIMINATION);
        MidEndRunner.optimize(program, ctx);
        Ast.VarDecl decl = (Ast.VarDecl) program.getStatements().get(0);
        assertEquals(Ast.NodeType.BINARY_EXPR, decl.getInitializer().getType());
        assertEquals(1, ctx.getApplied());
    }

    @Test
    void disabledEliminationStillFoldsConditions() throws SyntaxException {
        Ast.Program program = parse("IF NOT true { VAR a }");
        OptContext ctx = new OptContext(OptPass.CONSTANT_FOLDING);
        MidEndRunner.optimize(program, ctx);
        Ast.IfStmt stmt = (Ast.IfStmt) program.getStatements().get(0);
        assertEquals(Ast.NodeType.BOOLEAN_LITERAL, stmt.getCondition().getType());
        assertEquals(1, ctx.getApplied());
    }

    @Test
    void noPassesMeansNoChange() throws SyntaxException {
        OptContext ctx = new OptContext(EnumSet.noneOf(OptPass.class));
        Ast.Node node = MidEndRunner.optimize(expr("1 + 2"), ctx);
        assertEquals(Ast.NodeType.BINARY_EXPR, node.getType());
        assertEquals(0, ctx.getApplied());
        assertFalse(ctx.isEnabled(OptPass.CONSTANT_FOLDING));
    }

    @Test
    void definitionsAreLeftAlone() throws SyntaxException {
        Ast.Program program = parse("VAR a = 1 + 2\nPROMPT p { IF true { \"x\" } }");
        OptContext ctx = OptContext.all();
        MidEndRunner.optimize(program, ctx);
        assertEquals(0, ctx.getApplied());
        Ast.PromptDef prompt = (Ast.PromptDef) program.getStatements().get(1);
        assertEquals(Ast.NodeType.IF_STMT, prompt.getBody().getElements().get(0).getType());
    }

    @Test
    void disablingOnePassOfAll() {
        OptContext ctx = OptContext.all();
        ctx.disable(OptPass.DEAD_CODE_ELIMINATION);
        assertTrue(ctx.isEnabled(OptPass.CONSTANT_FOLDING));
        assertFalse(ctx.isEnabled(OptPass.DEAD_CODE_ELIMINATION));
    }
}
