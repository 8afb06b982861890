package backend;

import frontend.syntax.Ast;

/**
 * Markdown 输出: 定义是标题, 变量和调用是行内代码
 */
public class MarkdownEmitter extends Emitter {

    public MarkdownEmitter(StringBuilder out) {
        super(out);
    }

    private void code(String text) {
        out.append('`').append(text).append('`');
    }

    @Override
    public void emit(Ast.Node node) {
        switch (node.getType()) {
            case PROGRAM -> {
                for (Ast.Node statement : ((Ast.Program) node).getStatements()) {
                    emit(statement);
                    out.append("\n\n");
                }
            }
            case STATEMENT_LIST -> {
                for (Ast.Node statement : ((Ast.ListNode) node).getElements()) {
                    emit(statement);
                    out.append("\n\n");
                }
            }
            case ELEMENT_LIST -> {
                for (Ast.Node element : ((Ast.ListNode) node).getElements()) {
                    emit(element);
                }
            }
            case PROMPT_DEF -> {
                Ast.PromptDef def = (Ast.PromptDef) node;
                out.append("## Prompt: ").append(def.getName()).append("\n\n");
                emit(def.getBody());
            }
            case TEMPLATE_DEF -> {
                Ast.TemplateDef def = (Ast.TemplateDef) node;
                out.append("## Template: ").append(def.getName())
                        .append('(').append(String.join(", ", def.getParameters())).append(")\n\n");
                emit(def.getBody());
            }
            case VAR_DECL -> {
                Ast.VarDecl decl = (Ast.VarDecl) node;
                out.append("- **").append(decl.getName()).append("**");
                if (decl.getInitializer() != null) {
                    out.append(" = ");
                    code(expression(decl.getInitializer()));
                }
            }
            case OUTPUT_SPEC -> out.append("**Output:** ").append(((Ast.OutputSpec) node).getName());
            case CONSTRAINT_DEF -> {
                Ast.ConstraintDef def = (Ast.ConstraintDef) node;
                out.append("### Constraint: ").append(def.getName());
                for (Ast.Node item : def.getConstraints().getElements()) {
                    out.append("\n- ");
                    code(constraint((Ast.ConstraintExpr) item));
                }
            }
            case TEXT_ELEMENT -> out.append(((Ast.TextElement) node).getText());
            case IF_STMT -> {
                Ast.IfStmt stmt = (Ast.IfStmt) node;
                code("{IF " + expression(stmt.getCondition()) + "}");
                emit(stmt.getThenBranch());
                if (stmt.getElseBranch() != null) {
                    code("{ELSE}");
                    emit(stmt.getElseBranch());
                }
                code("{END}");
            }
            case FOR_STMT -> {
                Ast.ForStmt stmt = (Ast.ForStmt) node;
                code("{FOR " + stmt.getVariable() + " IN " + expression(stmt.getIterable()) + "}");
                emit(stmt.getBody());
                code("{END}");
            }
            case WHILE_STMT -> {
                Ast.WhileStmt stmt = (Ast.WhileStmt) node;
                code("{WHILE " + expression(stmt.getCondition()) + "}");
                emit(stmt.getBody());
                code("{END}");
            }
            case EMPTY -> {
            }
            default -> code(expression(node));
        }
    }
}
