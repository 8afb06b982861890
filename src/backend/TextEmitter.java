package backend;

import frontend.syntax.Ast;

/**
 * 纯文本输出
 */
public class TextEmitter extends Emitter {

    public TextEmitter(StringBuilder out) {
        super(out);
    }

    @Override
    public void emit(Ast.Node node) {
        switch (node.getType()) {
            case PROGRAM -> {
                for (Ast.Node statement : ((Ast.Program) node).getStatements()) {
                    emit(statement);
                    out.append('\n');
                }
            }
            case STATEMENT_LIST -> {
                for (Ast.Node statement : ((Ast.ListNode) node).getElements()) {
                    emit(statement);
                    out.append('\n');
                }
            }
            case ELEMENT_LIST -> {
                for (Ast.Node element : ((Ast.ListNode) node).getElements()) {
                    emit(element);
                }
            }
            case PROMPT_DEF -> {
                Ast.PromptDef def = (Ast.PromptDef) node;
                out.append("Prompt: ").append(def.getName()).append('\n');
                emit(def.getBody());
            }
            case TEMPLATE_DEF -> {
                Ast.TemplateDef def = (Ast.TemplateDef) node;
                out.append("Template: ").append(def.getName())
                        .append('(').append(String.join(", ", def.getParameters())).append(")\n");
                emit(def.getBody());
            }
            case VAR_DECL -> {
                Ast.VarDecl decl = (Ast.VarDecl) node;
                out.append("Var: ").append(decl.getName());
                if (decl.getInitializer() != null) {
                    out.append(" = ").append(expression(decl.getInitializer()));
                }
            }
            case OUTPUT_SPEC -> out.append("Output: ").append(((Ast.OutputSpec) node).getName());
            case CONSTRAINT_DEF -> {
                Ast.ConstraintDef def = (Ast.ConstraintDef) node;
                out.append("Constraint: ").append(def.getName());
                for (Ast.Node item : def.getConstraints().getElements()) {
                    out.append("\n  ").append(constraint((Ast.ConstraintExpr) item));
                }
            }
            case TEXT_ELEMENT -> out.append(((Ast.TextElement) node).getText());
            case IF_STMT -> {
                Ast.IfStmt stmt = (Ast.IfStmt) node;
                out.append("{IF ").append(expression(stmt.getCondition())).append('}');
                emit(stmt.getThenBranch());
                if (stmt.getElseBranch() != null) {
                    out.append("{ELSE}");
                    emit(stmt.getElseBranch());
                }
                out.append("{END}");
            }
            case FOR_STMT -> {
                Ast.ForStmt stmt = (Ast.ForStmt) node;
                out.append("{FOR ").append(stmt.getVariable()).append(" IN ")
                        .append(expression(stmt.getIterable())).append('}');
                emit(stmt.getBody());
                out.append("{END}");
            }
            case WHILE_STMT -> {
                Ast.WhileStmt stmt = (Ast.WhileStmt) node;
                out.append("{WHILE ").append(expression(stmt.getCondition())).append('}');
                emit(stmt.getBody());
                out.append("{END}");
            }
            case EMPTY -> {
            }
            default -> out.append(expression(node));
        }
    }
}
