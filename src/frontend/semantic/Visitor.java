package frontend.semantic;

import frontend.lexer.Position;
import frontend.semantic.symbol.SymTable;
import frontend.semantic.symbol.Symbol;
import frontend.semantic.symbol.SymbolKind;
import frontend.syntax.Ast;
import frontend.syntax.Ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 遍历语法树, 建立符号表并做语义检查
 * 遇到错误只记录诊断, 不中断遍历; 返回值表示该子树是否全部通过
 */
public class Visitor {
    private static final Logger log = LoggerFactory.getLogger(Visitor.class);

    private static final List<String> FORMATS = List.of("json", "text", "markdown");

    private final SymTable symTable;
    // 变量引用 / 调用 => 解析到的符号
    private final Map<Node, Symbol> resolutions = new IdentityHashMap<>();
    // 当前 prompt 的作用域, 不在 prompt 内时为 -1
    private int promptScope = -1;

    public Visitor() {
        this(new SymTable());
    }

    public Visitor(SymTable symTable) {
        if (symTable == null) {
            throw new NullPointerException("symTable");
        }
        this.symTable = symTable;
    }

    public SymTable getSymTable() {
        return symTable;
    }

    public Symbol getResolution(Node node) {
        return resolutions.get(node);
    }

    public boolean visitProgram(Program program) {
        boolean ok = true;
        for (Node statement : program.getStatements()) {
            ok &= visit(statement);
        }
        log.debug("analysis finished with {} diagnostics", symTable.errorCount());
        return ok;
    }

    private void error(String message, Position position, DiagnosticCode code) {
        symTable.addError(message, position, code);
    }

    private boolean define(String name, SymbolKind kind, Node node) {
        return symTable.add(new Symbol(name, kind, node));
    }

    // prompt 体内未定义的 $name 视为 prompt 的输入, 定义在 prompt 自己的作用域里
    private boolean visitPromptDef(PromptDef def) {
        boolean ok = define(def.getName(), SymbolKind.PROMPT, def);
        int outer = promptScope;
        promptScope = symTable.enterScope();
        try {
            ok &= visit(def.getBody());
        } finally {
            symTable.exitScope();
            promptScope = outer;
        }
        return ok;
    }

    private boolean visitVarDecl(VarDecl decl) {
        boolean ok = define(decl.getName(), SymbolKind.VARIABLE, decl);
        if (decl.getInitializer() != null) {
            ok &= visit(decl.getInitializer());
        }
        return ok;
    }

    private boolean visitTemplateDef(TemplateDef def) {
        boolean ok = define(def.getName(), SymbolKind.TEMPLATE, def);
        symTable.enterScope();
        try {
            for (String param : def.getParameters()) {
                ok &= symTable.add(new Symbol(param, SymbolKind.PARAMETER, def));
            }
            ok &= visit(def.getBody());
        } finally {
            symTable.exitScope();
        }
        return ok;
    }

    private boolean visitConstraintDef(ConstraintDef def) {
        boolean ok = define(def.getName(), SymbolKind.CONSTRAINT, def);
        return visit(def.getConstraints()) && ok;
    }

    private boolean visitOutputSpec(OutputSpec spec) {
        boolean ok = true;
        Symbol symbol = symTable.lookup(spec.getName());
        if (symbol == null) {
            error(String.format("Undefined prompt '%s' in OUTPUT specification", spec.getName()),
                    spec.getPosition(), DiagnosticCode.UNDEFINED_SYMBOL);
            ok = false;
        } else if (symbol.getKind() != SymbolKind.PROMPT) {
            error(String.format("'%s' is not a prompt in OUTPUT specification", spec.getName()),
                    spec.getPosition(), DiagnosticCode.TYPE_MISMATCH);
            ok = false;
        } else {
            symbol.markUsed();
            resolutions.put(spec, symbol);
        }
        String format = spec.getFormat();
        if (format != null && !FORMATS.contains(format.toLowerCase(Locale.ROOT))) {
            error(String.format("Unknown output format '%s'", format), spec.getPosition(),
                    DiagnosticCode.INVALID_OPERATION);
            ok = false;
        }
        return ok;
    }

    // $name 只能引用变量或参数
    private boolean checkVariable(Node node, String name) {
        Symbol symbol = symTable.lookup(name);
        if (symbol == null && promptScope != -1 && node instanceof VariableRef) {
            symbol = new Symbol(name, SymbolKind.VARIABLE, node);
            symTable.addTo(promptScope, symbol);
            log.debug("'${}' becomes an input of the enclosing prompt", name);
        }
        if (symbol == null) {
            error(String.format("Undefined variable '$%s'", name), node.getPosition(),
                    DiagnosticCode.UNDEFINED_SYMBOL);
            return false;
        }
        if (!symbol.getKind().isValue()) {
            error(String.format("'$%s' is not a variable", name), node.getPosition(),
                    DiagnosticCode.TYPE_MISMATCH);
            return false;
        }
        symbol.markUsed();
        resolutions.put(node, symbol);
        return true;
    }

    private boolean visitVariableRef(VariableRef ref) {
        return checkVariable(ref, ref.getName());
    }

    private boolean visitCall(Call call) {
        boolean ok = true;
        Symbol symbol = symTable.lookup(call.getName());
        if (symbol == null) {
            error(String.format("Undefined template '%s'", call.getName()), call.getPosition(),
                    DiagnosticCode.UNDEFINED_SYMBOL);
            ok = false;
        } else if (symbol.getKind() != SymbolKind.TEMPLATE) {
            error(String.format("'%s' is not a template", call.getName()), call.getPosition(),
                    DiagnosticCode.TYPE_MISMATCH);
            ok = false;
        } else {
            symbol.markUsed();
            resolutions.put(call, symbol);
            ok = checkArity(call, symbol);
        }
        return visit(call.getArguments()) && ok;
    }

    private boolean checkArity(Call call, Symbol template) {
        if (!(template.getNode() instanceof TemplateDef)) {
            return true;
        }
        int expected = ((TemplateDef) template.getNode()).getParameters().size();
        int actual = call.getArguments().size();
        if (actual < expected) {
            error(String.format("Template '%s' expects %d argument(s) but got %d", call.getName(), expected, actual),
                    call.getPosition(), DiagnosticCode.MISSING_ARGUMENT);
            return false;
        }
        if (actual > expected) {
            error(String.format("Template '%s' expects %d argument(s) but got %d", call.getName(), expected, actual),
                    call.getPosition(), DiagnosticCode.TOO_MANY_ARGUMENTS);
            return false;
        }
        return true;
    }

    private boolean visitIdentifier(Identifier ident) {
        Symbol symbol = symTable.lookup(ident.getName());
        if (symbol == null) {
            error(String.format("Undefined identifier '%s'", ident.getName()), ident.getPosition(),
                    DiagnosticCode.UNDEFINED_SYMBOL);
            return false;
        }
        symbol.markUsed();
        resolutions.put(ident, symbol);
        return true;
    }

    private boolean visitIfStmt(IfStmt stmt) {
        boolean ok = visit(stmt.getCondition());
        ok &= visit(stmt.getThenBranch());
        if (stmt.getElseBranch() != null) {
            ok &= visit(stmt.getElseBranch());
        }
        return ok;
    }

    // 循环变量只在循环内可见, 可遮蔽外层同名符号
    private boolean visitForStmt(ForStmt stmt) {
        boolean ok;
        symTable.enterScope();
        try {
            ok = symTable.add(new Symbol(stmt.getVariable(), SymbolKind.VARIABLE, stmt));
            ok &= visit(stmt.getIterable());
            ok &= visit(stmt.getBody());
        } finally {
            symTable.exitScope();
        }
        return ok;
    }

    private boolean visitWhileStmt(WhileStmt stmt) {
        boolean ok = visit(stmt.getCondition());
        return visit(stmt.getBody()) && ok;
    }

    private boolean visitConstraintExpr(ConstraintExpr expr) {
        boolean ok = checkVariable(expr, expr.getVariable());
        return visit(expr.getValue()) && ok;
    }

    private boolean visitChildren(Node node) {
        boolean ok = true;
        for (Node child : node.children()) {
            ok &= visit(child);
        }
        return ok;
    }

    public boolean visit(Node node) {
        if (node == null) {
            return true;
        }
        if (node instanceof Program) {
            return visitProgram((Program) node);
        } else if (node instanceof PromptDef) {
            return visitPromptDef((PromptDef) node);
        } else if (node instanceof VarDecl) {
            return visitVarDecl((VarDecl) node);
        } else if (node instanceof TemplateDef) {
            return visitTemplateDef((TemplateDef) node);
        } else if (node instanceof ConstraintDef) {
            return visitConstraintDef((ConstraintDef) node);
        } else if (node instanceof OutputSpec) {
            return visitOutputSpec((OutputSpec) node);
        } else if (node instanceof VariableRef) {
            return visitVariableRef((VariableRef) node);
        } else if (node instanceof Call) {
            return visitCall((Call) node);
        } else if (node instanceof Identifier) {
            return visitIdentifier((Identifier) node);
        } else if (node instanceof IfStmt) {
            return visitIfStmt((IfStmt) node);
        } else if (node instanceof ForStmt) {
            return visitForStmt((ForStmt) node);
        } else if (node instanceof WhileStmt) {
            return visitWhileStmt((WhileStmt) node);
        } else if (node instanceof ConstraintExpr) {
            return visitConstraintExpr((ConstraintExpr) node);
        } else if (node instanceof BinaryExpr || node instanceof UnaryExpr || node instanceof ListNode) {
            return visitChildren(node);
        } else if (node.getType().isLiteral() || node instanceof TextElement || node instanceof Ast.Empty) {
            return true;
        }
        throw new AssertionError("unhandled node " + node);
    }
}
