package frontend.semantic.symbol;

import frontend.lexer.Position;
import frontend.semantic.Diagnostic;
import frontend.semantic.DiagnosticCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分层结构的符号表
 * 所有作用域放在一个数组里, 0 号是全局作用域; 退出作用域只移动 current, 不删除
 */
public class SymTable {
    private static final Logger log = LoggerFactory.getLogger(SymTable.class);

    public static final int GLOBAL = 0;

    private final ArrayList<Scope> scopes = new ArrayList<>();
    private final ArrayList<Diagnostic> diagnostics = new ArrayList<>();
    private int current;

    // 构造全局符号表
    public SymTable() {
        scopes.add(new Scope(GLOBAL, Scope.NO_PARENT, 0));
        current = GLOBAL;
    }

    public int enterScope() {
        Scope parent = scopes.get(current);
        Scope scope = new Scope(scopes.size(), current, parent.getDepth() + 1);
        scopes.add(scope);
        current = scope.getHandle();
        return current;
    }

    public void exitScope() {
        Scope scope = scopes.get(current);
        if (!scope.hasParent()) {
            throw new IllegalStateException("cannot exit the global scope");
        }
        current = scope.getParent();
    }

    public int getCurrent() {
        return current;
    }

    public Scope getScope(int handle) {
        return scopes.get(handle);
    }

    public Scope getCurrentScope() {
        return scopes.get(current);
    }

    public int getScopeCount() {
        return scopes.size();
    }

    // 当前层已有同名符号 => 重定义, 保留先定义的那个
    public boolean add(Symbol symbol) {
        Scope scope = scopes.get(current);
        if (scope.contains(symbol.getName())) {
            addError(String.format("Symbol '%s' already defined in this scope", symbol.getName()),
                    symbol.getPosition(), DiagnosticCode.REDEFINED_SYMBOL);
            return false;
        }
        scope.put(symbol);
        return true;
    }

    // 直接加到指定作用域, 用于 prompt 的隐式输入变量
    public boolean addTo(int handle, Symbol symbol) {
        int saved = current;
        current = handle;
        try {
            return add(symbol);
        } finally {
            current = saved;
        }
    }

    // 使用符号 => 递归查找, 判断重定义 => 只查当前层
    public Symbol lookup(String name) {
        int handle = current;
        while (handle != Scope.NO_PARENT) {
            Scope scope = scopes.get(handle);
            Symbol symbol = scope.get(name);
            if (symbol != null) {
                return symbol;
            }
            handle = scope.getParent();
        }
        return null;
    }

    public Symbol lookupLocal(String name) {
        return scopes.get(current).get(name);
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public boolean markUsed(String name) {
        Symbol symbol = lookup(name);
        if (symbol == null) {
            addError(String.format("Undefined symbol '%s'", name), Position.UNKNOWN,
                    DiagnosticCode.UNDEFINED_SYMBOL);
            return false;
        }
        symbol.markUsed();
        return true;
    }

    public void addError(String message, Position position, DiagnosticCode code) {
        Diagnostic diagnostic = new Diagnostic(message, position, code);
        diagnostics.add(diagnostic);
        log.debug("{}", diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int errorCount() {
        return diagnostics.size();
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        for (Scope scope : scopes) {
            sb.append("  ".repeat(scope.getDepth())).append("Scope (level ").append(scope.getDepth()).append("):\n");
            for (Symbol symbol : scope.getSymbols()) {
                sb.append("  ".repeat(scope.getDepth() + 1)).append(symbol).append('\n');
            }
        }
        return sb.toString();
    }
}
