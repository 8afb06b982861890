package frontend.semantic.symbol;

import frontend.lexer.Position;
import frontend.syntax.Ast;

/**
 * 符号表中的一条符号信息
 */
public class Symbol {
    private final String name; // 符号名称
    private final SymbolKind kind; // 符号种类
    private final Ast.Node node; // 定义处的语法树节点(不持有, 可以为 null)
    private final Position position; // 定义位置
    private final boolean defined;
    private boolean used = false;

    public Symbol(final String name, final SymbolKind kind, final Ast.Node node, final Position position) {
        if (name == null || kind == null) {
            throw new NullPointerException("symbol name and kind are required");
        }
        this.name = name;
        this.kind = kind;
        this.node = node;
        this.position = position == null ? Position.UNKNOWN : position;
        this.defined = true;
    }

    public Symbol(final String name, final SymbolKind kind, final Ast.Node node) {
        this(name, kind, node, node == null ? Position.UNKNOWN : node.getPosition());
    }

    public String getName() {
        return this.name;
    }

    public SymbolKind getKind() {
        return this.kind;
    }

    public Ast.Node getNode() {
        return this.node;
    }

    public Position getPosition() {
        return this.position;
    }

    public boolean isDefined() {
        return this.defined;
    }

    public boolean isUsed() {
        return this.used;
    }

    public void markUsed() {
        this.used = true;
    }

    @Override
    public String toString() {
        return String.format("%s: %s (defined: %d, used: %d)", name, kind, defined ? 1 : 0, used ? 1 : 0);
    }
}
