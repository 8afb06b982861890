package frontend.semantic.symbol;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;

/**
 * 一层作用域, 由 SymTable 按下标管理; 父作用域用下标引用
 */
public class Scope {
    public static final int NO_PARENT = -1;

    private final int handle;
    private final int parent;
    private final int depth;
    // 保持插入顺序, 打印时按定义顺序
    private final LinkedHashMap<String, Symbol> symbols = new LinkedHashMap<>();

    Scope(int handle, int parent, int depth) {
        this.handle = handle;
        this.parent = parent;
        this.depth = depth;
    }

    public int getHandle() {
        return handle;
    }

    public int getParent() {
        return parent;
    }

    public boolean hasParent() {
        return parent != NO_PARENT;
    }

    public int getDepth() {
        return depth;
    }

    public Symbol get(String name) {
        return symbols.get(name);
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    void put(Symbol symbol) {
        symbols.putIfAbsent(symbol.getName(), symbol);
    }

    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public int size() {
        return symbols.size();
    }
}
