package frontend.semantic.symbol;

public enum SymbolKind {
    VARIABLE,
    TEMPLATE,
    PROMPT,
    CONSTRAINT,
    PARAMETER,
    UNKNOWN,
    ;

    // 可以出现在 $name 处的符号
    public boolean isValue() {
        return this == VARIABLE || this == PARAMETER;
    }
}
