package exception;

/**
 * 编译失败的分类, 决定命令行的退出码
 */
public enum ErrorKind {
    MEMORY,   // allocation failure, never recovered
    SYNTAX,   // lexer / parser
    SEMANTIC, // undefined symbol, redefinition, kind mismatch
    IO,       // reading the source or writing the rendering
    RUNTIME,  // contract violation inside the compiler
    ;

    public int exitCode() {
        return ordinal() + 1;
    }
}
