package util;

public class CenterControl {
    // JSON 字符串转义, 关掉后按原样输出
    public static boolean _ESCAPE_JSON = true;

    // debug dumps, printed to stderr
    public static boolean _OUTPUT_LEX = false;
    public static boolean _OUTPUT_AST = false;
    public static boolean _OUTPUT_SYMBOLS = false;
}
