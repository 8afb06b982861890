package backend;

import java.util.Locale;

public enum OutputFormat {
    JSON("json"),
    TEXT("text"),
    MARKDOWN("markdown"),
    ;

    private final String name;

    OutputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    // 大小写不敏感, 不认识返回 null
    public static OutputFormat fromName(String name) {
        if (name == null) {
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.name.equals(lower)) {
                return format;
            }
        }
        return null;
    }
}
