package backend;

import frontend.syntax.Ast;
import util.FileDealer;

import java.io.IOException;

/**
 * 代码生成: 语法树 -> JSON / 文本 / Markdown
 * 输出写在自己持有的缓冲区里, 每次生成前清空
 */
public class CodeGen {
    private final StringBuilder sb = new StringBuilder();
    private OutputFormat format;

    public CodeGen(OutputFormat format) {
        if (format == null) {
            throw new NullPointerException("format");
        }
        this.format = format;
    }

    public CodeGen() {
        this(OutputFormat.JSON);
    }

    private Emitter emitter() {
        return switch (format) {
            case JSON -> new JsonEmitter(sb);
            case TEXT -> new TextEmitter(sb);
            case MARKDOWN -> new MarkdownEmitter(sb);
        };
    }

    public String generate(Ast.Node node) {
        clear();
        if (node != null) {
            emitter().emit(node);
        }
        return sb.toString();
    }

    public String getOutput() {
        return sb.toString();
    }

    public void clear() {
        sb.setLength(0);
    }

    public OutputFormat getFormat() {
        return format;
    }

    // 切换格式时丢弃旧输出
    public void setFormat(OutputFormat format) {
        if (format == null) {
            throw new NullPointerException("format");
        }
        this.format = format;
        clear();
    }

    public void writeToFile(String path) throws IOException {
        FileDealer.outputToFile(sb, path);
    }
}
