package arg;

import backend.OutputFormat;
import midend.OptContext;
import midend.OptPass;

import java.util.EnumSet;

public class Arg {
    public final String srcFilename; // 源代码文件名 e.g. "greet.pcc", "-" 表示标准输入
    public final String outFilename; // 输出文件名, 空串表示标准输出
    public final OutputFormat format; // null 表示由 OUTPUT ... AS 决定
    public final int optLevel; // 优化等级, 缺省值为 1

    public final boolean constFold;
    public final boolean deadCodeDelete;
    public final boolean escapeJson;
    public final boolean keepGoing; // 有语义错误也继续生成

    public final boolean emitTokens;
    public final boolean emitAst;
    public final boolean emitSymbols;

    private Arg(String src, String out, OutputFormat format, int optLevel, boolean constFold,
                boolean deadCodeDelete, boolean escapeJson, boolean keepGoing,
                boolean emitTokens, boolean emitAst, boolean emitSymbols) {
        this.srcFilename = src;
        this.outFilename = out;
        this.format = format;
        this.optLevel = optLevel;
        this.constFold = constFold;
        this.deadCodeDelete = deadCodeDelete;
        this.escapeJson = escapeJson;
        this.keepGoing = keepGoing;
        this.emitTokens = emitTokens;
        this.emitAst = emitAst;
        this.emitSymbols = emitSymbols;
    }

    public boolean outputToFile() {
        return !outFilename.isEmpty();
    }

    public boolean readStdin() {
        return "-".equals(srcFilename);
    }

    // -O0 关掉全部优化, 否则按 --no-fold / --no-dce 逐个关闭
    public OptContext optContext() {
        EnumSet<OptPass> passes = EnumSet.noneOf(OptPass.class);
        if (optLevel > 0) {
            if (constFold) {
                passes.add(OptPass.CONSTANT_FOLDING);
            }
            if (deadCodeDelete) {
                passes.add(OptPass.DEAD_CODE_ELIMINATION);
            }
        }
        return new OptContext(passes);
    }

    public static Arg parse(String[] args) {
        String src = "", out = "";
        OutputFormat format = null;
        int optLevel = -1;
        boolean constFold = true, deadCodeDelete = true, escapeJson = true, keepGoing = false;
        boolean emitTokens = false, emitAst = false, emitSymbols = false;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            // detect "-Ox"
            if (a.startsWith("-O")) {
                if (optLevel != -1) {
                    throw new IllegalArgumentException("Optimize level should only have one.");
                }
                try {
                    optLevel = Integer.parseInt(a.substring(2));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid optimize level: " + a, e);
                }
                if (optLevel < 0 || optLevel > 1) {
                    throw new IllegalArgumentException("Optimize level should only be 0, 1");
                }
                continue;
            }
            switch (a) {
                case "-f" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("-f expected json, text or markdown");
                    }
                    if (format != null) {
                        throw new IllegalArgumentException("We got more than one output format.");
                    }
                    format = OutputFormat.fromName(args[++i]);
                    if (format == null) {
                        throw new IllegalArgumentException("unknown output format: " + args[i]);
                    }
                }
                case "-o" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("-o expected filename");
                    }
                    if (!out.isEmpty()) {
                        throw new IllegalArgumentException("We got more than one output file when we expected only one.");
                    }
                    out = args[++i];
                }
                case "--no-fold" -> constFold = false;
                case "--no-dce" -> deadCodeDelete = false;
                case "--raw-json" -> escapeJson = false;
                case "--keep-going" -> keepGoing = true;
                case "-emit-tokens" -> emitTokens = true;
                case "-emit-ast" -> emitAst = true;
                case "-emit-symbols" -> emitSymbols = true;
                default -> {
                    // detect illegal flags, a lone "-" is stdin
                    if (a.startsWith("-") && !a.equals("-")) {
                        throw new IllegalArgumentException("invalid flag: " + a);
                    }
                    // source file
                    if (!src.isEmpty()) {
                        throw new IllegalArgumentException("We got more than one source file when we expected only one.");
                    }
                    src = a;
                }
            }
        }
        if (src.isEmpty()) {
            throw new IllegalArgumentException("source file should be specified.");
        }
        return new Arg(src, out, format, optLevel == -1 ? 1 : optLevel, constFold, deadCodeDelete,
                escapeJson, keepGoing, emitTokens, emitAst, emitSymbols);
    }

    public static void printHelp() {
        System.err.println("Usage: pcc [-f json|text|markdown] [-o filename] [-O0|-O1] [options...] filename");
        System.err.println("options: --no-fold --no-dce --raw-json --keep-going -emit-tokens -emit-ast -emit-symbols");
        System.err.println("optimize level: 0, 1 (default)");
    }
}
