import arg.Arg;
import exception.ErrorKind;
import exception.SemanticException;
import exception.SyntaxException;
import frontend.semantic.Diagnostic;
import manage.CompileResult;
import manage.Manager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.CenterControl;
import util.FileDealer;

import java.io.IOException;

public class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    // 返回进程退出码: 0 成功, 否则 ErrorKind 序号 + 1
    static int run(String[] args) {
        Arg arg;
        try {
            arg = Arg.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            Arg.printHelp();
            return ErrorKind.RUNTIME.exitCode();
        }
        CenterControl._ESCAPE_JSON = arg.escapeJson;
        CenterControl._OUTPUT_LEX = arg.emitTokens;
        CenterControl._OUTPUT_AST = arg.emitAst;
        CenterControl._OUTPUT_SYMBOLS = arg.emitSymbols;
        try {
            String source = arg.readStdin() ? FileDealer.readStream(System.in) : FileDealer.readFile(arg.srcFilename);
            log.info("compiling {}", arg.srcFilename);
            Manager manager = new Manager()
                    .setFormat(arg.format)
                    .setOptContext(arg.optContext())
                    .setKeepGoing(arg.keepGoing);
            CompileResult result = manager.compile(source, arg.readStdin() ? "<stdin>" : arg.srcFilename);
            for (Diagnostic diagnostic : result.getDiagnostics()) {
                System.err.println(diagnostic);
            }
            log.info("opt level = {}, {} optimizations applied", arg.optLevel, result.getOptimizations());
            if (arg.outputToFile()) {
                FileDealer.outputToFile(result.getOutput(), arg.outFilename);
                log.info("wrote {} output to {}", result.getFormat().getName(), arg.outFilename);
            } else {
                FileDealer.outputToStream(result.getOutput(), System.out);
            }
            return 0;
        } catch (SyntaxException e) {
            System.err.println(e.getMessage());
            return e.getKind().exitCode();
        } catch (SemanticException e) {
            for (Diagnostic diagnostic : e.getDiagnostics()) {
                System.err.println(diagnostic);
            }
            System.err.println(e.getMessage());
            return e.getKind().exitCode();
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage());
            return ErrorKind.IO.exitCode();
        }
    }
}
