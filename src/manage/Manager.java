package manage;

import backend.CodeGen;
import backend.OutputFormat;
import exception.SemanticException;
import exception.SyntaxException;
import frontend.lexer.Lexer;
import frontend.lexer.TokenList;
import frontend.semantic.Visitor;
import frontend.syntax.Ast;
import frontend.syntax.AstPrinter;
import frontend.syntax.Parser;
import midend.MidEndRunner;
import midend.OptContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.CenterControl;

/**
 * 一次编译: 词法 -> 语法 -> 语义 -> 优化 -> 代码生成
 */
public class Manager {
    private static final Logger log = LoggerFactory.getLogger(Manager.class);

    private OutputFormat format = null; // null => OUTPUT ... AS, 否则 JSON
    private OptContext optContext = OptContext.all();
    private boolean keepGoing = false;

    public Manager setFormat(OutputFormat format) {
        this.format = format;
        return this;
    }

    public Manager setOptContext(OptContext optContext) {
        this.optContext = optContext;
        return this;
    }

    public Manager setKeepGoing(boolean keepGoing) {
        this.keepGoing = keepGoing;
        return this;
    }

    public CompileResult compile(String source, String filename) throws SyntaxException, SemanticException {
        Lexer lexer = new Lexer(source, filename);
        TokenList tokens = lexer.tokenize();
        if (CenterControl._OUTPUT_LEX) {
            System.err.print(tokens.dump());
        }
        if (lexer.hasError()) {
            throw new SyntaxException(String.format("Lexical error at line %d, column %d: %s",
                    lexer.getErrorPosition().getLine(), lexer.getErrorPosition().getColumn(),
                    lexer.getErrorMessage()), lexer.getErrorPosition());
        }
        log.debug("lexer produced {} tokens", tokens.size());

        Parser parser = new Parser(tokens);
        Ast.Program program = parser.parseProgram();
        if (CenterControl._OUTPUT_AST) {
            System.err.print(AstPrinter.print(program));
        }

        Visitor visitor = new Visitor();
        visitor.visitProgram(program);
        if (CenterControl._OUTPUT_SYMBOLS) {
            System.err.print(visitor.getSymTable().dump());
        }
        if (visitor.getSymTable().hasErrors()) {
            if (!keepGoing) {
                throw new SemanticException(visitor.getSymTable().errorCount() + " semantic error(s) in " + filename,
                        visitor.getSymTable().getDiagnostics());
            }
            log.warn("{} semantic error(s) in {}, generating anyway", visitor.getSymTable().errorCount(), filename);
        }

        int applied = 0;
        if (optContext != null) {
            int before = optContext.getApplied();
            MidEndRunner.optimize(program, optContext);
            applied = optContext.getApplied() - before;
        }

        OutputFormat target = chooseFormat(program);
        CodeGen codeGen = new CodeGen(target);
        String output = codeGen.generate(program);
        log.debug("generated {} characters of {}", output.length(), target.getName());
        return new CompileResult(output, target, tokens, program, visitor.getSymTable(), parser.getErrors(), applied);
    }

    // 命令行指定的格式优先, 其次是第一个 OUTPUT ... AS, 最后 JSON
    private OutputFormat chooseFormat(Ast.Program program) {
        if (format != null) {
            return format;
        }
        for (Ast.Node statement : program.getStatements()) {
            if (statement instanceof Ast.OutputSpec) {
                OutputFormat declared = OutputFormat.fromName(((Ast.OutputSpec) statement).getFormat());
                if (declared != null) {
                    return declared;
                }
            }
        }
        return OutputFormat.JSON;
    }
}
