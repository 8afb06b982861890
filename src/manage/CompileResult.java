package manage;

import backend.OutputFormat;
import frontend.lexer.TokenList;
import frontend.semantic.Diagnostic;
import frontend.semantic.symbol.SymTable;
import frontend.syntax.Ast;
import frontend.syntax.ParseError;

import java.util.List;

/**
 * 一次编译的全部产物
 */
public class CompileResult {
    private final String output;
    private final OutputFormat format;
    private final TokenList tokens;
    private final Ast.Program program;
    private final SymTable symTable;
    private final List<ParseError> parseErrors;
    private final int optimizations;

    CompileResult(String output, OutputFormat format, TokenList tokens, Ast.Program program,
                  SymTable symTable, List<ParseError> parseErrors, int optimizations) {
        this.output = output;
        this.format = format;
        this.tokens = tokens;
        this.program = program;
        this.symTable = symTable;
        this.parseErrors = parseErrors;
        this.optimizations = optimizations;
    }

    public String getOutput() {
        return output;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public TokenList getTokens() {
        return tokens;
    }

    public Ast.Program getProgram() {
        return program;
    }

    public SymTable getSymTable() {
        return symTable;
    }

    public List<Diagnostic> getDiagnostics() {
        return symTable.getDiagnostics();
    }

    public List<ParseError> getParseErrors() {
        return parseErrors;
    }

    public int getOptimizations() {
        return optimizations;
    }
}
