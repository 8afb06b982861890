package exception;

import frontend.semantic.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * 语义分析结束后仍有诊断信息时抛出
 */
public class SemanticException extends Exception {
    private final List<Diagnostic> diagnostics;

    public SemanticException(String message) {
        this(message, List.of());
    }

    public SemanticException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = new ArrayList<>(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public ErrorKind getKind() {
        return ErrorKind.SEMANTIC;
    }
}
