package manage;

import backend.OutputFormat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import exception.ErrorKind;
import exception.SemanticException;
import exception.SyntaxException;
import frontend.semantic.DiagnosticCode;
import midend.OptContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ManagerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void greetingCompilesToJson() throws Exception {
        CompileResult result = new Manager().compile(
                "VAR name\nPROMPT greet { \"Hello, \" $name }\nOUTPUT greet", "greet.pcc");
        assertEquals(0, result.getDiagnostics().size());
        assertEquals(OutputFormat.JSON, result.getFormat());
        JsonNode root = MAPPER.readTree(result.getOutput());
        JsonNode prompt = root.get("statements").get(1);
        assertEquals("prompt_def", prompt.get("type").asText());
        assertEquals("greet", prompt.get("name").asText());
        assertEquals("Hello, ", prompt.get("body").get("elements").get(0).get("text").asText());
    }

    @Test
    void freeVariableInPromptNeedsNoDeclaration() throws Exception {
        CompileResult result = new Manager().compile(
                "PROMPT greet { \"Hello, \" $name }\nOUTPUT greet", "greet.pcc");
        assertEquals(0, result.getDiagnostics().size());
        JsonNode root = MAPPER.readTree(result.getOutput());
        assertEquals(2, root.get("statements").size());
    }

    @Test
    void outputFormatComesFromOutputSpec() throws Exception {
        CompileResult result = new Manager().compile("PROMPT p { \"x\" }\nOUTPUT p AS markdown", "p.pcc");
        assertEquals(OutputFormat.MARKDOWN, result.getFormat());
        assertTrue(result.getOutput().startsWith("## Prompt: p\n\nx"), result.getOutput());
    }

    @Test
    void configuredFormatWins() throws Exception {
        CompileResult result = new Manager().setFormat(OutputFormat.TEXT)
                .compile("PROMPT p { \"x\" }\nOUTPUT p AS markdown", "p.pcc");
        assertEquals("Prompt: p\nx\nOutput: p\n", result.getOutput());
    }

    @Test
    void optimizationsAreCounted() throws Exception {
        CompileResult result = new Manager().compile("PROMPT p { \"x\" }\nIF 1 < 2 { OUTPUT p } IF NOT true { OUTPUT p }", "p.pcc");
        assertEquals(2, result.getOptimizations());
        assertEquals(2, result.getProgram().getStatements().size());
    }

    @Test
    void optimizerCanBeTurnedOff() throws Exception {
        CompileResult result = new Manager().setOptContext(OptContext.none())
                .compile("VAR n = 2 + 3", "p.pcc");
        assertEquals(0, result.getOptimizations());
        assertTrue(result.getOutput().contains("binary_expr"));
    }

    @Test
    void lexicalErrorIsASyntaxException() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> new Manager().compile("PROMPT p { \"open }", "bad.pcc"));
        assertTrue(e.getMessage().contains("Unterminated string literal"), e.getMessage());
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        assertEquals(1, e.getPosition().getLine());
    }

    @Test
    void parseErrorsAreSummarised() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> new Manager().compile("PROMPT { }\nVAR ;", "bad.pcc"));
        assertTrue(e.getMessage().startsWith("2 syntax errors"), e.getMessage());
    }

    @Test
    void semanticErrorsCarryDiagnostics() {
        SemanticException e = assertThrows(SemanticException.class,
                () -> new Manager().compile("OUTPUT missing", "bad.pcc"));
        assertEquals(1, e.getDiagnostics().size());
        assertEquals(DiagnosticCode.UNDEFINED_SYMBOL, e.getDiagnostics().get(0).getCode());
        assertEquals(ErrorKind.SEMANTIC, e.getKind());
        assertEquals(3, e.getKind().exitCode());
    }

    @Test
    void keepGoingStillGenerates() throws Exception {
        CompileResult result = new Manager().setKeepGoing(true).compile("PROMPT p { @x }", "p.pcc");
        assertEquals(1, result.getDiagnostics().size());
        assertFalse(result.getOutput().isEmpty());
        MAPPER.readTree(result.getOutput());
    }
}
