package arg;

import backend.OutputFormat;
import midend.OptContext;
import midend.OptPass;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ArgTest {

    @Test
    void defaults() {
        Arg arg = Arg.parse(new String[]{"greet.pcc"});
        assertEquals("greet.pcc", arg.srcFilename);
        assertNull(arg.format);
        assertEquals(1, arg.optLevel);
        assertFalse(arg.outputToFile());
        assertTrue(arg.escapeJson);
        OptContext ctx = arg.optContext();
        assertTrue(ctx.isEnabled(OptPass.CONSTANT_FOLDING));
        assertTrue(ctx.isEnabled(OptPass.DEAD_CODE_ELIMINATION));
    }

    @Test
    void allFlags() {
        Arg arg = Arg.parse(new String[]{"-f", "markdown", "-o", "out.md", "--no-fold", "--raw-json",
                "--keep-going", "-emit-tokens", "-emit-ast", "-emit-symbols", "in.pcc"});
        assertEquals(OutputFormat.MARKDOWN, arg.format);
        assertEquals("out.md", arg.outFilename);
        assertTrue(arg.outputToFile());
        assertFalse(arg.escapeJson);
        assertTrue(arg.keepGoing);
        assertTrue(arg.emitTokens && arg.emitAst && arg.emitSymbols);
        OptContext ctx = arg.optContext();
        assertFalse(ctx.isEnabled(OptPass.CONSTANT_FOLDING));
        assertTrue(ctx.isEnabled(OptPass.DEAD_CODE_ELIMINATION));
    }

    @Test
    void levelZeroDisablesEverything() {
        OptContext ctx = Arg.parse(new String[]{"-O0", "in.pcc"}).optContext();
        assertFalse(ctx.isEnabled(OptPass.CONSTANT_FOLDING));
        assertFalse(ctx.isEnabled(OptPass.DEAD_CODE_ELIMINATION));
    }

    @Test
    void stdinSource() {
        assertTrue(Arg.parse(new String[]{"-"}).readStdin());
    }

    @Test
    void invalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"-f", "yaml", "a"}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"-O2", "a"}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"-O0", "-O1", "a"}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"--bogus", "a"}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"a", "b"}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"a", "-o"}));
    }
}
