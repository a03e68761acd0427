package org.dxworks.omml2latex.converter;

import org.dxworks.omml2latex.MathMode;
import org.dxworks.omml2latex.Omml2LatexConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LatexAssemblerTest {

    private final LatexAssembler assembler = new LatexAssembler(Omml2LatexConfig.defaults());

    @Test
    void inlineUsesDollars() {
        assertEquals("$x^{2}$", assembler.assemble(MathMode.INLINE, "x^{2}"));
    }

    @Test
    void displayPutsBodyOnItsOwnLine() {
        assertEquals("\\[\nx^{2}\n\\]", assembler.assemble(MathMode.DISPLAY, "x^{2}"));
    }

    @Test
    void nullBodyIsEmpty() {
        assertEquals("$$", assembler.assemble(MathMode.INLINE, null));
    }

    @Test
    void delimitersComeFromConfig(@TempDir Path tempDir) throws IOException {
        Path configFile = tempDir.resolve("omml2latex-config.yml");
        Files.writeString(configFile, "inlineOpen: \"\\\\(\"\ninlineClose: \"\\\\)\"\n");

        LatexAssembler custom = new LatexAssembler(Omml2LatexConfig.load(configFile));

        assertEquals("\\(a\\)", custom.assemble(MathMode.INLINE, "a"));
        assertEquals("\\[\na\n\\]", custom.assemble(MathMode.DISPLAY, "a"));
    }

    @Test
    void rejectsNullMode() {
        assertThrows(NullPointerException.class, () -> assembler.assemble(null, "a"));
    }
}
