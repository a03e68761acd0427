package org.dxworks.omml2latex.converter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotationTemplatesTest {

    @Test
    void standardFunctionNames() {
        assertEquals("\\sin", NotationTemplates.functionName("sin"));
        assertEquals("\\ln", NotationTemplates.functionName(" ln "));
        assertEquals("\\max_{k}", NotationTemplates.functionName("max_{k}"));
        assertEquals("\\lim_{x\\to 0}", NotationTemplates.functionName("lim_{x\\to 0}"));
    }

    @Test
    void otherPlainNamesAreUpright() {
        assertEquals("\\mathrm{sgn}", NotationTemplates.functionName("sgn"));
        assertEquals("\\mathrm{sine}", NotationTemplates.functionName("sine"));
    }

    @Test
    void structuredNamesAreKept() {
        assertEquals("f^{-1}", NotationTemplates.functionName("f^{-1}"));
        assertEquals("\\alpha", NotationTemplates.functionName("\\alpha"));
        assertEquals("", NotationTemplates.functionName(" "));
    }

    @Test
    void concatSkipsEmptyPartsAndSeparatesControlWords() {
        assertEquals("\\pi r^{2}", NotationTemplates.concat(List.of("\\pi", "", "r^{2}")));
        assertEquals("\\pi2", NotationTemplates.concat(List.of("\\pi", "2")));
        assertEquals("\\{x", NotationTemplates.concat(List.of("\\{", "x")));
        assertEquals("", NotationTemplates.concat(List.of()));
    }
}
