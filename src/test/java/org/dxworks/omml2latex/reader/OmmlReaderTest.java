package org.dxworks.omml2latex.reader;

import org.dxworks.omml2latex.converter.MathConverter;
import org.dxworks.omml2latex.model.*;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class OmmlReaderTest {

    private static final String NS = " xmlns:m=\"" + OmmlReader.MATH_NS + "\""
            + " xmlns:w=\"" + OmmlReader.WORD_NS + "\"";

    private final OmmlReader reader = new OmmlReader();
    private final MathConverter converter = new MathConverter();

    private static Element parse(String xml) throws Exception {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        Document document = dbf.newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        return document.getDocumentElement();
    }

    private static String math(String content) {
        return "<m:oMath" + NS + ">" + content + "</m:oMath>";
    }

    private static String run(String text) {
        return "<m:r><m:t>" + text + "</m:t></m:r>";
    }

    private String convert(String content) throws Exception {
        return converter.convertBody(reader.read(parse(math(content))));
    }

    @Test
    void readsFractionIntoFractionNode() throws Exception {
        MarkupNode root = reader.read(parse(math(
                "<m:f><m:fPr><m:type m:val=\"bar\"/></m:fPr>"
                        + "<m:num>" + run("a") + "</m:num><m:den>" + run("b") + "</m:den></m:f>")));

        Sequence seq = assertInstanceOf(Sequence.class, root);
        Fraction fraction = assertInstanceOf(Fraction.class, seq.items.get(0));
        assertNotNull(fraction.numerator);
        assertNotNull(fraction.denominator);
        assertEquals("\\frac{a}{b}", converter.convertBody(root));
    }

    @Test
    void readsScripts() throws Exception {
        assertEquals("x^{2}", convert("<m:sSup><m:e>" + run("x") + "</m:e><m:sup>" + run("2") + "</m:sup></m:sSup>"));
        assertEquals("x_{i}", convert("<m:sSub><m:e>" + run("x") + "</m:e><m:sub>" + run("i") + "</m:sub></m:sSub>"));
        assertEquals("x_{i}^{2}", convert("<m:sSubSup><m:e>" + run("x") + "</m:e><m:sub>" + run("i")
                + "</m:sub><m:sup>" + run("2") + "</m:sup></m:sSubSup>"));
    }

    @Test
    void readsNaryOperatorWithHiddenUpperLimit() throws Exception {
        String nary = "<m:nary><m:naryPr><m:chr m:val=\"∏\"/><m:supHide m:val=\"1\"/></m:naryPr>"
                + "<m:sub>" + run("k") + "</m:sub><m:sup/><m:e>" + run("a") + "</m:e></m:nary>";
        assertEquals("\\prod_{k} a", convert(nary));
    }

    @Test
    void naryWithoutCharacterIsIntegral() throws Exception {
        String nary = "<m:nary><m:sub>" + run("0") + "</m:sub><m:sup>" + run("1") + "</m:sup>"
                + "<m:e>" + run("f") + "</m:e></m:nary>";
        assertEquals("\\int_{0}^{1} f", convert(nary));
    }

    @Test
    void readsRadicalDegreeVisibility() throws Exception {
        assertEquals("\\sqrt[3]{x}", convert("<m:rad><m:deg>" + run("3") + "</m:deg><m:e>" + run("x") + "</m:e></m:rad>"));
        assertEquals("\\sqrt{x}", convert("<m:rad><m:radPr><m:degHide m:val=\"on\"/></m:radPr><m:deg/>"
                + "<m:e>" + run("x") + "</m:e></m:rad>"));
        assertEquals("\\sqrt{x}", convert("<m:rad><m:deg/><m:e>" + run("x") + "</m:e></m:rad>"));
    }

    @Test
    void readsDelimiterProperties() throws Exception {
        String d = "<m:d><m:dPr><m:begChr m:val=\"[\"/><m:endChr m:val=\"\"/></m:dPr>"
                + "<m:e>" + run("x") + "</m:e></m:d>";
        assertEquals("\\left[ x \\right.", convert(d));
    }

    @Test
    void readsMatrixRows() throws Exception {
        String m = "<m:m><m:mPr/>"
                + "<m:mr><m:e>" + run("1") + "</m:e><m:e>" + run("0") + "</m:e></m:mr>"
                + "<m:mr><m:e>" + run("0") + "</m:e><m:e>" + run("1") + "</m:e></m:mr></m:m>";

        MarkupNode root = reader.read(parse(math(m)));
        Matrix matrix = assertInstanceOf(Matrix.class, ((Sequence) root).items.get(0));
        assertEquals(2, matrix.rows.size());
        assertFalse(matrix.isRagged());
        assertEquals("\\begin{pmatrix}1 & 0 \\\\ 0 & 1\\end{pmatrix}", converter.convertBody(root));
    }

    @Test
    void readsFunctionAccentAndBar() throws Exception {
        assertEquals("\\cos \\theta", convert("<m:func><m:fName>" + run("cos") + "</m:fName>"
                + "<m:e>" + run("θ") + "</m:e></m:func>"));
        assertEquals("\\dot{x}", convert("<m:acc><m:accPr><m:chr m:val=\"\u0307\"/></m:accPr>"
                + "<m:e>" + run("x") + "</m:e></m:acc>"));
        assertEquals("\\hat{x}", convert("<m:acc><m:e>" + run("x") + "</m:e></m:acc>"));
        assertEquals("\\underline{y}", convert("<m:bar><m:barPr><m:pos m:val=\"bot\"/></m:barPr>"
                + "<m:e>" + run("y") + "</m:e></m:bar>"));
    }

    @Test
    void readsLimitsAndPrescripts() throws Exception {
        assertEquals("x^{n}", convert("<m:limUpp><m:e>" + run("x") + "</m:e><m:lim>" + run("n") + "</m:lim></m:limUpp>"));
        assertEquals("{}_{0}^{1}F", convert("<m:sPre><m:sub>" + run("0") + "</m:sub><m:sup>" + run("1")
                + "</m:sup><m:e>" + run("F") + "</m:e></m:sPre>"));
    }

    @Test
    void missingChildIsAbsentSlot() throws Exception {
        MarkupNode root = reader.read(parse(math("<m:f><m:num>" + run("a") + "</m:num></m:f>")));

        Fraction fraction = (Fraction) ((Sequence) root).items.get(0);
        assertNull(fraction.denominator);
        assertEquals(java.util.List.of("denominator"), fraction.missingParts());
    }

    @Test
    void unrecognizedMathElementKeepsChildren() throws Exception {
        MarkupNode root = reader.read(parse(math("<m:phant><m:e>" + run("x") + "</m:e></m:phant>")));

        Unknown unknown = assertInstanceOf(Unknown.class, ((Sequence) root).items.get(0));
        assertEquals("m:phant", unknown.tag);
        assertEquals("x", converter.convertBody(root));
    }

    @Test
    void wordRunsAndForeignElementsAreTransparent() throws Exception {
        String content = "<w:ins w:id=\"1\">" + run("a") + "</w:ins>"
                + "<w:r><w:t>+</w:t></w:r>"
                + "<m:r><m:rPr><m:sty m:val=\"p\"/></m:rPr><w:rPr/><m:t>b</m:t></m:r>";
        assertEquals("a+b", convert(content));
    }

    @Test
    void textIsResolvedThroughSymbolTable() throws Exception {
        assertEquals("\\alpha \\in \\mathbb{R}", convert(run("α∈ℝ")));
    }

    @Test
    void deepNestingDoesNotOverflow() throws Exception {
        int depth = 3_000;
        StringBuilder xml = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            xml.append("<m:d><m:e>");
        }
        xml.append(run("x"));
        for (int i = 0; i < depth; i++) {
            xml.append("</m:e></m:d>");
        }

        String latex = convert(xml.toString());

        assertTrue(latex.startsWith("\\left( \\left( "));
        assertTrue(latex.endsWith(" \\right) \\right)"));
    }

    @Test
    void rejectsNullRoot() {
        assertThrows(NullPointerException.class, () -> reader.read(null));
    }
}
