package org.dxworks.omml2latex.reader;

import org.dxworks.omml2latex.MathMode;
import org.dxworks.omml2latex.SourceFormat;
import org.dxworks.omml2latex.converter.MathConverter;
import org.dxworks.omml2latex.model.ExtractedEquation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class DocxMathExtractorTest {

    private static final String DOCUMENT = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<w:document xmlns:w=\"" + OmmlReader.WORD_NS + "\" xmlns:m=\"" + OmmlReader.MATH_NS + "\">"
            + "<w:body>"
            + "<w:p><w:r><w:t>Let </w:t></w:r>"
            + "<m:oMath><m:r><m:t>x</m:t></m:r></m:oMath>"
            + "<w:r><w:t> be given.</w:t></w:r></w:p>"
            + "<w:p><m:oMathPara>"
            + "<m:oMath><m:sSup><m:e><m:r><m:t>x</m:t></m:r></m:e><m:sup><m:r><m:t>2</m:t></m:r></m:sup></m:sSup></m:oMath>"
            + "<m:oMath><m:r><m:t>y</m:t></m:r></m:oMath>"
            + "</m:oMathPara></w:p>"
            + "</w:body></w:document>";

    private final DocxMathExtractor extractor = new DocxMathExtractor();
    private final MathConverter converter = new MathConverter();

    @Test
    void extractsEquationsFromDocxInDocumentOrder(@TempDir Path tempDir) throws IOException {
        Path docx = tempDir.resolve("paper.docx");
        writeZip(docx, DocxMathExtractor.DOCUMENT_ENTRY, DOCUMENT);

        List<ExtractedEquation> equations = extractor.extract(docx, SourceFormat.DOCX);

        assertEquals(3, equations.size());
        assertEquals(1, equations.get(0).index);
        assertEquals(MathMode.INLINE, equations.get(0).mode);
        assertEquals(MathMode.DISPLAY, equations.get(1).mode);
        assertEquals(MathMode.DISPLAY, equations.get(2).mode);
        assertEquals("x^{2}", converter.convertBody(equations.get(1).root));
        assertEquals("y", converter.convertBody(equations.get(2).root));
    }

    @Test
    void extractsFromPlainXml() {
        InputStream in = new ByteArrayInputStream(DOCUMENT.getBytes(StandardCharsets.UTF_8));

        List<ExtractedEquation> equations = extractor.extract(in, "document.xml");

        assertEquals(3, equations.size());
        assertEquals("x", converter.convertBody(equations.get(0).root));
    }

    @Test
    void nestedMathBelongsToItsEnclosingEquation() {
        String xml = "<w:document xmlns:w=\"" + OmmlReader.WORD_NS + "\" xmlns:m=\"" + OmmlReader.MATH_NS + "\">"
                + "<m:oMath><m:box><m:e><m:oMath><m:r><m:t>z</m:t></m:r></m:oMath></m:e></m:box></m:oMath>"
                + "</w:document>";

        List<ExtractedEquation> equations =
                extractor.extract(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "nested.xml");

        assertEquals(1, equations.size());
        assertEquals("z", converter.convertBody(equations.get(0).root));
    }

    @Test
    void documentWithoutMathHasNoEquations() {
        String xml = "<w:document xmlns:w=\"" + OmmlReader.WORD_NS + "\"><w:body/></w:document>";

        assertTrue(extractor.extract(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "empty.xml")
                .isEmpty());
    }

    @Test
    void docxWithoutMainDocumentFails(@TempDir Path tempDir) throws IOException {
        Path docx = tempDir.resolve("broken.docx");
        writeZip(docx, "word/styles.xml", "<styles/>");

        MathExtractionException e = assertThrows(MathExtractionException.class,
                () -> extractor.extract(docx, SourceFormat.DOCX));
        assertTrue(e.getMessage().contains(DocxMathExtractor.DOCUMENT_ENTRY));
    }

    @Test
    void notAZipFails(@TempDir Path tempDir) throws IOException {
        Path docx = tempDir.resolve("plain.docx");
        Files.writeString(docx, "not a zip archive");

        assertThrows(MathExtractionException.class, () -> extractor.extract(docx, SourceFormat.DOCX));
    }

    @Test
    void malformedXmlFails() {
        InputStream in = new ByteArrayInputStream("<w:document".getBytes(StandardCharsets.UTF_8));

        assertThrows(MathExtractionException.class, () -> extractor.extract(in, "bad.xml"));
    }

    @Test
    void doctypeIsRejected() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE d [<!ENTITY e \"x\">]><d>&e;</d>";

        assertThrows(MathExtractionException.class,
                () -> extractor.extract(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "dtd.xml"));
    }

    private static void writeZip(Path target, String entryName, String content) throws IOException {
        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(content.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
    }
}
