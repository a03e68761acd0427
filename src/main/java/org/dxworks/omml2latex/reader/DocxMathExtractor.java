package org.dxworks.omml2latex.reader;

import org.dxworks.omml2latex.MathMode;
import org.dxworks.omml2latex.SourceFormat;
import org.dxworks.omml2latex.model.ExtractedEquation;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Finds the equations of a Word document in document order.
 * <p>
 * An {@code m:oMath} inside an {@code m:oMathPara} is a display equation; any other
 * top-level {@code m:oMath} sits in running text and is inline.
 */
public class DocxMathExtractor {

    public static final String DOCUMENT_ENTRY = "word/document.xml";

    private final OmmlReader reader;

    public DocxMathExtractor() {
        this(new OmmlReader());
    }

    public DocxMathExtractor(OmmlReader reader) {
        this.reader = reader;
    }

    public List<ExtractedEquation> extract(Path file, SourceFormat format) {
        if (format == SourceFormat.DOCX) {
            return extractFromDocx(file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return extract(in, file.toString());
        } catch (IOException e) {
            throw new MathExtractionException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private List<ExtractedEquation> extractFromDocx(Path file) {
        try (ZipFile zip = new ZipFile(file.toFile())) {
            ZipEntry entry = zip.getEntry(DOCUMENT_ENTRY);
            if (entry == null) {
                throw new MathExtractionException("No " + DOCUMENT_ENTRY + " in " + file);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return extract(in, file + "!" + DOCUMENT_ENTRY);
            }
        } catch (IOException e) {
            throw new MathExtractionException("Cannot open " + file + ": " + e.getMessage(), e);
        }
    }

    public List<ExtractedEquation> extract(InputStream xml, String sourceName) {
        Document document;
        try {
            document = newDocumentBuilder().parse(xml);
        } catch (SAXException | IOException e) {
            throw new MathExtractionException("Cannot parse " + sourceName + ": " + e.getMessage(), e);
        }
        return extract(document);
    }

    public List<ExtractedEquation> extract(Document document) {
        List<ExtractedEquation> equations = new ArrayList<>();
        NodeList maths = document.getElementsByTagNameNS(OmmlReader.MATH_NS, "oMath");
        for (int i = 0; i < maths.getLength(); i++) {
            Element math = (Element) maths.item(i);
            if (hasAncestor(math, "oMath")) {
                continue; // already part of an enclosing equation
            }
            MathMode mode = MathMode.of(hasAncestor(math, "oMathPara"));
            equations.add(new ExtractedEquation(equations.size() + 1, mode, reader.read(math)));
        }
        return equations;
    }

    private static boolean hasAncestor(Element element, String localName) {
        for (Node p = element.getParentNode(); p != null; p = p.getParentNode()) {
            if (p.getNodeType() == Node.ELEMENT_NODE
                    && OmmlReader.MATH_NS.equals(p.getNamespaceURI())
                    && localName.equals(p.getLocalName())) {
                return true;
            }
        }
        return false;
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        try {
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new MathExtractionException("XML parser unavailable: " + e.getMessage(), e);
        }
    }
}
