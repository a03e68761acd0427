package org.dxworks.omml2latex.reader;

import org.dxworks.omml2latex.model.*;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link MarkupNode} tree from an Office Math (OMML) DOM element.
 * <p>
 * Reading mirrors conversion: each element first lists the child elements that carry its
 * content, those are read, then the node is built from them. The walk uses an explicit stack,
 * so deeply nested markup does not grow the call stack. Property elements ({@code *Pr}) are
 * read for attributes only. Math tags without a dedicated variant become {@link Unknown}
 * with their children; elements from other namespaces (revision marks, bookmarks) are
 * transparent containers.
 * <p>
 * The DOM must have been parsed namespace-aware.
 */
public class OmmlReader {

    public static final String MATH_NS = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String WORD_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

    private static final Set<String> CONTAINERS = Set.of(
            "oMathPara", "oMath", "e", "num", "den", "sub", "sup", "deg", "lim", "fName",
            "box", "borderBox", "mr");

    private static final Set<String> ON_VALUES = Set.of("1", "on", "true");

    public MarkupNode read(Element root) {
        Objects.requireNonNull(root, "root");
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, contentChildren(root)));
        MarkupNode result = null;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next < frame.parts.size()) {
                Element child = frame.parts.get(frame.next);
                if (child == null) {
                    frame.complete(null);
                } else {
                    stack.push(new Frame(child, contentChildren(child)));
                }
                continue;
            }

            stack.pop();
            MarkupNode node = build(frame.element, frame.built);
            if (stack.isEmpty()) {
                result = node;
            } else {
                stack.peek().complete(node);
            }
        }
        return result;
    }

    /**
     * Child elements to read, in slot order. A null entry is an absent child.
     */
    private List<Element> contentChildren(Element element) {
        if (!isMath(element)) {
            return isText(element) ? List.of() : nonPropertyChildren(element);
        }
        String tag = element.getLocalName();
        if (CONTAINERS.contains(tag)) {
            return nonPropertyChildren(element);
        }
        return switch (tag) {
            case "r", "t" -> List.of();
            case "f" -> slots(child(element, "num"), child(element, "den"));
            case "rad" -> slots(isDegreeHidden(element) ? null : child(element, "deg"), child(element, "e"));
            case "sSup" -> slots(child(element, "e"), child(element, "sup"));
            case "sSub" -> slots(child(element, "e"), child(element, "sub"));
            case "sSubSup" -> slots(child(element, "e"), child(element, "sub"), child(element, "sup"));
            case "nary" -> slots(
                    isOn(element, "naryPr", "subHide") ? null : child(element, "sub"),
                    isOn(element, "naryPr", "supHide") ? null : child(element, "sup"),
                    child(element, "e"));
            case "d", "eqArr" -> children(element, "e");
            case "func" -> slots(child(element, "fName"), child(element, "e"));
            case "m" -> {
                List<Element> cells = new ArrayList<>();
                for (Element row : children(element, "mr")) {
                    cells.addAll(children(row, "e"));
                }
                yield cells;
            }
            case "acc", "bar", "groupChr" -> slots(child(element, "e"));
            case "limLow", "limUpp" -> slots(child(element, "e"), child(element, "lim"));
            case "sPre" -> slots(child(element, "sub"), child(element, "sup"), child(element, "e"));
            default -> nonPropertyChildren(element);
        };
    }

    private MarkupNode build(Element element, List<MarkupNode> parts) {
        if (!isMath(element)) {
            return isText(element) ? textOf(element) : new Sequence(parts);
        }
        String tag = element.getLocalName();
        if (CONTAINERS.contains(tag)) {
            return new Sequence(parts);
        }
        return switch (tag) {
            case "r", "t" -> textOf(element);
            case "f" -> new Fraction(parts.get(0), parts.get(1));
            case "rad" -> new Radical(parts.get(0), parts.get(1), isDegreeHidden(element));
            case "sSup" -> SupSub.superscript(parts.get(0), parts.get(1));
            case "sSub" -> SupSub.subscript(parts.get(0), parts.get(1));
            case "sSubSup" -> new SupSub(SupSub.Form.BOTH, parts.get(0), parts.get(1), parts.get(2));
            case "nary" -> new NaryOperator(propertyValue(element, "naryPr", "chr"),
                    parts.get(0), parts.get(1), parts.get(2));
            case "d" -> new Delimiter(
                    propertyValue(element, "dPr", "begChr"),
                    propertyValue(element, "dPr", "endChr"),
                    propertyValue(element, "dPr", "sepChr"),
                    parts);
            case "func" -> new Function(parts.get(0), parts.get(1));
            case "m" -> matrixOf(element, parts);
            case "acc" -> new Accent(propertyValue(element, "accPr", "chr"), parts.get(0));
            case "bar" -> new Bar(parts.get(0), !"bot".equals(propertyValue(element, "barPr", "pos")));
            case "groupChr" -> new GroupChar(propertyValue(element, "groupChrPr", "chr"), parts.get(0));
            case "limLow" -> new LimitLower(parts.get(0), parts.get(1));
            case "limUpp" -> new LimitUpper(parts.get(0), parts.get(1));
            case "sPre" -> new PreSubSup(parts.get(0), parts.get(1), parts.get(2));
            case "eqArr" -> new EquationArray(parts);
            default -> new Unknown(element.getNodeName(), parts);
        };
    }

    private static Matrix matrixOf(Element element, List<MarkupNode> cells) {
        List<List<MarkupNode>> rows = new ArrayList<>();
        int cell = 0;
        for (Element row : children(element, "mr")) {
            int count = children(row, "e").size();
            rows.add(new ArrayList<>(cells.subList(cell, cell + count)));
            cell += count;
        }
        return new Matrix(rows);
    }

    private static TextRun textOf(Element element) {
        if (isTextLeaf(element)) {
            return new TextRun(element.getTextContent());
        }
        StringBuilder text = new StringBuilder();
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child && isTextLeaf(child)) {
                text.append(child.getTextContent());
            }
        }
        return new TextRun(text.toString());
    }

    /**
     * A radical hides its degree when {@code degHide} is on or when there is no degree to show.
     */
    private static boolean isDegreeHidden(Element rad) {
        if (isOn(rad, "radPr", "degHide")) {
            return true;
        }
        Element degree = child(rad, "deg");
        return degree == null || degree.getTextContent().isBlank();
    }

    private static boolean isOn(Element element, String propertiesTag, String flagTag) {
        Element properties = child(element, propertiesTag);
        Element flag = properties == null ? null : child(properties, flagTag);
        if (flag == null) {
            return false;
        }
        if (!flag.hasAttributeNS(MATH_NS, "val")) {
            return true;
        }
        return ON_VALUES.contains(flag.getAttributeNS(MATH_NS, "val").toLowerCase(Locale.ROOT));
    }

    /**
     * {@code m:val} of a property, or null when the property (or its value) is absent.
     */
    private static String propertyValue(Element element, String propertiesTag, String propertyTag) {
        Element properties = child(element, propertiesTag);
        Element property = properties == null ? null : child(properties, propertyTag);
        if (property == null || !property.hasAttributeNS(MATH_NS, "val")) {
            return null;
        }
        return property.getAttributeNS(MATH_NS, "val");
    }

    private static Element child(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child && isMath(child) && localName.equals(child.getLocalName())) {
                return child;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child && isMath(child) && localName.equals(child.getLocalName())) {
                result.add(child);
            }
        }
        return result;
    }

    private static List<Element> nonPropertyChildren(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child && !isProperty(child)) {
                result.add(child);
            }
        }
        return result;
    }

    private static List<Element> slots(Element... elements) {
        return Arrays.asList(elements);
    }

    private static boolean isMath(Element element) {
        return MATH_NS.equals(element.getNamespaceURI());
    }

    private static boolean isText(Element element) {
        String tag = element.getLocalName();
        return WORD_NS.equals(element.getNamespaceURI()) && ("r".equals(tag) || "t".equals(tag));
    }

    private static boolean isTextLeaf(Element element) {
        return "t".equals(element.getLocalName())
                && (isMath(element) || WORD_NS.equals(element.getNamespaceURI()));
    }

    private static boolean isProperty(Element element) {
        String tag = element.getLocalName();
        return tag != null && tag.endsWith("Pr");
    }

    private static final class Frame {
        private final Element element;
        private final List<Element> parts;
        private final List<MarkupNode> built;
        private int next;

        Frame(Element element, List<Element> parts) {
            this.element = element;
            this.parts = parts;
            this.built = new ArrayList<>(parts.size());
        }

        void complete(MarkupNode node) {
            built.add(node);
            next++;
        }
    }
}
