package org.dxworks.omml2latex.converter;

import org.dxworks.omml2latex.model.*;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One LaTeX template per markup variant. Each method receives the node and its slots already
 * converted, in {@link MarkupNode#slots()} order, with absent slots as empty strings.
 */
class NotationTemplates implements MarkupVisitor<String, List<String>> {

    static final Set<String> STANDARD_FUNCTIONS = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc",
            "sinh", "cosh", "tanh", "coth",
            "arcsin", "arccos", "arctan",
            "log", "ln", "exp", "lim", "max", "min",
            "sup", "inf", "det", "dim", "ker", "deg",
            "gcd", "lcm", "arg", "mod");

    private static final String ROW_SEPARATOR = " \\\\ ";
    private static final String CELL_SEPARATOR = " & ";

    private final SymbolResolver resolver;
    private final String matrixEnvironment;

    NotationTemplates(SymbolResolver resolver, String matrixEnvironment) {
        this.resolver = resolver;
        this.matrixEnvironment = matrixEnvironment;
    }

    @Override
    public String visitTextRun(TextRun node, List<String> parts) {
        return resolver.resolveText(node.text);
    }

    @Override
    public String visitSequence(Sequence node, List<String> parts) {
        return concat(parts);
    }

    @Override
    public String visitUnknown(Unknown node, List<String> parts) {
        return concat(parts);
    }

    @Override
    public String visitFraction(Fraction node, List<String> parts) {
        return "\\frac{" + parts.get(0) + "}{" + parts.get(1) + "}";
    }

    @Override
    public String visitSupSub(SupSub node, List<String> parts) {
        String base = parts.get(0);
        return switch (node.form) {
            case SUBSCRIPT -> base + "_{" + parts.get(1) + "}";
            case SUPERSCRIPT -> base + "^{" + parts.get(2) + "}";
            case BOTH -> base + "_{" + parts.get(1) + "}^{" + parts.get(2) + "}";
        };
    }

    @Override
    public String visitRadical(Radical node, List<String> parts) {
        if (node.degreeHidden) {
            return "\\sqrt{" + parts.get(1) + "}";
        }
        return "\\sqrt[" + parts.get(0) + "]{" + parts.get(1) + "}";
    }

    @Override
    public String visitNaryOperator(NaryOperator node, List<String> parts) {
        StringBuilder sb = new StringBuilder(resolver.resolveOperator(node.operatorChar));
        if (!parts.get(0).isEmpty()) {
            sb.append("_{").append(parts.get(0)).append('}');
        }
        if (!parts.get(1).isEmpty()) {
            sb.append("^{").append(parts.get(1)).append('}');
        }
        if (!parts.get(2).isEmpty()) {
            sb.append(' ').append(parts.get(2));
        }
        return sb.toString();
    }

    @Override
    public String visitDelimiter(Delimiter node, List<String> parts) {
        String separator = " " + resolver.resolveText(node.separatorChar) + " ";
        String body = String.join(separator, parts);
        String open = "\\left" + resolver.resolveDelimiter(node.openChar);
        String close = "\\right" + resolver.resolveDelimiter(node.closeChar);
        if (body.isBlank()) {
            return open + close;
        }
        return open + " " + body + " " + close;
    }

    @Override
    public String visitFunction(Function node, List<String> parts) {
        String name = functionName(parts.get(0));
        String argument = parts.get(1);
        if (name.isEmpty() || argument.isEmpty()) {
            return name + argument;
        }
        return name + " " + argument;
    }

    @Override
    public String visitMatrix(Matrix node, List<String> parts) {
        StringBuilder sb = new StringBuilder("\\begin{").append(matrixEnvironment).append('}');
        int cell = 0;
        for (int r = 0; r < node.rows.size(); r++) {
            if (r > 0) {
                sb.append(ROW_SEPARATOR);
            }
            int cells = node.rows.get(r).size();
            for (int c = 0; c < cells; c++) {
                if (c > 0) {
                    sb.append(CELL_SEPARATOR);
                }
                sb.append(parts.get(cell++));
            }
        }
        return sb.append("\\end{").append(matrixEnvironment).append('}').toString();
    }

    @Override
    public String visitAccent(Accent node, List<String> parts) {
        return resolver.resolveAccent(node.accentChar) + "{" + parts.get(0) + "}";
    }

    @Override
    public String visitEquationArray(EquationArray node, List<String> parts) {
        return "\\begin{aligned}" + String.join(ROW_SEPARATOR, parts) + "\\end{aligned}";
    }

    @Override
    public String visitBar(Bar node, List<String> parts) {
        return (node.top ? "\\overline{" : "\\underline{") + parts.get(0) + "}";
    }

    @Override
    public String visitGroupChar(GroupChar node, List<String> parts) {
        return switch (node.groupChar) {
            case "⏟", "︸" -> "\\underbrace{" + parts.get(0) + "}";
            case "⏞", "︷" -> "\\overbrace{" + parts.get(0) + "}";
            default -> parts.get(0);
        };
    }

    @Override
    public String visitLimitLower(LimitLower node, List<String> parts) {
        return parts.get(0) + "_{" + parts.get(1) + "}";
    }

    @Override
    public String visitLimitUpper(LimitUpper node, List<String> parts) {
        return parts.get(0) + "^{" + parts.get(1) + "}";
    }

    @Override
    public String visitPreSubSup(PreSubSup node, List<String> parts) {
        return "{}_{" + parts.get(0) + "}^{" + parts.get(1) + "}" + parts.get(2);
    }

    /**
     * Standard names become their operator macro, with or without attached limits; other plain
     * names are set upright; anything already structured is kept as converted.
     */
    static String functionName(String converted) {
        String name = converted.trim();
        if (name.isEmpty()) {
            return name;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (STANDARD_FUNCTIONS.contains(lower)) {
            return "\\" + lower;
        }
        for (String standard : STANDARD_FUNCTIONS) {
            if (lower.length() > standard.length() && lower.startsWith(standard)) {
                char next = name.charAt(standard.length());
                if (next == '_' || next == '^') {
                    return "\\" + standard + name.substring(standard.length());
                }
            }
        }
        if (name.chars().noneMatch(c -> c == '\\' || c == '{' || c == '}' || c == '_' || c == '^')) {
            return "\\mathrm{" + name + "}";
        }
        return name;
    }

    /**
     * Joins sibling fragments, separating a trailing control word from a following letter.
     */
    static String concat(List<String> parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (SymbolResolver.endsWithControlWord(sb) && isAsciiLetter(part.charAt(0))) {
                sb.append(' ');
            }
            sb.append(part);
        }
        return sb.toString();
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
