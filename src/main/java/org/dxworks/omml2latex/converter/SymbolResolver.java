package org.dxworks.omml2latex.converter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup from markup characters to LaTeX macros.
 * <p>
 * Unmapped characters pass through unchanged, so resolution never fails and never drops input.
 * {@link #DEFAULT} is built once and shared by every conversion.
 */
public final class SymbolResolver {

    public static final SymbolResolver DEFAULT = new SymbolResolver();

    private static final String NOTATION_SPECIALS = "#$%&_{}";

    private final Map<Integer, String> symbols;
    private final Map<String, String> operators;
    private final Map<String, String> accents;
    private final Map<String, String> delimiters;

    private SymbolResolver() {
        this.symbols = Collections.unmodifiableMap(buildSymbols());
        this.operators = Collections.unmodifiableMap(buildOperators());
        this.accents = Collections.unmodifiableMap(buildAccents());
        this.delimiters = Collections.unmodifiableMap(buildDelimiters());
    }

    /**
     * Macro for a single character, the escaped character for notation specials,
     * or the character itself.
     */
    public String resolve(int codePoint) {
        String macro = symbols.get(codePoint);
        if (macro != null) {
            return macro;
        }
        if (codePoint == '\\') {
            return "\\backslash";
        }
        if (codePoint < 128 && NOTATION_SPECIALS.indexOf(codePoint) >= 0) {
            return "\\" + (char) codePoint;
        }
        return new String(Character.toChars(codePoint));
    }

    public String resolve(char c) {
        return resolve((int) c);
    }

    public boolean isMapped(int codePoint) {
        return symbols.containsKey(codePoint);
    }

    public Set<Integer> mappedCodePoints() {
        return symbols.keySet();
    }

    /**
     * Resolves every character of a text run. A macro ending in a letter is followed by a space
     * so the next character cannot extend the control word; the result is trimmed.
     */
    public String resolveText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        text.codePoints().forEach(cp -> {
            String resolved = resolve(cp);
            sb.append(resolved);
            if (endsWithControlWord(resolved)) {
                sb.append(' ');
            }
        });
        return sb.toString().trim();
    }

    /**
     * Big-operator macro. A null or empty character is the markup default, the integral.
     */
    public String resolveOperator(String operatorChar) {
        if (operatorChar == null || operatorChar.isEmpty()) {
            return "\\int";
        }
        String macro = operators.get(operatorChar);
        return macro != null ? macro : resolveText(operatorChar);
    }

    /**
     * Accent macro. Null and unmapped marks use the markup default, the hat.
     */
    public String resolveAccent(String accentChar) {
        if (accentChar == null) {
            return "\\hat";
        }
        return accents.getOrDefault(accentChar, "\\hat");
    }

    /**
     * Delimiter as written after {@code \left} or {@code \right}. The empty string is the
     * invisible delimiter {@code .}.
     */
    public String resolveDelimiter(String delimiterChar) {
        if (delimiterChar == null || delimiterChar.isEmpty()) {
            return ".";
        }
        return delimiters.getOrDefault(delimiterChar, delimiterChar);
    }

    static boolean endsWithControlWord(CharSequence latex) {
        int i = latex.length() - 1;
        if (i < 0 || !isAsciiLetter(latex.charAt(i))) {
            return false;
        }
        while (i >= 0 && isAsciiLetter(latex.charAt(i))) {
            i--;
        }
        return i >= 0 && latex.charAt(i) == '\\';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static Map<Integer, String> buildSymbols() {
        Map<Integer, String> m = new HashMap<>();

        // Greek, lower case
        put(m, 'α', "\\alpha");
        put(m, 'β', "\\beta");
        put(m, 'γ', "\\gamma");
        put(m, 'δ', "\\delta");
        put(m, 'ε', "\\varepsilon");
        put(m, 'ζ', "\\zeta");
        put(m, 'η', "\\eta");
        put(m, 'θ', "\\theta");
        put(m, 'ι', "\\iota");
        put(m, 'κ', "\\kappa");
        put(m, 'λ', "\\lambda");
        put(m, 'μ', "\\mu");
        put(m, 'ν', "\\nu");
        put(m, 'ξ', "\\xi");
        put(m, 'ο', "o");
        put(m, 'π', "\\pi");
        put(m, 'ρ', "\\rho");
        put(m, 'σ', "\\sigma");
        put(m, 'τ', "\\tau");
        put(m, 'υ', "\\upsilon");
        put(m, 'φ', "\\varphi");
        put(m, 'χ', "\\chi");
        put(m, 'ψ', "\\psi");
        put(m, 'ω', "\\omega");

        // Greek, upper case; letters without their own macro use the Latin look-alike
        put(m, 'Α', "A");
        put(m, 'Β', "B");
        put(m, 'Γ', "\\Gamma");
        put(m, 'Δ', "\\Delta");
        put(m, 'Ε', "E");
        put(m, 'Ζ', "Z");
        put(m, 'Η', "H");
        put(m, 'Θ', "\\Theta");
        put(m, 'Ι', "I");
        put(m, 'Κ', "K");
        put(m, 'Λ', "\\Lambda");
        put(m, 'Μ', "M");
        put(m, 'Ν', "N");
        put(m, 'Ξ', "\\Xi");
        put(m, 'Ο', "O");
        put(m, 'Π', "\\Pi");
        put(m, 'Ρ', "P");
        put(m, 'Σ', "\\Sigma");
        put(m, 'Τ', "T");
        put(m, 'Υ', "\\Upsilon");
        put(m, 'Φ', "\\Phi");
        put(m, 'Χ', "X");
        put(m, 'Ψ', "\\Psi");
        put(m, 'Ω', "\\Omega");

        // Greek variants
        put(m, 'ϕ', "\\phi");
        put(m, 'ϵ', "\\epsilon");
        put(m, 'ϑ', "\\vartheta");
        put(m, 'ϖ', "\\varpi");
        put(m, 'ϱ', "\\varrho");
        put(m, 'ς', "\\varsigma");

        // Analysis and big operators
        put(m, '∞', "\\infty");
        put(m, '∂', "\\partial");
        put(m, '∇', "\\nabla");
        put(m, '∑', "\\sum");
        put(m, '∏', "\\prod");
        put(m, '∫', "\\int");
        put(m, '∮', "\\oint");
        put(m, '∬', "\\iint");
        put(m, '∭', "\\iiint");
        put(m, '√', "\\sqrt");
        put(m, '∛', "\\sqrt[3]");
        put(m, '∜', "\\sqrt[4]");

        // Arithmetic
        put(m, '±', "\\pm");
        put(m, '∓', "\\mp");
        put(m, '×', "\\times");
        put(m, '÷', "\\div");
        put(m, '·', "\\cdot");
        put(m, '⋅', "\\cdot");
        put(m, '∘', "\\circ");
        put(m, '⊗', "\\otimes");
        put(m, '⊕', "\\oplus");
        put(m, '−', "-");

        // Relations
        put(m, '≤', "\\leq");
        put(m, '≥', "\\geq");
        put(m, '≠', "\\neq");
        put(m, '≈', "\\approx");
        put(m, '≡', "\\equiv");
        put(m, '∝', "\\propto");
        put(m, '∼', "\\sim");
        put(m, '≃', "\\simeq");
        put(m, '≅', "\\cong");
        put(m, '≪', "\\ll");
        put(m, '≫', "\\gg");

        // Sets and logic
        put(m, '∈', "\\in");
        put(m, '∉', "\\notin");
        put(m, '⊂', "\\subset");
        put(m, '⊃', "\\supset");
        put(m, '⊆', "\\subseteq");
        put(m, '⊇', "\\supseteq");
        put(m, '∪', "\\cup");
        put(m, '∩', "\\cap");
        put(m, '∅', "\\emptyset");
        put(m, '∀', "\\forall");
        put(m, '∃', "\\exists");
        put(m, '¬', "\\neg");
        put(m, '∧', "\\land");
        put(m, '∨', "\\lor");

        // Arrows
        put(m, '→', "\\to");
        put(m, '←', "\\leftarrow");
        put(m, '↔', "\\leftrightarrow");
        put(m, '⇒', "\\Rightarrow");
        put(m, '⇐', "\\Leftarrow");
        put(m, '⇔', "\\Leftrightarrow");
        put(m, '↑', "\\uparrow");
        put(m, '↓', "\\downarrow");
        put(m, '↦', "\\mapsto");

        // Primes and units
        put(m, '′', "'");
        put(m, '″', "''");
        put(m, '‴', "'''");
        put(m, '°', "^\\circ");
        put(m, '‰', "\\permil");

        // Number sets
        put(m, 'ℕ', "\\mathbb{N}");
        put(m, 'ℤ', "\\mathbb{Z}");
        put(m, 'ℚ', "\\mathbb{Q}");
        put(m, 'ℝ', "\\mathbb{R}");
        put(m, 'ℂ', "\\mathbb{C}");

        // Brackets and bars
        put(m, '⟨', "\\langle");
        put(m, '⟩', "\\rangle");
        put(m, '⌈', "\\lceil");
        put(m, '⌉', "\\rceil");
        put(m, '⌊', "\\lfloor");
        put(m, '⌋', "\\rfloor");
        put(m, '|', "\\vert");
        put(m, '‖', "\\Vert");

        // Dots
        put(m, '…', "\\ldots");
        put(m, '⋯', "\\cdots");
        put(m, '⋮', "\\vdots");
        put(m, '⋱', "\\ddots");

        // Letter-like
        put(m, 'ℓ', "\\ell");
        put(m, 'ℏ', "\\hbar");
        put(m, '℘', "\\wp");
        put(m, 'ℑ', "\\Im");
        put(m, 'ℜ', "\\Re");

        return m;
    }

    private static void put(Map<Integer, String> m, char c, String macro) {
        m.put((int) c, macro);
    }

    private static Map<String, String> buildOperators() {
        Map<String, String> m = new HashMap<>();
        m.put("∑", "\\sum");
        m.put("∏", "\\prod");
        m.put("∐", "\\coprod");
        m.put("∫", "\\int");
        m.put("∬", "\\iint");
        m.put("∭", "\\iiint");
        m.put("∮", "\\oint");
        m.put("⋃", "\\bigcup");
        m.put("⋂", "\\bigcap");
        m.put("⋁", "\\bigvee");
        m.put("⋀", "\\bigwedge");
        m.put("⨁", "\\bigoplus");
        m.put("⨂", "\\bigotimes");
        return m;
    }

    private static Map<String, String> buildAccents() {
        Map<String, String> m = new HashMap<>();
        // spacing and combining form of each mark
        m.put("^", "\\hat");
        m.put("\u0302", "\\hat");
        m.put("¯", "\\bar");
        m.put("\u0304", "\\bar");
        m.put("\u0305", "\\bar");
        m.put("→", "\\vec");
        m.put("\u20D7", "\\vec");
        m.put("˙", "\\dot");
        m.put("\u0307", "\\dot");
        m.put("¨", "\\ddot");
        m.put("\u0308", "\\ddot");
        m.put("˜", "\\tilde");
        m.put("~", "\\tilde");
        m.put("\u0303", "\\tilde");
        m.put("˘", "\\breve");
        m.put("\u0306", "\\breve");
        m.put("ˇ", "\\check");
        m.put("\u030C", "\\check");
        return m;
    }

    private static Map<String, String> buildDelimiters() {
        Map<String, String> m = new HashMap<>();
        m.put("(", "(");
        m.put(")", ")");
        m.put("[", "[");
        m.put("]", "]");
        m.put("{", "\\{");
        m.put("}", "\\}");
        m.put("|", "|");
        m.put("‖", "\\|");
        m.put("⟨", "\\langle");
        m.put("⟩", "\\rangle");
        m.put("〈", "\\langle");
        m.put("〉", "\\rangle");
        m.put("⌈", "\\lceil");
        m.put("⌉", "\\rceil");
        m.put("⌊", "\\lfloor");
        m.put("⌋", "\\rfloor");
        return m;
    }
}
