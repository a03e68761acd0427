package org.dxworks.omml2latex.converter;

import org.dxworks.omml2latex.MathMode;
import org.dxworks.omml2latex.Omml2LatexConfig;
import org.dxworks.omml2latex.model.ConversionAdvisory;
import org.dxworks.omml2latex.model.ConversionResult;
import org.dxworks.omml2latex.model.MarkupNode;
import org.dxworks.omml2latex.model.Matrix;
import org.dxworks.omml2latex.model.Unknown;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts a markup tree into LaTeX math notation.
 * <p>
 * The tree is walked post-order with an explicit stack, so nesting depth is limited only by
 * heap memory. Every node is finished exactly once: its slots are converted first, then its
 * template from {@link NotationTemplates} is applied. Conversion never fails on a malformed
 * tree; absent children become empty content and are reported as advisories.
 * <p>
 * Instances hold no mutable state and may be shared between threads.
 */
public class MathConverter {

    private final NotationTemplates templates;
    private final LatexAssembler assembler;

    public MathConverter() {
        this(Omml2LatexConfig.defaults());
    }

    public MathConverter(Omml2LatexConfig config) {
        this(config, SymbolResolver.DEFAULT);
    }

    public MathConverter(Omml2LatexConfig config, SymbolResolver resolver) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(resolver, "resolver");
        this.templates = new NotationTemplates(resolver, config.getMatrixEnvironment());
        this.assembler = new LatexAssembler(config);
    }

    /**
     * Converts one equation and wraps it for its placement in the document.
     */
    public ConversionResult convert(MarkupNode root, MathMode mode) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(mode, "mode");
        List<ConversionAdvisory> advisories = new ArrayList<>();
        String body = transduce(root, advisories);
        return new ConversionResult(mode, body, assembler.assemble(mode, body), advisories);
    }

    /**
     * Converts a tree without the outer math delimiters.
     */
    public String convertBody(MarkupNode root) {
        Objects.requireNonNull(root, "root");
        return transduce(root, new ArrayList<>());
    }

    private String transduce(MarkupNode root, List<ConversionAdvisory> advisories) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        String result = "";

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.hasPendingSlot()) {
                MarkupNode child = frame.nextSlot();
                if (child == null) {
                    frame.complete("");
                } else {
                    stack.push(new Frame(child));
                }
                continue;
            }

            stack.pop();
            inspect(frame.node, advisories);
            String converted = frame.node.accept(templates, frame.parts);
            if (stack.isEmpty()) {
                result = converted;
            } else {
                stack.peek().complete(converted);
            }
        }
        return result;
    }

    private static void inspect(MarkupNode node, List<ConversionAdvisory> advisories) {
        for (String part : node.missingParts()) {
            advisories.add(new ConversionAdvisory(ConversionAdvisory.Kind.MISSING_CHILD,
                    node.kind() + " has no " + part));
        }
        if (node instanceof Matrix matrix && matrix.isRagged()) {
            String sizes = matrix.rows.stream()
                    .map(row -> String.valueOf(row.size()))
                    .collect(Collectors.joining(", "));
            advisories.add(new ConversionAdvisory(ConversionAdvisory.Kind.RAGGED_MATRIX,
                    "matrix rows have differing cell counts: " + sizes));
        }
        if (node instanceof Unknown unknown) {
            advisories.add(new ConversionAdvisory(ConversionAdvisory.Kind.UNKNOWN_ELEMENT,
                    "unrecognized element '" + unknown.tag + "' passed through"));
        }
    }

    private static final class Frame {
        private final MarkupNode node;
        private final List<MarkupNode> slots;
        private final List<String> parts;
        private int next;

        Frame(MarkupNode node) {
            this.node = node;
            this.slots = node.slots();
            this.parts = new ArrayList<>(slots.size());
        }

        boolean hasPendingSlot() {
            return next < slots.size();
        }

        MarkupNode nextSlot() {
            return slots.get(next);
        }

        void complete(String converted) {
            parts.add(converted);
            next++;
        }
    }
}
