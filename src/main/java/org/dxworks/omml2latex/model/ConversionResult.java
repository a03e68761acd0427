package org.dxworks.omml2latex.model;

import org.dxworks.omml2latex.MathMode;

import java.util.List;

/**
 * Output of converting one equation: the wrapped notation, the raw body and any advisories.
 */
public final class ConversionResult {
    public final MathMode mode;
    public final String body;
    public final String latex;
    public final List<ConversionAdvisory> advisories;

    public ConversionResult(MathMode mode, String body, String latex, List<ConversionAdvisory> advisories) {
        this.mode = mode;
        this.body = body;
        this.latex = latex;
        this.advisories = advisories == null ? List.of() : List.copyOf(advisories);
    }

    public boolean hasAdvisories() {
        return !advisories.isEmpty();
    }
}
