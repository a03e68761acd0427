package org.dxworks.omml2latex.converter;

import org.dxworks.omml2latex.MathMode;
import org.dxworks.omml2latex.Omml2LatexConfig;

import java.util.Objects;

/**
 * Wraps a converted body in the inline or display math delimiters. Callers that embed
 * notation inside a larger expression use the raw body and skip this step.
 */
public class LatexAssembler {

    private final Omml2LatexConfig config;

    public LatexAssembler(Omml2LatexConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public String assemble(MathMode mode, String body) {
        Objects.requireNonNull(mode, "mode");
        String content = body == null ? "" : body;
        if (mode == MathMode.DISPLAY) {
            return config.getDisplayOpen() + "\n" + content + "\n" + config.getDisplayClose();
        }
        return config.getInlineOpen() + content + config.getInlineClose();
    }
}
