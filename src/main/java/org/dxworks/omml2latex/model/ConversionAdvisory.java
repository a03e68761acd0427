package org.dxworks.omml2latex.model;

import java.util.Objects;

/**
 * Non-fatal finding about an equation whose output may need a human look.
 */
public final class ConversionAdvisory {

    public enum Kind {
        MISSING_CHILD,
        RAGGED_MATRIX,
        UNKNOWN_ELEMENT
    }

    public final Kind kind;
    public final String message;

    public ConversionAdvisory(Kind kind, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionAdvisory)) return false;
        ConversionAdvisory that = (ConversionAdvisory) o;
        return kind == that.kind && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
