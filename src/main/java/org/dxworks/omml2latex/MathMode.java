package org.dxworks.omml2latex;

public enum MathMode {
    INLINE("inline"),
    DISPLAY("display");

    private final String name;

    MathMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static MathMode of(boolean display) {
        return display ? DISPLAY : INLINE;
    }
}
