package org.dxworks.omml2latex;

public enum SourceFormat {
    DOCX("docx"),
    XML("xml");

    private final String name;

    SourceFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
