package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * One JSONL line describing a converted equation.
 */
public class EquationRecord {
    public String kind = "equation";
    public String file;
    public int index; // 1-based position of the equation within its file
    public String mode;
    public String latex;
    public List<ConversionAdvisory> advisories; // omitted when empty or when reporting is disabled
}
