package org.dxworks.omml2latex;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class SourceDetector {

    public static Optional<SourceFormat> detectFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);

        // Word keeps a lock file named ~$name.docx next to open documents
        if (fileName.startsWith("~$")) {
            return Optional.empty();
        }
        if (fileName.endsWith(".docx") || fileName.endsWith(".docm")) {
            return Optional.of(SourceFormat.DOCX);
        } else if (fileName.endsWith(".xml")) {
            return Optional.of(SourceFormat.XML);
        }

        return Optional.empty();
    }
}
