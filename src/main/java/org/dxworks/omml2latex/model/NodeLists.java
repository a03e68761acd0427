package org.dxworks.omml2latex.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable list helpers that, unlike {@code List.of}, accept null elements (absent slots).
 */
final class NodeLists {

    private NodeLists() {
        // utility class
    }

    static List<MarkupNode> of(MarkupNode... nodes) {
        return Collections.unmodifiableList(Arrays.asList(nodes.clone()));
    }

    static List<MarkupNode> copy(List<? extends MarkupNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    static List<String> missing(Object... namesAndValues) {
        List<String> missing = new ArrayList<>();
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            if (namesAndValues[i + 1] == null) {
                missing.add((String) namesAndValues[i]);
            }
        }
        return missing.isEmpty() ? List.of() : Collections.unmodifiableList(missing);
    }
}
