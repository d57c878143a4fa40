package com.dnsfilter.api.authz;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Domain name normalization and label-wise comparison.
 *
 * Normalized names are lowercase, carry no trailing dot and have at least two
 * labels. All comparisons work on whole labels, so {@code evilexample.com} is
 * never below {@code example.com}.
 */
public final class DomainName {

    public static final int MAX_LENGTH = 253;
    public static final int MAX_LABEL_LENGTH = 63;

    private static final Pattern LABEL = Pattern.compile("^[a-z0-9_]([a-z0-9_-]*[a-z0-9])?$");

    private DomainName() {}

    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String name = raw.trim().toLowerCase(Locale.ROOT);
        if (name.endsWith(".")) {
            name = name.substring(0, name.length() - 1);
        }
        if (name.isEmpty() || name.length() > MAX_LENGTH) {
            return Optional.empty();
        }
        String[] labels = name.split("\\.", -1);
        if (labels.length < 2) {
            return Optional.empty();
        }
        for (String label : labels) {
            if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH || !LABEL.matcher(label).matches()) {
                return Optional.empty();
            }
        }
        return Optional.of(name);
    }

    public static boolean isValid(String raw) {
        return normalize(raw).isPresent();
    }

    /**
     * True when {@code name} equals {@code ancestor} or lies below it.
     * Both arguments must already be normalized.
     */
    public static boolean isSameOrBelow(String name, String ancestor) {
        return depthBelow(name, ancestor) >= 0;
    }

    public static boolean isStrictlyBelow(String name, String ancestor) {
        return depthBelow(name, ancestor) > 0;
    }

    /**
     * Number of labels {@code name} has below {@code ancestor}, 0 when equal,
     * -1 when {@code name} is not within {@code ancestor}.
     */
    public static int depthBelow(String name, String ancestor) {
        String[] nameLabels = name.split("\\.");
        String[] ancestorLabels = ancestor.split("\\.");
        int extra = nameLabels.length - ancestorLabels.length;
        if (extra < 0) {
            return -1;
        }
        for (int i = 0; i < ancestorLabels.length; i++) {
            if (!ancestorLabels[i].equals(nameLabels[extra + i])) {
                return -1;
            }
        }
        return extra;
    }

    /**
     * The name followed by each parent, longest first, down to two labels.
     */
    public static List<String> selfAndParents(String name) {
        List<String> result = new ArrayList<>();
        String current = name;
        while (current.indexOf('.') > 0) {
            result.add(current);
            current = current.substring(current.indexOf('.') + 1);
        }
        return result;
    }
}
