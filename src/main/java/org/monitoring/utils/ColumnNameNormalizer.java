package org.monitoring.utils;

import org.monitoring.models.mapping.ColumnDescriptor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class ColumnNameNormalizer {

    private static final Pattern ASCII_NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private ColumnNameNormalizer() {
    }

    /**
     * Lowercase slug with runs of non-alphanumerics collapsed to a single underscore.
     */
    public static String slugify(String value) {
        return slugify(value, ASCII_NON_ALPHANUMERIC);
    }

    /**
     * Lowercase slug where every run matched by {@code separators} becomes a single underscore.
     */
    public static String slugify(String value, Pattern separators) {
        if (value == null) {
            return "";
        }
        String slug = separators.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("_")
                .replaceAll("_+", "_");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '_') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '_') {
            end--;
        }
        return slug.substring(start, end);
    }

    public static List<ColumnDescriptor> describe(List<String> headers) {
        List<ColumnDescriptor> descriptors = new ArrayList<>(headers.size());
        Set<String> seen = new HashSet<>();
        for (int idx = 0; idx < headers.size(); idx++) {
            String name = headers.get(idx);
            String base = slugify(name);
            if (base.isEmpty()) {
                base = "column_" + (idx + 1);
            }
            String candidate = base;
            int counter = 1;
            while (seen.contains(candidate)) {
                counter++;
                candidate = base + "_" + counter;
            }
            seen.add(candidate);
            descriptors.add(new ColumnDescriptor(name, candidate));
        }
        return descriptors;
    }
}
