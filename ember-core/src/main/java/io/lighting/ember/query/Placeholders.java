package io.lighting.ember.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans {@code $n} positional placeholders in filter text.
 */
public final class Placeholders {
    private static final Pattern PARAM = Pattern.compile("\\$([0-9]+)");

    private Placeholders() {
    }

    /**
     * Adds {@code offset} to every {@code $n} in {@code fragment}. A {@code $} not followed by digits is
     * left as is.
     *
     * @throws NumberFormatException if an index does not fit in an int
     */
    public static String shift(String fragment, int offset) {
        Objects.requireNonNull(fragment, "fragment");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (offset == 0) {
            return fragment;
        }
        Matcher matcher = PARAM.matcher(fragment);
        StringBuilder shifted = new StringBuilder(fragment.length() + 8);
        int last = 0;
        while (matcher.find()) {
            shifted.append(fragment, last, matcher.start(1));
            int index = Integer.parseInt(matcher.group(1));
            shifted.append(Math.addExact(index, offset));
            last = matcher.end(1);
        }
        shifted.append(fragment, last, fragment.length());
        return shifted.toString();
    }

    /**
     * Placeholder indices in textual order, repeats included.
     */
    public static List<Integer> indices(String filter) {
        if (filter == null) {
            return List.of();
        }
        List<Integer> indices = new ArrayList<>();
        Matcher matcher = PARAM.matcher(filter);
        while (matcher.find()) {
            indices.add(Integer.parseInt(matcher.group(1)));
        }
        return indices;
    }

    /**
     * Rewrites each {@code $n} through {@code replacer}, which receives the 1-based index.
     */
    public static String replace(String filter, IntFunction<String> replacer) {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(replacer, "replacer");
        Matcher matcher = PARAM.matcher(filter);
        StringBuilder out = new StringBuilder(filter.length());
        int last = 0;
        while (matcher.find()) {
            out.append(filter, last, matcher.start());
            out.append(replacer.apply(Integer.parseInt(matcher.group(1))));
            last = matcher.end();
        }
        out.append(filter, last, filter.length());
        return out.toString();
    }
}
