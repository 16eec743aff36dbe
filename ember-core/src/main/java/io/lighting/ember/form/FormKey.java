package io.lighting.ember.form;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parameter name split into its head and bracket segments, e.g. {@code deep[c][]} is head {@code deep}
 * with segments {@code ["c", ""]}. An empty segment stands for the next array slot.
 * <p>
 * A name that is not {@code head([segment]|[])*} is kept whole as a flat key without segments.
 */
public record FormKey(String raw, String head, List<String> segments) {
    private static final Pattern SEGMENT = Pattern.compile("\\[([^\\]]*)\\]");
    private static final Pattern TAIL = Pattern.compile("(?:\\[[^\\]]*\\])+");

    public FormKey {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(head, "head");
        segments = List.copyOf(segments);
    }

    public static FormKey parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        int open = raw.indexOf('[');
        if (open <= 0 || !TAIL.matcher(raw).region(open, raw.length()).matches()) {
            return new FormKey(raw, raw, List.of());
        }
        List<String> segments = new ArrayList<>();
        Matcher matcher = SEGMENT.matcher(raw);
        matcher.region(open, raw.length());
        while (matcher.find()) {
            segments.add(matcher.group(1));
        }
        return new FormKey(raw, raw.substring(0, open), segments);
    }

    public boolean isFlat() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }
}
