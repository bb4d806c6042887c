package nl.nfi.djwordlist.generate.mask;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed mask template such as {@code {sym}{camel}{num}}.
 * <p>
 * The template is split into literal text and placeholder references. Each distinct placeholder gets a
 * slot, numbered in order of first appearance; all occurrences of the same placeholder share that slot,
 * so they receive the same value within one rendered candidate. Every innermost pair of braces must
 * enclose a known placeholder name; anything else, including {@code {}}, is an {@link InvalidMaskException}.
 * Unpaired braces are literal text.
 */
public final class Mask {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{([^{}]*)}");

    private final String template;
    private final List<Placeholder> slots;
    // literal text is stored as-is, a placeholder reference as its slot index
    private final List<Object> segments;

    private Mask(final String template, final List<Placeholder> slots, final List<Object> segments) {
        this.template = template;
        this.slots = slots;
        this.segments = segments;
    }

    public static Mask parse(final String template) {
        final List<Placeholder> slots = new ArrayList<>();
        final List<Object> segments = new ArrayList<>();

        final Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        int position = 0;
        while (matcher.find()) {
            final String token = matcher.group(1);
            final Placeholder placeholder = Placeholder.forToken(token)
                    .orElseThrow(() -> new InvalidMaskException(template, token));

            if (matcher.start() > position) {
                segments.add(template.substring(position, matcher.start()));
            }
            int slot = slots.indexOf(placeholder);
            if (slot < 0) {
                slot = slots.size();
                slots.add(placeholder);
            }
            segments.add(slot);
            position = matcher.end();
        }
        if (position < template.length()) {
            segments.add(template.substring(position));
        }

        return new Mask(template, List.copyOf(slots), List.copyOf(segments));
    }

    public String template() {
        return template;
    }

    /**
     * The distinct placeholders of this mask, in order of first appearance.
     */
    public List<Placeholder> slots() {
        return slots;
    }

    boolean uses(final Placeholder placeholder) {
        return slots.contains(placeholder);
    }

    public String render(final String[] slotValues) {
        final StringBuilder candidate = new StringBuilder();
        for (final Object segment : segments) {
            if (segment instanceof final Integer slot) {
                candidate.append(slotValues[slot]);
            } else {
                candidate.append((String) segment);
            }
        }
        return candidate.toString();
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof final Mask mask && mask.template.equals(template);
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }
}
