package org.recdiff.engine;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import org.recdiff.model.Absent;
import org.recdiff.model.FieldDescriptor;
import org.recdiff.model.ItemNormalizing;

/**
 * Canonicalizes values before they are compared.
 *
 * <p>Text is cleaned in a fixed order: whitespace, then case, then Unicode normal form. Emptiness is
 * checked after all text normalization.
 */
public final class ValueNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final boolean ignoreWhitespace;
    private final boolean ignoreCase;
    private final boolean unicodeNormal;
    private final boolean ignoreEmptySlots;

    ValueNormalizer(ComparisonOptions options) {
        Objects.requireNonNull(options, "options");
        this.ignoreWhitespace = options.ignoreWhitespace();
        this.ignoreCase = options.ignoreCase();
        this.unicodeNormal = options.unicodeNormal();
        this.ignoreEmptySlots = options.ignoreEmptySlots();
    }

    /**
     * Returns the scrubbed value, or {@link Absent#VALUE} when the value counts as not set.
     */
    public Object normalizeValue(Object value) {
        Object normalized = value;
        if (normalized instanceof String text) {
            normalized = normalizeText(text);
        }
        if (ignoreEmptySlots && isEmpty(normalized)) {
            return Absent.VALUE;
        }
        return normalized;
    }

    /**
     * Normalizes a record slot, running the field's {@code compareAs} hook first.
     */
    public Object normalizeSlot(Object value, FieldDescriptor field) {
        Object normalized = value;
        if (!Absent.is(normalized) && field != null && field.compareAs().isPresent()) {
            normalized = field.compareAs().get().apply(normalized);
        }
        return normalizeValue(normalized);
    }

    /**
     * Normalizes a collection item, running the container's item hook first when it has one.
     */
    public Object normalizeItem(Object value, Object container) {
        Object normalized = value;
        if (!Absent.is(normalized) && container instanceof ItemNormalizing hooked) {
            normalized = hooked.compareItemAs(normalized);
        }
        return normalizeValue(normalized);
    }

    public String normalizeText(String value) {
        String normalized = value;
        if (ignoreWhitespace) {
            normalized = normalizeWhitespace(normalized);
        }
        if (ignoreCase) {
            normalized = normalizeCase(normalized);
        }
        if (unicodeNormal) {
            normalized = Normalizer.normalize(normalized, Normalizer.Form.NFC);
        }
        return normalized;
    }

    public String normalizeWhitespace(String value) {
        StringJoiner joined = new StringJoiner(" ");
        for (String word : WHITESPACE.split(value)) {
            if (!word.isEmpty()) {
                joined.add(word);
            }
        }
        return joined.toString();
    }

    // Locale-independent; Turkish dotless i and similar are not folded.
    public String normalizeCase(String value) {
        return value.toUpperCase(Locale.ROOT);
    }

    /**
     * Only {@code null} and the empty string are empty; zero and empty containers are values.
     */
    public boolean isEmpty(Object value) {
        return value == null || value instanceof String text && text.isEmpty();
    }
}
