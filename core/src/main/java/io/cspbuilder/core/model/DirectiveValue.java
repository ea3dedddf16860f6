package io.cspbuilder.core.model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Value of a single policy directive.
 *
 * <p>
 * Implementations are a sealed hierarchy: a directive is either a boolean
 * {@link Flag} (e.g. {@code upgrade-insecure-requests}) or an ordered list of
 * {@link Sources} tokens (e.g. {@code 'self'}, a URL, a hash). An absent
 * directive is represented by {@code null} wherever a map carries values.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface DirectiveValue {

    /**
     * Returns a new value with {@code other} appended after this one. Token
     * order is preserved, duplicates are kept.
     *
     * @param other the value to append
     * @return the combined value
     */
    DirectiveValue append(DirectiveValue other);

    /**
     * Normalizes a loosely typed value into a {@link DirectiveValue}.
     *
     * <ul>
     * <li>{@code null} → {@code null} (absent)</li>
     * <li>{@code Boolean} → {@link Flag}</li>
     * <li>collection or array → {@link Flag} if the first element is a
     * {@code Boolean}, otherwise {@link Sources} of every element as text</li>
     * <li>any other object → single-token {@link Sources}</li>
     * </ul>
     *
     * @param raw the value to normalize, may be {@code null}
     * @return the normalized value, or {@code null} if {@code raw} is absent
     */
    static DirectiveValue of(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof DirectiveValue value) {
            return value;
        }
        if (raw instanceof Boolean enabled) {
            return flag(enabled);
        }
        if (raw instanceof Collection<?> collection) {
            return fromElements(new ArrayList<>(collection));
        }
        if (raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(raw, i));
            }
            return fromElements(elements);
        }
        return new Sources(List.of(String.valueOf(raw)));
    }

    /** Creates a source list from the given tokens. */
    static Sources sources(String... tokens) {
        return new Sources(List.of(tokens));
    }

    /**
     * Creates a source list from arbitrary objects, coercing each to text.
     * {@code null} elements are dropped.
     */
    static Sources sources(Collection<?> tokens) {
        List<String> text = new ArrayList<>(tokens.size());
        for (Object token : tokens) {
            if (token != null) {
                text.add(String.valueOf(token));
            }
        }
        return new Sources(text);
    }

    /** Creates a flag value. */
    static Flag flag(boolean enabled) {
        return enabled ? Flag.ENABLED : Flag.DISABLED;
    }

    private static DirectiveValue fromElements(List<Object> elements) {
        if (!elements.isEmpty() && elements.get(0) instanceof Boolean enabled) {
            return flag(enabled);
        }
        return sources(elements);
    }

    // ── Implementations ──

    /**
     * A directive with no value list. {@code true} emits the bare directive
     * name, {@code false} suppresses the directive.
     */
    record Flag(boolean enabled) implements DirectiveValue {

        static final Flag ENABLED = new Flag(true);
        static final Flag DISABLED = new Flag(false);

        /** A flag is decided by its first token; anything appended is ignored. */
        @Override
        public DirectiveValue append(DirectiveValue other) {
            return this;
        }
    }

    /**
     * An ordered list of source-expression tokens. An empty list still emits
     * the bare directive name.
     *
     * @param tokens the tokens, in emission order
     */
    record Sources(List<String> tokens) implements DirectiveValue {

        /** Canonical constructor with defensive copy. */
        public Sources {
            Objects.requireNonNull(tokens, "tokens must not be null");
            tokens = List.copyOf(tokens);
        }

        @Override
        public DirectiveValue append(DirectiveValue other) {
            if (other instanceof Sources more) {
                List<String> merged = new ArrayList<>(tokens.size() + more.tokens.size());
                merged.addAll(tokens);
                merged.addAll(more.tokens);
                return new Sources(merged);
            }
            // a flag cannot follow source tokens
            return this;
        }

        /** Returns {@code true} if there are no tokens. */
        public boolean isEmpty() {
            return tokens.isEmpty();
        }
    }
}
