package io.cspbuilder.core.model;

/**
 * Attributes recognized on a rendered {@code <script>} tag, declared in
 * rendering order. The order is fixed so that output is deterministic
 * regardless of the order in which callers supply values.
 */
public enum ScriptAttribute {
    NONCE("nonce", Rule.DEFAULT_STRING),
    ID("id", Rule.DEFAULT_STRING),
    SRC("src", Rule.DEFAULT_STRING),
    TYPE("type", Rule.DEFAULT_STRING),
    ASYNC("async", Rule.TRI_STATE_ASYNC),
    DEFER("defer", Rule.BARE_BOOLEAN),
    INTEGRITY("integrity", Rule.DEFAULT_STRING),
    NOMODULE("nomodule", Rule.BARE_BOOLEAN);

    /**
     * How an attribute value is written into the tag.
     *
     * <ul>
     * <li>{@link #DEFAULT_STRING}: {@code name="value"} when truthy</li>
     * <li>{@link #BARE_BOOLEAN}: bare {@code name} when truthy</li>
     * <li>{@link #TRI_STATE_ASYNC}: bare {@code name} when truthy,
     * {@code name=false} when explicitly false</li>
     * </ul>
     */
    public enum Rule {
        DEFAULT_STRING,
        BARE_BOOLEAN,
        TRI_STATE_ASYNC
    }

    private final String attributeName;
    private final Rule rule;

    ScriptAttribute(String attributeName, Rule rule) {
        this.attributeName = attributeName;
        this.rule = rule;
    }

    /** The HTML attribute name, e.g. {@code integrity}. */
    public String attributeName() {
        return attributeName;
    }

    /** The formatting rule applied to this attribute. */
    public Rule rule() {
        return rule;
    }
}
