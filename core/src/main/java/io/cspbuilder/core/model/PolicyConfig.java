package io.cspbuilder.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base policy configuration: the directive table plus the options read by
 * callers that decide whether and how the policy is attached.
 *
 * <p>
 * Immutable and safe to share across threads and requests. The directive map
 * preserves insertion order; absent ({@code null}) values are dropped at
 * construction. Use {@link #builder()} to construct instances, or
 * {@link #defaults()} for the default table.
 *
 * @param directives         directive name → value, in emission order
 * @param includeNonceIn     directives that receive the per-request nonce;
 *                           {@code null} means unset ({@code default-src})
 * @param reportOnly         send the policy as report-only
 * @param reportPercentage   share of report-only responses to report, 0–100
 * @param excludeUrlPrefixes request path prefixes that skip the policy
 */
public record PolicyConfig(
        Map<String, DirectiveValue> directives,
        List<String> includeNonceIn,
        boolean reportOnly,
        int reportPercentage,
        List<String> excludeUrlPrefixes) {

    /** Nonce target used when {@link #includeNonceIn()} is unset. */
    public static final List<String> DEFAULT_NONCE_TARGETS = List.of(Directives.DEFAULT_SRC);

    /** Canonical constructor with defensive copies. */
    public PolicyConfig {
        Map<String, DirectiveValue> copy = new LinkedHashMap<>();
        if (directives != null) {
            directives.forEach((name, value) -> {
                if (value != null) {
                    copy.put(name, value);
                }
            });
        }
        directives = Collections.unmodifiableMap(copy);
        includeNonceIn = includeNonceIn != null ? List.copyOf(includeNonceIn) : null;
        excludeUrlPrefixes = excludeUrlPrefixes != null ? List.copyOf(excludeUrlPrefixes) : List.of();
        if (reportPercentage < 0 || reportPercentage > 100) {
            throw new IllegalArgumentException("reportPercentage must be between 0 and 100, got: " + reportPercentage);
        }
    }

    /**
     * Default directive table: {@code default-src 'self'} with the mixed
     * content flags disabled. Nonce targets are unset, nothing is report-only.
     */
    public static PolicyConfig defaults() {
        return builder().build();
    }

    /** Returns a builder pre-populated with the {@link #defaults()} values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder initialized from this configuration. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.directives.clear();
        builder.directives.putAll(directives);
        builder.includeNonceIn = includeNonceIn;
        builder.reportOnly = reportOnly;
        builder.reportPercentage = reportPercentage;
        builder.excludeUrlPrefixes = excludeUrlPrefixes;
        return builder;
    }

    /** Nonce targets, falling back to {@link #DEFAULT_NONCE_TARGETS} when unset. */
    public List<String> nonceTargets() {
        return includeNonceIn != null ? includeNonceIn : DEFAULT_NONCE_TARGETS;
    }

    /** Header that carries this policy, depending on {@link #reportOnly()}. */
    public String headerName() {
        return reportOnly ? CspHeaders.CONTENT_SECURITY_POLICY_REPORT_ONLY : CspHeaders.CONTENT_SECURITY_POLICY;
    }

    /** Builder for {@link PolicyConfig}. Not thread-safe. */
    public static final class Builder {

        private final Map<String, DirectiveValue> directives = new LinkedHashMap<>();
        private List<String> includeNonceIn;
        private boolean reportOnly;
        private int reportPercentage;
        private List<String> excludeUrlPrefixes = List.of();

        private Builder() {
            directives.put(Directives.DEFAULT_SRC, DirectiveValue.sources("'self'"));
            directives.put(Directives.UPGRADE_INSECURE_REQUESTS, DirectiveValue.flag(false));
            directives.put(Directives.BLOCK_ALL_MIXED_CONTENT, DirectiveValue.flag(false));
        }

        /**
         * Sets a directive. Accepts anything {@link DirectiveValue#of(Object)}
         * accepts; {@code null} removes the directive. A directive already
         * present keeps its position.
         */
        public Builder directive(String name, Object value) {
            DirectiveValue normalized = DirectiveValue.of(value);
            if (normalized == null) {
                directives.remove(name);
            } else {
                directives.put(name, normalized);
            }
            return this;
        }

        /** Removes every directive, including the defaults. */
        public Builder clearDirectives() {
            directives.clear();
            return this;
        }

        public Builder includeNonceIn(List<String> includeNonceIn) {
            this.includeNonceIn = includeNonceIn != null ? new ArrayList<>(includeNonceIn) : null;
            return this;
        }

        public Builder includeNonceIn(String... directiveNames) {
            return includeNonceIn(List.of(directiveNames));
        }

        public Builder reportOnly(boolean reportOnly) {
            this.reportOnly = reportOnly;
            return this;
        }

        public Builder reportPercentage(int reportPercentage) {
            this.reportPercentage = reportPercentage;
            return this;
        }

        public Builder excludeUrlPrefixes(List<String> excludeUrlPrefixes) {
            this.excludeUrlPrefixes = excludeUrlPrefixes != null ? new ArrayList<>(excludeUrlPrefixes) : List.of();
            return this;
        }

        public PolicyConfig build() {
            return new PolicyConfig(directives, includeNonceIn, reportOnly, reportPercentage, excludeUrlPrefixes);
        }
    }
}
