package io.cspbuilder.core.engine;

import io.cspbuilder.core.model.DirectiveValue;
import io.cspbuilder.core.model.Directives;
import io.cspbuilder.core.model.PolicyConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a {@code Content-Security-Policy} header value from a base
 * {@link PolicyConfig} and optional per-request overrides.
 *
 * <p>
 * Processing order:
 * <ol>
 * <li>{@code replace}: supersedes the base value of a directive; an absent
 * value removes the directive</li>
 * <li>{@code update}: appends tokens to the result of step 1, creating the
 * directive if needed</li>
 * <li>serialize: flag directives render as their bare name (or not at all),
 * source lists render as space-joined tokens</li>
 * <li>nonce: {@code 'nonce-<value>'} is appended to each nonce target</li>
 * </ol>
 *
 * <p>
 * {@code report-uri} is always emitted last. Directive names are not
 * validated; unknown names pass through. The base configuration and the
 * override maps are never modified, so a single {@link PolicyConfig} may be
 * shared by concurrent requests.
 */
public final class PolicyBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyBuilder.class);

    static final String DIRECTIVE_SEPARATOR = "; ";

    private PolicyBuilder() {
        // utility class
    }

    /**
     * Builds the policy from the base configuration alone.
     *
     * @param config the base configuration, {@link PolicyConfig#defaults()} if
     *               {@code null}
     * @return the policy string
     */
    public static String build(PolicyConfig config) {
        return build(config, null, null, null);
    }

    /**
     * Builds the policy from the base configuration with a per-request nonce.
     *
     * @param config the base configuration, {@link PolicyConfig#defaults()} if
     *               {@code null}
     * @param nonce  the nonce, or {@code null}/empty for none
     * @return the policy string
     */
    public static String build(PolicyConfig config, String nonce) {
        return build(config, null, null, nonce);
    }

    /**
     * Builds the policy string.
     *
     * <p>
     * Override map values are normalized with {@link DirectiveValue#of(Object)}:
     * a {@code Boolean} is a flag, a collection or array is a token list, any
     * other object is a single token, {@code null} is absent.
     *
     * @param config  the base configuration, {@link PolicyConfig#defaults()} if
     *                {@code null}
     * @param update  directive name → tokens to append, may be {@code null}
     * @param replace directive name → value that replaces the base value, may
     *                be {@code null}
     * @param nonce   the nonce, or {@code null}/empty for none
     * @return the policy string, directives separated by {@code "; "}
     */
    public static String build(
            PolicyConfig config, Map<String, ?> update, Map<String, ?> replace, String nonce) {
        PolicyConfig base = config != null ? config : PolicyConfig.defaults();

        Map<String, DirectiveValue> directives = merge(base.directives(), update, replace);

        DirectiveValue reportUri = directives.remove(Directives.REPORT_URI);

        Map<String, String> parts = serialize(directives);
        String reportUriValue = reportUriValue(reportUri);

        boolean withNonce = nonce != null && !nonce.isEmpty();
        if (withNonce) {
            String nonceToken = "'nonce-" + nonce + "'";
            for (String target : base.nonceTargets()) {
                if (Directives.REPORT_URI.equals(target)) {
                    reportUriValue = appendNonce(reportUriValue, nonceToken);
                } else {
                    parts.put(target, appendNonce(parts.get(target), nonceToken));
                }
            }
        }

        StringJoiner policy = new StringJoiner(DIRECTIVE_SEPARATOR);
        parts.forEach((name, value) -> policy.add((name + " " + value).trim()));
        if (reportUriValue != null) {
            policy.add((Directives.REPORT_URI + " " + reportUriValue).trim());
        }

        String result = policy.toString().trim();
        LOG.debug("Built policy: directives={}, nonce={}, length={}", parts.size(), withNonce, result.length());
        return result;
    }

    // --- Private helpers ---

    /**
     * Merges base, replace and update layers into a fresh, insertion-ordered
     * map. Base names come first, then names only present in {@code replace},
     * then names only present in {@code update}.
     */
    private static Map<String, DirectiveValue> merge(
            Map<String, DirectiveValue> base, Map<String, ?> update, Map<String, ?> replace) {
        List<String> names = new ArrayList<>(base.keySet());
        if (replace != null) {
            for (String name : replace.keySet()) {
                if (!base.containsKey(name)) {
                    names.add(name);
                }
            }
        }

        Map<String, DirectiveValue> merged = new LinkedHashMap<>();
        for (String name : names) {
            Object value = replace != null && replace.containsKey(name) ? replace.get(name) : base.get(name);
            DirectiveValue normalized = DirectiveValue.of(value);
            if (normalized != null) {
                merged.put(name, normalized);
            }
        }

        if (update != null) {
            update.forEach((name, value) -> {
                DirectiveValue addition = DirectiveValue.of(value);
                if (addition == null) {
                    return;
                }
                DirectiveValue existing = merged.get(name);
                if (existing == null) {
                    merged.put(name, addition);
                } else {
                    if (existing instanceof DirectiveValue.Sources && addition instanceof DirectiveValue.Flag) {
                        LOG.debug("Ignoring flag update for source directive: {}", name);
                    }
                    merged.put(name, existing.append(addition));
                }
            });
        }
        return merged;
    }

    /**
     * Serializes every directive to its value text. Disabled flags are
     * dropped; enabled flags and empty source lists map to an empty value.
     */
    private static Map<String, String> serialize(Map<String, DirectiveValue> directives) {
        Map<String, String> parts = new LinkedHashMap<>();
        directives.forEach((name, value) -> {
            if (value instanceof DirectiveValue.Flag flag) {
                if (flag.enabled()) {
                    parts.put(name, "");
                }
            } else if (value instanceof DirectiveValue.Sources sources) {
                parts.put(name, String.join(" ", sources.tokens()));
            }
        });
        return parts;
    }

    /** Returns the space-joined report URIs, or {@code null} if there are none. */
    private static String reportUriValue(DirectiveValue reportUri) {
        if (reportUri instanceof DirectiveValue.Sources uris && !uris.isEmpty()) {
            return String.join(" ", uris.tokens());
        }
        if (reportUri instanceof DirectiveValue.Flag) {
            LOG.debug("Ignoring flag value for {}", Directives.REPORT_URI);
        }
        return null;
    }

    /** Appends the nonce token to an already serialized value, then trims. */
    private static String appendNonce(String value, String nonceToken) {
        String existing = value != null ? value : "";
        return (existing + " " + nonceToken).trim();
    }
}
