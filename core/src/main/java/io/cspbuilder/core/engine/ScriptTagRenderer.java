package io.cspbuilder.core.engine;

import io.cspbuilder.core.model.ScriptAttribute;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders an HTML {@code <script>} tag with attributes in the fixed
 * {@link ScriptAttribute} order.
 *
 * <p>
 * Attribute values may be strings, booleans, numbers or {@code null}. A value
 * counts as set ("truthy") when it is a non-empty string, {@code true}, a
 * non-zero number or any other non-null object. Keys that are not a
 * {@link ScriptAttribute} name are ignored.
 *
 * <p>
 * Inline content is dropped when {@code src} is set. Content that is already
 * wrapped in a {@code <script>} block is unwrapped first.
 */
public final class ScriptTagRenderer {

    /** Opening tag (minimal) up to the first closing tag, interior captured. */
    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script[\\s\\S]*?>([\\s\\S]+?)</script>");

    private static final String ASYNC_FALSE_TEXT = "False";

    private ScriptTagRenderer() {
        // utility class
    }

    /**
     * Renders an empty script tag carrying the given attributes.
     *
     * @param attrs attribute name → value, may be {@code null}
     * @return the HTML tag
     */
    public static String render(Map<String, ?> attrs) {
        return render(null, attrs);
    }

    /**
     * Renders a script tag.
     *
     * @param content inline script body, optionally already wrapped in a
     *                {@code <script>} block; ignored when {@code src} is set
     * @param attrs   attribute name → value, may be {@code null}
     * @return the HTML tag, e.g. {@code <script nonce="abc">alert(1)</script>}
     */
    public static String render(String content, Map<String, ?> attrs) {
        Map<String, ?> values = attrs != null ? attrs : Map.of();

        StringBuilder attributes = new StringBuilder();
        for (ScriptAttribute attribute : ScriptAttribute.values()) {
            attributes.append(format(attribute, values.get(attribute.attributeName())));
        }

        String body = "";
        if (content != null && !content.isEmpty() && !isTruthy(values.get(ScriptAttribute.SRC.attributeName()))) {
            body = unwrapScript(content);
        }

        return ("<script" + attributes.toString().stripTrailing() + ">" + body + "</script>").trim();
    }

    /**
     * Formats a single attribute according to its {@link ScriptAttribute.Rule}.
     *
     * @return the attribute text with a leading space, or an empty string
     */
    static String format(ScriptAttribute attribute, Object value) {
        String name = attribute.attributeName();
        return switch (attribute.rule()) {
            case DEFAULT_STRING -> isTruthy(value) ? " " + name + "=\"" + value + "\"" : "";
            case BARE_BOOLEAN -> isTruthy(value) ? " " + name : "";
            case TRI_STATE_ASYNC -> {
                if (Boolean.FALSE.equals(value) || ASYNC_FALSE_TEXT.equals(value)) {
                    // async may be explicitly disabled with an unquoted false
                    yield " " + name + "=false";
                }
                yield isTruthy(value) ? " " + name : "";
            }
        };
    }

    /** Extracts the interior of a {@code <script>} block, or returns the text unchanged. */
    static String unwrapScript(String text) {
        Matcher matcher = SCRIPT_BLOCK.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).strip();
        }
        return text;
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return true;
    }
}
