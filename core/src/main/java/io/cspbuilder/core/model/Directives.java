package io.cspbuilder.core.model;

import java.util.List;

/**
 * Names of the policy directives known to this library.
 *
 * <p>
 * The list is informational only. Directive names are an open set: names not
 * listed here pass through policy assembly unchanged.
 */
public final class Directives {

    // Fetch directives
    public static final String CHILD_SRC = "child-src";
    public static final String CONNECT_SRC = "connect-src";
    public static final String DEFAULT_SRC = "default-src";
    public static final String SCRIPT_SRC = "script-src";
    public static final String SCRIPT_SRC_ATTR = "script-src-attr";
    public static final String SCRIPT_SRC_ELEM = "script-src-elem";
    public static final String OBJECT_SRC = "object-src";
    public static final String STYLE_SRC = "style-src";
    public static final String STYLE_SRC_ATTR = "style-src-attr";
    public static final String STYLE_SRC_ELEM = "style-src-elem";
    public static final String FONT_SRC = "font-src";
    public static final String FRAME_SRC = "frame-src";
    public static final String IMG_SRC = "img-src";
    public static final String MANIFEST_SRC = "manifest-src";
    public static final String MEDIA_SRC = "media-src";
    /** Deprecated in browsers, still emitted when configured. */
    public static final String PREFETCH_SRC = "prefetch-src";

    // Document directives
    public static final String BASE_URI = "base-uri";
    /** Deprecated in browsers, still emitted when configured. */
    public static final String PLUGIN_TYPES = "plugin-types";
    public static final String SANDBOX = "sandbox";

    // Navigation directives
    public static final String FORM_ACTION = "form-action";
    public static final String FRAME_ANCESTORS = "frame-ancestors";
    public static final String NAVIGATE_TO = "navigate-to";

    // Reporting directives
    public static final String REPORT_URI = "report-uri";
    public static final String REPORT_TO = "report-to";
    public static final String REQUIRE_SRI_FOR = "require-sri-for";

    // Trusted Types directives
    public static final String REQUIRE_TRUSTED_TYPES_FOR = "require-trusted-types-for";
    public static final String TRUSTED_TYPES = "trusted-types";

    // Other directives
    public static final String WEBRTC = "webrtc";
    public static final String WORKER_SRC = "worker-src";
    public static final String UPGRADE_INSECURE_REQUESTS = "upgrade-insecure-requests";
    /** Deprecated in browsers, still emitted when configured. */
    public static final String BLOCK_ALL_MIXED_CONTENT = "block-all-mixed-content";

    /** Every known directive, in declaration order. */
    public static final List<String> KNOWN = List.of(
            CHILD_SRC,
            CONNECT_SRC,
            DEFAULT_SRC,
            SCRIPT_SRC,
            SCRIPT_SRC_ATTR,
            SCRIPT_SRC_ELEM,
            OBJECT_SRC,
            STYLE_SRC,
            STYLE_SRC_ATTR,
            STYLE_SRC_ELEM,
            FONT_SRC,
            FRAME_SRC,
            IMG_SRC,
            MANIFEST_SRC,
            MEDIA_SRC,
            PREFETCH_SRC,
            BASE_URI,
            PLUGIN_TYPES,
            SANDBOX,
            FORM_ACTION,
            FRAME_ANCESTORS,
            NAVIGATE_TO,
            REPORT_URI,
            REPORT_TO,
            REQUIRE_SRI_FOR,
            REQUIRE_TRUSTED_TYPES_FOR,
            TRUSTED_TYPES,
            WEBRTC,
            WORKER_SRC,
            UPGRADE_INSECURE_REQUESTS,
            BLOCK_ALL_MIXED_CONTENT);

    private Directives() {
        // constants
    }

    /** Returns {@code true} if the name is one of the {@link #KNOWN} directives. */
    public static boolean isKnown(String name) {
        return KNOWN.contains(name);
    }
}
