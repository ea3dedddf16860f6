package io.cspbuilder.core.model;

/** Response header names that carry an assembled policy. */
public final class CspHeaders {

    /** Enforced policy. */
    public static final String CONTENT_SECURITY_POLICY = "Content-Security-Policy";

    /** Evaluated and reported, but not enforced. */
    public static final String CONTENT_SECURITY_POLICY_REPORT_ONLY = "Content-Security-Policy-Report-Only";

    private CspHeaders() {
        // constants
    }
}
