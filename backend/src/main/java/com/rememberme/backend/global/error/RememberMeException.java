package com.rememberme.backend.global.error;

/**
 * Root of the fatal error hierarchy. Expected protocol outcomes (bad cookie, unknown login,
 * token mismatch) are results, never subclasses of this type.
 */
public abstract class RememberMeException extends RuntimeException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:rememberme:";

    private final String code;
    private final String type;

    protected RememberMeException(String code, String detail) {
        this(code, detail, null);
    }

    protected RememberMeException(String code, String detail, Throwable cause) {
        super((detail != null && !detail.isBlank()) ? detail : code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("RememberMeException code must not be blank");
        }
        this.code = code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public String getCode() {
        return code;
    }

    public String getProblemType() {
        return type;
    }
}
