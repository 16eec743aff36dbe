package io.lighting.ember.form;

/**
 * Form parameters that contradict each other, e.g. the same key given twice or used both as an array and
 * as a map. Callers should answer with a bad-request response.
 */
public class FormDataException extends IllegalArgumentException {
    private final String key;
    private final String rawKey;

    public FormDataException(String message, String key, String rawKey) {
        super(message);
        this.key = key;
        this.rawKey = rawKey;
    }

    public FormDataException(String message, String key, String rawKey, Throwable cause) {
        super(message, cause);
        this.key = key;
        this.rawKey = rawKey;
    }

    /**
     * Path of the conflicting node, e.g. {@code deep[c]}.
     */
    public String key() {
        return key;
    }

    /**
     * The parameter name being processed when the conflict was found.
     */
    public String rawKey() {
        return rawKey;
    }
}
