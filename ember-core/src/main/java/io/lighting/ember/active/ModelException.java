package io.lighting.ember.active;

/**
 * 模型校验失败，{@link #code()} 为机器可读的错误码，例如 {@code user--not-found}。
 */
public class ModelException extends RuntimeException {
    private final String code;

    public ModelException(String code) {
        super(code);
        this.code = code;
    }

    public ModelException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
