package io.lighting.ember.form;

public class FormBindingException extends IllegalArgumentException {
    private final Class<?> targetType;

    public FormBindingException(Class<?> targetType, Throwable cause) {
        super("Cannot bind form data to " + targetType.getName() + ": " + cause.getMessage(), cause);
        this.targetType = targetType;
    }

    public Class<?> targetType() {
        return targetType;
    }
}
