package com.surveyflow.runtime.expression;

public class UnknownReferenceException extends RuntimeException {
    private final String ref;

    public UnknownReferenceException(String ref) {
        super("Unknown reference: " + ref);
        this.ref = ref;
    }

    public String ref() {
        return ref;
    }
}
