package com.surveyflow.runtime.expression;

public class ExpressionParseException extends RuntimeException {
    public ExpressionParseException(String message, int position) {
        super(message + " at position " + position);
    }
}
