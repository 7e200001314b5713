package com.umitunal.cronlite.error;

/**
 * Thrown when a cron expression cannot be parsed.
 */
public class InvalidCronExpressionException extends ValidationException {
    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression: " + expression + ". " + reason);
        this.expression = expression;
    }

    public InvalidCronExpressionException(String expression, Throwable cause) {
        super("Invalid cron expression: " + expression + ". " + cause.getMessage(), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
