package com.sitecrawler.scheduler;

/**
 * A schedule was created or updated with a cron expression that does not
 * validate.
 */
public class InvalidCronExpressionException extends IllegalArgumentException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String error) {
        super("Invalid cron expression: " + error);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
