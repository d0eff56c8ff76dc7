package com.company.placeholder.exception;

public class InvalidCronException extends RuntimeException {
    public InvalidCronException(String cronExpression, String reason) {
        super("Invalid cron expression '" + cronExpression + "': " + reason);
    }

    public InvalidCronException(String cronExpression, String reason, Throwable cause) {
        super("Invalid cron expression '" + cronExpression + "': " + reason, cause);
    }
}
