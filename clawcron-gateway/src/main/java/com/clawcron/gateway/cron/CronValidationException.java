package com.clawcron.gateway.cron;

/**
 * Rejected cron job input. The store is left untouched when this is thrown.
 */
public class CronValidationException extends IllegalArgumentException {

    public CronValidationException(String message) {
        super(message);
    }

    public CronValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
