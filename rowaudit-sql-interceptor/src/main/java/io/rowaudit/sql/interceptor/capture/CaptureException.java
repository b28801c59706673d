package io.rowaudit.sql.interceptor.capture;

/**
 * A capture strategy cannot handle the statement. Thrown before the statement runs, so the caller
 * can still choose another strategy.
 */
public class CaptureException extends Exception {

    public CaptureException(String message) {
        super(message);
    }
}
