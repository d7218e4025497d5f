package dev.devanks.energy.alerts.exception;

public class InvalidAlertRuleException extends RuntimeException {
    public InvalidAlertRuleException(String message) {
        super(message);
    }

    public InvalidAlertRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
