package com.spending.fraud.alert;

/**
 * Alert severity levels.
 */
public enum AlertSeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String code;

    AlertSeverity(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * The more severe of the two.
     */
    public AlertSeverity max(AlertSeverity other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
