package dev.devanks.energy.alerts.model;

public enum RuleOutcome {
    /** Threshold breached while idle; a notification was dispatched. */
    FIRED,
    /** Threshold breached during cooldown, or another instance armed the rule first. */
    SUPPRESSED,
    BELOW_THRESHOLD,
    NO_DATA,
    /** Fetch, state store or dispatch failed for this rule only. */
    FAILED
}
