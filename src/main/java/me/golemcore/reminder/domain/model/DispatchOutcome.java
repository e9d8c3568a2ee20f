package me.golemcore.reminder.domain.model;

/**
 * Result of presenting a due reminder to the user.
 */
public enum DispatchOutcome {

    /** At least one sink presented the reminder. */
    DELIVERED,

    /** Skipped because the same reminder was presented inside the dedup window. */
    SUPPRESSED,

    /** No sink could present the reminder. */
    FAILED
}
