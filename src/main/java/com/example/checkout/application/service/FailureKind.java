package com.example.checkout.application.service;

/**
 * How a failed step affects the rest of the checkout.
 */
public enum FailureKind {

    /**
     * Aborts the remaining steps and decides a non-success status.
     */
    FATAL,

    /**
     * Recorded as a warning; the flow continues.
     */
    TOLERABLE,

    /**
     * The request deadline ran out. Handled like {@link #FATAL} from the step it was detected at.
     */
    DEADLINE_EXCEEDED
}
