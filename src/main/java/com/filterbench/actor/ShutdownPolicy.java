package com.filterbench.actor;

/**
 * What an actor does with tasks still waiting in its inbox when it is asked to
 * stop.
 */
public enum ShutdownPolicy {
    /** Process everything queued before the stop message, then exit. */
    DRAIN,
    /** Drop queued-but-unstarted tasks; only the task in flight completes. */
    DISCARD
}
