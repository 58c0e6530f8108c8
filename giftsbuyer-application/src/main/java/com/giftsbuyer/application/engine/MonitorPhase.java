package com.giftsbuyer.application.engine;

public enum MonitorPhase {
    /** Polling: no new gifts in the current cycle. */
    IDLE,
    /** Working through a batch of new gifts. */
    PROCESSING
}
