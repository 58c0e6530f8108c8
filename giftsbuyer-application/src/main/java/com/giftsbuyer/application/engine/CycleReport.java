package com.giftsbuyer.application.engine;

import com.giftsbuyer.domain.acquisition.SkipTally;

import java.util.List;

/**
 * Summary of one detection cycle.
 *
 * failedStage is null for a completed cycle, otherwise "connect", "snapshot_load" or "fetch".
 */
public record CycleReport(String failedStage,
                          int catalogSize,
                          List<String> newGiftIds,
                          SkipTally tally) {

    public CycleReport {
        newGiftIds = List.copyOf(newGiftIds);
    }

    static CycleReport failed(String stage) {
        return new CycleReport(stage, 0, List.of(), SkipTally.ZERO);
    }

    public boolean completed() {
        return failedStage == null;
    }
}
