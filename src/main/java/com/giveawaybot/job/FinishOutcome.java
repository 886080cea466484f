package com.giveawaybot.job;

public enum FinishOutcome {
    /** Giveaway missing or no longer active; nothing done. */
    SKIPPED,
    /** Finished with zero winners. */
    NO_PARTICIPANTS,
    FINISHED,
    /** The finish transaction failed; the giveaway stays active. */
    FAILED
}
