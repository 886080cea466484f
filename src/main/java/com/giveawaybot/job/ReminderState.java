package com.giveawaybot.job;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reminder flags of one giveaway. Only {@link GiveawayLifecycleScheduler} mutates it.
 */
public class ReminderState {

    private volatile boolean enabled;
    private final Set<ReminderTier> firedTiers = ConcurrentHashMap.newKeySet();

    ReminderState(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean hasFired(ReminderTier tier) {
        return firedTiers.contains(tier);
    }

    public Set<ReminderTier> getFiredTiers() {
        Set<ReminderTier> copy = EnumSet.noneOf(ReminderTier.class);
        copy.addAll(firedTiers);
        return Collections.unmodifiableSet(copy);
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Marks the tier as fired
     * @return false when reminders are disabled or the tier already fired
     */
    boolean tryClaim(ReminderTier tier) {
        return enabled && firedTiers.add(tier);
    }

    void release(ReminderTier tier) {
        firedTiers.remove(tier);
    }
}
