package com.giveawaybot.domain.mailing.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag, checked by the delivery loop before each send
 */
public class StopSignal {

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public void stop() {
        stopped.set(true);
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
