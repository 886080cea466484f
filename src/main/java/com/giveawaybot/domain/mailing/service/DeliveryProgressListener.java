package com.giveawaybot.domain.mailing.service;

@FunctionalInterface
public interface DeliveryProgressListener {

    void onProgress(int processed, int total, DeliveryStats stats);
}
