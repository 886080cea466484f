package com.giveawaybot.job;

import java.util.List;

public record TimerStatus(boolean running, int jobsCount, List<ScheduledJobInfo> jobs) {
}
