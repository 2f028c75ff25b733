package com.initialone.jyardify.llm;

import java.util.Locale;

/** Whether a job of N requests fits in what is left of a provider's daily cap. */
public final class QuotaEstimate {
    public final int totalRequests;
    public final long remainingToday;
    public final boolean canCompleteToday;
    /** at the configured requests-per-minute pace; 0 when unthrottled */
    public final double estimatedMinutes;

    QuotaEstimate(int totalRequests, long remainingToday, double estimatedMinutes) {
        this.totalRequests = totalRequests;
        this.remainingToday = remainingToday;
        this.canCompleteToday = totalRequests <= remainingToday;
        this.estimatedMinutes = Math.round(estimatedMinutes * 10) / 10.0;
    }

    public String recommendation() {
        if (canCompleteToday) {
            return String.format(Locale.ROOT, "Job can be completed within daily limits (%d requests, ~%.1f min)",
                    totalRequests, estimatedMinutes);
        }
        return "Job requires " + totalRequests + " requests but only " + remainingToday
                + " remain today. Consider splitting the job or waiting until tomorrow.";
    }
}
