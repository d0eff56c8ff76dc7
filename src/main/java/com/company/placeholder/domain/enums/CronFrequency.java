package com.company.placeholder.domain.enums;

public enum CronFrequency {
    MINUTELY(0, 0.80),
    HOURLY(0, 0.80),
    DAILY(-1, 0.95),
    WEEKLY(-7, 0.90),
    MONTHLY(-30, 0.85), // approximation, not a calendar month
    YEARLY(-365, 0.85),
    CUSTOM(-1, 0.60);

    private final int dataLagDays;
    private final double confidence;

    CronFrequency(int dataLagDays, double confidence) {
        this.dataLagDays = dataLagDays;
        this.confidence = confidence;
    }

    /**
     * Days between the execution instant and the data period it reports on
     */
    public int getDataLagDays() {
        return dataLagDays;
    }

    public double getConfidence() {
        return confidence;
    }
}
