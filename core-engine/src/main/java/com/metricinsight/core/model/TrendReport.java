package com.metricinsight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Combined trend analysis of one series.
 *
 * @since 1.0.0
 */
public final class TrendReport {

    private final LinearTrend linearTrend;
    private final Seasonality seasonality;
    private final List<ChangePoint> changePoints;
    private final Forecast forecast;

    public TrendReport(LinearTrend linearTrend, Seasonality seasonality,
                       List<ChangePoint> changePoints, Forecast forecast) {
        this.linearTrend = Objects.requireNonNull(linearTrend, "linearTrend must not be null");
        this.seasonality = Objects.requireNonNull(seasonality, "seasonality must not be null");
        this.changePoints = List.copyOf(changePoints);
        this.forecast = Objects.requireNonNull(forecast, "forecast must not be null");
    }

    public LinearTrend getLinearTrend() {
        return linearTrend;
    }

    public Seasonality getSeasonality() {
        return seasonality;
    }

    /** @return change points in timestamp order */
    public List<ChangePoint> getChangePoints() {
        return changePoints;
    }

    public Forecast getForecast() {
        return forecast;
    }

    @Override
    public String toString() {
        return "TrendReport{" +
                "linearTrend=" + linearTrend +
                ", seasonality=" + seasonality +
                ", changePoints=" + changePoints.size() +
                ", forecast=" + forecast +
                '}';
    }
}
