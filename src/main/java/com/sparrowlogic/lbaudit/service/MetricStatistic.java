package com.sparrowlogic.lbaudit.service;

import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

public enum MetricStatistic {
    SUM(Statistic.SUM),
    AVERAGE(Statistic.AVERAGE);

    private final Statistic statistic;

    MetricStatistic(Statistic statistic) {
        this.statistic = statistic;
    }

    Statistic toSdk() {
        return statistic;
    }

    double valueOf(Datapoint datapoint) {
        var value = this == SUM ? datapoint.sum() : datapoint.average();
        return value != null ? value : 0.0;
    }
}
