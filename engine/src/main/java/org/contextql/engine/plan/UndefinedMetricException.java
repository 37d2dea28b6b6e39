package org.contextql.engine.plan;

public class UndefinedMetricException extends CompileException {

    private final String metricId;

    public UndefinedMetricException(String metricId) {
        super("Metric '" + metricId + "' is not defined in this context");
        this.metricId = metricId;
    }

    public String getMetricId() {
        return metricId;
    }
}
