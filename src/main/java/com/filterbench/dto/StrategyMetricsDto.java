package com.filterbench.dto;

import java.util.List;

/**
 * Timing history of one strategy with its derived speedup and efficiency.
 * Speedup, efficiency and workers are null until they can be computed.
 */
public class StrategyMetricsDto {

    private String strategy;
    private int samples;
    private double averageSeconds;
    private List<Double> history;
    private Integer workers;
    private Double speedup;
    private Double efficiency;

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public int getSamples() {
        return samples;
    }

    public void setSamples(int samples) {
        this.samples = samples;
    }

    public double getAverageSeconds() {
        return averageSeconds;
    }

    public void setAverageSeconds(double averageSeconds) {
        this.averageSeconds = averageSeconds;
    }

    public List<Double> getHistory() {
        return history;
    }

    public void setHistory(List<Double> history) {
        this.history = history;
    }

    public Integer getWorkers() {
        return workers;
    }

    public void setWorkers(Integer workers) {
        this.workers = workers;
    }

    public Double getSpeedup() {
        return speedup;
    }

    public void setSpeedup(Double speedup) {
        this.speedup = speedup;
    }

    public Double getEfficiency() {
        return efficiency;
    }

    public void setEfficiency(Double efficiency) {
        this.efficiency = efficiency;
    }
}
