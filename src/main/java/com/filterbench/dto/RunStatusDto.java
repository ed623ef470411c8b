package com.filterbench.dto;

/**
 * Live counters of the current run, or of the last one when idle.
 */
public class RunStatusDto {

    private boolean running;
    private String strategy;
    private int total;
    private int processed;
    private int errors;
    private int activeExecutions;
    private int gateCapacity;

    public boolean isRunning() {
        return running;
    }

    public void setRunning(boolean running) {
        this.running = running;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public int getProcessed() {
        return processed;
    }

    public void setProcessed(int processed) {
        this.processed = processed;
    }

    public int getErrors() {
        return errors;
    }

    public void setErrors(int errors) {
        this.errors = errors;
    }

    public int getActiveExecutions() {
        return activeExecutions;
    }

    public void setActiveExecutions(int activeExecutions) {
        this.activeExecutions = activeExecutions;
    }

    public int getGateCapacity() {
        return gateCapacity;
    }

    public void setGateCapacity(int gateCapacity) {
        this.gateCapacity = gateCapacity;
    }
}
