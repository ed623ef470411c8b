package com.filterbench.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequential baseline against one or more parallel strategies, timed over the
 * same batch.
 */
public class ComparisonReport {

    private String filter;
    private int imageCount;
    private double sequentialSeconds;
    private List<Row> rows = new ArrayList<>();
    private List<RunReport> runs = new ArrayList<>();

    public static class Row {
        private String strategy;
        private double seconds;
        private int workers;
        private Double speedup;
        private Double efficiency;

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public double getSeconds() {
            return seconds;
        }

        public void setSeconds(double seconds) {
            this.seconds = seconds;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        /** Null when the parallel time was zero. */
        public Double getSpeedup() {
            return speedup;
        }

        public void setSpeedup(Double speedup) {
            this.speedup = speedup;
        }

        /** Percentage of ideal linear scaling; null when speedup is. */
        public Double getEfficiency() {
            return efficiency;
        }

        public void setEfficiency(Double efficiency) {
            this.efficiency = efficiency;
        }
    }

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    public int getImageCount() {
        return imageCount;
    }

    public void setImageCount(int imageCount) {
        this.imageCount = imageCount;
    }

    public double getSequentialSeconds() {
        return sequentialSeconds;
    }

    public void setSequentialSeconds(double sequentialSeconds) {
        this.sequentialSeconds = sequentialSeconds;
    }

    public List<Row> getRows() {
        return rows;
    }

    public void setRows(List<Row> rows) {
        this.rows = rows;
    }

    public List<RunReport> getRuns() {
        return runs;
    }

    public void setRuns(List<RunReport> runs) {
        this.runs = runs;
    }
}
