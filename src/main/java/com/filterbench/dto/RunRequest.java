package com.filterbench.dto;

import java.util.List;

/**
 * Request body for starting a run or a comparison.
 *
 * paths may name image files or folders. For a comparison, strategy names
 * the parallel strategy to compare against Sequential, or "ALL".
 */
public class RunRequest {

    private List<String> paths;
    private String filter;
    private String outputDir;
    private String strategy;
    private Integer workers;
    private Integer gateCapacity;

    public RunRequest() {
    }

    public RunRequest(List<String> paths, String filter, String outputDir, String strategy) {
        this.paths = paths;
        this.filter = filter;
        this.outputDir = outputDir;
        this.strategy = strategy;
    }

    public List<String> getPaths() {
        return paths;
    }

    public void setPaths(List<String> paths) {
        this.paths = paths;
    }

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public Integer getWorkers() {
        return workers;
    }

    public void setWorkers(Integer workers) {
        this.workers = workers;
    }

    public Integer getGateCapacity() {
        return gateCapacity;
    }

    public void setGateCapacity(Integer gateCapacity) {
        this.gateCapacity = gateCapacity;
    }
}
