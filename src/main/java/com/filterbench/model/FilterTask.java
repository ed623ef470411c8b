package com.filterbench.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * One unit of work: apply a filter to one image and write the output into a
 * folder.
 *
 * Paths are kept as strings so a task can be sent to a worker process as a
 * plain JSON value. The method tag only ends up in the output filename.
 */
public final class FilterTask {

    private final String sourcePath;
    private final FilterType filter;
    private final String outputDir;
    private final String methodTag;

    @JsonCreator
    public FilterTask(@JsonProperty("sourcePath") String sourcePath,
            @JsonProperty("filter") FilterType filter,
            @JsonProperty("outputDir") String outputDir,
            @JsonProperty("methodTag") String methodTag) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.methodTag = Objects.requireNonNull(methodTag, "methodTag");
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public FilterType getFilter() {
        return filter;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public String getMethodTag() {
        return methodTag;
    }

    @JsonIgnore
    public Path getSource() {
        return Paths.get(sourcePath);
    }

    /**
     * File name of the source image, without its directory. Works on the raw
     * string, so it never fails, even for paths the file system rejects.
     */
    @JsonIgnore
    public String getSourceFileName() {
        int slash = Math.max(sourcePath.lastIndexOf('/'), sourcePath.lastIndexOf('\\'));
        String fileName = sourcePath.substring(slash + 1);
        return fileName.isEmpty() ? sourcePath : fileName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FilterTask))
            return false;
        FilterTask other = (FilterTask) o;
        return sourcePath.equals(other.sourcePath)
                && filter == other.filter
                && outputDir.equals(other.outputDir)
                && methodTag.equals(other.methodTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourcePath, filter, outputDir, methodTag);
    }

    @Override
    public String toString() {
        return "FilterTask{" + sourcePath + ", " + filter + ", " + methodTag + "}";
    }
}
