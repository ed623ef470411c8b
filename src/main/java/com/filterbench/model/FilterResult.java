package com.filterbench.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Outcome of executing one {@link FilterTask}: either OK with the written
 * output path, or ERROR with a message describing what went wrong.
 *
 * Error results carry neither an output path nor a filter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FilterResult {

    public enum Status {
        OK, ERROR
    }

    private final Status status;
    private final String original;
    private final String output;
    private final String message;
    private final FilterType filter;
    private final String method;

    @JsonCreator
    FilterResult(@JsonProperty("status") Status status,
            @JsonProperty("original") String original,
            @JsonProperty("output") String output,
            @JsonProperty("message") String message,
            @JsonProperty("filter") FilterType filter,
            @JsonProperty("method") String method) {
        this.status = Objects.requireNonNull(status, "status");
        this.original = original;
        this.output = output;
        this.message = message;
        this.filter = filter;
        this.method = method;
    }

    public static FilterResult ok(FilterTask task, String output, String message) {
        return new FilterResult(Status.OK, task.getSourcePath(), output, message,
                task.getFilter(), task.getMethodTag());
    }

    public static FilterResult error(FilterTask task, String message) {
        return error(task.getSourcePath(), message, task.getMethodTag());
    }

    public static FilterResult error(String original, String message, String method) {
        return new FilterResult(Status.ERROR, original, null, message, null, method);
    }

    public Status getStatus() {
        return status;
    }

    @JsonIgnore
    public boolean isOk() {
        return status == Status.OK;
    }

    public String getOriginal() {
        return original;
    }

    public String getOutput() {
        return output;
    }

    public String getMessage() {
        return message;
    }

    public FilterType getFilter() {
        return filter;
    }

    public String getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FilterResult))
            return false;
        FilterResult other = (FilterResult) o;
        return status == other.status
                && Objects.equals(original, other.original)
                && Objects.equals(output, other.output)
                && Objects.equals(message, other.message)
                && filter == other.filter
                && Objects.equals(method, other.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, original, output, message, filter, method);
    }

    @Override
    public String toString() {
        return status + " " + original + ": " + message;
    }
}
