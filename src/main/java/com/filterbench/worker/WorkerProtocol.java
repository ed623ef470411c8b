package com.filterbench.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;

/**
 * JSON-lines codec spoken between the process-pool strategy and its worker
 * processes: one {@link FilterTask} per line on the worker's stdin, one
 * {@link FilterResult} per line on its stdout.
 */
public class WorkerProtocol {

    private final ObjectMapper mapper = new ObjectMapper();

    public String writeTask(FilterTask task) throws JsonProcessingException {
        return mapper.writeValueAsString(task);
    }

    public FilterTask readTask(String line) throws JsonProcessingException {
        return mapper.readValue(line, FilterTask.class);
    }

    public String writeResult(FilterResult result) throws JsonProcessingException {
        return mapper.writeValueAsString(result);
    }

    public FilterResult readResult(String line) throws JsonProcessingException {
        return mapper.readValue(line, FilterResult.class);
    }
}
