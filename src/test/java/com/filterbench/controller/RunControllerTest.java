package com.filterbench.controller;

import com.filterbench.dto.RunReport;
import com.filterbench.dto.RunRequest;
import com.filterbench.dto.RunStatusDto;
import com.filterbench.service.ProcessingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RunController.class)
class RunControllerTest {

    private static final String BODY = "{\"paths\":[\"/photos\"],\"filter\":\"Blur\",\"strategy\":\"ThreadPool\",\"workers\":4}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProcessingService processingService;

    @Test
    void startRunReturnsAccepted() throws Exception {
        mockMvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("STARTED"));

        verify(processingService).submitRun(any(RunRequest.class));
    }

    @Test
    void invalidRequestReturnsBadRequest() throws Exception {
        doThrow(new IllegalArgumentException("Unknown filter: Posterize"))
                .when(processingService).submitRun(any(RunRequest.class));

        mockMvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown filter: Posterize"));
    }

    @Test
    void concurrentRunReturnsConflict() throws Exception {
        doThrow(new IllegalStateException("A run is already in progress"))
                .when(processingService).submitComparison(any(RunRequest.class));

        mockMvc.perform(post("/api/runs/compare").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("ALREADY_RUNNING"));
    }

    @Test
    void statusExposesLiveCounters() throws Exception {
        RunStatusDto dto = new RunStatusDto();
        dto.setRunning(true);
        dto.setStrategy("ActorPool");
        dto.setTotal(10);
        dto.setProcessed(6);
        dto.setErrors(1);
        dto.setGateCapacity(4);
        when(processingService.status()).thenReturn(dto);

        mockMvc.perform(get("/api/runs/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.strategy").value("ActorPool"))
                .andExpect(jsonPath("$.processed").value(6))
                .andExpect(jsonPath("$.errors").value(1));
    }

    @Test
    void lastRunIsEmptyBeforeAnyRun() throws Exception {
        mockMvc.perform(get("/api/runs/last")).andExpect(status().isNoContent());
        mockMvc.perform(get("/api/runs/comparison")).andExpect(status().isNoContent());
    }

    @Test
    void lastRunReturnsReport() throws Exception {
        when(processingService.getLastReport())
                .thenReturn(new RunReport("Sequential", 1.25, 1, 3, 0, List.of()));

        mockMvc.perform(get("/api/runs/last"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("Sequential"))
                .andExpect(jsonPath("$.elapsedSeconds").value(1.25))
                .andExpect(jsonPath("$.processed").value(3));
    }

    @Test
    void progressStreamStartsAsync() throws Exception {
        when(processingService.status()).thenReturn(new RunStatusDto());

        mockMvc.perform(get("/api/runs/progress"))
                .andExpect(request().asyncStarted());
    }
}
