package com.filterbench;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FilterBenchApplication {

    private static final Logger log = LoggerFactory.getLogger(FilterBenchApplication.class);

    public static void main(String[] args) {
        // Filters run on worker threads and child JVMs; no display is needed
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(FilterBenchApplication.class, args);
        log.info("==========================================================");
        log.info("  FilterBench is running.");
        log.info("  POST /api/runs or /api/runs/compare to process images,");
        log.info("  GET /api/metrics for timing history and speedup.");
        log.info("==========================================================");
    }
}
