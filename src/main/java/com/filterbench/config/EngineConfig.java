package com.filterbench.config;

import com.filterbench.filter.FilterTransforms;
import com.filterbench.service.ImageProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the per-task image operation. {@link ImageProcessor} is a plain class
 * because worker processes build it without a Spring context.
 */
@Configuration
public class EngineConfig {

    @Bean
    public FilterTransforms filterTransforms() {
        return FilterTransforms.defaults();
    }

    @Bean
    public ImageProcessor imageProcessor(FilterTransforms filterTransforms, AppConfig appConfig) {
        return new ImageProcessor(filterTransforms, appConfig.getMinTaskLatencyMs());
    }
}
