package com.aejis.processor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the processor registry to the host. The host only resolves ids from it; the
 * processors themselves run inside the sandbox image.
 */
@Configuration
public class ProcessorConfig {

    @Bean
    public ProcessorRegistry processorRegistry() {
        return ProcessorRegistry.defaults();
    }
}
