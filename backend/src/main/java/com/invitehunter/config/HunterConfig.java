package com.invitehunter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.invitehunter.hunt.extract.ConfidenceScorer;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.source.DefaultSourceCatalog;
import com.invitehunter.hunt.source.SourceRegistry;
import com.invitehunter.hunt.state.HunterStateStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HunterConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("hunter-http");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public HunterStateStore hunterStateStore(HunterProperties properties) {
        return new HunterStateStore(properties.getMaxCandidates(), properties.getMaxLogEntries());
    }

    @Bean
    public ConfidenceScorer confidenceScorer(HunterProperties properties) {
        return new ConfidenceScorer(properties.getBrandTerm());
    }

    @Bean
    public SourceRegistry sourceRegistry(
        HunterProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        HunterStateStore stateStore
    ) {
        return new SourceRegistry(DefaultSourceCatalog.build(properties, httpClient, objectMapper), stateStore);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
