package com.pipewright.worker;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class WorkerConfig {

    @Bean
    public AgentApiClient agentApiClient(WorkerProperties properties) {
        return new AgentApiClient(properties.getHost(), Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean(WorkerProvider.class)
    public WorkerProvider agentApiWorkerProvider(WorkerProperties properties, AgentApiClient client) {
        return new AgentApiWorkerProvider(properties, client);
    }
}
