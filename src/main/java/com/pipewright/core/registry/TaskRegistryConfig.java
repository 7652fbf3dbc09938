package com.pipewright.core.registry;

import com.pipewright.core.config.PipelineProperties;
import com.pipewright.worker.WorkerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskRegistryConfig {

    @Bean
    public TaskDefinitionProvider taskDefinitionProvider(PipelineProperties properties) {
        return TaskDefinitions.fromProperties(properties);
    }

    @Bean
    public RunningTaskRegistry runningTaskRegistry(WorkerProperties workerProperties) {
        return new RunningTaskRegistry(workerProperties.getBasePort(), RunningTaskRegistry.DEFAULT_SNAPSHOT);
    }
}
