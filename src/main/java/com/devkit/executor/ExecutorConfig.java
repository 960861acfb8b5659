package com.devkit.executor;

import com.devkit.config.DevkitProperties;
import com.devkit.core.model.TaskLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;

/**
 * Builds one {@link CommandExecutionStrategy} per entry of {@code devkit.executor.strategies}.
 */
@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Bean(destroyMethod = "close")
    public ExecutorDispatcher executorDispatcher(DevkitProperties properties) {
        var strategies = new ArrayList<ExecutionStrategy>();
        properties.getExecutor().getStrategies().forEach((labelName, config) -> {
            TaskLabel label = TaskLabel.fromString(labelName);
            strategies.add(new CommandExecutionStrategy(label, config.getCommand(), config.getEnvironment()));
        });
        if (strategies.isEmpty()) {
            log.warn("No execution strategies configured; every task will fail until devkit.executor.strategies is set");
        }
        return new ExecutorDispatcher(strategies);
    }
}
