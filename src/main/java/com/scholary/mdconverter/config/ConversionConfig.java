package com.scholary.mdconverter.config;

import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for conversion workers.
 *
 * <p>Enables {@link ConversionProperties} and sets up the bounded worker pool. The queue in front
 * of the workers is unbounded so that submissions never block or get rejected.
 */
@Configuration
@EnableConfigurationProperties(ConversionProperties.class)
public class ConversionConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionConfig.class);

  @Bean(name = "conversionExecutor")
  public Executor conversionExecutor(ConversionProperties properties) {
    int threads = properties.effectiveWorkers();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("conversion-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();

    LOGGER.info(
        "Conversion workers: {} (CPU cores available: {}), timeout={}s",
        threads,
        Runtime.getRuntime().availableProcessors(),
        properties.timeoutSeconds());
    return executor;
  }
}
