package org.example.ednascan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Random;

@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    /**
     * One task per sample. {@code pipeline.workers} caps how many samples convert at once;
     * the rest wait in the queue with status {@code uploaded}.
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(@Value("${pipeline.workers:4}") int workers,
                                                   @Value("${pipeline.shutdown-await-seconds:60}") int awaitSeconds) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("sample-pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitSeconds);
        return executor;
    }

    @Bean(name = "matcherRandom")
    public Random matcherRandom(@Value("${pipeline.matcher.seed:}") String seed) {
        if (seed == null || seed.isBlank()) {
            return new Random();
        }
        log.info("Species matcher uses fixed seed {}", seed);
        return new Random(Long.parseLong(seed.trim()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
