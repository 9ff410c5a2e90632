package omni.sync.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the job runner.
 */
@Configuration
public class AsyncConfig {

    /**
     * Runs job handlers so the runner can enforce the per-job timeout. Sized above the lane
     * count because a timed-out handler may keep its thread until it notices the interrupt.
     */
    @Bean(name = "jobHandlerExecutor")
    public ThreadPoolTaskExecutor jobHandlerExecutor(JobProperties jobProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, jobProperties.getConcurrency()));
        executor.setMaxPoolSize(Math.max(1, jobProperties.getConcurrency()) * 2 + 2);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("job-handler-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Lanes of one poll cycle when omni.jobs.concurrency is above 1.
     */
    @Bean(name = "jobLaneExecutor")
    public ThreadPoolTaskExecutor jobLaneExecutor(JobProperties jobProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, jobProperties.getConcurrency()));
        executor.setMaxPoolSize(Math.max(1, jobProperties.getConcurrency()));
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("job-lane-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
