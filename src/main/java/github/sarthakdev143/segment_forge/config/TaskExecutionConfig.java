package github.sarthakdev143.segment_forge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for segment loops and segment retries.
 * <p>
 * Each job runs on its own thread, so there is no queue: a task that finds every thread busy is
 * rejected and the caller reports it, instead of sitting behind long-running jobs as if started.
 */
@Configuration
public class TaskExecutionConfig {

    public static final String SEGMENT_TASK_EXECUTOR = "segmentTaskExecutor";

    @Bean(SEGMENT_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor segmentTaskExecutor(SegmentForgeProperties properties) {
        int maxConcurrentTasks = properties.execution().maxConcurrentTasks();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentTasks);
        executor.setMaxPoolSize(maxConcurrentTasks);
        executor.setQueueCapacity(0);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("segment-forge-");
        return executor;
    }
}
