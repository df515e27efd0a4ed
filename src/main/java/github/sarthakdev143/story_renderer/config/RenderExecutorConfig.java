package github.sarthakdev143.story_renderer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Single execution slot for render jobs: jobs run one at a time in submission order.
 */
@Configuration
public class RenderExecutorConfig {

    public static final String RENDER_JOB_EXECUTOR = "renderJobExecutor";

    @Bean(name = RENDER_JOB_EXECUTOR)
    public ThreadPoolTaskExecutor renderJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("render-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
