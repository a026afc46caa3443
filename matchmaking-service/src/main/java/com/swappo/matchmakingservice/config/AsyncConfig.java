package com.swappo.matchmakingservice.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

    private final SideEffectProperties sideEffectProperties;

    /**
     * Runs notification and chat provisioning after a transition commits.
     *
     * Request threads hand the work over and return; a client that disconnects
     * does not interrupt a side effect that is already retrying.
     */
    @Bean("sideEffectExecutor")
    public ThreadPoolTaskExecutor sideEffectExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sideEffectProperties.getCorePoolSize());
        executor.setMaxPoolSize(sideEffectProperties.getMaxPoolSize());
        executor.setQueueCapacity(sideEffectProperties.getQueueCapacity());
        executor.setThreadNamePrefix("side-effect-");
        executor.setRejectedExecutionHandler(new CallerRunsWithLogging());
        // let queued side effects finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Side effect ThreadPool created: core={}, max={}, queue={}",
                sideEffectProperties.getCorePoolSize(),
                sideEffectProperties.getMaxPoolSize(),
                sideEffectProperties.getQueueCapacity());

        return executor;
    }

    /**
     * When the queue is full the request thread runs the side effect itself.
     */
    static class CallerRunsWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Side effect pool exhausted: queue={}, active={}, pool={}. Running on caller thread",
                    executor.getQueue().size(),
                    executor.getActiveCount(),
                    executor.getPoolSize());
            if (!executor.isShutdown()) {
                r.run();
            }
        }
    }
}
