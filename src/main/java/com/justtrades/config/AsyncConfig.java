package com.justtrades.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools used by the engine.
 *
 * <ul>
 *   <li>{@code positionLoopExecutor} - drains the per-position serial queues</li>
 *   <li>{@code brokerIoExecutor} - off-loop broker queries (confirmation polls, drift audits)</li>
 *   <li>{@code killSwitchExecutor} - parallel cancel/flatten calls; sized so an activation never queues</li>
 *   <li>{@code engineScheduler} - confirmation poll timers and deadlines</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private final EngineConfig engineConfig;

    public AsyncConfig(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
    }

    @Bean("positionLoopExecutor")
    public ThreadPoolTaskExecutor positionLoopExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(engineConfig.getLoopThreads());
        executor.setMaxPoolSize(engineConfig.getLoopThreads());
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("position-loop-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean("brokerIoExecutor")
    public ThreadPoolTaskExecutor brokerIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("broker-io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        return executor;
    }

    @Bean("killSwitchExecutor")
    public ThreadPoolTaskExecutor killSwitchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("kill-switch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        return executor;
    }

    @Bean("engineScheduler")
    public ThreadPoolTaskScheduler engineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("engine-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Override
    public Executor getAsyncExecutor() {
        return brokerIoExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
