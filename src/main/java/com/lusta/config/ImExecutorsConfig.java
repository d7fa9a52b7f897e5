package com.lusta.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(ImDbExecutorProperties.class)
public class ImExecutorsConfig {

    /**
     * 队列满时直接拒绝（AbortPolicy）：调用方拿到 RejectedExecutionException 后回 server_busy，
     * 不能用 CallerRuns，否则落库会跑到 Netty eventLoop 上。
     */
    @Bean("imDbExecutor")
    @Primary
    public Executor imDbExecutor(ImDbExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("im-db-");
        int core = props == null ? 8 : props.corePoolSizeEffective();
        int max = props == null ? 32 : props.maxPoolSizeEffective();
        if (max < core) {
            max = core;
        }
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(props == null ? 10_000 : props.queueCapacityEffective());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
