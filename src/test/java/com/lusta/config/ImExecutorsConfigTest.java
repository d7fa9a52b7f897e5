package com.lusta.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

class ImExecutorsConfigTest {

    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner().withUserConfiguration(ImExecutorsConfig.class);

    @Test
    void dbExecutor_defaults() {
        contextRunner.run(context -> {
            ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) context.getBean("imDbExecutor", Executor.class);
            assertThat(executor.getCorePoolSize()).isEqualTo(8);
            assertThat(executor.getMaxPoolSize()).isEqualTo(32);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("im-db-");
        });
    }

    @Test
    void dbExecutor_maxNeverBelowCore() {
        contextRunner
                .withPropertyValues("im.executors.db.core-pool-size=4", "im.executors.db.max-pool-size=2")
                .run(context -> {
                    ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) context.getBean("imDbExecutor", Executor.class);
                    assertThat(executor.getCorePoolSize()).isEqualTo(4);
                    assertThat(executor.getMaxPoolSize()).isEqualTo(4);
                });
    }
}
