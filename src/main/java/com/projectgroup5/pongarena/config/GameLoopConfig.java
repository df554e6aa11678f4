package com.projectgroup5.pongarena.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 引擎线程配置：
 * - gameLoopExecutor：每个对局一个固定频率的 tick 任务
 * - resultExecutor：对局 / 锦标赛结果异步写库，不占用 tick 线程
 */
@Configuration
public class GameLoopConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService gameLoopExecutor(GameProperties properties) {
        return Executors.newScheduledThreadPool(
                properties.tickThreads(), new CustomizableThreadFactory("game-loop-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService resultExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("result-writer-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
