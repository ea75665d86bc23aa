package com.typehub.raceservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 倒计时线程池配置，统一创建开赛倒计时用的 ScheduledThreadPoolExecutor。
 *
 * 功能说明：
 * 1. 从配置文件读取核心线程数（scheduler.clock.corePoolSize）；
 * 2. 线程命名为 countdown-N，便于排查；
 * 3. 守护线程，JVM 退出时不用等它；
 * 4. 启用 setRemoveOnCancelPolicy(true)，清理已取消任务。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.clock.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "countdownExecutor")
    public ScheduledThreadPoolExecutor countdownExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "countdown-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
