package com.typehub.raceservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 比赛进行中的调度器：机器人每 50ms 的 tick、进度节流后的补发、比赛时长到期。
 * 与开赛倒计时的线程池分开，防止彼此影响实时性。
 */
@Configuration
public class RaceSchedulerConfig {

    @Value("${scheduler.bot.corePoolSize:2}")
    private int corePoolSize;

	@Bean("raceScheduler")
	public ScheduledExecutorService raceScheduler() {
		int poolSize = Math.max(corePoolSize, Runtime.getRuntime().availableProcessors() / 2);
		ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(poolSize, new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, "race-tick-" + idx.getAndIncrement());
				t.setDaemon(true);
				return t;
			}
		});
		exec.setRemoveOnCancelPolicy(true);
		return exec;
	}
}
