package com.typehub.raceservice.clock;

import com.typehub.raceservice.clock.scheduler.CountdownScheduler;
import com.typehub.raceservice.clock.scheduler.CountdownSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 计时相关 Bean 的装配：开赛倒计时引擎、比赛内定时器。
 *
 * 说明：
 *  - 倒计时线程池由 {@link ClockSchedulerConfig} 提供；
 *  - 比赛内定时器（节流补发 / 时长到期 / 机器人 tick）使用独立的 raceScheduler，
 *    避免 50ms 一次的机器人 tick 挤占倒计时线程。
 */
@Configuration
public class ClockAutoConfig {

    /**
     * 注册开赛倒计时调度器。
     */
    @Bean
    public CountdownScheduler countdownScheduler(RedisTemplate<String, Object> redisTemplate,
                                                 @Qualifier("countdownExecutor") ScheduledThreadPoolExecutor countdownExecutor,
                                                 RaceClock raceClock) {
        return new CountdownSchedulerImpl(redisTemplate, countdownExecutor, raceClock);
    }

    /**
     * 比赛内定时器。
     */
    @Bean
    public RaceTimer raceTimer(@Qualifier("raceScheduler") ScheduledExecutorService raceScheduler) {
        return new ScheduledRaceTimer(raceScheduler);
    }
}
