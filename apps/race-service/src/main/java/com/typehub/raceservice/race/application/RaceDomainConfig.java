package com.typehub.raceservice.race.application;

import com.typehub.metrics.learning.AdaptiveLearningEngine;
import com.typehub.metrics.learning.CharacterStatsRepository;
import com.typehub.raceservice.clock.RaceClock;
import com.typehub.raceservice.race.domain.rule.RaceStateMachine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 把纯领域对象（状态机、逐字母学习引擎）注册为 Bean。
 */
@Configuration
public class RaceDomainConfig {

    @Bean
    public RaceStateMachine raceStateMachine(RaceClock raceClock) {
        return new RaceStateMachine(raceClock);
    }

    @Bean
    public AdaptiveLearningEngine adaptiveLearningEngine(CharacterStatsRepository characterStatsRepository) {
        return new AdaptiveLearningEngine(characterStatsRepository);
    }
}
