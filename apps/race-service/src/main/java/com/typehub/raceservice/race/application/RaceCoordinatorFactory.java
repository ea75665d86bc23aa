package com.typehub.raceservice.race.application;

import com.typehub.raceservice.clock.RaceClock;
import com.typehub.raceservice.clock.RaceTimer;
import com.typehub.raceservice.race.domain.bot.BotRunner;
import com.typehub.raceservice.race.domain.channel.RaceChannel;
import com.typehub.raceservice.race.domain.model.PlayerState;
import com.typehub.raceservice.race.domain.model.RaceState;
import com.typehub.raceservice.race.domain.repository.RaceResultRepository;
import com.typehub.raceservice.race.domain.rule.RaceStateMachine;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

/**
 * 为一场已开赛的比赛创建协调器：真人对战每个参赛者一个，人机对战只为真人创建一个。
 */
@Component
@RequiredArgsConstructor
public class RaceCoordinatorFactory {

    private final RaceStateMachine machine;
    private final RaceChannel channel;
    private final RaceClock clock;
    private final RaceTimer timer;
    private final RaceResultRepository results;

    @Value("${race.publish.throttle-ms:200}")
    private long publishThrottleMs;

    @Value("${race.bot.tick-ms:50}")
    private long botTickMs;

    public List<RaceCoordinator> create(RaceState active, RaceCoordinatorListener listener) {
        RaceCoordinator.Settings settings = new RaceCoordinator.Settings(publishThrottleMs, botTickMs);
        List<RaceCoordinator> out = new ArrayList<>(2);
        PlayerState opponent = active.getOpponent();
        if (active.isBotRace() && opponent != null && opponent.getBotLevel() != null) {
            BotRunner bot = new BotRunner(opponent.getBotLevel().profile(), active.getExpectedText(),
                    new SecureRandom(), botTickMs);
            out.add(new RaceCoordinator(active.getHostId(), machine, null, clock, timer, results,
                    listener, bot, settings));
            return out;
        }
        out.add(new RaceCoordinator(active.getHostId(), machine, channel, clock, timer, results,
                listener, null, settings));
        if (opponent != null) {
            out.add(new RaceCoordinator(opponent.getId(), machine, channel, clock, timer, results,
                    listener, null, settings));
        }
        return out;
    }
}
