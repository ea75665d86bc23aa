package com.typehub.raceservice.support;

import com.typehub.raceservice.race.domain.channel.RaceChannel;
import com.typehub.raceservice.race.domain.model.RaceSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 内存版比赛通道。publish 只入队，deliverAll 时才投递给订阅者（包括发送方自己），
 * 避免两个协调器在同一调用栈里互相重入。
 */
public class InMemoryRaceChannel implements RaceChannel {

    private final Map<String, List<Consumer<RaceSnapshot>>> subscribers = new HashMap<>();
    private final Deque<Map.Entry<String, RaceSnapshot>> queue = new ArrayDeque<>();
    private final List<RaceSnapshot> published = new ArrayList<>();

    @Override
    public void publish(String channelKey, RaceSnapshot snapshot) {
        published.add(snapshot);
        queue.add(Map.entry(channelKey, snapshot));
    }

    @Override
    public Subscription subscribe(String channelKey, Consumer<RaceSnapshot> listener) {
        subscribers.computeIfAbsent(channelKey, k -> new ArrayList<>()).add(listener);
        return () -> subscribers.getOrDefault(channelKey, new ArrayList<>()).remove(listener);
    }

    public void deliverAll() {
        while (!queue.isEmpty()) {
            Map.Entry<String, RaceSnapshot> e = queue.poll();
            for (Consumer<RaceSnapshot> l : new ArrayList<>(subscribers.getOrDefault(e.getKey(), List.of()))) {
                l.accept(e.getValue());
            }
        }
    }

    public List<RaceSnapshot> published() {
        return published;
    }

    public RaceSnapshot lastPublished() {
        return published.isEmpty() ? null : published.get(published.size() - 1);
    }

    public int subscriberCount(String channelKey) {
        return subscribers.getOrDefault(channelKey, List.of()).size();
    }
}
