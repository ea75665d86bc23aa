package com.typehub.raceservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 公用 Redis 工具类：
 * - 封装仓储用到的 String/Hash/List/Key 操作
 * - 仅提供“原语级”方法；业务键名放在 Repo 层组织
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;

    // -------------- String --------------
    /**
     * 写入键值（仅当不存在时，SETNX）
     * @return true 表示写入成功，false 表示键已存在
     */
    public boolean setNx(String key, Object val, Duration ttl) {
        Boolean ok = redis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }
    /**
     * 获取键值并转换为指定类型；类型不符时返回 null
     */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    // -------------- Hash --------------
    /**
     * 批量写入 Hash
     */
    public boolean hSetAll(String key, Map<String, ?> map) {
        redis.opsForHash().putAll(key, map);
        return true;
    }
    /**
     * 获取整个 Hash（转为 Map<String,Object>）
     */
    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    // -------------- List --------------
    /**
     * 头部插入并裁剪到最多 maxSize 条
     */
    public void lPushCapped(String key, Object val, int maxSize) {
        redis.opsForList().leftPush(key, val);
        redis.opsForList().trim(key, 0, maxSize - 1L);
    }
    /**
     * 读取 [0, count) 范围的元素，只保留指定类型
     */
    public <T> List<T> lRange(String key, int count, Class<T> type) {
        List<Object> raw = redis.opsForList().range(key, 0, count - 1L);
        List<T> out = new ArrayList<>();
        if (raw == null) return out;
        for (Object o : raw) {
            if (type.isInstance(o)) out.add(type.cast(o));
        }
        return out;
    }

    // -------------- Key --------------
    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }
}
