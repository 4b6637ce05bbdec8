package com.callstt.processing.adapter;

import com.callstt.processing.service.QueueStore;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Component
public class RedisQueueStore implements QueueStore {

    static final RedisScript<Long> PUSH_UNLESS_MEMBER = new DefaultRedisScript<>("""
            if redis.call('SISMEMBER', KEYS[2], ARGV[1]) == 1 then
              return 0
            end
            redis.call('RPUSH', KEYS[1], ARGV[2])
            return 1
            """, Long.class);

    static final RedisScript<Long> MOVE_BACK = new DefaultRedisScript<>("""
            if redis.call('LREM', KEYS[1], 1, ARGV[1]) == 0 then
              return 0
            end
            redis.call('SREM', KEYS[2], ARGV[2])
            redis.call('RPUSH', KEYS[3], ARGV[3])
            return 1
            """, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisQueueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void rightPush(String listKey, String value) {
        redisTemplate.opsForList().rightPush(listKey, value);
    }

    @Override
    public boolean rightPushUnlessMember(String listKey, String setKey, String member, String value) {
        Long pushed = redisTemplate.execute(PUSH_UNLESS_MEMBER, List.of(listKey, setKey), member, value);
        return pushed != null && pushed == 1L;
    }

    @Override
    public Optional<String> leftPop(String listKey) {
        return Optional.ofNullable(redisTemplate.opsForList().leftPop(listKey));
    }

    @Override
    public Optional<String> blockingLeftPop(String listKey, Duration timeout) {
        return Optional.ofNullable(redisTemplate.opsForList().leftPop(listKey, timeout));
    }

    @Override
    public List<String> range(String listKey) {
        List<String> values = redisTemplate.opsForList().range(listKey, 0, -1);
        return values == null ? List.of() : values;
    }

    @Override
    public void addMember(String setKey, String member) {
        redisTemplate.opsForSet().add(setKey, member);
    }

    @Override
    public boolean isMember(String setKey, String member) {
        return Boolean.TRUE.equals(redisTemplate.opsForSet().isMember(setKey, member));
    }

    @Override
    public boolean moveBack(String sourceListKey, String value, String setKey, String member,
                            String targetListKey, String targetValue) {
        Long moved = redisTemplate.execute(
                MOVE_BACK,
                List.of(sourceListKey, setKey, targetListKey),
                value,
                member,
                targetValue
        );
        return moved != null && moved == 1L;
    }
}
