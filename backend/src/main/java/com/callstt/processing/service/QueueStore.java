package com.callstt.processing.service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface QueueStore {

    void rightPush(String listKey, String value);

    boolean rightPushUnlessMember(String listKey, String setKey, String member, String value);

    Optional<String> leftPop(String listKey);

    Optional<String> blockingLeftPop(String listKey, Duration timeout);

    List<String> range(String listKey);

    void addMember(String setKey, String member);

    boolean isMember(String setKey, String member);

    // LREM, then SREM and RPUSH only when the LREM removed something
    boolean moveBack(String sourceListKey, String value, String setKey, String member,
                     String targetListKey, String targetValue);
}
