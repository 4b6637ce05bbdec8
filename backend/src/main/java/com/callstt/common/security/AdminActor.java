package com.callstt.common.security;

public record AdminActor(
        String name
) {
}
