package com.innstay.booking.lifecycle;

import com.innstay.booking.security.ActorContext;

import java.time.LocalDateTime;

public record LifecycleEvent(LifecycleAction action, ActorContext actor, LocalDateTime occurredAt, String reason) {

    public static LifecycleEvent of(LifecycleAction action, ActorContext actor, LocalDateTime occurredAt) {
        return new LifecycleEvent(action, actor, occurredAt, null);
    }

    public static LifecycleEvent system(LifecycleAction action, LocalDateTime occurredAt) {
        return new LifecycleEvent(action, ActorContext.system(), occurredAt, null);
    }
}
