package com.browsermcp.server.lifecycle;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the bridge lifecycle and the edges allowed between them.
 */
public enum LifecycleState {

    INITIALIZING,
    CREATING_SERVER,
    RETRYING_SERVER_CREATION,
    CONNECTING,
    RETRYING_CONNECTION,
    CONNECTED,
    RECONNECTING,
    RESTARTING,
    SHUTTING_DOWN,
    SHUTDOWN,
    FAILED;

    public Set<LifecycleState> successors() {
        return switch (this) {
            case INITIALIZING -> EnumSet.of(CREATING_SERVER);
            case CREATING_SERVER -> EnumSet.of(CONNECTING, RETRYING_SERVER_CREATION, FAILED);
            case RETRYING_SERVER_CREATION -> EnumSet.of(CREATING_SERVER);
            case CONNECTING -> EnumSet.of(CONNECTED, RETRYING_CONNECTION, FAILED);
            case RETRYING_CONNECTION -> EnumSet.of(CONNECTING, RESTARTING);
            case CONNECTED -> EnumSet.of(RECONNECTING, SHUTTING_DOWN);
            case RECONNECTING, RESTARTING -> EnumSet.of(CREATING_SERVER);
            case SHUTTING_DOWN -> EnumSet.of(SHUTDOWN);
            case SHUTDOWN, FAILED -> EnumSet.noneOf(LifecycleState.class);
        };
    }

    public boolean canTransitionTo(LifecycleState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == SHUTDOWN || this == FAILED;
    }
}
