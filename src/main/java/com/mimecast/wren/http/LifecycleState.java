package com.mimecast.wren.http;

/**
 * Server lifecycle states.
 *
 * <p>Transitions only move forward: STARTING, RUNNING, SHUTTING_DOWN, STOPPED.
 */
public enum LifecycleState {
    STARTING,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
