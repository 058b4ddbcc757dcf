package io.syncmesh.model;

public enum ClockOrder {
    EQUAL,
    BEFORE,
    AFTER,
    CONCURRENT
}
