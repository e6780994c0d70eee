package com.driftwatch.domain;

public record WindowStatus(boolean baselineReady, boolean monitorReady) {

    public static final WindowStatus NOT_READY = new WindowStatus(false, false);
}
