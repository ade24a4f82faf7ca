package org.example.dailyreport.ratelimit;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

public final class MutableClock extends Clock {

    private volatile Instant current;

    public MutableClock(Instant initial) {
        this.current = initial;
    }

    @Override
    public ZoneId getZone() {
        return ZoneId.of("UTC");
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return current;
    }

    public void advanceMillis(long millis) {
        current = current.plusMillis(millis);
    }
}
