package com.axlabs.neo.vetoshares.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A clock that only moves when told to.
 */
public class TestClock extends Clock {

    private volatile Instant instant;

    public TestClock(long epochSecond) {
        instant = Instant.ofEpochSecond(epochSecond);
    }

    public void fastForward(long seconds) {
        instant = instant.plusSeconds(seconds);
    }

    public void setTime(long epochSecond) {
        instant = Instant.ofEpochSecond(epochSecond);
    }

    public long getTime() {
        return instant.getEpochSecond();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
