package io.tickwork.core.database;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

public class TestingClock
        extends Clock
{
    private volatile Instant now;

    public TestingClock(Instant now)
    {
        this.now = now;
    }

    public void set(Instant now)
    {
        this.now = now;
    }

    public void advance(Duration duration)
    {
        this.now = now.plus(duration);
    }

    @Override
    public ZoneId getZone()
    {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone)
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public Instant instant()
    {
        return now;
    }
}
