package io.pacer.core.schedule;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that stays where a test puts it.
 */
class TestingClock
        extends Clock
{
    private volatile Instant now;

    TestingClock(Instant now)
    {
        this.now = now;
    }

    void set(Instant now)
    {
        this.now = now;
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
