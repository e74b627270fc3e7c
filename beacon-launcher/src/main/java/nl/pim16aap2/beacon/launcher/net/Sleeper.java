package nl.pim16aap2.beacon.launcher.net;

import java.time.Duration;

/**
 * Waits between retry attempts.
 */
@FunctionalInterface
public interface Sleeper
{
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration)
        throws InterruptedException;
}
