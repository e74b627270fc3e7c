package nl.pim16aap2.beacon.launcher.net;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.TransientNetworkException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Retries calls that fail with a {@link TransientNetworkException}.
 * <p>
 * Any other {@link LauncherException} is considered terminal and is rethrown immediately.
 */
@Log
@Getter
@ToString(onlyExplicitlyIncluded = true)
@Accessors(fluent = true)
public final class RetryPolicy
{
    /**
     * The number of attempts of a single network call.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * The step of the linear backoff between attempts of a single network call.
     */
    public static final Duration DEFAULT_BACKOFF_STEP = Duration.ofSeconds(1);

    /**
     * The number of attempts of a full provisioning run.
     */
    public static final int PROVISIONING_MAX_ATTEMPTS = 3;

    /**
     * The fixed delay between attempts of a full provisioning run.
     */
    public static final Duration PROVISIONING_DELAY = Duration.ofSeconds(3);

    @ToString.Include
    private final int maxAttempts;

    /**
     * Maps the number of the attempt that just failed (starting at 1) to the delay before the next attempt.
     */
    private final IntFunction<Duration> backoff;

    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, IntFunction<Duration> backoff, Sleeper sleeper)
    {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts + ".");
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff may not be null.");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper may not be null.");
    }

    /**
     * Creates a policy that waits {@code attempt * step} after each failed attempt.
     */
    public static RetryPolicy linear(int maxAttempts, Duration step)
    {
        return new RetryPolicy(maxAttempts, attempt -> step.multipliedBy(attempt), Sleeper.SYSTEM);
    }

    /**
     * Creates a policy that waits the same delay after each failed attempt.
     */
    public static RetryPolicy fixed(int maxAttempts, Duration delay)
    {
        return new RetryPolicy(maxAttempts, attempt -> delay, Sleeper.SYSTEM);
    }

    public static RetryPolicy defaultNetworkPolicy()
    {
        return linear(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_STEP);
    }

    public static RetryPolicy defaultProvisioningPolicy()
    {
        return fixed(PROVISIONING_MAX_ATTEMPTS, PROVISIONING_DELAY);
    }

    public RetryPolicy withSleeper(Sleeper newSleeper)
    {
        return new RetryPolicy(maxAttempts, backoff, newSleeper);
    }

    /**
     * Runs a call, retrying it while it fails with a {@link TransientNetworkException}.
     *
     * @param description
     *     What the call does. This is used for logging purposes only.
     * @param call
     *     The call to run.
     * @param <T>
     *     The result type.
     * @return the result of the first successful attempt.
     *
     * @throws LauncherException
     *     The terminal failure, or the last transient failure once all attempts are exhausted.
     */
    public <T> T execute(String description, RetryableCall<T> call)
        throws LauncherException
    {
        int attempt = 1;
        while (true)
        {
            try
            {
                return call.call();
            }
            catch (TransientNetworkException exception)
            {
                if (attempt >= maxAttempts)
                {
                    log.warning(() -> "Giving up on %s after %d attempt(s): %s"
                        .formatted(description, maxAttempts, exception.getMessage()));
                    throw exception;
                }

                final Duration delay = backoff.apply(attempt);
                final int failedAttempt = attempt;
                log.fine(() -> "Attempt %d/%d of %s failed (%s), retrying in %d ms."
                    .formatted(failedAttempt, maxAttempts, description, exception.getMessage(), delay.toMillis()));
                pause(description, delay);
                ++attempt;
            }
        }
    }

    private void pause(String description, Duration delay)
        throws LauncherException
    {
        try
        {
            sleeper.sleep(delay);
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            throw new LauncherException("Interrupted while waiting to retry " + description + ".", exception);
        }
    }

    /**
     * A call that may be retried.
     *
     * @param <T>
     *     The result type.
     */
    @FunctionalInterface
    public interface RetryableCall<T>
    {
        T call()
            throws LauncherException;
    }
}
