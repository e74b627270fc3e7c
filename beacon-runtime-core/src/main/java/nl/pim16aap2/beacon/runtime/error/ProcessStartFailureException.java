package nl.pim16aap2.beacon.runtime.error;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a spawned client process exits inside the start grace window.
 */
@Getter
@Accessors(fluent = true)
public class ProcessStartFailureException extends LauncherException
{
    private final int exitCode;

    /**
     * The last lines the process wrote before it exited.
     */
    private final String outputTail;

    public ProcessStartFailureException(int exitCode, String outputTail)
    {
        super("Client process exited during startup with code %d.".formatted(exitCode));
        this.exitCode = exitCode;
        this.outputTail = outputTail;
    }
}
