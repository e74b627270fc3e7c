package nl.pim16aap2.beacon.runtime.error;

/**
 * Base class for all checked failures raised by the launcher.
 */
public class LauncherException extends Exception
{
    public LauncherException(String message)
    {
        super(message);
    }

    public LauncherException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
