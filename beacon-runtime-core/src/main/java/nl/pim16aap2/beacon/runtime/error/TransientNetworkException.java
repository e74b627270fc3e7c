package nl.pim16aap2.beacon.runtime.error;

/**
 * A network failure that may succeed when retried, such as a timeout, a reset connection or a server error status.
 */
public class TransientNetworkException extends LauncherException
{
    public TransientNetworkException(String message)
    {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
