package nl.pim16aap2.beacon.runtime.error;

/**
 * Thrown when the stored credentials can no longer be used and the user has to authenticate again.
 */
public class AuthRequiredException extends LauncherException
{
    public AuthRequiredException(String message)
    {
        super(message);
    }

    public AuthRequiredException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
