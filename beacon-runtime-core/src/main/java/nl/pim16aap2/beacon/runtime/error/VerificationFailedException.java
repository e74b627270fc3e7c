package nl.pim16aap2.beacon.runtime.error;

/**
 * Thrown when an installed artifact fails a sanity check, such as a size or hash mismatch.
 */
public class VerificationFailedException extends LauncherException
{
    public VerificationFailedException(String message)
    {
        super(message);
    }

    public VerificationFailedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
