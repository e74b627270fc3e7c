package nl.pim16aap2.beacon.runtime.error;

/**
 * Thrown when a file that should exist after a download or install step is absent.
 */
public class ResourceMissingException extends LauncherException
{
    public ResourceMissingException(String message)
    {
        super(message);
    }
}
