package nl.pim16aap2.beacon.runtime.error;

import lombok.Getter;
import lombok.experimental.Accessors;
import nl.pim16aap2.beacon.runtime.AuthState;

/**
 * Thrown when a hop of the authorization chain fails.
 */
@Getter
@Accessors(fluent = true)
public class AuthenticationException extends LauncherException
{
    /**
     * The last state the chain reached before the failing hop.
     */
    private final AuthState reachedState;

    public AuthenticationException(AuthState reachedState, String message)
    {
        super(message);
        this.reachedState = reachedState;
    }

    public AuthenticationException(AuthState reachedState, String message, Throwable cause)
    {
        super(message, cause);
        this.reachedState = reachedState;
    }
}
