package nl.pim16aap2.beacon.runtime;

/**
 * The states of the delegated authorization chain.
 * <p>
 * Each hop of the chain moves the state forward by exactly one step. A failure at any hop leaves the chain in the
 * last state it successfully reached.
 */
public enum AuthState
{
    /**
     * No hop has completed yet.
     */
    NOT_AUTHENTICATED,

    /**
     * The identity provider issued a user token.
     */
    IDENTITY_OK,

    /**
     * The authorization broker exchanged the user token for a service token.
     */
    BROKER_OK,

    /**
     * The game service accepted the service token and returned a game access token and profile.
     */
    GAME_SERVICE_OK;

    /**
     * Gets the state that follows this one.
     *
     * @return the next state.
     *
     * @throws IllegalStateException
     *     If this is the final state.
     */
    public AuthState next()
    {
        final AuthState[] values = values();
        if (ordinal() == values.length - 1)
            throw new IllegalStateException("State " + this + " is the final state.");
        return values[ordinal() + 1];
    }
}
