package nl.pim16aap2.beacon.runtime;

/**
 * How far a credential record is into its trust window.
 */
public enum CredentialFreshness
{
    /**
     * Young enough to be used without any network call.
     */
    FRESH,

    /**
     * Old enough that a silent refresh should be attempted before use.
     */
    STALE,

    /**
     * Too old to be trusted at all; the user has to authenticate again.
     */
    EXPIRED
}
