package nl.pim16aap2.beacon.runtime.event;

import java.net.URI;
import java.time.Duration;

/**
 * Published when the identity provider issued a device code the user has to enter to authenticate.
 *
 * @param userCode
 *     The code to show to the user.
 * @param verificationUri
 *     The page where the user enters the code.
 * @param expiresIn
 *     How long the code stays valid.
 */
public record DeviceCodeEvent(
    String userCode,
    URI verificationUri,
    Duration expiresIn
)
{
}
