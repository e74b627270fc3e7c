/**
 * Turns runtime and loader descriptors into one deduplicated version profile.
 */
@NullMarked
package nl.pim16aap2.beacon.launcher.resolver;

import org.jspecify.annotations.NullMarked;
