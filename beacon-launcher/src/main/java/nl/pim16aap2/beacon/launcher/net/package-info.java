/**
 * Shared HTTP plumbing and the retry policy used by every network call site.
 */
@NullMarked
package nl.pim16aap2.beacon.launcher.net;

import org.jspecify.annotations.NullMarked;
