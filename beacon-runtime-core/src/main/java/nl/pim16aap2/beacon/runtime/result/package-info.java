/**
 * Result objects returned by the operations the launcher exposes to its callers.
 */
@NullMarked
package nl.pim16aap2.beacon.runtime.result;

import org.jspecify.annotations.NullMarked;
