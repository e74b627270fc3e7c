/**
 * Notifications published on the launcher event channel.
 */
@NullMarked
package nl.pim16aap2.beacon.runtime.event;

import org.jspecify.annotations.NullMarked;
