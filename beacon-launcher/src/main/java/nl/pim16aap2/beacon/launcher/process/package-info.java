/**
 * Supervision of the spawned client process.
 */
@NullMarked
package nl.pim16aap2.beacon.launcher.process;

import org.jspecify.annotations.NullMarked;
