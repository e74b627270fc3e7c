/**
 * Turns a resolved profile and a credential into a process command line.
 */
@NullMarked
package nl.pim16aap2.beacon.launcher.launch;

import org.jspecify.annotations.NullMarked;
