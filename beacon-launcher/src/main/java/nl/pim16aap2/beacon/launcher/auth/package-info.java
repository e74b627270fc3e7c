/**
 * Acquisition, validation, refresh and persistence of the delegated authorization chain.
 */
@NullMarked
package nl.pim16aap2.beacon.launcher.auth;

import org.jspecify.annotations.NullMarked;
