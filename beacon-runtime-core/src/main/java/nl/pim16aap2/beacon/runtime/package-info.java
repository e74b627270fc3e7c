/**
 * Value types shared between the launcher components.
 */
@NullMarked
package nl.pim16aap2.beacon.runtime;

import org.jspecify.annotations.NullMarked;
