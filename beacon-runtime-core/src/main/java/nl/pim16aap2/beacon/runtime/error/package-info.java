@NullMarked
package nl.pim16aap2.beacon.runtime.error;

import org.jspecify.annotations.NullMarked;
