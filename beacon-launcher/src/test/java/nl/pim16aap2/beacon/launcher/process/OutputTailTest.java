package nl.pim16aap2.beacon.launcher.process;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputTailTest
{
    @Test
    void add_shouldKeepOnlyLastLines()
    {
        // setup
        final OutputTail tail = new OutputTail(2);

        // execute
        tail.add("one");
        tail.add("two");
        tail.add("three");

        // verify
        assertThat(tail.text()).isEqualTo("two" + System.lineSeparator() + "three");
    }

    @Test
    void constructor_shouldRejectZeroCapacity()
    {
        assertThatThrownBy(() -> new OutputTail(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
