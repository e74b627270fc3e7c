package nl.pim16aap2.beacon.launcher.process;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Keeps the last lines a process printed.
 */
final class OutputTail
{
    private final int capacity;
    private final Deque<String> lines;

    OutputTail(int capacity)
    {
        if (capacity < 1)
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity + ".");
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(capacity);
    }

    synchronized void add(String line)
    {
        if (lines.size() == capacity)
            lines.removeFirst();
        lines.addLast(line);
    }

    synchronized String text()
    {
        return String.join(System.lineSeparator(), lines);
    }
}
