package uk.co.speedyvan.realtime.bootstrap.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Closes registered resources in reverse registration order.
 */
public final class CloseableRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(CloseableRegistry.class);

    private final Deque<AutoCloseable> stack = new ArrayDeque<>();

    public synchronized <T extends AutoCloseable> T register(T closeable) {
        Objects.requireNonNull(closeable, "closeable");
        stack.push(closeable);
        return closeable;
    }

    public synchronized int size() {
        return stack.size();
    }

    /**
     * @return number of resources whose close() threw
     */
    public synchronized int closeAllQuietly() {
        int failures = 0;
        while (!stack.isEmpty()) {
            AutoCloseable c = stack.pop();
            try {
                c.close();
            } catch (Throwable t) {
                failures++;
                LOGGER.warn("Failed to close {}", c.getClass().getName(), t);
            }
        }
        return failures;
    }
}
