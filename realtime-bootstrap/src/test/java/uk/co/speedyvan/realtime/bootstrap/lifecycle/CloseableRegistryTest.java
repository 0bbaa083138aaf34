package uk.co.speedyvan.realtime.bootstrap.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CloseableRegistryTest {

    @Test
    void closesInReverseRegistrationOrder() {
        CloseableRegistry registry = new CloseableRegistry();
        List<String> closed = new ArrayList<>();
        registry.register(() -> closed.add("http"));
        registry.register(() -> closed.add("scheduler"));
        registry.register(() -> closed.add("manager"));

        assertEquals(0, registry.closeAllQuietly());

        assertEquals(List.of("manager", "scheduler", "http"), closed);
        assertEquals(0, registry.size());
    }

    @Test
    void failuresAreCountedAndDoNotStopTheRest() {
        CloseableRegistry registry = new CloseableRegistry();
        List<String> closed = new ArrayList<>();
        registry.register(() -> closed.add("first"));
        registry.register(() -> {
            throw new IllegalStateException("already closed");
        });
        registry.register(() -> closed.add("last"));

        assertEquals(1, registry.closeAllQuietly());
        assertEquals(List.of("last", "first"), closed);
    }

    @Test
    void secondCloseDoesNothing() {
        CloseableRegistry registry = new CloseableRegistry();
        List<String> closed = new ArrayList<>();
        registry.register(() -> closed.add("once"));

        registry.closeAllQuietly();
        registry.closeAllQuietly();

        assertEquals(List.of("once"), closed);
    }
}
