package uibridge.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNumberedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("worker-");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertEquals("worker-1", first.getName());
        assertEquals("worker-2", second.getName());
        assertTrue(first.isDaemon());
        assertEquals(2, factory.createdCount());
    }

    @Test
    void installsUncaughtExceptionHandler() throws Exception {
        Thread thread = new DaemonThreadFactory("failing-").newThread(() -> {
            throw new IllegalStateException("boom");
        });
        assertNotNull(thread.getUncaughtExceptionHandler());

        thread.start();
        thread.join(3000);
    }

    @Test
    void rejectsNullPrefix() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
