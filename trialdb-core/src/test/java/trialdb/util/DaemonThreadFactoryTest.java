package trialdb.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("trialdb-connection-check-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertTrue(thread.getName().startsWith("trialdb-connection-check-"));
    }

    @Test
    void sequentialNaming() {
        DaemonThreadFactory factory = new DaemonThreadFactory("test-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });
        Thread t3 = factory.newThread(() -> {
        });

        assertEquals("test-1", t1.getName());
        assertEquals("test-2", t2.getName());
        assertEquals("test-3", t3.getName());
    }

    @Test
    void runsTaskOnDaemonThread() throws Exception {
        DaemonThreadFactory factory = new DaemonThreadFactory("probe-");
        CountDownLatch ran = new CountDownLatch(1);

        Thread thread = factory.newThread(ran::countDown);
        thread.start();

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertTrue(thread.isDaemon());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () ->
                new DaemonThreadFactory(null));
    }
}
