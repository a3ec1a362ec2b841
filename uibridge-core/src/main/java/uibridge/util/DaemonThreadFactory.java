package uibridge.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates daemon threads named {@code <prefix>1}, {@code <prefix>2}, and so on.
 *
 * <p>Pipeline threads never keep the JVM alive. An exception escaping a thread's task is
 * logged at {@code SEVERE} under this class's logger instead of the default stderr dump,
 * so aborted executions surface as diagnostics.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOGGING_HANDLER = (thread, error) ->
        logger.log(Level.SEVERE, "Uncaught failure on " + thread.getName(), error);

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
        return thread;
    }

    /** Number of threads created so far. */
    public int createdCount() {
        return counter.get() - 1;
    }
}
