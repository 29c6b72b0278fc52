package io.mailqueue.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Names the engine's threads {@code <prefix><n>} and marks them as daemons, so an engine
 * that was never closed does not keep the JVM alive.
 *
 * <p>A fault that escapes a task is logged at {@code SEVERE} under the thread's name
 * instead of going to {@code System.err}.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String namePrefix;
    private final AtomicInteger nextId = new AtomicInteger(1);

    /**
     * @param namePrefix thread name prefix, e.g. {@code "email-worker-"}; must not be blank
     */
    public DaemonThreadFactory(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isBlank()) {
            throw new IllegalArgumentException("namePrefix must not be blank");
        }
        this.namePrefix = namePrefix;
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, namePrefix + nextId.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught fault on " + t.getName(), e));
        return thread;
    }

    public String namePrefix() {
        return namePrefix;
    }
}
