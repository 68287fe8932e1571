package com.codegen.gencore.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging so that a listener or consumer failing on
 * every step cannot flood the log.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at error level unless another message was logged less than the
     * interval ago.
     *
     * @return true if the message was written.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // only one thread wins the interval
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                if (dropped > 0)
                    logger.error("{} ({} similar suppressed)", message, dropped, t);
                else
                    logger.error(message, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
