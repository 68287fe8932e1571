package com.codegen.gencore.wiring;

import com.codegen.gencore.api.StepStatus;
import com.codegen.gencore.engine.GenerationPlan;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Thread-safe front door for generator drivers running in parallel.
 *
 * <p>
 * Drivers call {@link #report} from any thread; outcomes travel through an LMAX
 * Disruptor ring buffer to a single consumer thread ({@link StepEventHandler})
 * that applies them to the {@link GenerationPlan}. A step is attached to the
 * run that is active when the consumer handles it, so an orchestrator must
 * call {@link #drain} before {@code complete()} to keep late steps in the run
 * they belong to.
 */
public final class StepReporter implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(StepReporter.class);

    private final Disruptor<StepEvent> disruptor;
    private final RingBuffer<StepEvent> ringBuffer;
    private final StepEventHandler handler;
    private volatile boolean closed;

    public StepReporter(GenerationPlan plan, int ringBufferSize) {
        this.handler = new StepEventHandler(plan);
        this.disruptor = new Disruptor<>(
                StepEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        log.debug("Step reporter started, ring buffer size {}", ringBufferSize);
    }

    /**
     * Publishes one step outcome. Blocks only while the ring buffer is full.
     *
     * @throws IllegalStateException if the reporter was closed.
     */
    public void report(String stepKey, StepStatus status, Integer filesProduced, Long duration, boolean cached) {
        if (closed)
            throw new IllegalStateException("Step reporter is closed");
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(stepKey, status, filesProduced, duration, cached);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Waits until every event published before this call has been handled.
     *
     * @return false if the timeout elapsed first.
     */
    public boolean drain(Duration timeout) {
        long target = ringBuffer.getCursor();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (handler.processedSequence() < target) {
            if (System.nanoTime() - deadline >= 0)
                return false;
            LockSupport.parkNanos(100_000);
        }
        return true;
    }

    public StepEventHandler handler() {
        return handler;
    }

    /** Handles everything already published, then stops the consumer thread. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        // shutdown() skips a consumer whose thread has not started yet
        if (!drain(Duration.ofSeconds(5)))
            log.warn("Step reporter still has a backlog after 5s");
        try {
            disruptor.shutdown(5, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.error("Step reporter did not drain within 5s, halting", e);
            disruptor.halt();
        }
        log.debug("Step reporter stopped after {} event(s), {} failure(s)",
                handler.processedSequence() + 1, handler.failures());
    }
}
