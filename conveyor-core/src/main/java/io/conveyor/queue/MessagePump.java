package io.conveyor.queue;

import io.conveyor.config.QueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Single consumer that drains a {@link BlockingMessageQueue} on a dedicated thread.
 *
 * <p><b>Characteristics:</b>
 * <ul>
 *   <li>One platform thread named {@code conveyor-pump-{queue}}</li>
 *   <li>Drains in batches with {@link BlockingMessageQueue#popWaitAll}, hands messages over in FIFO order</li>
 *   <li>Graceful error handling - a failing handler is logged and the next message processed</li>
 *   <li>Stops when the queue is canceled or the worker is interrupted</li>
 * </ul>
 *
 * <p><b>Shutdown:</b> {@link #close()} cancels the queue and joins the worker. Messages still
 * queued at that point are not handled; {@link #shutdown()} returns them, provided every producer
 * has already stopped.
 *
 * <p><b>Usage:</b>
 * <pre>
 * BlockingMessageQueue&lt;Order&gt; orders = ConfiguredQueueFactory.getInstance().create("orders");
 * MessagePump&lt;Order&gt; pump = new MessagePump&lt;&gt;(orders, this::process);
 * pump.start();
 * orders.push(order);
 * ...
 * List&lt;Order&gt; unprocessed = pump.shutdown();
 * </pre>
 *
 * @param <T> message type
 */
public class MessagePump<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MessagePump.class);

    private final BlockingMessageQueue<T> queue;
    private final Consumer<? super T> handler;
    private final Thread worker;
    private final long joinTimeoutMs;
    private final AtomicLong handled = new AtomicLong();
    private volatile boolean started = false;

    /**
     * Creates a pump using the queue's settings from {@link QueueConfig#forQueue(String)}.
     *
     * @param queue   the queue to drain
     * @param handler receives every message, on the worker thread
     */
    public MessagePump(BlockingMessageQueue<T> queue, Consumer<? super T> handler) {
        this(queue, handler, QueueConfig.forQueue(queue.name()));
    }

    MessagePump(BlockingMessageQueue<T> queue, Consumer<? super T> handler, QueueConfig config) {
        this(queue, handler,
            config.getBoolean(QueueConfig.PUMP_DAEMON, true),
            config.getLong(QueueConfig.PUMP_JOIN_TIMEOUT_MS, 1000L));
    }

    /**
     * Creates a pump with explicit settings.
     *
     * @param queue         the queue to drain
     * @param handler       receives every message, on the worker thread
     * @param daemon        whether the worker is a daemon thread
     * @param joinTimeoutMs how long {@link #close()} waits for the worker to stop
     */
    public MessagePump(BlockingMessageQueue<T> queue, Consumer<? super T> handler, boolean daemon, long joinTimeoutMs) {
        this.queue = Objects.requireNonNull(queue, "Queue cannot be null");
        this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        if (joinTimeoutMs <= 0) {
            throw new IllegalArgumentException("joinTimeoutMs must be positive: " + joinTimeoutMs);
        }
        this.joinTimeoutMs = joinTimeoutMs;
        this.worker = new Thread(this::processQueue, "conveyor-pump-" + queue.name());
        this.worker.setDaemon(daemon);
    }

    /**
     * Starts the worker thread.
     *
     * @throws IllegalStateException if the pump was already started
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Pump for queue '" + queue.name() + "' already started");
        }
        started = true;
        worker.start();
        logger.debug("Started pump for queue '{}'", queue.name());
    }

    /**
     * Cancels the queue and waits up to the configured join timeout for the worker to finish.
     */
    @Override
    public void close() {
        queue.cancel();
        if (!started) {
            return;
        }
        try {
            worker.join(joinTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (worker.isAlive()) {
            logger.warn("Pump for queue '{}' did not stop within {} ms", queue.name(), joinTimeoutMs);
        }
    }

    /**
     * Closes the pump, then hands back the messages it never processed.
     *
     * <p>Every producer must have stopped before this is called: the leftovers are collected with
     * {@link BlockingMessageQueue#popRemainingUnsynchronized}. If the worker is still running after
     * the join timeout, nothing is drained and an empty list is returned.
     *
     * @return messages still queued, in FIFO order
     */
    public List<T> shutdown() {
        close();
        List<T> remaining = new ArrayList<>();
        if (worker.isAlive()) {
            return remaining;
        }
        queue.popRemainingUnsynchronized(remaining);
        return remaining;
    }

    /**
     * @return whether the worker thread is alive
     */
    public boolean isRunning() {
        return worker.isAlive();
    }

    /**
     * @return number of messages handed to the handler so far, failed ones included
     */
    public long handled() {
        return handled.get();
    }

    /**
     * @return the queue this pump drains
     */
    public BlockingMessageQueue<T> queue() {
        return queue;
    }

    private void processQueue() {
        List<T> batch = new ArrayList<>();
        try {
            while (true) {
                queue.popWaitAll(batch);
                for (T message : batch) {
                    dispatch(message);
                }
                batch.clear();
            }
        } catch (CanceledException e) {
            logger.debug("Pump for queue '{}' stopped after {} message(s)", queue.name(), handled.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Pump for queue '{}' interrupted", queue.name());
        }
    }

    private void dispatch(T message) {
        handled.incrementAndGet();
        try {
            handler.accept(message);
        } catch (RuntimeException e) {
            // Log error but continue processing
            logger.error("Error handling message on queue '{}'", queue.name(), e);
        }
    }

    @Override
    public String toString() {
        return "MessagePump[queue=" + queue.name() + ", handled=" + handled.get() + "]";
    }
}
