package io.conveyor.queue;

/**
 * Factory interface for creating {@link BlockingMessageQueue} instances.
 *
 * <p>Lets callers plug in how queues are tuned (lock fairness today) without knowing where the
 * settings come from.
 *
 * <p><b>Usage:</b>
 * <pre>
 * QueueFactory factory = ConfiguredQueueFactory.getInstance();
 * BlockingMessageQueue&lt;Order&gt; orders = factory.create("orders");
 * </pre>
 *
 * @see ConfiguredQueueFactory
 */
public interface QueueFactory {

    /**
     * Creates a new, active queue.
     *
     * @param name queue name, also used to look up queue-specific settings
     * @param <T>  message type
     * @return a new queue
     */
    <T> BlockingMessageQueue<T> create(String name);
}
