package io.conveyor.queue;

import io.conveyor.config.QueueConfig;

/**
 * {@link QueueFactory} that reads each queue's settings from {@link QueueConfig#forQueue(String)}.
 *
 * <p><b>Settings used:</b>
 * <ul>
 *   <li>{@code queue.lock.fair} - fairness of the queue lock (default false)</li>
 * </ul>
 *
 * <p><b>Thread safety:</b> Fully thread-safe singleton.
 *
 * @see QueueConfig
 */
public final class ConfiguredQueueFactory implements QueueFactory {

    private static final ConfiguredQueueFactory INSTANCE = new ConfiguredQueueFactory();

    /**
     * Private constructor - use {@link #getInstance()}.
     */
    private ConfiguredQueueFactory() {
    }

    /**
     * Get the singleton instance.
     *
     * @return the ConfiguredQueueFactory singleton
     */
    public static ConfiguredQueueFactory getInstance() {
        return INSTANCE;
    }

    @Override
    public <T> BlockingMessageQueue<T> create(String name) {
        QueueConfig config = QueueConfig.forQueue(name);
        return new BlockingMessageQueue<>(name, config.getBoolean(QueueConfig.LOCK_FAIR, false));
    }

    @Override
    public String toString() {
        return "ConfiguredQueueFactory{}";
    }
}
