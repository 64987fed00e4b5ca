package io.conveyor.queue;

/**
 * Thrown by the blocking pops of a {@link BlockingMessageQueue} once the queue has been canceled.
 *
 * <p>This is the normal way for a consumer loop to learn that it should stop. Cancellation wins
 * over queued messages: it is thrown even if the queue still holds some.
 */
public class CanceledException extends RuntimeException {

    private final String queueName;

    public CanceledException(String queueName) {
        super("Queue '" + queueName + "' was canceled");
        this.queueName = queueName;
    }

    /**
     * @return name of the queue that was canceled
     */
    public String queueName() {
        return queueName;
    }
}
