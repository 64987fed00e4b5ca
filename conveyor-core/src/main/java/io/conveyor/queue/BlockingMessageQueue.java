package io.conveyor.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Unbounded, thread-safe FIFO mailbox for handing messages between producer and consumer threads.
 *
 * <p>Messages are held in an internal singly linked chain. Nodes are allocated before the lock is
 * taken, so every critical section is O(1): link a node, splice a chain, check the flag, signal.
 * The lock is never held across a wait, a copy, or iteration over a caller's collection.
 *
 * <p><b>Cancellation:</b> {@link #cancel()} moves the queue from <i>active</i> to <i>canceled</i>
 * exactly once. The transition is terminal. Every blocking pop re-checks the flag on each wake and
 * throws {@link CanceledException} once it is set, even when messages are still queued.
 * Pushes stay legal after cancellation and still enqueue.
 *
 * <p><b>Ownership:</b> once {@code push} returns, the queue owns the message reference until a pop
 * hands it back out. Callers that want to keep using their instance push a copy with
 * {@link #pushCopy(Object, UnaryOperator)}.
 *
 * <p><b>Advisory queries:</b> {@link #size()}, {@link #isEmpty()} and {@link #isCanceled()} are
 * snapshots. The value may be stale by the time it is returned; do not base a later decision on it
 * without re-checking through a real pop.
 *
 * <p>Instances are not cloneable. {@link #close()} cancels, so disposing of a queue never leaves a
 * consumer blocked.
 *
 * @param <T> message type
 * @see CanceledException
 * @see MessagePump
 */
public final class BlockingMessageQueue<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BlockingMessageQueue.class);

    private final String name;
    private final ReentrantLock lock;
    private final Condition signal;

    // Guarded by lock, except in popRemainingUnsynchronized
    private Node<T> head;
    private Node<T> tail;
    private int count;
    private boolean canceled;

    /**
     * Creates an anonymous queue with a non-fair lock.
     */
    public BlockingMessageQueue() {
        this("anonymous");
    }

    /**
     * Creates a named queue with a non-fair lock.
     *
     * @param name label used in log lines and exception messages
     */
    public BlockingMessageQueue(String name) {
        this(name, false);
    }

    /**
     * Creates a named queue.
     *
     * @param name label used in log lines and exception messages, never blank
     * @param fair whether the internal lock hands itself to the longest waiting thread
     */
    public BlockingMessageQueue(String name, boolean fair) {
        Objects.requireNonNull(name, "Queue name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Queue name cannot be blank");
        }
        this.name = name;
        this.lock = new ReentrantLock(fair);
        this.signal = lock.newCondition();
    }

    /**
     * Appends a message at the tail and wakes one waiting consumer.
     *
     * <p>The reference is handed over to the queue; the caller should not touch the instance again.
     *
     * @param message the message, never {@code null}
     */
    public void push(T message) {
        Node<T> node = new Node<>(Objects.requireNonNull(message, "Message cannot be null"));
        lock.lock();
        try {
            link(node, node, 1);
            signal.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a copy of a message at the tail and wakes one waiting consumer.
     *
     * <p>The copier runs before the lock is taken, so an expensive copy never holds up other
     * producers or consumers. The caller keeps ownership of the original.
     *
     * @param message the message to copy
     * @param copier  produces the instance that is actually enqueued
     */
    public void pushCopy(T message, UnaryOperator<T> copier) {
        Objects.requireNonNull(message, "Message cannot be null");
        Objects.requireNonNull(copier, "Copier cannot be null");
        push(Objects.requireNonNull(copier.apply(message), "Copier returned null"));
    }

    /**
     * Moves every message of {@code messages} to the tail, in iteration order, under a single lock
     * acquisition, and wakes one waiting consumer.
     *
     * <p>The collection is cleared: ownership of all of its elements passes to the queue. An empty
     * collection is a no-op. If it contains {@code null}, nothing is enqueued and the collection is
     * left untouched.
     *
     * @param messages the messages to move, left empty on return
     */
    public void pushAll(Collection<? extends T> messages) {
        Objects.requireNonNull(messages, "Messages cannot be null");
        Node<T> first = null;
        Node<T> last = null;
        int added = 0;
        for (T message : messages) {
            Node<T> node = new Node<>(Objects.requireNonNull(message, "Message cannot be null"));
            if (first == null) {
                first = node;
            } else {
                last.next = node;
            }
            last = node;
            added++;
        }
        if (first == null) {
            return;
        }
        messages.clear();

        lock.lock();
        try {
            link(first, last, added);
            signal.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the head without blocking.
     *
     * <p>Never reports cancellation: a canceled queue still hands out whatever it holds.
     *
     * @return the head message, or empty if the queue holds nothing
     */
    public Optional<T> tryPop() {
        lock.lock();
        try {
            return head == null ? Optional.empty() : Optional.of(unlinkHead());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the head, blocking until a message arrives or the queue is canceled.
     *
     * <p>If messages remain after the head is taken, the next waiting consumer is woken, so a bulk
     * push reaches every blocked consumer and not just the first.
     *
     * @return the head message
     * @throws CanceledException    if the queue is canceled, whether before the call or while waiting
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public T popWait() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            awaitMessageOrCancel();
            T message = unlinkHead();
            if (head != null) {
                signal.signal();
            }
            return message;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until at least one message is available, then moves everything the queue holds at that
     * instant into {@code out}, in FIFO order.
     *
     * <p>The chain is detached in one step under the lock and appended to {@code out} after the lock
     * is released, so {@code out} must be confined to the calling thread: another thread reading it
     * concurrently may see a partial batch.
     *
     * <p>If {@code out} rejects a message, that message and every one after it are put back at the
     * head of the queue, in order, before the exception propagates. Messages already added stay in
     * {@code out}.
     *
     * @param out receives the drained messages, confined to the calling thread
     * @throws CanceledException    if the queue is canceled, whether before the call or while waiting
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void popWaitAll(Collection<? super T> out) throws InterruptedException {
        Objects.requireNonNull(out, "Output collection cannot be null");
        Node<T> chain;
        lock.lockInterruptibly();
        try {
            awaitMessageOrCancel();
            chain = detachAll();
        } finally {
            lock.unlock();
        }
        Node<T> node = chain;
        try {
            for (; node != null; node = node.next) {
                out.add(node.message);
            }
        } catch (RuntimeException e) {
            Node<T> last = lastOf(node);
            int restored = lengthOf(node);
            lock.lock();
            try {
                relinkAtHead(node, last, restored);
                signal.signal();
            } finally {
                lock.unlock();
            }
            throw e;
        }
    }

    /**
     * Moves everything the queue holds into {@code out} <b>without taking the lock</b>.
     *
     * <p>This is unsafe unless the caller guarantees that no other thread touches the queue, and that
     * every thread that did has finished (for instance: {@link #cancel()} was called, every consumer
     * observed it and was joined, and every producer has stopped). It exists for orderly teardown,
     * where it must neither block nor contend. Messages pushed concurrently may be lost or corrupt
     * the chain.
     *
     * <p>If {@code out} rejects a message, it and every message after it stay in the queue.
     *
     * @param out receives the remaining messages
     */
    public void popRemainingUnsynchronized(Collection<? super T> out) {
        Objects.requireNonNull(out, "Output collection cannot be null");
        int drained = count;
        Node<T> node = detachAll();
        try {
            for (; node != null; node = node.next) {
                out.add(node.message);
            }
        } catch (RuntimeException e) {
            relinkAtHead(node, lastOf(node), lengthOf(node));
            throw e;
        }
        if (drained > 0) {
            logger.debug("Drained {} remaining message(s) from queue '{}'", drained, name);
        }
    }

    /**
     * Cancels the queue and wakes every blocked consumer.
     *
     * <p>Idempotent. There is no way back to the active state.
     */
    public void cancel() {
        boolean first;
        lock.lock();
        try {
            first = !canceled;
            canceled = true;
            signal.signalAll();
        } finally {
            lock.unlock();
        }
        if (first) {
            logger.debug("Queue '{}' canceled", name);
        }
    }

    /**
     * Same as {@link #cancel()}.
     */
    @Override
    public void close() {
        cancel();
    }

    /**
     * Advisory snapshot of the cancellation flag.
     *
     * @return true once {@link #cancel()} has been called
     */
    public boolean isCanceled() {
        lock.lock();
        try {
            return canceled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advisory snapshot; may be stale on return.
     *
     * @return true if the queue held no message at the time of the call
     */
    public boolean isEmpty() {
        lock.lock();
        try {
            return head == null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advisory snapshot; may be stale on return.
     *
     * @return number of messages held at the time of the call
     */
    public int size() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the label given at construction
     */
    public String name() {
        return name;
    }

    /**
     * @return whether the internal lock is fair
     */
    public boolean isFair() {
        return lock.isFair();
    }

    @Override
    public String toString() {
        return "BlockingMessageQueue[name=" + name + "]";
    }

    // Caller holds lock. Loops to absorb spurious wakeups.
    private void awaitMessageOrCancel() throws InterruptedException {
        while (head == null && !canceled) {
            signal.await();
        }
        if (canceled) {
            throw new CanceledException(name);
        }
    }

    private void link(Node<T> first, Node<T> last, int added) {
        if (tail == null) {
            head = first;
        } else {
            tail.next = first;
        }
        tail = last;
        count += added;
    }

    private T unlinkHead() {
        Node<T> node = head;
        head = node.next;
        if (head == null) {
            tail = null;
        }
        count--;
        T message = node.message;
        node.message = null;
        node.next = null;
        return message;
    }

    private Node<T> detachAll() {
        Node<T> chain = head;
        head = null;
        tail = null;
        count = 0;
        return chain;
    }

    // Puts a detached run back in front of whatever was pushed since it was detached
    private void relinkAtHead(Node<T> first, Node<T> last, int restored) {
        last.next = head;
        if (tail == null) {
            tail = last;
        }
        head = first;
        count += restored;
    }

    private static <T> Node<T> lastOf(Node<T> chain) {
        Node<T> last = chain;
        while (last.next != null) {
            last = last.next;
        }
        return last;
    }

    private static int lengthOf(Node<?> chain) {
        int length = 0;
        for (Node<?> node = chain; node != null; node = node.next) {
            length++;
        }
        return length;
    }

    private static final class Node<T> {
        T message;
        Node<T> next;

        Node(T message) {
            this.message = message;
        }
    }
}
