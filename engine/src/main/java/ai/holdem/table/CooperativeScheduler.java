package ai.holdem.table;

import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded queue of delayed continuations.
 * <p>
 * Replaces ad-hoc timers: every continuation carries a guard that is evaluated when the
 * continuation comes due, not when it was queued, so work scheduled against a hand that
 * has since ended (fold to one player, new hand started) is dropped instead of racing the
 * current state. Time is virtual; the {@link Pacer} decides whether the delay is actually
 * waited out.
 * <p>
 * Continuations run in due-time order, ties in scheduling order. A continuation may
 * schedule further continuations.
 */
public class CooperativeScheduler {
    private static final Logger log = LoggerFactory.getLogger(CooperativeScheduler.class);

    private final PriorityQueue<Task> queue = new PriorityQueue<>(
            Comparator.comparingLong((Task t) -> t.dueAt).thenComparingLong(t -> t.sequence));
    private final Pacer pacer;
    private long now;
    private long sequence;

    public CooperativeScheduler() {
        this(Pacer.NONE);
    }

    public CooperativeScheduler(Pacer pacer) {
        this.pacer = Objects.requireNonNull(pacer, "pacer");
    }

    /**
     * Queues {@code task} to run after {@code delayMillis}, provided {@code guard} still holds
     * at that point.
     */
    public void schedule(long delayMillis, BooleanSupplier guard, Runnable task) {
        Objects.requireNonNull(guard, "guard");
        Objects.requireNonNull(task, "task");
        queue.add(new Task(now + Math.max(0, delayMillis), sequence++, guard, task));
    }

    /**
     * Runs the next due continuation if its guard still holds.
     *
     * @return {@code true} if a continuation was taken off the queue (run or dropped)
     */
    public boolean runNext() {
        Task task = queue.poll();
        if (task == null) {
            return false;
        }
        long wait = task.dueAt - now;
        if (wait > 0) {
            pacer.pause(wait);
            now = task.dueAt;
        }
        if (task.guard.getAsBoolean()) {
            task.body.run();
        } else if (log.isDebugEnabled()) {
            log.debug("Dropped stale continuation #{}", task.sequence);
        }
        return true;
    }

    /**
     * Drains the queue, including continuations scheduled while draining.
     *
     * @return number of continuations taken off the queue
     */
    public int runAll() {
        int count = 0;
        while (runNext()) {
            count++;
        }
        return count;
    }

    public int pending() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }

    /**
     * Virtual clock in milliseconds since the scheduler was created.
     */
    public long now() {
        return now;
    }

    private static final class Task {
        final long dueAt;
        final long sequence;
        final BooleanSupplier guard;
        final Runnable body;

        Task(long dueAt, long sequence, BooleanSupplier guard, Runnable body) {
            this.dueAt = dueAt;
            this.sequence = sequence;
            this.guard = guard;
            this.body = body;
        }
    }
}
