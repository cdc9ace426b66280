package io.hearthwarrio.formweaver.core.anchor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered tasks plus a cursor.
 * <p>
 * The cursor only moves forward during execution; {@link #seek(int)} exists for restoring a saved session.
 */
public final class FillQueue {

    private final List<FillTask> tasks;
    private int cursor;

    public FillQueue(List<FillTask> tasks) {
        this.tasks = List.copyOf(Objects.requireNonNull(tasks, "tasks must not be null"));
    }

    public List<FillTask> getTasks() {
        return tasks;
    }

    public int size() {
        return tasks.size();
    }

    public FillTask get(int index) {
        return tasks.get(index);
    }

    public synchronized int cursor() {
        return cursor;
    }

    public synchronized boolean hasMore() {
        return cursor < tasks.size();
    }

    public synchronized Optional<FillTask> peek() {
        return cursor < tasks.size() ? Optional.of(tasks.get(cursor)) : Optional.empty();
    }

    /**
     * Up to {@code n} pending tasks at or after the cursor, without moving it.
     *
     * @param n maximum count, negative for all
     */
    public synchronized List<FillTask> takePending(int n) {
        List<FillTask> out = new ArrayList<>();
        for (int i = cursor; i < tasks.size() && (n < 0 || out.size() < n); i++) {
            FillTask t = tasks.get(i);
            if (t.isPending()) {
                out.add(t);
            }
        }
        return out;
    }

    public synchronized void advance() {
        advance(1);
    }

    public synchronized void advance(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative");
        }
        cursor = Math.min(tasks.size(), cursor + n);
    }

    public synchronized void seek(int position) {
        if (position < 0 || position > tasks.size()) {
            throw new IllegalArgumentException("position out of range: " + position);
        }
        cursor = position;
    }

    public int count(TaskStatus status) {
        int c = 0;
        for (FillTask t : tasks) {
            if (t.getStatus() == status) {
                c++;
            }
        }
        return c;
    }

    @Override
    public synchronized String toString() {
        return "FillQueue{size=" + tasks.size() + ", cursor=" + cursor + ", pending=" + count(TaskStatus.PENDING) + '}';
    }
}
