package com.gocars.ridesafety.service;

import com.gocars.ridesafety.model.MonitoringSession;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Owner of one live {@link MonitoringSession}: its lock and its group of scheduled tasks.
 *
 * Every mutation goes through {@link #update}, {@link #tryUpdate} or {@link #execute}, which run the whole step
 * (detectors, alerts, risk) under one lock and then commit: bump the version and hand the session
 * to the {@link SessionUpdateListener} while the lock is still held.
 *
 * {@link #close()} cancels every task of the group. Tasks registered after close are cancelled on
 * registration, so nothing scheduled for this session outlives the stop call.
 */
@Slf4j
public class SessionContext {

    @Getter
    private final MonitoringSession session;

    private final SessionUpdateListener listener;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<ScheduledFuture<?>> tasks = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public SessionContext(MonitoringSession session, SessionUpdateListener listener) {
        this.session = session;
        this.listener = listener;
    }

    public String getSessionId() {
        return session.getId();
    }

    /** Runs the mutation atomically and always commits. */
    public <T> T update(Function<MonitoringSession, T> mutation) {
        lock.lock();
        try {
            T result = mutation.apply(session);
            commit();
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the mutation atomically; commits only when it reports a change.
     *
     * @return whether the session changed
     */
    public boolean tryUpdate(Predicate<MonitoringSession> mutation) {
        lock.lock();
        try {
            boolean changed = mutation.test(session);
            if (changed) {
                commit();
            }
            return changed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the operation atomically; commits only when it succeeds, so a rejected operation leaves
     * the session and its version untouched.
     */
    public OperationResult execute(Function<MonitoringSession, OperationResult> operation) {
        lock.lock();
        try {
            OperationResult result = operation.apply(session);
            if (result.isSuccess()) {
                commit();
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Consistent read under the lock; the function must not mutate. */
    public <T> T read(Function<MonitoringSession, T> reader) {
        lock.lock();
        try {
            return reader.apply(session);
        } finally {
            lock.unlock();
        }
    }

    /** Adds a task to the group, dropping fired one-shot tasks first. */
    public void addTask(ScheduledFuture<?> task) {
        tasks.removeIf(Future::isDone);
        tasks.add(task);
        if (closed) {
            task.cancel(false);
        }
    }

    int taskCount() {
        return tasks.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /** Cancels the whole task group. Safe to call more than once. */
    public void close() {
        closed = true;
        int cancelled = 0;
        for (ScheduledFuture<?> task : tasks) {
            if (task.cancel(false)) {
                cancelled++;
            }
        }
        tasks.clear();
        log.debug("Session {} task group closed — {} task(s) cancelled", session.getId(), cancelled);
    }

    private void commit() {
        session.nextVersion();
        listener.onSessionUpdated(session);
    }
}
