package com.gocars.ridesafety.service;

import com.gocars.ridesafety.model.MonitoringSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionContextTest {

    @Mock private SessionUpdateListener listener;
    @Mock private ScheduledFuture<?> task;

    private MonitoringSession session;
    private SessionContext context;

    @BeforeEach
    void setUp() {
        session = MonitoringSession.builder().id("session-1").rideId("ride-1").userId("user-1").build();
        context = new SessionContext(session, listener);
    }

    @Test
    @DisplayName("Every committed update bumps the version and notifies the listener")
    void update_commits() {
        context.update(s -> s.getAlerts().size());
        context.update(s -> s.getAlerts().size());

        assertThat(session.getVersion()).isEqualTo(2);
        verify(listener, times(2)).onSessionUpdated(session);
    }

    @Test
    @DisplayName("Rejected operation leaves version and listener untouched")
    void failedExecute_noCommit() {
        OperationResult result = context.execute(s -> OperationResult.failure("nope"));
        boolean changed = context.tryUpdate(s -> false);

        assertThat(result.isSuccess()).isFalse();
        assertThat(changed).isFalse();
        assertThat(session.getVersion()).isZero();
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Close cancels the task group and cancels late registrations")
    void close_cancelsTasks() {
        context.addTask(task);
        context.close();

        verify(task).cancel(false);
        assertThat(context.isClosed()).isTrue();

        @SuppressWarnings("unchecked")
        ScheduledFuture<Object> late = mock(ScheduledFuture.class);
        context.addTask(late);
        verify(late).cancel(false);
    }

    @Test
    @DisplayName("Fired one-shot tasks are dropped from the group when the next one is added")
    void addTask_dropsFiredTasks() {
        @SuppressWarnings("unchecked")
        ScheduledFuture<Object> fired = mock(ScheduledFuture.class);
        @SuppressWarnings("unchecked")
        ScheduledFuture<Object> next = mock(ScheduledFuture.class);
        when(task.isDone()).thenReturn(false);
        when(fired.isDone()).thenReturn(true);

        context.addTask(task);
        context.addTask(fired);
        context.addTask(next);

        assertThat(context.taskCount()).isEqualTo(2);
        context.close();
        verify(task).cancel(false);
        verify(next).cancel(false);
        verify(fired, never()).cancel(anyBoolean());
    }

    @Test
    @DisplayName("Concurrent updates are serialised, no version is lost")
    void concurrentUpdates() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(200);
        for (int i = 0; i < 200; i++) {
            pool.execute(() -> {
                context.update(s -> {
                    s.setConsecutiveMissedSamples(s.getConsecutiveMissedSamples() + 1);
                    return null;
                });
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(session.getVersion()).isEqualTo(200);
        assertThat(session.getConsecutiveMissedSamples()).isEqualTo(200);
    }
}
