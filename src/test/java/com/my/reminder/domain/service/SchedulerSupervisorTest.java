package com.my.reminder.domain.service;

import com.my.reminder.domain.model.AlertHandle;
import com.my.reminder.domain.model.MonitorState;
import com.my.reminder.domain.model.NotificationEvent;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.AudioPort;
import com.my.reminder.domain.port.out.ReminderPersistencePort;
import com.my.reminder.domain.port.out.UiPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerSupervisorTest {

    private TestClock clock;
    private ReminderStore store;
    private NotificationQueue queue;
    private ShutdownSignal shutdownSignal;
    private NotificationDispatcher dispatcher;
    private SchedulerSupervisor supervisor;

    @BeforeEach
    void setUp() {
        clock = TestClock.at("2026-03-01T08:00:00Z");
        store = new ReminderStore(mock(ReminderPersistencePort.class));
        queue = new NotificationQueue();
        shutdownSignal = new ShutdownSignal();
        UiPort uiPort = mock(UiPort.class);
        when(uiPort.presentAlert(anyString(), anyString())).thenReturn(new AlertHandle("h"));
        dispatcher = new NotificationDispatcher(queue, uiPort, mock(AudioPort.class), shutdownSignal,
                Duration.ofMillis(20), Duration.ofSeconds(5), "bell.wav");
        supervisor = new SchedulerSupervisor(store, queue, clock, dispatcher, shutdownSignal,
                Duration.ofMillis(20), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
        store.close();
    }

    @Test
    void refusesSecondMonitorForSameId() {
        Reminder reminder = store.upsert(reminder("a", "2026-03-01T09:00:00Z"));

        assertThat(supervisor.schedule(reminder)).isTrue();
        assertThat(supervisor.schedule(reminder)).isFalse();
        assertThat(supervisor.activeMonitorCount()).isEqualTo(1);
    }

    @Test
    void doesNotScheduleInactiveReminders() {
        Reminder reminder = store.upsert(reminder("a", "2026-03-01T09:00:00Z").withActive(false));

        assertThat(supervisor.schedule(reminder)).isFalse();
        assertThat(supervisor.isMonitoring("a")).isFalse();
    }

    @Test
    void handleIsReleasedAfterFiring() throws Exception {
        Reminder reminder = store.upsert(reminder("a", "2026-03-01T08:30:00Z"));
        supervisor.schedule(reminder);

        clock.advance(Duration.ofHours(1));

        awaitUntil(() -> !supervisor.isMonitoring("a"));
        assertThat(queue.size()).isEqualTo(1);
        assertThat(store.get("a").active()).isFalse();
    }

    @Test
    void rescheduleReplacesTheMonitorWithTheLatestRevision() throws Exception {
        Reminder original = store.upsert(reminder("a", "2026-03-01T08:30:00Z"));
        supervisor.schedule(original);
        ReminderMonitor first = supervisor.monitorFor("a").orElseThrow();

        Reminder edited = store.replace(reminder("a", "2026-03-01T10:00:00Z"));
        supervisor.reschedule("a");

        ReminderMonitor second = supervisor.monitorFor("a").orElseThrow();
        assertThat(second).isNotSameAs(first);
        assertThat(second.revision()).isEqualTo(edited.revision());

        clock.set(Instant.parse("2026-03-01T09:00:00Z"));
        Thread.sleep(150);
        assertThat(queue.size()).isZero();

        clock.set(Instant.parse("2026-03-01T10:00:00Z"));
        awaitUntil(() -> queue.size() == 1);
        Thread.sleep(100);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void newerRevisionReplacesStaleHandle() throws Exception {
        Reminder original = store.upsert(reminder("a", "2026-03-01T08:30:00Z"));
        supervisor.schedule(original);
        ReminderMonitor stale = supervisor.monitorFor("a").orElseThrow();

        Reminder reloaded = store.replaceAll(List.of(reminder("a", "2026-03-01T08:30:00Z"))).get(0);

        assertThat(supervisor.schedule(reloaded)).isTrue();
        assertThat(supervisor.monitorFor("a")).hasValueSatisfying(current ->
                assertThat(current.revision()).isEqualTo(reloaded.revision()));
        assertThat(supervisor.schedule(original)).isFalse();

        clock.set(Instant.parse("2026-03-01T08:30:00Z"));
        awaitUntil(() -> queue.size() == 1);
        awaitUntil(() -> stale.state() == MonitorState.CANCELLED);
        Thread.sleep(100);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void rescheduleKeepsOneRegisteredHandleWhileOldMonitorWindsDown() throws Exception {
        supervisor.schedule(store.upsert(reminder("a", "2026-03-01T08:30:00Z")));
        ReminderMonitor first = supervisor.monitorFor("a").orElseThrow();

        store.replace(reminder("a", "2026-03-01T09:00:00Z"));
        supervisor.reschedule("a");

        assertThat(supervisor.activeMonitorCount()).isEqualTo(1);
        awaitUntil(() -> first.state() == MonitorState.CANCELLED);
        assertThat(supervisor.activeMonitorCount()).isEqualTo(1);
        assertThat(supervisor.monitorFor("a")).hasValueSatisfying(current ->
                assertThat(current).isNotSameAs(first));
    }

    @Test
    void firingOrderFollowsTriggerOrder() throws Exception {
        supervisor.schedule(store.upsert(reminder("a", "2026-03-01T08:10:00Z")));
        supervisor.schedule(store.upsert(reminder("b", "2026-03-01T08:20:00Z")));

        clock.set(Instant.parse("2026-03-01T08:10:00Z"));
        awaitUntil(() -> queue.size() == 1);
        clock.set(Instant.parse("2026-03-01T08:20:00Z"));
        awaitUntil(() -> queue.size() == 2);

        assertThat(queue.poll(Duration.ofMillis(10))).map(NotificationEvent::title).contains("title-a");
        assertThat(queue.poll(Duration.ofMillis(10))).map(NotificationEvent::title).contains("title-b");
    }

    @Test
    void shutdownStopsMonitorsAndDispatcher() throws Exception {
        supervisor.start();
        supervisor.schedule(store.upsert(reminder("a", "2026-03-01T09:00:00Z")));
        supervisor.schedule(store.upsert(reminder("b", "2026-03-01T09:30:00Z")));
        awaitUntil(supervisor::isDispatcherRunning);

        supervisor.shutdown();

        assertThat(supervisor.activeMonitorCount()).isZero();
        assertThat(supervisor.isDispatcherRunning()).isFalse();
        assertThat(supervisor.schedule(store.upsert(reminder("c", "2026-03-01T09:00:00Z")))).isFalse();
        assertThat(store.get("a").active()).isTrue();
    }

    @Test
    void racingEditsRemovalsAndDeadlinesNeverDuplicateEvents() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            String id = "r" + i;
            ids.add(id);
            supervisor.schedule(store.upsert(reminder(id, "2026-03-01T08:00:01Z")));
        }

        Thread mutator = new Thread(() -> {
            for (String id : ids) {
                int choice = ThreadLocalRandom.current().nextInt(3);
                if (choice == 0) {
                    store.remove(id);
                    supervisor.cancel(id);
                } else if (choice == 1) {
                    store.replace(new Reminder(id, "title-" + id + "-v2", "", Instant.parse("2026-03-01T08:00:02Z"), true));
                    supervisor.reschedule(id);
                }
            }
        });
        mutator.start();
        clock.advance(Duration.ofSeconds(5));
        mutator.join(5000);

        awaitUntil(() -> supervisor.activeMonitorCount() == 0);
        Map<String, Integer> perTitle = new HashMap<>();
        Optional<NotificationEvent> next;
        while ((next = queue.poll(Duration.ofMillis(10))).isPresent()) {
            perTitle.merge(next.get().title(), 1, Integer::sum);
        }
        assertThat(perTitle.values()).allMatch(count -> count == 1);
        for (Reminder remaining : store.listAll()) {
            assertThat(remaining.active()).isFalse();
            assertThat(perTitle).containsKey(remaining.title());
        }
    }

    private static Reminder reminder(String id, String trigger) {
        return new Reminder(id, "title-" + id, "", Instant.parse(trigger), true);
    }

    static void awaitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("조건이 제한 시간 안에 충족되지 않았습니다.");
            }
            Thread.sleep(10);
        }
    }
}
