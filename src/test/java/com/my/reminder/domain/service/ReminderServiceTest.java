package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.InvalidReminderException;
import com.my.reminder.domain.exception.ReminderNotFoundException;
import com.my.reminder.domain.exception.ReminderPersistenceException;
import com.my.reminder.domain.model.AlertHandle;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.model.ReminderDraft;
import com.my.reminder.domain.port.out.AudioPort;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.ReminderPersistencePort;
import com.my.reminder.domain.port.out.UiPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.my.reminder.domain.service.SchedulerSupervisorTest.awaitUntil;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReminderServiceTest {

    private ReminderPersistencePort persistencePort;
    private UiPort uiPort;
    private AudioPort audioPort;
    private ReminderStore store;
    private SchedulerSupervisor supervisor;
    private ReminderService service;
    private final List<Long> alertedAtMillis = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.shutdown();
        }
        if (store != null) {
            store.close();
        }
    }

    @Test
    void reminderTwoSecondsAheadAlertsExactlyOnce() throws Exception {
        wire(ShiftedClock.startingAt(Instant.parse("2026-03-01T08:59:58Z")), Duration.ofSeconds(1));
        long createdAt = System.currentTimeMillis();

        Reminder created = service.create(new ReminderDraft("Stand-up", "daily sync", "2026-03-01", "09:00"));

        awaitUntil(() -> alertedAtMillis.size() == 1);
        long elapsed = alertedAtMillis.get(0) - createdAt;
        assertThat(elapsed).isBetween(1500L, 3000L);
        verify(audioPort).playAsync("bell.wav");
        assertThat(store.get(created.id()).active()).isFalse();

        Thread.sleep(5000);
        assertThat(alertedAtMillis).hasSize(1);
        assertThat(supervisor.isMonitoring(created.id())).isFalse();
    }

    @Test
    void pastDueRemindersOnLoadAreDeactivatedWithoutAlert() throws Exception {
        TestClock clock = TestClock.at("2026-03-01T10:00:00Z");
        wire(clock, Duration.ofMillis(20));
        when(persistencePort.loadAll()).thenReturn(List.of(
                new Reminder("old", "missed", "", Instant.parse("2026-03-01T09:00:00Z"), true),
                new Reminder("next", "upcoming", "", Instant.parse("2026-03-01T11:00:00Z"), true),
                new Reminder("done", "already fired", "", Instant.parse("2026-03-01T08:00:00Z"), false)));

        int started = service.loadAll();

        assertThat(started).isEqualTo(1);
        assertThat(store.get("old").active()).isFalse();
        assertThat(supervisor.isMonitoring("next")).isTrue();
        Thread.sleep(150);
        assertThat(alertedAtMillis).isEmpty();
        verify(audioPort, never()).playAsync(anyString());
    }

    @Test
    void reloadingKeepsRemindersArmed() throws Exception {
        TestClock clock = TestClock.at("2026-03-01T08:00:00Z");
        wire(clock, Duration.ofMillis(20));
        when(persistencePort.loadAll()).thenReturn(List.of(
                new Reminder("next", "upcoming", "", Instant.parse("2026-03-01T09:00:00Z"), true)));

        assertThat(service.loadAll()).isEqualTo(1);
        assertThat(service.loadAll()).isEqualTo(1);
        assertThat(supervisor.isMonitoring("next")).isTrue();

        clock.set(Instant.parse("2026-03-01T09:00:00Z"));
        awaitUntil(() -> alertedAtMillis.size() == 1);
        verify(uiPort).presentAlert("upcoming", "");
        assertThat(store.get("next").active()).isFalse();
        Thread.sleep(150);
        assertThat(alertedAtMillis).hasSize(1);
    }

    @Test
    void loadFailureStartsEmptyAndWarns() {
        wire(TestClock.at("2026-03-01T10:00:00Z"), Duration.ofMillis(20));
        when(persistencePort.loadAll()).thenThrow(new ReminderPersistenceException("broken json"));

        assertThat(service.loadAll()).isZero();

        assertThat(service.list()).isEmpty();
        verify(uiPort).showWarning(contains("broken json"));
    }

    @Test
    void removedReminderNeverAlerts() throws Exception {
        TestClock clock = TestClock.at("2026-03-01T08:00:00Z");
        wire(clock, Duration.ofMillis(20));
        Reminder created = service.create(draft("Call", LocalDateTime.of(2026, 3, 1, 8, 30)));

        service.remove(created.id());
        clock.advance(Duration.ofHours(1));

        Thread.sleep(150);
        assertThat(alertedAtMillis).isEmpty();
        assertThat(service.list()).isEmpty();
        assertThat(supervisor.isMonitoring(created.id())).isFalse();
    }

    @Test
    void editMovesTheAlertToTheNewTime() throws Exception {
        TestClock clock = TestClock.at("2026-03-01T08:00:00Z");
        wire(clock, Duration.ofMillis(20));
        Reminder created = service.create(draft("Call", LocalDateTime.of(2026, 3, 1, 8, 30)));

        Reminder edited = service.update(created.id(), draft("Call later", LocalDateTime.of(2026, 3, 1, 9, 30)));

        assertThat(edited.id()).isEqualTo(created.id());
        assertThat(edited.revision()).isGreaterThan(created.revision());
        clock.set(Instant.parse("2026-03-01T09:00:00Z"));
        Thread.sleep(150);
        assertThat(alertedAtMillis).isEmpty();

        clock.set(Instant.parse("2026-03-01T09:30:00Z"));
        awaitUntil(() -> alertedAtMillis.size() == 1);
        verify(uiPort, timeout(1000)).presentAlert("Call later", "");
        Thread.sleep(150);
        assertThat(alertedAtMillis).hasSize(1);
    }

    @Test
    void editingAFiredReminderArmsItAgain() throws Exception {
        TestClock clock = TestClock.at("2026-03-01T08:00:00Z");
        wire(clock, Duration.ofMillis(20));
        Reminder created = service.create(draft("Call", LocalDateTime.of(2026, 3, 1, 8, 30)));
        clock.set(Instant.parse("2026-03-01T08:30:00Z"));
        awaitUntil(() -> alertedAtMillis.size() == 1);

        Reminder edited = service.update(created.id(), draft("Call", LocalDateTime.of(2026, 3, 1, 9, 0)));

        assertThat(edited.active()).isTrue();
        assertThat(supervisor.isMonitoring(created.id())).isTrue();
    }

    @Test
    void invalidInputIsRejectedBeforeTouchingTheStore() {
        wire(TestClock.at("2026-03-01T08:00:00Z"), Duration.ofMillis(20));

        assertThatThrownBy(() -> service.create(draft("  ", LocalDateTime.of(2026, 3, 1, 9, 0))))
                .isInstanceOf(InvalidReminderException.class);
        assertThatThrownBy(() -> service.create(new ReminderDraft("t", "", "2026-03-01", "25:00")))
                .isInstanceOf(InvalidReminderException.class);
        assertThatThrownBy(() -> service.create(draft("t", LocalDateTime.of(2026, 3, 1, 7, 59))))
                .isInstanceOf(InvalidReminderException.class);
        assertThat(service.list()).isEmpty();
        assertThat(supervisor.activeMonitorCount()).isZero();
    }

    @Test
    void unknownIdsRaiseNotFound() {
        wire(TestClock.at("2026-03-01T08:00:00Z"), Duration.ofMillis(20));

        assertThatThrownBy(() -> service.update("missing", draft("t", LocalDateTime.of(2026, 3, 1, 9, 0))))
                .isInstanceOf(ReminderNotFoundException.class);
        assertThatThrownBy(() -> service.remove("missing"))
                .isInstanceOf(ReminderNotFoundException.class);
        assertThatThrownBy(() -> service.get("missing"))
                .isInstanceOf(ReminderNotFoundException.class);
    }

    private void wire(ClockPort clock, Duration pollInterval) {
        persistencePort = mock(ReminderPersistencePort.class);
        uiPort = mock(UiPort.class);
        audioPort = mock(AudioPort.class);
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return null;
        }).when(uiPort).scheduleOnUiThread(any());
        when(uiPort.presentAlert(anyString(), anyString())).thenAnswer(invocation -> {
            alertedAtMillis.add(System.currentTimeMillis());
            return new AlertHandle("alert-" + alertedAtMillis.size());
        });

        store = new ReminderStore(persistencePort);
        NotificationQueue queue = new NotificationQueue();
        ShutdownSignal shutdownSignal = new ShutdownSignal();
        NotificationDispatcher dispatcher = new NotificationDispatcher(queue, uiPort, audioPort, shutdownSignal,
                Duration.ofMillis(50), Duration.ofSeconds(5), "bell.wav");
        supervisor = new SchedulerSupervisor(store, queue, clock, dispatcher, shutdownSignal,
                pollInterval, Duration.ofSeconds(2));
        supervisor.start();
        service = new ReminderService(store, supervisor, persistencePort, uiPort, clock);
    }

    private static ReminderDraft draft(String title, LocalDateTime trigger) {
        return ReminderDraft.of(title, "", trigger);
    }

    /**
     * 실제 시간과 같은 속도로 흐르되 지정한 시각에서 출발하는 시계.
     */
    private static final class ShiftedClock implements ClockPort {

        private final Duration offset;

        private ShiftedClock(Duration offset) {
            this.offset = offset;
        }

        static ShiftedClock startingAt(Instant virtualStart) {
            return new ShiftedClock(Duration.between(Instant.now(), virtualStart));
        }

        @Override
        public OffsetDateTime now() {
            return Instant.now().plus(offset).atOffset(ZoneOffset.UTC);
        }

        @Override
        public ZoneId zone() {
            return ZoneOffset.UTC;
        }
    }
}
