package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.InvalidReminderException;
import com.my.reminder.domain.exception.ReminderPersistenceException;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.model.ReminderDraft;
import com.my.reminder.domain.port.in.ReminderUseCase;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.ReminderPersistencePort;
import com.my.reminder.domain.port.out.UiPort;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 왜: 입력 검증, 저장소 변경, 모니터 관리를 하나의 유스케이스로 묶어 순서가 어긋나지 않도록 하기 위함.
 */
public class ReminderService implements ReminderUseCase {

    private static final Logger log = Logger.getLogger(ReminderService.class);

    private final ReminderStore store;
    private final SchedulerSupervisor supervisor;
    private final ReminderPersistencePort persistencePort;
    private final UiPort uiPort;
    private final ClockPort clock;

    public ReminderService(ReminderStore store,
                           SchedulerSupervisor supervisor,
                           ReminderPersistencePort persistencePort,
                           UiPort uiPort,
                           ClockPort clock) {
        this.store = store;
        this.supervisor = supervisor;
        this.persistencePort = persistencePort;
        this.uiPort = uiPort;
        this.clock = clock;
    }

    @Override
    public Reminder create(ReminderDraft draft) {
        Instant triggerAt = futureTrigger(draft);
        Reminder reminder = store.upsert(new Reminder(UUID.randomUUID().toString(),
                draft.title(), draft.description(), triggerAt, true));
        supervisor.schedule(reminder);
        log.infof("알림 생성: %s (%s)", reminder.id(), triggerAt);
        return reminder;
    }

    @Override
    public Reminder update(String id, ReminderDraft draft) {
        Reminder existing = store.get(id);
        Instant triggerAt = futureTrigger(draft);
        Reminder updated = store.replace(new Reminder(existing.id(),
                draft.title(), draft.description(), triggerAt, true));
        supervisor.reschedule(updated.id());
        log.infof("알림 수정: %s (%s)", updated.id(), triggerAt);
        return updated;
    }

    @Override
    public Reminder remove(String id) {
        Reminder removed = store.remove(id);
        supervisor.cancel(id);
        log.infof("알림 삭제: %s", id);
        return removed;
    }

    @Override
    public Reminder get(String id) {
        return store.get(id);
    }

    @Override
    public List<Reminder> list() {
        return store.listAll();
    }

    @Override
    public int loadAll() {
        List<Reminder> loaded;
        try {
            loaded = persistencePort.loadAll();
        } catch (ReminderPersistenceException e) {
            log.errorf(e, "저장된 알림을 불러오지 못했습니다. 빈 목록으로 시작합니다: %s", e.getMessage());
            warn("저장된 알림을 불러오지 못했습니다: " + e.getMessage());
            return 0;
        }
        Instant now = clock.instant();
        List<Reminder> normalized = new ArrayList<>(loaded.size());
        int expired = 0;
        for (Reminder reminder : loaded) {
            if (reminder.active() && reminder.isDueAt(now)) {
                normalized.add(reminder.withActive(false));
                expired++;
            } else {
                normalized.add(reminder);
            }
        }
        int replaced = supervisor.cancelAll();
        if (replaced > 0) {
            log.infof("다시 불러오기 전에 기존 모니터 %d개를 취소했습니다.", replaced);
        }
        List<Reminder> stored = store.replaceAll(normalized);
        int started = supervisor.scheduleAll(stored);
        log.infof("알림 %d건 복원 (지난 알림 %d건 비활성화, 감시 %d건)", stored.size(), expired, started);
        return started;
    }

    private Instant futureTrigger(ReminderDraft draft) {
        Instant triggerAt = draft.triggerAt(clock.zone());
        if (triggerAt.isBefore(clock.instant())) {
            throw new InvalidReminderException("과거 시각으로 알림을 설정할 수 없습니다.");
        }
        return triggerAt;
    }

    private void warn(String message) {
        try {
            uiPort.scheduleOnUiThread(() -> uiPort.showWarning(message));
        } catch (RuntimeException e) {
            log.warnf(e, "경고 표시 실패: %s", message);
        }
    }
}
