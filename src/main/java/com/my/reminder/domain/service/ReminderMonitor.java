package com.my.reminder.domain.service;

import com.my.reminder.domain.model.MonitorState;
import com.my.reminder.domain.model.NotificationEvent;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.ClockPort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 왜: 알림 하나의 발화 시각을 독립적으로 감시하고, 저장소 전이에 성공했을 때만 정확히 한 번 이벤트를 적재하기 위함.
 *
 * <p>매 틱마다 종료 신호, 자신의 취소 신호, 저장소 상태(삭제/비활성/revision 변경) 순으로 확인한다.
 * 대기는 취소 래치 위에서 이뤄지므로 취소는 즉시, 늦어도 한 폴링 간격 안에 관찰된다.
 * 루프 안의 예기치 못한 예외는 이 모니터만 종료시키며 상위로 전파되지 않는다.
 */
public class ReminderMonitor implements Runnable {

    private static final Logger log = Logger.getLogger(ReminderMonitor.class);

    private final String reminderId;
    private final Instant triggerAt;
    private final long revision;
    private final ReminderStore store;
    private final NotificationQueue queue;
    private final ClockPort clock;
    private final Duration pollInterval;
    private final ShutdownSignal shutdownSignal;
    private final Consumer<ReminderMonitor> onTerminated;
    private final CountDownLatch cancelLatch = new CountDownLatch(1);
    private volatile MonitorState state = MonitorState.SCHEDULED;

    public ReminderMonitor(Reminder reminder,
                           ReminderStore store,
                           NotificationQueue queue,
                           ClockPort clock,
                           Duration pollInterval,
                           ShutdownSignal shutdownSignal,
                           Consumer<ReminderMonitor> onTerminated) {
        this.reminderId = reminder.id();
        this.triggerAt = reminder.triggerAt();
        this.revision = reminder.revision();
        this.store = store;
        this.queue = queue;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.shutdownSignal = shutdownSignal;
        this.onTerminated = onTerminated;
    }

    @Override
    public void run() {
        MDC.put("reminderId", reminderId);
        MonitorState outcome = MonitorState.CANCELLED;
        try {
            log.debugf("감시 시작: trigger=%s, revision=%d", triggerAt, revision);
            outcome = watch();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debugf("감시 스레드 인터럽트: %s", reminderId);
        } catch (RuntimeException e) {
            log.errorf(e, "감시 중 예외로 모니터를 종료합니다: %s", reminderId);
        } finally {
            state = outcome;
            log.debugf("감시 종료: %s (%s)", reminderId, outcome);
            MDC.remove("reminderId");
            onTerminated.accept(this);
        }
    }

    public void cancel() {
        cancelLatch.countDown();
    }

    public String reminderId() {
        return reminderId;
    }

    public long revision() {
        return revision;
    }

    public MonitorState state() {
        return state;
    }

    private MonitorState watch() throws InterruptedException {
        while (true) {
            if (shutdownSignal.isRaised() || cancelLatch.getCount() == 0) {
                return MonitorState.CANCELLED;
            }
            Optional<Reminder> current = store.find(reminderId);
            if (current.isEmpty() || !current.get().active() || current.get().revision() != revision) {
                log.debugf("알림이 삭제/비활성/수정되어 감시를 멈춥니다: %s", reminderId);
                return MonitorState.CANCELLED;
            }
            Instant now = clock.instant();
            if (!now.isBefore(triggerAt)) {
                return fire(now);
            }
            long remaining = Duration.between(now, triggerAt).toMillis();
            long waitMillis = Math.max(1L, Math.min(pollInterval.toMillis(), remaining));
            cancelLatch.await(waitMillis, TimeUnit.MILLISECONDS);
        }
    }

    private MonitorState fire(Instant now) {
        boolean fired = store.fireIfCurrent(reminderId, revision,
                snapshot -> queue.push(NotificationEvent.of(snapshot, now)));
        if (!fired) {
            log.infof("이미 발화했거나 삭제된 알림이라 알림을 보내지 않습니다: %s", reminderId);
            return MonitorState.CANCELLED;
        }
        log.infof("알림 발화: %s (예정 %s, 지연 %dms)", reminderId, triggerAt,
                Duration.between(triggerAt, now).toMillis());
        return MonitorState.FIRED;
    }
}
