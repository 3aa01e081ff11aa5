package com.my.reminder.domain.service;

import com.my.reminder.domain.model.AlertHandle;
import com.my.reminder.domain.model.NotificationEvent;
import com.my.reminder.domain.port.out.AudioPort;
import com.my.reminder.domain.port.out.UiPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 왜: 큐의 유일한 소비자로서 알림 전달(알림 창 + 알림음)을 순서대로 시작하되,
 * 어느 쪽의 완료도 기다리지 않아 다음 이벤트 처리가 막히지 않도록 하기 위함.
 */
public class NotificationDispatcher implements Runnable {

    private static final Logger log = Logger.getLogger(NotificationDispatcher.class);

    private final NotificationQueue queue;
    private final UiPort uiPort;
    private final AudioPort audioPort;
    private final ShutdownSignal shutdownSignal;
    private final Duration pollTimeout;
    private final Duration dismissAfter;
    private final String soundRef;
    private final ScheduledExecutorService dismissScheduler;
    private final AtomicLong delivered = new AtomicLong();

    public NotificationDispatcher(NotificationQueue queue,
                                  UiPort uiPort,
                                  AudioPort audioPort,
                                  ShutdownSignal shutdownSignal,
                                  Duration pollTimeout,
                                  Duration dismissAfter,
                                  String soundRef) {
        this.queue = queue;
        this.uiPort = uiPort;
        this.audioPort = audioPort;
        this.shutdownSignal = shutdownSignal;
        this.pollTimeout = pollTimeout;
        this.dismissAfter = dismissAfter;
        this.soundRef = soundRef;
        this.dismissScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "alert-dismiss");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void run() {
        log.info("알림 디스패처 시작");
        try {
            while (!shutdownSignal.isRaised()) {
                Optional<NotificationEvent> next = queue.poll(pollTimeout);
                next.ifPresent(this::deliver);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            dismissScheduler.shutdownNow();
            log.infof("알림 디스패처 종료 (전달 %d건, 미전달 %d건)", delivered.get(), queue.size());
        }
    }

    public long deliveredCount() {
        return delivered.get();
    }

    void deliver(NotificationEvent event) {
        log.infof("알림 전달: %s", event.title());
        try {
            audioPort.playAsync(soundRef);
        } catch (RuntimeException e) {
            log.warnf(e, "알림음 요청 실패: %s", e.getMessage());
        }
        try {
            uiPort.scheduleOnUiThread(() -> present(event));
        } catch (RuntimeException e) {
            log.errorf(e, "알림 창 예약 실패: %s", event.title());
        }
        delivered.incrementAndGet();
    }

    private void present(NotificationEvent event) {
        AlertHandle handle;
        try {
            handle = uiPort.presentAlert(event.title(), event.description());
        } catch (RuntimeException e) {
            log.errorf(e, "알림 창 표시 실패: %s", event.title());
            return;
        }
        try {
            dismissScheduler.schedule(() -> uiPort.scheduleOnUiThread(() -> dismissQuietly(handle)),
                    dismissAfter.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debugf("종료 중이라 자동 닫기를 예약하지 않습니다: %s", handle.id());
        }
    }

    private void dismissQuietly(AlertHandle handle) {
        try {
            uiPort.dismiss(handle);
        } catch (RuntimeException e) {
            log.warnf(e, "알림 창 닫기 실패: %s", handle.id());
        }
    }
}
