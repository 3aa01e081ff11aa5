package com.my.reminder.adapter.out.ui;

import com.my.reminder.domain.model.AlertHandle;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.UiPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 왜: 화면이 없는 환경(서버, CI)에서도 UI 단일 스레드 규칙을 그대로 지키며 알림을 로그로 남기기 위함.
 */
@IfBuildProperty(name = "app.ui.mode", stringValue = "headless", enableIfMissing = true)
@ApplicationScoped
public class HeadlessUiAdapter implements UiPort {

    private static final Logger log = Logger.getLogger(HeadlessUiAdapter.class);
    static final String UI_THREAD_NAME = "ui";

    private final ExecutorService uiThread = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, UI_THREAD_NAME);
        thread.setDaemon(true);
        return thread;
    });
    private final Map<String, String> openAlerts = new ConcurrentHashMap<>();

    @Override
    public void scheduleOnUiThread(Runnable task) {
        uiThread.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.errorf(e, "UI 작업 실패: %s", e.getMessage());
            }
        });
    }

    @Override
    public AlertHandle presentAlert(String title, String description) {
        requireUiThread();
        AlertHandle handle = new AlertHandle(UUID.randomUUID().toString());
        openAlerts.put(handle.id(), title);
        log.infof("[ALERT] %s - %s", title, description);
        return handle;
    }

    @Override
    public void dismiss(AlertHandle handle) {
        requireUiThread();
        if (openAlerts.remove(handle.id()) != null) {
            log.debugf("[ALERT] 닫힘: %s", handle.id());
        }
    }

    @Override
    public void showReminders(List<Reminder> reminders) {
        requireUiThread();
        log.debugf("알림 목록 갱신: %d건", reminders.size());
    }

    @Override
    public void showWarning(String message) {
        log.warnf("[WARNING] %s", message);
    }

    public int openAlertCount() {
        return openAlerts.size();
    }

    @PreDestroy
    void stop() {
        uiThread.shutdownNow();
    }

    private void requireUiThread() {
        if (!UI_THREAD_NAME.equals(Thread.currentThread().getName())) {
            throw new IllegalStateException("UI 스레드 밖에서 화면을 변경할 수 없습니다: " + Thread.currentThread().getName());
        }
    }
}
