package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.ReminderPersistenceException;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.UiPort;

import java.util.List;

/**
 * 왜: 저장소 변경과 저장 실패를 화면 갱신/경고로 옮기되, 모든 화면 작업을 UI 스레드로 넘기기 위함.
 */
public class ReminderListPresenter implements ReminderStoreListener {

    private final ReminderStore store;
    private final UiPort uiPort;

    public ReminderListPresenter(ReminderStore store, UiPort uiPort) {
        this.store = store;
        this.uiPort = uiPort;
    }

    @Override
    public void remindersChanged(List<Reminder> snapshot) {
        // 실행 시점의 목록을 다시 읽어 늦게 도착한 갱신이 최신 상태를 덮지 않도록 한다
        uiPort.scheduleOnUiThread(() -> uiPort.showReminders(store.listAll()));
    }

    @Override
    public void persistenceFailed(ReminderPersistenceException failure) {
        uiPort.scheduleOnUiThread(() -> uiPort.showWarning("알림을 저장하지 못했습니다: " + failure.getMessage()));
    }
}
