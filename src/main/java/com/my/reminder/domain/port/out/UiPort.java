package com.my.reminder.domain.port.out;

import com.my.reminder.domain.model.AlertHandle;
import com.my.reminder.domain.model.Reminder;

import java.util.List;

/**
 * 왜: 단일 스레드 UI 툴킷에 대한 접근을 한 곳으로 모아 모든 화면 변경이 UI 스레드에서만 일어나도록 하기 위함.
 * presentAlert/dismiss/showReminders 는 scheduleOnUiThread 로 넘긴 작업 안에서만 호출해야 한다.
 */
public interface UiPort {

    void scheduleOnUiThread(Runnable task);

    AlertHandle presentAlert(String title, String description);

    /**
     * 이미 닫힌 알림이면 아무 것도 하지 않는다.
     */
    void dismiss(AlertHandle handle);

    void showReminders(List<Reminder> reminders);

    /**
     * 왜: 저장 실패 같은 비치명적 오류를 사용자 흐름을 막지 않고 알리기 위함.
     */
    void showWarning(String message);
}
