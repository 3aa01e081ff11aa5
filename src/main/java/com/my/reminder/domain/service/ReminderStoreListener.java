package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.ReminderPersistenceException;
import com.my.reminder.domain.model.Reminder;

import java.util.List;

/**
 * 왜: 저장소 변경을 화면 목록 갱신이나 경고 표시로 연결하되, 저장소가 UI 를 직접 알지 않도록 하기 위함.
 * 콜백은 변경을 수행한 스레드(또는 저장 스레드)에서 호출되므로 UI 작업은 구현 쪽에서 UI 스레드로 넘겨야 한다.
 */
public interface ReminderStoreListener {

    void remindersChanged(List<Reminder> snapshot);

    default void persistenceFailed(ReminderPersistenceException failure) {
    }
}
