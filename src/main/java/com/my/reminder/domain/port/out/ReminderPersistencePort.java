package com.my.reminder.domain.port.out;

import com.my.reminder.domain.model.Reminder;

import java.util.List;

/**
 * 왜: 알림 목록의 저장 형식(JSON 파일 등)을 도메인에서 분리해 저장 실패가 스케줄링에 영향을 주지 않도록 하기 위함.
 */
public interface ReminderPersistencePort {
    /**
     * 왜: 재시작 후에도 알림을 복원하기 위함. 파일이 없으면 빈 목록을 돌려준다.
     */
    List<Reminder> loadAll();

    /**
     * 왜: 메모리 상태의 전체 스냅숏을 기록하기 위함. 실패 시 ReminderPersistenceException.
     */
    void saveAll(List<Reminder> reminders);
}
