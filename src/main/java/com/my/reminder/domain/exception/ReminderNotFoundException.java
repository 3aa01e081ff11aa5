package com.my.reminder.domain.exception;

/**
 * 왜: 저장소에 없는 id 를 참조한 호출을 호출자에게 알리되, 스케줄링 코어에는 치명적이지 않게 다루기 위함.
 */
public class ReminderNotFoundException extends RuntimeException {

    private final String reminderId;

    public ReminderNotFoundException(String reminderId) {
        super("알림을 찾을 수 없습니다: " + reminderId);
        this.reminderId = reminderId;
    }

    public String reminderId() {
        return reminderId;
    }
}
