package com.my.reminder.domain.exception;

/**
 * 왜: 입력 경계에서 계약을 위반한 알림(빈 제목, 잘못된 시각, 과거 시각)을 코어 진입 전에 명확히 거부하기 위함.
 */
public class InvalidReminderException extends RuntimeException {
    public InvalidReminderException(String message) {
        super(message);
    }

    public InvalidReminderException(String message, Throwable cause) {
        super(message, cause);
    }
}
