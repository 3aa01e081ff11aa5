package com.my.reminder.domain.exception;

/**
 * 왜: 영속화 입출력 실패를 도메인 용어로 감싸 메모리 상태를 되돌리지 않고 경고로만 처리하도록 하기 위함.
 */
public class ReminderPersistenceException extends RuntimeException {
    public ReminderPersistenceException(String message) {
        super(message);
    }

    public ReminderPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
