package com.my.reminder.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 발화 시점의 제목/설명만 담아 전달해 디스패처가 저장소를 다시 조회할 필요가 없도록 하기 위함.
 */
public record NotificationEvent(String title, String description, Instant firedAt) {

    public NotificationEvent {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(firedAt, "firedAt");
        description = description == null ? "" : description;
    }

    public static NotificationEvent of(Reminder reminder, Instant firedAt) {
        return new NotificationEvent(reminder.title(), reminder.description(), firedAt);
    }
}
