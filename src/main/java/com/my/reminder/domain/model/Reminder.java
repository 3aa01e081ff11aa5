package com.my.reminder.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 알림 한 건의 상태를 불변 값으로 고정해 저장소 밖에서 임의로 변경되지 않도록 하기 위함.
 * revision 은 저장소가 upsert 마다 증가시키며, 모니터가 자신이 감시하던 버전인지 판별하는 기준이 된다.
 */
public record Reminder(
        String id,
        String title,
        String description,
        Instant triggerAt,
        boolean active,
        long revision
) {
    public Reminder {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(triggerAt, "triggerAt");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id는 비어 있을 수 없습니다.");
        }
        if (title.isBlank()) {
            throw new IllegalArgumentException("알림 제목은 비어 있을 수 없습니다.");
        }
        description = description == null ? "" : description;
    }

    public Reminder(String id, String title, String description, Instant triggerAt, boolean active) {
        this(id, title, description, triggerAt, active, 0L);
    }

    public Reminder withActive(boolean value) {
        return new Reminder(id, title, description, triggerAt, value, revision);
    }

    public Reminder withRevision(long value) {
        return new Reminder(id, title, description, triggerAt, active, value);
    }

    public boolean isDueAt(Instant now) {
        return !now.isBefore(triggerAt);
    }
}
