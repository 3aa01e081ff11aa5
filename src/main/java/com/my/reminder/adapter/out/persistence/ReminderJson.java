package com.my.reminder.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.my.reminder.domain.exception.ReminderPersistenceException;
import com.my.reminder.domain.model.Reminder;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * 왜: 파일에 기록되는 필드 이름과 시각 형식("yyyy-MM-dd HH:mm", 로컬 시간)을 도메인 모델과 분리해 고정하기 위함.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReminderJson(@JsonProperty("id") String id,
                           @JsonProperty("title") String title,
                           @JsonProperty("description") String description,
                           @JsonProperty("trigger_time") String triggerTime,
                           @JsonProperty("is_active") boolean active) {

    static final DateTimeFormatter TRIGGER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public ReminderJson {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(triggerTime, "trigger_time");
    }

    public static ReminderJson from(Reminder reminder, ZoneId zone) {
        String trigger = TRIGGER_FORMAT.format(reminder.triggerAt().atZone(zone).toLocalDateTime());
        return new ReminderJson(reminder.id(), reminder.title(), reminder.description(), trigger, reminder.active());
    }

    public Reminder toReminder(ZoneId zone) {
        try {
            LocalDateTime local = LocalDateTime.parse(triggerTime, TRIGGER_FORMAT);
            return new Reminder(id, title, description, local.atZone(zone).toInstant(), active);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new ReminderPersistenceException("저장된 알림 형식이 올바르지 않습니다: " + id, e);
        }
    }
}
