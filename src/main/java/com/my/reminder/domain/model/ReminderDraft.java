package com.my.reminder.domain.model;

import com.my.reminder.domain.exception.InvalidReminderException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * 왜: 사용자가 입력한 원시 값(날짜/시각 문자열)을 코어에 들어오기 전에 검증하고 절대 시각으로 변환하기 위함.
 */
public record ReminderDraft(String title, String description, String date, String time) {

    static final DateTimeFormatter INPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy-M-d H:mm");

    public ReminderDraft {
        title = title == null ? "" : title.strip();
        description = description == null ? "" : description.strip();
        date = date == null ? "" : date.strip();
        time = time == null ? "" : time.strip();
    }

    public static ReminderDraft of(String title, String description, LocalDateTime trigger) {
        return new ReminderDraft(title, description,
                trigger.toLocalDate().toString(),
                String.format("%02d:%02d", trigger.getHour(), trigger.getMinute()));
    }

    public void validate() {
        if (title.isEmpty()) {
            throw new InvalidReminderException("제목은 비어 있을 수 없습니다.");
        }
        parseLocal();
    }

    public Instant triggerAt(ZoneId zone) {
        validate();
        return parseLocal().atZone(zone).toInstant();
    }

    private LocalDateTime parseLocal() {
        try {
            return LocalDateTime.parse(date + " " + time, INPUT_FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidReminderException("시간 형식이 올바르지 않습니다. HH:MM(24시간) 형식을 사용하세요: " + date + " " + time, e);
        }
    }
}
