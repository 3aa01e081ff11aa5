package com.my.reminder.domain.model;

import java.util.Objects;

/**
 * 왜: UI 어댑터가 띄운 알림 창을 도메인이 구체 타입 없이 다시 닫을 수 있도록 식별자만 노출하기 위함.
 */
public record AlertHandle(String id) {
    public AlertHandle {
        Objects.requireNonNull(id, "id");
    }
}
