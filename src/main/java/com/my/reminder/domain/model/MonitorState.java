package com.my.reminder.domain.model;

/**
 * 왜: 모니터 하나가 도달할 수 있는 상태를 명시해 발화와 취소가 동시에 일어나지 않음을 표현하기 위함.
 */
public enum MonitorState {
    SCHEDULED,
    FIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != SCHEDULED;
    }
}
