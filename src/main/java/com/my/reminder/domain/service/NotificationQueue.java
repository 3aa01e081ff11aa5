package com.my.reminder.domain.service;

import com.my.reminder.domain.model.NotificationEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 여러 모니터가 동시에 발화해도 이벤트를 잃지 않고 발화 순서대로 단일 디스패처에 넘기기 위함.
 * 적재는 절대 막히지 않는다. 생산자 수는 활성 알림 수로 제한되므로 상한을 두지 않는다.
 */
public class NotificationQueue {

    private final BlockingQueue<NotificationEvent> events = new LinkedBlockingQueue<>();

    public void push(NotificationEvent event) {
        Objects.requireNonNull(event, "event");
        events.add(event);
    }

    public Optional<NotificationEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int size() {
        return events.size();
    }
}
