package com.my.reminder.domain.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 왜: 애플리케이션 종료를 모든 모니터와 디스패처가 같은 깃발 하나로 관찰하도록 하기 위함.
 */
public class ShutdownSignal {

    private final AtomicBoolean raised = new AtomicBoolean(false);

    /**
     * @return 이 호출로 처음 올렸으면 true
     */
    public boolean raise() {
        return raised.compareAndSet(false, true);
    }

    public boolean isRaised() {
        return raised.get();
    }
}
