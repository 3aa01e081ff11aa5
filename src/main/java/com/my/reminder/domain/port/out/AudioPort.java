package com.my.reminder.domain.port.out;

/**
 * 왜: 알림음 재생을 비동기 단위 작업으로 분리해 디스패처가 재생 완료를 기다리지 않도록 하기 위함.
 */
public interface AudioPort {
    void playAsync(String soundRef);
}
