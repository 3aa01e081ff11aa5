package com.my.reminder.adapter.out.clock;

import com.my.reminder.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 테스트와 시간대 변환 일관성을 확보하기 위함.
 */
public class ZonedClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private ZonedClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static ZonedClockAdapter system() {
        return new ZonedClockAdapter(ZoneId.systemDefault());
    }

    public static ZonedClockAdapter of(ZoneId zoneId) {
        return new ZonedClockAdapter(zoneId);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }

    @Override
    public ZoneId zone() {
        return zoneId;
    }
}
