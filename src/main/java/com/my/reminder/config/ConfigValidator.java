package com.my.reminder.config;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);
    static final long MAX_POLL_INTERVAL_MILLIS = 1000L;

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        long poll = appConfig.scheduler().pollIntervalMillis();
        if (poll <= 0 || poll > MAX_POLL_INTERVAL_MILLIS) {
            throw new IllegalStateException("폴링 간격은 1~" + MAX_POLL_INTERVAL_MILLIS + "ms 사이여야 합니다: " + poll);
        }
        requirePositive("app.scheduler.shutdown-timeout-seconds", appConfig.scheduler().shutdownTimeoutSeconds());
        requirePositive("app.notification.dismiss-after-seconds", appConfig.notification().dismissAfterSeconds());
        requirePositive("app.notification.queue-poll-millis", appConfig.notification().queuePollMillis());
        appConfig.zone().ifPresent(this::validateZone);
        warnIfMissing("SOUND_PATH", appConfig.notification().soundPath());
    }

    private void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalStateException("양수여야 하는 설정입니다: " + name + "=" + value);
        }
    }

    private void validateZone(String zone) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("알 수 없는 시간대입니다: " + zone, e);
        }
    }

    // 알림음이 없어도 알림은 동작하므로 기동을 막지 않는다
    private void warnIfMissing(String name, String path) {
        if (!Files.exists(Path.of(path))) {
            log.warnf("경로가 존재하지 않습니다: %s=%s (알림음 없이 동작합니다)", name, path);
        }
    }
}
