package com.my.reminder.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    SchedulerConfig scheduler();

    NotificationConfig notification();

    StorageConfig storage();

    UiConfig ui();

    /**
     * 알림 시각을 해석할 시간대. 비어 있으면 시스템 기본 시간대.
     */
    @WithName("zone")
    Optional<String> zone();

    interface SchedulerConfig {
        @WithName("poll-interval-millis")
        @WithDefault("1000")
        long pollIntervalMillis();

        @WithName("shutdown-timeout-seconds")
        @WithDefault("5")
        int shutdownTimeoutSeconds();
    }

    interface NotificationConfig {
        @WithName("queue-poll-millis")
        @WithDefault("1000")
        long queuePollMillis();

        @WithName("dismiss-after-seconds")
        @WithDefault("5")
        int dismissAfterSeconds();

        @WithName("sound-path")
        @WithDefault("./data/notification_sound.wav")
        String soundPath();
    }

    interface StorageConfig {
        @WithName("backend")
        @WithDefault("json")
        String backend();

        @WithName("path")
        @WithDefault("./data/reminders.json")
        String path();
    }

    interface UiConfig {
        @WithName("mode")
        @WithDefault("headless")
        String mode();
    }
}
