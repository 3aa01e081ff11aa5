package com.my.reminder.config;

import com.my.reminder.adapter.out.clock.ZonedClockAdapter;
import com.my.reminder.domain.port.in.ReminderUseCase;
import com.my.reminder.domain.port.out.AudioPort;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.ReminderPersistencePort;
import com.my.reminder.domain.port.out.UiPort;
import com.my.reminder.domain.service.NotificationDispatcher;
import com.my.reminder.domain.service.NotificationQueue;
import com.my.reminder.domain.service.ReminderListPresenter;
import com.my.reminder.domain.service.ReminderService;
import com.my.reminder.domain.service.ReminderStore;
import com.my.reminder.domain.service.SchedulerSupervisor;
import com.my.reminder.domain.service.ShutdownSignal;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 * 도메인 클래스는 프록시 없이 쓰도록 @Singleton 으로 노출한다.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return appConfig.zone()
                .map(zone -> ZonedClockAdapter.of(ZoneId.of(zone)))
                .orElseGet(ZonedClockAdapter::system);
    }

    @Produces
    @Singleton
    public ReminderStore reminderStore(ReminderPersistencePort persistencePort, UiPort uiPort) {
        ReminderStore store = new ReminderStore(persistencePort);
        store.addListener(new ReminderListPresenter(store, uiPort));
        return store;
    }

    void closeReminderStore(@Disposes ReminderStore store) {
        store.close();
    }

    @Produces
    @Singleton
    public NotificationQueue notificationQueue() {
        return new NotificationQueue();
    }

    @Produces
    @Singleton
    public ShutdownSignal shutdownSignal() {
        return new ShutdownSignal();
    }

    @Produces
    @Singleton
    public NotificationDispatcher notificationDispatcher(NotificationQueue queue,
                                                         UiPort uiPort,
                                                         AudioPort audioPort,
                                                         ShutdownSignal shutdownSignal,
                                                         AppConfig appConfig) {
        AppConfig.NotificationConfig notification = appConfig.notification();
        return new NotificationDispatcher(queue, uiPort, audioPort, shutdownSignal,
                Duration.ofMillis(notification.queuePollMillis()),
                Duration.ofSeconds(notification.dismissAfterSeconds()),
                notification.soundPath());
    }

    @Produces
    @Singleton
    public SchedulerSupervisor schedulerSupervisor(ReminderStore store,
                                                   NotificationQueue queue,
                                                   ClockPort clockPort,
                                                   NotificationDispatcher dispatcher,
                                                   ShutdownSignal shutdownSignal,
                                                   AppConfig appConfig) {
        AppConfig.SchedulerConfig scheduler = appConfig.scheduler();
        return new SchedulerSupervisor(store, queue, clockPort, dispatcher, shutdownSignal,
                Duration.ofMillis(scheduler.pollIntervalMillis()),
                Duration.ofSeconds(scheduler.shutdownTimeoutSeconds()));
    }

    @Produces
    @ApplicationScoped
    public ReminderUseCase reminderUseCase(ReminderStore store,
                                           SchedulerSupervisor supervisor,
                                           ReminderPersistencePort persistencePort,
                                           UiPort uiPort,
                                           ClockPort clockPort) {
        return new ReminderService(store, supervisor, persistencePort, uiPort, clockPort);
    }
}
