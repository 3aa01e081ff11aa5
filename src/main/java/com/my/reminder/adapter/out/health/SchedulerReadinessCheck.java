package com.my.reminder.adapter.out.health;

import com.my.reminder.config.AppConfig;
import com.my.reminder.domain.service.NotificationQueue;
import com.my.reminder.domain.service.ReminderStore;
import com.my.reminder.domain.service.SchedulerSupervisor;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class SchedulerReadinessCheck implements HealthCheck {

    private final SchedulerSupervisor supervisor;
    private final ReminderStore store;
    private final NotificationQueue queue;
    private final AppConfig appConfig;

    public SchedulerReadinessCheck(SchedulerSupervisor supervisor,
                                   ReminderStore store,
                                   NotificationQueue queue,
                                   AppConfig appConfig) {
        this.supervisor = supervisor;
        this.store = store;
        this.queue = queue;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        boolean dispatcherUp = supervisor.isDispatcherRunning();
        return HealthCheckResponse.named("reminder-scheduler")
                .withData("dispatcherRunning", dispatcherUp)
                .withData("activeMonitors", supervisor.activeMonitorCount())
                .withData("reminders", store.size())
                .withData("pendingNotifications", queue.size())
                .withData("storagePath", appConfig.storage().path())
                .status(dispatcherUp && !supervisor.isShutdown())
                .build();
    }
}
