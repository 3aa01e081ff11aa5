package com.my.reminder.adapter.in.lifecycle;

import com.my.reminder.domain.port.in.ReminderUseCase;
import com.my.reminder.domain.service.ReminderStore;
import com.my.reminder.domain.service.SchedulerSupervisor;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * 왜: 기동 시 저장된 알림 복원과 디스패처 시작, 종료 시 모든 모니터 정리를 애플리케이션 수명주기에 묶기 위함.
 */
@Startup
@ApplicationScoped
public class ReminderLifecycle {

    private static final Logger log = Logger.getLogger(ReminderLifecycle.class);

    private final ReminderUseCase reminderUseCase;
    private final SchedulerSupervisor supervisor;
    private final ReminderStore store;

    @Inject
    public ReminderLifecycle(ReminderUseCase reminderUseCase, SchedulerSupervisor supervisor, ReminderStore store) {
        this.reminderUseCase = reminderUseCase;
        this.supervisor = supervisor;
        this.store = store;
    }

    @PostConstruct
    void start() {
        supervisor.start();
        int monitoring = reminderUseCase.loadAll();
        log.infof("알림 스케줄러 시작: 감시 중 %d건", monitoring);
    }

    @PreDestroy
    void stop() {
        supervisor.shutdown();
        store.flush(Duration.ofSeconds(5));
        log.info("알림 스케줄러 종료");
    }
}
