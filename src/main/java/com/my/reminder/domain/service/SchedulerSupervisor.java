package com.my.reminder.domain.service;

import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.ClockPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 왜: 모니터의 생성과 취소를 한 곳에서 관리해 알림 id 당 등록된 모니터 핸들이 최대 하나임을 보장하고,
 * 종료 시 모든 모니터와 디스패처를 한 번에 정리하는 유일한 지점을 두기 위함.
 */
public class SchedulerSupervisor {

    private static final Logger log = Logger.getLogger(SchedulerSupervisor.class);

    private final ReminderStore store;
    private final NotificationQueue queue;
    private final ClockPort clock;
    private final NotificationDispatcher dispatcher;
    private final ShutdownSignal shutdownSignal;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;
    private final Map<String, ReminderMonitor> handles = new ConcurrentHashMap<>();
    private final ExecutorService monitorPool;
    private volatile Thread dispatcherThread;

    public SchedulerSupervisor(ReminderStore store,
                               NotificationQueue queue,
                               ClockPort clock,
                               NotificationDispatcher dispatcher,
                               ShutdownSignal shutdownSignal,
                               Duration pollInterval,
                               Duration shutdownTimeout) {
        this.store = store;
        this.queue = queue;
        this.clock = clock;
        this.dispatcher = dispatcher;
        this.shutdownSignal = shutdownSignal;
        this.pollInterval = pollInterval;
        this.shutdownTimeout = shutdownTimeout;
        AtomicInteger sequence = new AtomicInteger();
        this.monitorPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "reminder-monitor-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (dispatcherThread != null || shutdownSignal.isRaised()) {
            return;
        }
        Thread thread = new Thread(dispatcher, "notification-dispatcher");
        thread.setDaemon(true);
        dispatcherThread = thread;
        thread.start();
    }

    /**
     * 활성 알림에 대해 모니터를 띄운다. 같은 id 의 핸들이 같거나 더 새로운 revision 이면 거절하고,
     * 더 오래된 revision 이면 그 모니터를 취소한 뒤 교체한다.
     *
     * @return 새 모니터를 시작했으면 true
     */
    public synchronized boolean schedule(Reminder reminder) {
        if (shutdownSignal.isRaised()) {
            log.debugf("종료 중이라 감시를 시작하지 않습니다: %s", reminder.id());
            return false;
        }
        if (!reminder.active()) {
            return false;
        }
        ReminderMonitor existing = handles.get(reminder.id());
        if (existing != null) {
            if (existing.revision() >= reminder.revision()) {
                log.warnf("이미 감시 중인 알림입니다. 두 번째 모니터를 거절합니다: %s", reminder.id());
                return false;
            }
            log.debugf("이전 revision(%d)의 모니터를 새 revision(%d)으로 교체합니다: %s",
                    existing.revision(), reminder.revision(), reminder.id());
            cancel(reminder.id());
        }
        ReminderMonitor monitor = new ReminderMonitor(reminder, store, queue, clock, pollInterval,
                shutdownSignal, this::release);
        handles.put(reminder.id(), monitor);
        try {
            monitorPool.execute(monitor);
        } catch (RejectedExecutionException e) {
            handles.remove(reminder.id(), monitor);
            log.warnf("모니터 풀이 종료되어 감시를 시작하지 못했습니다: %s", reminder.id());
            return false;
        }
        return true;
    }

    /**
     * 기존 모니터를 먼저 취소한 뒤, 저장소의 최신 상태로 새 모니터를 띄운다.
     */
    public synchronized boolean reschedule(String reminderId) {
        cancel(reminderId);
        Optional<Reminder> latest = store.find(reminderId);
        return latest.filter(Reminder::active).map(this::schedule).orElse(false);
    }

    /**
     * 핸들은 취소 신호를 보내는 즉시 빠진다. 취소된 모니터 스레드는 다음 확인 시점까지 잠시 남을 수 있지만
     * revision 이 달라 발화하지 못한다.
     */
    public synchronized boolean cancel(String reminderId) {
        ReminderMonitor monitor = handles.remove(reminderId);
        if (monitor == null) {
            return false;
        }
        monitor.cancel();
        log.debugf("감시 취소: %s", reminderId);
        return true;
    }

    public synchronized int cancelAll() {
        int cancelled = 0;
        for (String reminderId : List.copyOf(handles.keySet())) {
            if (cancel(reminderId)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int scheduleAll(List<Reminder> reminders) {
        int started = 0;
        for (Reminder reminder : reminders) {
            if (schedule(reminder)) {
                started++;
            }
        }
        return started;
    }

    public void shutdown() {
        if (!shutdownSignal.raise()) {
            return;
        }
        log.infof("스케줄러 종료: 모니터 %d개 취소", handles.size());
        handles.values().forEach(ReminderMonitor::cancel);
        monitorPool.shutdown();
        long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        try {
            if (!monitorPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warnf("모니터가 %s 안에 끝나지 않았습니다.", shutdownTimeout);
                monitorPool.shutdownNow();
            }
            Thread thread = dispatcherThread;
            if (thread != null) {
                long remainingMillis = Math.max(1L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
                thread.join(remainingMillis);
                if (thread.isAlive()) {
                    log.warn("디스패처가 제한 시간 안에 끝나지 않았습니다.");
                    thread.interrupt();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            monitorPool.shutdownNow();
        }
    }

    public boolean isMonitoring(String reminderId) {
        return handles.containsKey(reminderId);
    }

    public Optional<ReminderMonitor> monitorFor(String reminderId) {
        return Optional.ofNullable(handles.get(reminderId));
    }

    public int activeMonitorCount() {
        return handles.size();
    }

    public boolean isDispatcherRunning() {
        Thread thread = dispatcherThread;
        return thread != null && thread.isAlive();
    }

    public boolean isShutdown() {
        return shutdownSignal.isRaised();
    }

    private void release(ReminderMonitor monitor) {
        handles.remove(monitor.reminderId(), monitor);
    }
}
