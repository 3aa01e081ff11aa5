package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.ReminderNotFoundException;
import com.my.reminder.domain.exception.ReminderPersistenceException;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.ReminderPersistencePort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 왜: 알림 상태의 유일한 원본을 하나의 락 아래에 두어 모든 읽기/쓰기를 직렬화하고,
 * 발화 전이(active true→false)를 중복 발화를 막는 상호 배제 지점으로 삼기 위함.
 *
 * <p>변경이 성공할 때마다 전체 스냅숏 저장을 전용 스레드에 맡기며 호출자는 기다리지 않는다.
 * 저장 실패는 로그와 리스너 경고로만 보고되고 메모리 상태는 되돌리지 않는다.
 */
public class ReminderStore implements AutoCloseable {

    private static final Logger log = Logger.getLogger(ReminderStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Reminder> reminders = new LinkedHashMap<>();
    private final List<ReminderStoreListener> listeners = new CopyOnWriteArrayList<>();
    private final ReminderPersistencePort persistencePort;
    private final ExecutorService writer;
    private long revisionSequence = 0L;

    public ReminderStore(ReminderPersistencePort persistencePort) {
        this.persistencePort = persistencePort;
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "reminder-persistence");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(ReminderStoreListener listener) {
        listeners.add(listener);
    }

    /**
     * 새 revision 을 부여해 저장한다. 같은 id 가 있으면 교체한다.
     */
    public Reminder upsert(Reminder reminder) {
        List<Reminder> snapshot;
        Reminder stored;
        lock.lock();
        try {
            stored = reminder.withRevision(++revisionSequence);
            reminders.put(stored.id(), stored);
            snapshot = snapshotLocked();
            requestSaveLocked(snapshot);
        } finally {
            lock.unlock();
        }
        notifyChanged(snapshot);
        return stored;
    }

    /**
     * 기존 항목만 교체한다. 없으면 ReminderNotFoundException.
     */
    public Reminder replace(Reminder reminder) {
        List<Reminder> snapshot;
        Reminder stored;
        lock.lock();
        try {
            if (!reminders.containsKey(reminder.id())) {
                throw new ReminderNotFoundException(reminder.id());
            }
            stored = reminder.withRevision(++revisionSequence);
            reminders.put(stored.id(), stored);
            snapshot = snapshotLocked();
            requestSaveLocked(snapshot);
        } finally {
            lock.unlock();
        }
        notifyChanged(snapshot);
        return stored;
    }

    public Reminder get(String id) {
        return find(id).orElseThrow(() -> new ReminderNotFoundException(id));
    }

    public Optional<Reminder> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(reminders.get(id));
        } finally {
            lock.unlock();
        }
    }

    public Reminder remove(String id) {
        List<Reminder> snapshot;
        Reminder removed;
        lock.lock();
        try {
            removed = reminders.remove(id);
            if (removed == null) {
                throw new ReminderNotFoundException(id);
            }
            snapshot = snapshotLocked();
            requestSaveLocked(snapshot);
        } finally {
            lock.unlock();
        }
        notifyChanged(snapshot);
        return removed;
    }

    public List<Reminder> listAll() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 상태가 실제로 바뀌었으면 true, 이미 같은 값이었으면 false
     * @throws ReminderNotFoundException id 가 없을 때
     */
    public boolean setActive(String id, boolean active) {
        List<Reminder> snapshot;
        lock.lock();
        try {
            Reminder current = reminders.get(id);
            if (current == null) {
                throw new ReminderNotFoundException(id);
            }
            if (current.active() == active) {
                return false;
            }
            reminders.put(id, current.withActive(active));
            snapshot = snapshotLocked();
            requestSaveLocked(snapshot);
        } finally {
            lock.unlock();
        }
        notifyChanged(snapshot);
        return true;
    }

    /**
     * 모니터 전용 발화 전이. 항목이 존재하고 활성이며 revision 이 같을 때만 비활성으로 바꾸고,
     * 같은 임계 구역 안에서 onFired 를 실행해 큐 적재 순서가 전이 순서와 같도록 한다.
     *
     * @return 이 호출이 전이에 성공했으면 true
     */
    public boolean fireIfCurrent(String id, long revision, Consumer<Reminder> onFired) {
        List<Reminder> snapshot;
        lock.lock();
        try {
            Reminder current = reminders.get(id);
            if (current == null || !current.active() || current.revision() != revision) {
                return false;
            }
            Reminder fired = current.withActive(false);
            reminders.put(id, fired);
            onFired.accept(fired);
            snapshot = snapshotLocked();
            requestSaveLocked(snapshot);
        } finally {
            lock.unlock();
        }
        notifyChanged(snapshot);
        return true;
    }

    /**
     * 기동 시 복원 경로. 기존 내용을 모두 버리고 새 revision 으로 채운다.
     */
    public List<Reminder> replaceAll(Collection<Reminder> loaded) {
        List<Reminder> snapshot;
        lock.lock();
        try {
            reminders.clear();
            for (Reminder reminder : loaded) {
                Reminder stored = reminder.withRevision(++revisionSequence);
                reminders.put(stored.id(), stored);
            }
            snapshot = snapshotLocked();
            requestSaveLocked(snapshot);
        } finally {
            lock.unlock();
        }
        notifyChanged(snapshot);
        return snapshot;
    }

    public int size() {
        lock.lock();
        try {
            return reminders.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 대기 중인 저장 요청을 최대 timeout 동안 마무리한다.
     */
    public void flush(Duration timeout) {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warnf("저장 작업이 %s 안에 끝나지 않았습니다.", timeout);
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }

    @Override
    public void close() {
        flush(Duration.ofSeconds(5));
    }

    private List<Reminder> snapshotLocked() {
        return List.copyOf(reminders.values());
    }

    private void requestSaveLocked(List<Reminder> snapshot) {
        try {
            writer.execute(() -> save(snapshot));
        } catch (RejectedExecutionException e) {
            log.warnf("저장 스레드가 종료되어 %d건의 스냅숏을 기록하지 못했습니다.", snapshot.size());
        }
    }

    private void save(List<Reminder> snapshot) {
        try {
            persistencePort.saveAll(snapshot);
            log.debugf("알림 %d건 저장 완료", snapshot.size());
        } catch (RuntimeException e) {
            ReminderPersistenceException failure = e instanceof ReminderPersistenceException known
                    ? known
                    : new ReminderPersistenceException("알림 저장 중 예기치 못한 예외", e);
            log.errorf(e, "알림 저장 실패: %s", failure.getMessage());
            for (ReminderStoreListener listener : listeners) {
                try {
                    listener.persistenceFailed(failure);
                } catch (RuntimeException listenerFailure) {
                    log.warnf(listenerFailure, "저장 실패 리스너 예외: %s", listenerFailure.getMessage());
                }
            }
        }
    }

    private void notifyChanged(List<Reminder> snapshot) {
        for (ReminderStoreListener listener : listeners) {
            try {
                listener.remindersChanged(snapshot);
            } catch (RuntimeException e) {
                log.warnf(e, "변경 리스너 예외: %s", e.getMessage());
            }
        }
    }
}
