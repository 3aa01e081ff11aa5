package com.my.reminder.adapter.out.persistence;

import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.ReminderPersistencePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

@IfBuildProperty(name = "app.storage.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryReminderRepository implements ReminderPersistencePort {

    private final AtomicReference<List<Reminder>> saved = new AtomicReference<>(List.of());

    @Override
    public List<Reminder> loadAll() {
        return saved.get();
    }

    @Override
    public void saveAll(List<Reminder> reminders) {
        saved.set(List.copyOf(reminders));
    }
}
