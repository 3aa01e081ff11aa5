package com.my.reminder.adapter.out.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.reminder.config.AppConfig;
import com.my.reminder.domain.exception.ReminderPersistenceException;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.ReminderPersistencePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 알림 목록을 사람이 읽을 수 있는 JSON 파일 하나로 보관하고, 파일이 없으면 빈 상태로 시작하기 위함.
 */
@IfBuildProperty(name = "app.storage.backend", stringValue = "json", enableIfMissing = true)
@ApplicationScoped
public class JsonFileReminderRepository implements ReminderPersistencePort {

    private static final Logger log = Logger.getLogger(JsonFileReminderRepository.class);
    private static final TypeReference<List<ReminderJson>> LIST_TYPE = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    @Inject
    public JsonFileReminderRepository(AppConfig appConfig, ObjectMapper objectMapper, ClockPort clockPort) {
        this(Path.of(appConfig.storage().path()), objectMapper, clockPort.zone());
    }

    JsonFileReminderRepository(Path path, ObjectMapper objectMapper, ZoneId zone) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.zone = zone;
    }

    @Override
    public List<Reminder> loadAll() {
        if (!Files.exists(path)) {
            log.infof("알림 파일이 없어 빈 목록으로 시작합니다: %s", path);
            return List.of();
        }
        List<ReminderJson> entries;
        try {
            entries = objectMapper.readValue(path.toFile(), LIST_TYPE);
        } catch (IOException e) {
            throw new ReminderPersistenceException("알림 파일 읽기 실패: " + path, e);
        }
        List<Reminder> reminders = new ArrayList<>(entries.size());
        for (ReminderJson entry : entries) {
            reminders.add(entry.toReminder(zone));
        }
        log.infof("알림 %d건을 불러왔습니다: %s", reminders.size(), path);
        return reminders;
    }

    @Override
    @Retry(maxRetries = 2, delay = 200, retryOn = ReminderPersistenceException.class)
    public void saveAll(List<Reminder> reminders) {
        List<ReminderJson> entries = reminders.stream()
                .map(reminder -> ReminderJson.from(reminder, zone))
                .toList();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
            moveIntoPlace(temp);
        } catch (IOException e) {
            throw new ReminderPersistenceException("알림 파일 쓰기 실패: " + path, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
