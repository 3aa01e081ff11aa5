package com.my.reminder.adapter.out.audio;

import com.my.reminder.domain.port.out.AudioPort;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * 왜: 알림음 재생을 별도 스레드의 단위 작업으로 실행하고, 재생 실패는 로그로만 남겨 스케줄링 코어로 전파되지 않게 하기 위함.
 */
@ApplicationScoped
public class JavaSoundAudioAdapter implements AudioPort {

    private static final Logger log = Logger.getLogger(JavaSoundAudioAdapter.class);

    private final ExecutorService player = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "audio-player");
        thread.setDaemon(true);
        return thread;
    });

    @Override
    public void playAsync(String soundRef) {
        try {
            player.execute(() -> play(soundRef));
        } catch (RejectedExecutionException e) {
            log.debugf("재생 스레드가 종료되어 알림음을 건너뜁니다: %s", soundRef);
        }
    }

    void play(String soundRef) {
        if (soundRef == null || soundRef.isBlank()) {
            return;
        }
        Path path = Path.of(soundRef);
        if (!Files.exists(path)) {
            log.warnf("알림음 파일이 없습니다: %s", path.toAbsolutePath());
            return;
        }
        try (AudioInputStream stream = AudioSystem.getAudioInputStream(path.toFile())) {
            Clip clip = AudioSystem.getClip();
            clip.open(stream);
            clip.addLineListener(event -> {
                if (event.getType() == LineEvent.Type.STOP) {
                    clip.close();
                }
            });
            clip.start();
        } catch (UnsupportedAudioFileException | LineUnavailableException | IOException e) {
            log.warnf("알림음 재생 실패: %s (%s)", soundRef, e.getMessage());
        } catch (RuntimeException e) {
            // 헤드리스 환경 등에서 믹서가 없으면 IllegalArgumentException 이 난다
            log.warnf("알림음 재생 실패: %s (%s)", soundRef, e.getMessage());
        }
    }

    @PreDestroy
    void stop() {
        player.shutdownNow();
    }
}
