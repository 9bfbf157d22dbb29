package com.di.logingest.infra.queue;

import com.di.logingest.config.LogIngestProperties;
import com.di.logingest.exception.LogIngestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * {@link MessageQueue} that writes every payload to {@code <dump-dir>/<id>.json}
 * instead of publishing it. Used to inspect what an enqueue run would send.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "logingest.queue.type", havingValue = "file")
public class FileDumpMessageQueue implements MessageQueue {

    private final Path dumpDir;

    @Autowired
    public FileDumpMessageQueue(LogIngestProperties properties) {
        this(Path.of(properties.getQueue().getDumpDir()));
    }

    public FileDumpMessageQueue(Path dumpDir) {
        this.dumpDir = dumpDir;
    }

    @Override
    public String publish(byte[] payload) {
        String id = UUID.randomUUID().toString();
        Path file = dumpDir.resolve(id + ".json");
        try {
            Files.createDirectories(dumpDir);
            Files.write(file, payload);
        } catch (IOException e) {
            throw new LogIngestException("Failed to dump message to " + file, e);
        }
        log.info("[QUEUE] dumped message {} ({} bytes) to {}", id, payload.length, file);
        return id;
    }
}
