package com.sanctionsentinel.service.notify;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanctionsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Development mail sink: messages are appended to a JSON array file instead of being sent.
 */
public class DevOutboxEmailSender implements EmailSender {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public DevOutboxEmailSender(Path file) {
        this.file = file;
    }

    @Override
    public void send(EmailMessage message) throws IOException {
        lock.lock();
        try {
            List<EmailMessage> messages = new ArrayList<>(readAll());
            messages.add(message);
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (OutputStream out = Files.newOutputStream(file)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, messages);
            }
        } finally {
            lock.unlock();
        }
    }

    public List<EmailMessage> messages() throws IOException {
        lock.lock();
        try {
            return readAll();
        } finally {
            lock.unlock();
        }
    }

    private List<EmailMessage> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return MAPPER.readValue(in, new TypeReference<List<EmailMessage>>() {
            });
        }
    }
}
