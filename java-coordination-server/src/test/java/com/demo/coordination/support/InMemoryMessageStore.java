package com.demo.coordination.support;

import com.demo.coordination.domain.Message;
import com.demo.coordination.infrastructure.MessageStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryMessageStore implements MessageStore {

    private final Map<String, Message> messages = new ConcurrentHashMap<>();

    public void save(Message message) {
        messages.put(message.getId(), message);
    }

    @Override
    public Optional<Message> findById(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public List<Message> findRecent(String threadId, int limit) {
        List<Message> newestFirst = messages.values().stream()
                .filter(message -> threadId.equals(message.getThreadId()))
                .sorted(Comparator.comparing(Message::getCreatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
        List<Message> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }

    public List<Message> findByThread(String threadId) {
        return messages.values().stream()
                .filter(message -> threadId.equals(message.getThreadId()))
                .collect(Collectors.toList());
    }
}
