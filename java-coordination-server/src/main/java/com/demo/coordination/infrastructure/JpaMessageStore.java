package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.Message;
import com.demo.coordination.exception.StoreFailureException;
import com.demo.coordination.repository.ThreadMessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class JpaMessageStore implements MessageStore {

    private final ThreadMessageRepository messageRepository;

    public JpaMessageStore(ThreadMessageRepository messageRepository) {
        this.messageRepository = messageRepository;
    }

    @Override
    public Optional<Message> findById(String messageId) {
        try {
            return messageRepository.findById(messageId);
        } catch (DataAccessException e) {
            log.error("Failed to find message: messageId={}", messageId, e);
            throw new StoreFailureException("Message read failed", e);
        }
    }

    @Override
    public List<Message> findRecent(String threadId, int limit) {
        try {
            List<Message> newestFirst = messageRepository.findByThreadIdOrderByCreatedAtDesc(
                    threadId, PageRequest.of(0, limit));
            List<Message> oldestFirst = new ArrayList<>(newestFirst);
            Collections.reverse(oldestFirst);
            return oldestFirst;
        } catch (DataAccessException e) {
            log.error("Failed to read thread history: threadId={}", threadId, e);
            throw new StoreFailureException("Thread history read failed", e);
        }
    }
}
