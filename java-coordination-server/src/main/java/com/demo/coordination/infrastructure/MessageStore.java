package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.Message;

import java.util.List;
import java.util.Optional;

public interface MessageStore {

    Optional<Message> findById(String messageId);

    /**
     * The newest {@code limit} messages of a thread, oldest first.
     */
    List<Message> findRecent(String threadId, int limit);
}
