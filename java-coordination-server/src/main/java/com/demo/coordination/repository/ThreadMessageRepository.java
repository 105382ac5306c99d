package com.demo.coordination.repository;

import com.demo.coordination.domain.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ThreadMessageRepository extends JpaRepository<Message, String> {

    /**
     * Newest first; callers reverse for prompt order.
     */
    List<Message> findByThreadIdOrderByCreatedAtDesc(String threadId, Pageable pageable);
}
