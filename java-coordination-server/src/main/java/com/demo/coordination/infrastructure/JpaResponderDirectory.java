package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.Responder;
import com.demo.coordination.exception.StoreFailureException;
import com.demo.coordination.repository.ResponderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class JpaResponderDirectory implements ResponderDirectory {

    private final ResponderRepository responderRepository;

    public JpaResponderDirectory(ResponderRepository responderRepository) {
        this.responderRepository = responderRepository;
    }

    @Override
    public Optional<Responder> findResponder(String responderId) {
        try {
            return responderRepository.findById(responderId);
        } catch (DataAccessException e) {
            log.error("Error fetching responder: responderId={}", responderId, e);
            throw new StoreFailureException("Responder read failed", e);
        }
    }

    @Override
    public List<Responder> findActiveRoomResponders(String roomId) {
        try {
            return responderRepository.findActiveByRoomId(roomId);
        } catch (DataAccessException e) {
            log.error("Error fetching room responders: roomId={}", roomId, e);
            throw new StoreFailureException("Room responder read failed", e);
        }
    }
}
