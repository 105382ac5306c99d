package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.Responder;

import java.util.List;
import java.util.Optional;

public interface ResponderDirectory {

    Optional<Responder> findResponder(String responderId);

    List<Responder> findActiveRoomResponders(String roomId);
}
