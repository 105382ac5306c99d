package com.demo.coordination.repository;

import com.demo.coordination.domain.Responder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResponderRepository extends JpaRepository<Responder, String> {

    /**
     * Active responders registered (and still active) in a room
     */
    @Query("SELECT r FROM Responder r " +
           "WHERE r.active = true " +
           "AND r.id IN (SELECT rr.responderId FROM RoomResponder rr " +
           "             WHERE rr.roomId = :roomId AND rr.active = true) " +
           "ORDER BY r.name")
    List<Responder> findActiveByRoomId(@Param("roomId") String roomId);
}
