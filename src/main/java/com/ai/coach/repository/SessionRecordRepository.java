package com.ai.coach.repository;

import com.ai.coach.entity.SessionRecord;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SessionRecordRepository extends JpaRepository<SessionRecord, Long> {
    Optional<SessionRecord> findBySessionId(String sessionId);

    boolean existsBySessionId(String sessionId);

    List<SessionRecord> findAllByOrderByUpdatedAtDesc();
}
