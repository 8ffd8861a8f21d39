package com.ai.coach.repository;

import com.ai.coach.entity.ConversationMessage;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {
	List<ConversationMessage> findBySessionIdOrderByTurnAscIdAsc(String sessionId);

}
