package com.study.webflux.agent.infrastructure.history.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

import com.study.webflux.agent.domain.dialogue.entity.ConversationEntity;
import reactor.core.publisher.Flux;

public interface ConversationMongoRepository
	extends
		ReactiveMongoRepository<ConversationEntity, String> {

	/** 같은 시각에 저장된 턴은 ObjectId 순서로 구분합니다. */
	Flux<ConversationEntity> findByConversationIdOrderByCreatedAtDescIdDesc(String conversationId,
		Pageable pageable);
}
