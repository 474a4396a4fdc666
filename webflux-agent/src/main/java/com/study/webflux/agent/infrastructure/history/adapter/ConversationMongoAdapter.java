package com.study.webflux.agent.infrastructure.history.adapter;

import java.util.Collections;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.dialogue.entity.ConversationEntity;
import com.study.webflux.agent.domain.dialogue.model.ConversationId;
import com.study.webflux.agent.domain.dialogue.model.ConversationTurn;
import com.study.webflux.agent.domain.dialogue.model.MessageRole;
import com.study.webflux.agent.domain.dialogue.port.ConversationRepository;
import com.study.webflux.agent.infrastructure.history.repository.ConversationMongoRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** MongoDB 기반 대화 기록 어댑터입니다. */
@Component
@ConditionalOnProperty(prefix = "agent.history", name = "backend", havingValue = "mongo", matchIfMissing = true)
public class ConversationMongoAdapter implements ConversationRepository {

	private final ConversationMongoRepository mongoRepository;

	public ConversationMongoAdapter(ConversationMongoRepository mongoRepository) {
		this.mongoRepository = mongoRepository;
	}

	@Override
	public Mono<ConversationTurn> save(ConversationTurn turn) {
		ConversationEntity entity = new ConversationEntity(
			turn.id(),
			turn.conversationId().value(),
			turn.role().getValue(),
			turn.content(),
			turn.createdAt());
		return mongoRepository.save(entity)
			.map(this::toConversationTurn);
	}

	/** 최근 턴을 저장 순서대로 조회합니다. */
	@Override
	public Flux<ConversationTurn> findRecent(ConversationId conversationId, int limit) {
		if (limit <= 0) {
			return Flux.empty();
		}
		return mongoRepository
			.findByConversationIdOrderByCreatedAtDescIdDesc(conversationId.value(),
				PageRequest.of(0, limit))
			.map(this::toConversationTurn)
			.collectList()
			.flatMapMany(list -> {
				Collections.reverse(list);
				return Flux.fromIterable(list);
			});
	}

	private ConversationTurn toConversationTurn(ConversationEntity entity) {
		return ConversationTurn.withId(
			entity.id(),
			ConversationId.of(entity.conversationId()),
			MessageRole.fromValue(entity.role()),
			entity.content(),
			entity.createdAt());
	}
}
