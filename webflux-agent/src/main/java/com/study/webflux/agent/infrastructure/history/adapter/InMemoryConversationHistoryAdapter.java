package com.study.webflux.agent.infrastructure.history.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.dialogue.model.ConversationId;
import com.study.webflux.agent.domain.dialogue.model.ConversationTurn;
import com.study.webflux.agent.domain.dialogue.port.ConversationRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** 프로세스 메모리 대화 기록입니다. 재시작하면 사라집니다. */
@Component
@ConditionalOnProperty(prefix = "agent.history", name = "backend", havingValue = "memory")
public class InMemoryConversationHistoryAdapter implements ConversationRepository {

	private final Map<String, List<ConversationTurn>> turnsByConversation = new ConcurrentHashMap<>();

	@Override
	public Mono<ConversationTurn> save(ConversationTurn turn) {
		return Mono.fromCallable(() -> {
			ConversationTurn stored = turn.id() != null
				? turn
				: ConversationTurn.withId(UUID.randomUUID().toString(), turn.conversationId(),
					turn.role(), turn.content(), turn.createdAt());
			List<ConversationTurn> turns = turnsByConversation
				.computeIfAbsent(turn.conversationId().value(), key -> new ArrayList<>());
			synchronized (turns) {
				turns.add(stored);
			}
			return stored;
		});
	}

	@Override
	public Flux<ConversationTurn> findRecent(ConversationId conversationId, int limit) {
		return Flux.defer(() -> {
			List<ConversationTurn> snapshot = snapshot(conversationId);
			int from = Math.max(0, snapshot.size() - Math.max(limit, 0));
			return Flux.fromIterable(snapshot.subList(from, snapshot.size()));
		});
	}

	private List<ConversationTurn> snapshot(ConversationId conversationId) {
		List<ConversationTurn> turns = turnsByConversation.get(conversationId.value());
		if (turns == null) {
			return List.of();
		}
		synchronized (turns) {
			return List.copyOf(turns);
		}
	}
}
