package com.study.webflux.agent.infrastructure.history.adapter;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.domain.dialogue.model.ConversationId;
import com.study.webflux.agent.domain.dialogue.model.ConversationTurn;
import com.study.webflux.agent.domain.dialogue.model.MessageRole;
import com.study.webflux.agent.domain.dialogue.port.ConversationRepository;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis 리스트에 대화 턴을 JSON으로 보관합니다. 새 턴은 LPUSH로 앞에 추가되므로 조회 결과를 뒤집어 반환하고, 오래된
 * 턴은 LTRIM으로 잘라냅니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "agent.history", name = "backend", havingValue = "redis")
public class RedisConversationHistoryAdapter implements ConversationRepository {

	private final ReactiveStringRedisTemplate redisTemplate;
	private final ObjectMapper objectMapper;
	private final String keyPrefix;
	private final int maxStoredTurns;

	public RedisConversationHistoryAdapter(ReactiveStringRedisTemplate redisTemplate,
		ObjectMapper objectMapper,
		AgentProperties properties) {
		this.redisTemplate = redisTemplate;
		this.objectMapper = objectMapper;
		this.keyPrefix = properties.getHistory().getKeyPrefix();
		this.maxStoredTurns = properties.getHistory().getMaxStoredTurns();
	}

	private String keyFor(ConversationId conversationId) {
		return keyPrefix + conversationId.value();
	}

	/** 추가 후 가장 최근 maxStoredTurns개만 남기도록 리스트를 자릅니다. */
	@Override
	public Mono<ConversationTurn> save(ConversationTurn turn) {
		String key = keyFor(turn.conversationId());
		return Mono.fromCallable(() -> serialize(turn))
			.flatMap(json -> redisTemplate.opsForList().leftPush(key, json))
			.then(Mono.defer(() -> redisTemplate.opsForList().trim(key, 0, maxStoredTurns - 1L)))
			.thenReturn(turn);
	}

	@Override
	public Flux<ConversationTurn> findRecent(ConversationId conversationId, int limit) {
		if (limit <= 0) {
			return Flux.empty();
		}
		return readRange(conversationId, limit - 1L);
	}

	private Flux<ConversationTurn> readRange(ConversationId conversationId, long end) {
		return redisTemplate.opsForList().range(keyFor(conversationId), 0, end)
			.flatMapIterable(json -> deserialize(conversationId, json))
			.collectList()
			.flatMapMany(list -> {
				Collections.reverse(list);
				return Flux.fromIterable(list);
			});
	}

	private String serialize(ConversationTurn turn) throws JsonProcessingException {
		return objectMapper.writeValueAsString(new StoredTurn(turn.role().getValue(), turn.content(),
			turn.createdAt().toEpochMilli()));
	}

	/** 손상된 항목은 건너뜁니다. */
	private List<ConversationTurn> deserialize(ConversationId conversationId, String json) {
		try {
			StoredTurn stored = objectMapper.readValue(json, StoredTurn.class);
			return List.of(new ConversationTurn(null, conversationId,
				MessageRole.fromValue(stored.role()), stored.content(),
				Instant.ofEpochMilli(stored.timestamp())));
		} catch (JsonProcessingException | IllegalArgumentException e) {
			log.warn("손상된 대화 기록 항목을 건너뜁니다 conversationId={}, 이유={}", conversationId.value(),
				e.getMessage());
			return List.of();
		}
	}

	record StoredTurn(String role, String content, long timestamp) {
	}
}
