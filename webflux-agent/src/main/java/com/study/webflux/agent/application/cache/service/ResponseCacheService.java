package com.study.webflux.agent.application.cache.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.study.webflux.agent.domain.cache.model.CacheEntry;
import com.study.webflux.agent.domain.cache.model.CacheOutcome;
import com.study.webflux.agent.domain.cache.port.KeyValueStorePort;
import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.dialogue.model.NormalizedQuery;
import com.study.webflux.agent.domain.monitoring.model.AgentPipelineStage;
import com.study.webflux.agent.domain.vector.model.ScoredPoint;
import com.study.webflux.agent.domain.vector.model.VectorPoint;
import com.study.webflux.agent.domain.vector.port.VectorStorePort;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import reactor.core.publisher.Mono;

/**
 * 정확 일치 캐시와 시맨틱 캐시로 구성된 2단 응답 캐시입니다.
 *
 * <p>
 * 두 백엔드 모두 best-effort로 동작합니다. 조회 실패나 타임아웃은 해당 단계의 미스로, 저장 실패는 경고 로그로 처리하며 요청을
 * 실패시키지 않습니다.
 */
@Slf4j
@Service
public class ResponseCacheService {

	static final String PAYLOAD_NORMALIZED_PROMPT = "normalized_prompt";
	static final String PAYLOAD_RESPONSE = "response";
	static final String PAYLOAD_CREATED_AT = "created_at";

	private final KeyValueStorePort keyValueStore;
	private final VectorStorePort vectorStore;
	private final AgentMetricsConfiguration metrics;
	private final boolean enabled;
	private final String keyPrefix;
	private final String collection;
	private final Duration ttl;
	private final double similarityThreshold;
	private final Duration timeout;

	public ResponseCacheService(KeyValueStorePort keyValueStore,
		@Qualifier("cacheVectorStore") VectorStorePort cacheVectorStore,
		AgentMetricsConfiguration metrics,
		AgentProperties properties) {
		var cache = properties.getCache();
		if (cache.getSimilarityThreshold() < 0.0 || cache.getSimilarityThreshold() > 1.0) {
			throw new IllegalArgumentException("similarityThreshold는 0과 1 사이여야 합니다.");
		}
		this.keyValueStore = keyValueStore;
		this.vectorStore = cacheVectorStore;
		this.metrics = metrics;
		this.enabled = cache.isEnabled();
		this.keyPrefix = cache.getKeyPrefix();
		this.collection = cache.getCollection();
		this.ttl = cache.getTtl() == null || cache.getTtl().isZero() ? null : cache.getTtl();
		this.similarityThreshold = cache.getSimilarityThreshold();
		this.timeout = cache.getTimeout();
	}

	/**
	 * 정확 일치 캐시를 먼저 조회하고, 미스이면 임베딩으로 시맨틱 캐시를 조회합니다.
	 *
	 * @param query
	 *            정규화된 질의
	 * @param embedding
	 *            요청 단위로 캐시된 지연 임베딩. 정확 일치 적중 시 구독되지 않습니다.
	 * @return 캐시 조회 결과, 오류를 방출하지 않습니다.
	 */
	public Mono<CacheOutcome> lookup(NormalizedQuery query, Mono<Embedding> embedding) {
		if (!enabled || query.isEmpty()) {
			return Mono.just(CacheOutcome.miss());
		}
		String key = exactKey(query);
		return lookupExact(key)
			.switchIfEmpty(Mono.defer(() -> lookupSemantic(query, key, embedding)))
			.defaultIfEmpty(CacheOutcome.miss())
			.doOnNext(outcome -> metrics.recordCacheOutcome(outcome.type()));
	}

	/**
	 * 생성된 응답을 두 캐시 단계에 기록합니다. 정확 일치 단계는 TTL과 함께, 시맨틱 단계는 만료 없이 저장합니다.
	 *
	 * @return 항상 정상 완료되는 Mono
	 */
	public Mono<Void> store(NormalizedQuery query, Mono<Embedding> embedding, String response) {
		if (!enabled || query.isEmpty() || response == null || response.isBlank()) {
			return Mono.empty();
		}
		String key = exactKey(query);
		Mono<Void> exactWrite = writeExact(key, response);
		Mono<Void> semanticWrite = embedding
			.flatMap(vector -> writeSemantic(new CacheEntry(key, vector, query.value(), response,
				Instant.now(), null)))
			.doOnError(error -> warnDegraded(AgentPipelineStage.POPULATE_CACHE,
				"시맨틱 캐시 저장을 위한 임베딩 실패", key, error))
			.onErrorResume(error -> Mono.empty());
		return Mono.when(exactWrite, semanticWrite);
	}

	private Mono<CacheOutcome> lookupExact(String key) {
		return keyValueStore.get(key)
			.timeout(timeout)
			.map(CacheOutcome::exactHit)
			.doOnNext(hit -> log.debug("정확 일치 캐시 적중 key={}", key))
			.doOnError(error -> warnDegraded(AgentPipelineStage.CACHE_CHECK,
				"정확 일치 캐시 조회 실패, 미스로 처리합니다", key, error))
			.onErrorResume(error -> Mono.empty());
	}

	private Mono<CacheOutcome> lookupSemantic(NormalizedQuery query,
		String key,
		Mono<Embedding> embedding) {
		return embedding
			.flatMap(vector -> vectorStore.search(collection, vector.vector(), 1)
				.next()
				.timeout(timeout))
			.flatMap(this::toSemanticHit)
			.flatMap(hit -> promote(key, hit).thenReturn(hit))
			.doOnError(error -> warnDegraded(AgentPipelineStage.CACHE_CHECK,
				"시맨틱 캐시 조회 실패, 미스로 처리합니다", key, error))
			.onErrorResume(error -> Mono.empty());
	}

	private Mono<CacheOutcome> toSemanticHit(ScoredPoint point) {
		if (point.score() < similarityThreshold) {
			log.debug("시맨틱 캐시 후보가 임계값 미만입니다 score={}, threshold={}", point.score(),
				similarityThreshold);
			return Mono.empty();
		}
		return Mono.justOrEmpty(point.payloadString(PAYLOAD_RESPONSE))
			.filter(response -> !response.isBlank())
			.map(response -> CacheOutcome.semanticHit(response, point.score()))
			.doOnNext(hit -> log.debug("시맨틱 캐시 적중 pointId={}, score={}", point.id(),
				point.score()))
			.switchIfEmpty(Mono.fromRunnable(
				() -> log.warn("시맨틱 캐시 페이로드에 response가 없어 무시합니다 pointId={}", point.id())));
	}

	/** 시맨틱 적중 결과를 정확 일치 캐시에 기록합니다. */
	private Mono<Void> promote(String key, CacheOutcome hit) {
		return writeExact(key, hit.response());
	}

	private Mono<Void> writeExact(String key, String response) {
		return keyValueStore.set(key, response, ttl)
			.timeout(timeout)
			.doOnError(error -> warnDegraded(AgentPipelineStage.POPULATE_CACHE,
				"정확 일치 캐시 저장 실패", key, error))
			.onErrorResume(error -> Mono.empty());
	}

	/** 포인트 id는 정확 일치 키에서 유도하므로 같은 질의를 다시 저장하면 기존 포인트를 덮어씁니다. */
	private Mono<Void> writeSemantic(CacheEntry entry) {
		String pointId = UUID.nameUUIDFromBytes(entry.key().getBytes(StandardCharsets.UTF_8)).toString();
		VectorPoint point = new VectorPoint(pointId,
			entry.embedding().vector(),
			Map.of(PAYLOAD_NORMALIZED_PROMPT, entry.normalizedQuery(),
				PAYLOAD_RESPONSE, entry.response(),
				PAYLOAD_CREATED_AT, entry.createdAt().getEpochSecond()));
		return vectorStore.upsert(collection, point)
			.timeout(timeout)
			.doOnError(error -> warnDegraded(AgentPipelineStage.POPULATE_CACHE,
				"시맨틱 캐시 저장 실패", entry.key(), error))
			.onErrorResume(error -> Mono.empty());
	}

	private void warnDegraded(AgentPipelineStage stage,
		String message,
		String key,
		Throwable error) {
		log.warn("{} key={}, 이유={}", message, key, error.toString());
		metrics.recordDegraded(stage);
	}

	String exactKey(NormalizedQuery query) {
		return keyPrefix + sha256Hex(query.value());
	}

	private static String sha256Hex(String value) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm is not available", e);
		}
	}
}
