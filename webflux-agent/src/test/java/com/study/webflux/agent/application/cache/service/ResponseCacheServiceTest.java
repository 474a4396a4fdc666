package com.study.webflux.agent.application.cache.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import com.study.webflux.agent.domain.cache.model.CacheHitType;
import com.study.webflux.agent.domain.cache.port.KeyValueStorePort;
import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.dialogue.model.NormalizedQuery;
import com.study.webflux.agent.domain.vector.model.VectorPoint;
import com.study.webflux.agent.fixture.AgentPropertiesFixture;
import com.study.webflux.agent.fixture.EmbeddingFixture;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.cache.adapter.InMemoryKeyValueStoreAdapter;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import com.study.webflux.agent.infrastructure.vectordb.adapter.InMemoryVectorStoreAdapter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResponseCacheServiceTest {

	private static final NormalizedQuery QUERY = NormalizedQuery.of("  What is   my ORDER status ");

	private InMemoryKeyValueStoreAdapter keyValueStore;
	private InMemoryVectorStoreAdapter vectorStore;
	private SimpleMeterRegistry meterRegistry;
	private AgentProperties properties;
	private ResponseCacheService service;

	@BeforeEach
	void setUp() {
		keyValueStore = new InMemoryKeyValueStoreAdapter(Clock.systemUTC());
		vectorStore = new InMemoryVectorStoreAdapter();
		meterRegistry = new SimpleMeterRegistry();
		properties = AgentPropertiesFixture.inMemory();
		service = newService(keyValueStore);
	}

	@Test
	@DisplayName("저장된 응답은 같은 정규화 질의로 정확 일치 적중한다")
	void lookup_exactHitAfterStore() {
		Embedding embedding = EmbeddingFixture.create();

		StepVerifier.create(service.lookup(QUERY, Mono.just(embedding)))
			.assertNext(outcome -> assertThat(outcome.type()).isEqualTo(CacheHitType.MISS))
			.verifyComplete();

		StepVerifier.create(service.store(QUERY, Mono.just(embedding), "배송 중입니다."))
			.verifyComplete();

		StepVerifier.create(service.lookup(NormalizedQuery.of("what is my order status"),
			Mono.just(embedding)))
			.assertNext(outcome -> {
				assertThat(outcome.type()).isEqualTo(CacheHitType.EXACT);
				assertThat(outcome.response()).isEqualTo("배송 중입니다.");
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("정확 일치 적중 시 임베딩을 계산하지 않는다")
	void lookup_exactHitSkipsEmbedding() {
		AtomicInteger embeddingCalls = new AtomicInteger();
		Mono<Embedding> embedding = Mono.fromCallable(() -> {
			embeddingCalls.incrementAndGet();
			return EmbeddingFixture.create();
		});
		keyValueStore.set(service.exactKey(QUERY), "cached", null).block();

		StepVerifier.create(service.lookup(QUERY, embedding))
			.assertNext(outcome -> assertThat(outcome.type()).isEqualTo(CacheHitType.EXACT))
			.verifyComplete();

		assertThat(embeddingCalls).hasValue(0);
	}

	@Test
	@DisplayName("임계값 이상으로 유사한 질의는 시맨틱 적중하고 정확 일치 캐시로 승격된다")
	void lookup_semanticHitIsPromoted() {
		seedSemantic("where is my order", EmbeddingFixture.of(1.0f, 0.0f, 0.0f), "곧 도착합니다.");
		Embedding similar = EmbeddingFixture.of(0.9f, 0.1f, 0.0f);

		StepVerifier.create(service.lookup(QUERY, Mono.just(similar)))
			.assertNext(outcome -> {
				assertThat(outcome.type()).isEqualTo(CacheHitType.SEMANTIC);
				assertThat(outcome.response()).isEqualTo("곧 도착합니다.");
				assertThat(outcome.score()).isGreaterThan(0.9);
			})
			.verifyComplete();

		StepVerifier.create(keyValueStore.get(service.exactKey(QUERY)))
			.expectNext("곧 도착합니다.")
			.verifyComplete();
	}

	@Test
	@DisplayName("유사도가 임계값보다 낮으면 미스로 처리한다")
	void lookup_belowThresholdIsMiss() {
		properties.getCache().setSimilarityThreshold(0.95);
		service = newService(keyValueStore);
		seedSemantic("where is my order", EmbeddingFixture.of(1.0f, 0.0f, 0.0f), "곧 도착합니다.");

		StepVerifier.create(service.lookup(QUERY, Mono.just(EmbeddingFixture.of(0.5f, 0.5f, 0.0f))))
			.assertNext(outcome -> assertThat(outcome.isHit()).isFalse())
			.verifyComplete();
	}

	@Test
	@DisplayName("키-값 저장소 장애는 오류 없이 시맨틱 조회로 넘어간다")
	void lookup_keyValueFailureDegradesToSemantic() {
		KeyValueStorePort failing = mock(KeyValueStorePort.class);
		when(failing.get(anyString())).thenReturn(Mono.error(new IllegalStateException("redis down")));
		when(failing.set(anyString(), anyString(), any())).thenReturn(Mono.error(
			new IllegalStateException("redis down")));
		service = newService(failing);
		seedSemantic("where is my order", EmbeddingFixture.of(1.0f, 0.0f, 0.0f), "곧 도착합니다.");

		StepVerifier.create(service.lookup(QUERY, Mono.just(EmbeddingFixture.of(1.0f, 0.0f, 0.0f))))
			.assertNext(outcome -> assertThat(outcome.type()).isEqualTo(CacheHitType.SEMANTIC))
			.verifyComplete();

		assertThat(meterRegistry.get("agent.pipeline.degraded").tag("stage", "cache_check")
			.counter().count()).isEqualTo(1.0);
	}

	@Test
	@DisplayName("임베딩 실패 시 저장은 정확 일치 단계만 기록하고 정상 완료된다")
	void store_embeddingFailureStillWritesExact() {
		StepVerifier.create(service.store(QUERY, Mono.error(new IllegalStateException("embed")),
			"응답"))
			.verifyComplete();

		StepVerifier.create(keyValueStore.get(service.exactKey(QUERY)))
			.expectNext("응답")
			.verifyComplete();
	}

	@Test
	@DisplayName("캐시가 비활성화되면 항상 미스를 반환한다")
	void lookup_disabledCacheAlwaysMisses() {
		properties.getCache().setEnabled(false);
		service = newService(keyValueStore);
		keyValueStore.set(service.exactKey(QUERY), "cached", null).block();

		StepVerifier.create(service.lookup(QUERY, Mono.just(EmbeddingFixture.create())))
			.assertNext(outcome -> assertThat(outcome.isHit()).isFalse())
			.verifyComplete();
	}

	@Test
	@DisplayName("정확 일치 키는 접두사와 SHA-256 16진수로 구성된다")
	void exactKey_usesPrefixAndSha256() {
		assertThat(service.exactKey(NormalizedQuery.of("hello")))
			.isEqualTo("agent:cache:2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
	}

	@Test
	@DisplayName("0과 1 사이를 벗어난 임계값은 거부한다")
	void constructor_rejectsInvalidThreshold() {
		properties.getCache().setSimilarityThreshold(1.5);

		assertThatThrownBy(() -> newService(keyValueStore))
			.isInstanceOf(IllegalArgumentException.class);
	}

	private ResponseCacheService newService(KeyValueStorePort store) {
		return new ResponseCacheService(store, vectorStore, new AgentMetricsConfiguration(meterRegistry),
			properties);
	}

	private void seedSemantic(String prompt, Embedding embedding, String response) {
		vectorStore.upsert(properties.getCache().getCollection(), new VectorPoint(
			"point-" + prompt.hashCode(),
			embedding.vector(),
			Map.of(ResponseCacheService.PAYLOAD_NORMALIZED_PROMPT, prompt,
				ResponseCacheService.PAYLOAD_RESPONSE, response,
				ResponseCacheService.PAYLOAD_CREATED_AT, Instant.now().getEpochSecond())))
			.block();
		assertThat(vectorStore.search(properties.getCache().getCollection(), embedding.vector(), 1)
			.collectList().block()).hasSize(1);
	}
}
