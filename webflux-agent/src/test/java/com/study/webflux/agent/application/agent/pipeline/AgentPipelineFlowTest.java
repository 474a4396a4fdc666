package com.study.webflux.agent.application.agent.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.application.agent.pipeline.stage.AnswerGenerationService;
import com.study.webflux.agent.application.agent.pipeline.stage.ContextRetrievalService;
import com.study.webflux.agent.application.agent.pipeline.stage.ConversationHistoryService;
import com.study.webflux.agent.application.agent.pipeline.stage.IntentClassificationService;
import com.study.webflux.agent.application.agent.pipeline.stage.LlmInvocationService;
import com.study.webflux.agent.application.agent.pipeline.stage.PipelinePostProcessingService;
import com.study.webflux.agent.application.agent.pipeline.stage.PromptTemplateRenderer;
import com.study.webflux.agent.application.agent.pipeline.stage.TopicResolverService;
import com.study.webflux.agent.application.cache.service.ResponseCacheService;
import com.study.webflux.agent.domain.cache.model.CacheHitType;
import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.model.IndexDefinition;
import com.study.webflux.agent.domain.config.model.IndexSchema;
import com.study.webflux.agent.domain.dialogue.model.CompletionRequest;
import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.dialogue.model.NormalizedQuery;
import com.study.webflux.agent.domain.dialogue.model.Query;
import com.study.webflux.agent.domain.dialogue.model.ResponseSource;
import com.study.webflux.agent.domain.dialogue.port.EmbeddingPort;
import com.study.webflux.agent.domain.dialogue.port.LlmPort;
import com.study.webflux.agent.domain.retrieval.model.RetrievalContext;
import com.study.webflux.agent.domain.retrieval.model.RetrievalDocument;
import com.study.webflux.agent.domain.retrieval.port.RetrievalPort;
import com.study.webflux.agent.fixture.AgentPropertiesFixture;
import com.study.webflux.agent.fixture.ConfigSnapshotFixture;
import com.study.webflux.agent.fixture.ConversationTurnFixture;
import com.study.webflux.agent.fixture.EmbeddingFixture;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.cache.adapter.InMemoryKeyValueStoreAdapter;
import com.study.webflux.agent.infrastructure.history.adapter.InMemoryConversationHistoryAdapter;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import com.study.webflux.agent.infrastructure.vectordb.adapter.InMemoryVectorStoreAdapter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 실제 단계 서비스와 인메모리 저장소로 파이프라인 전체를 실행합니다. 외부 백엔드인 LLM, 임베딩, 문서 검색만 대역으로 둡니다.
 */
@ExtendWith(MockitoExtension.class)
class AgentPipelineFlowTest {

	private static final String ORDERS_QUESTION = "Show my orders";

	@Mock
	private LlmPort llmPort;

	@Mock
	private EmbeddingPort embeddingPort;

	@Mock
	private RetrievalPort retrievalPort;

	private final List<String> prompts = new CopyOnWriteArrayList<>();
	private final Embedding embedding = EmbeddingFixture.create();
	private AgentProperties properties;
	private SimpleMeterRegistry meterRegistry;
	private InMemoryVectorStoreAdapter cacheVectors;
	private ResponseCacheService cacheService;
	private AgentPipelineService pipeline;

	@BeforeEach
	void setUp() {
		properties = AgentPropertiesFixture.inMemory();
		properties.getRetrieval().setTimeout(Duration.ofMillis(100));
		meterRegistry = new SimpleMeterRegistry();
		AgentMetricsConfiguration metrics = new AgentMetricsConfiguration(meterRegistry);
		ObjectMapper objectMapper = new ObjectMapper();
		PromptTemplateRenderer renderer = new PromptTemplateRenderer();

		cacheVectors = new InMemoryVectorStoreAdapter();
		cacheService = new ResponseCacheService(new InMemoryKeyValueStoreAdapter(Clock.systemUTC()),
			cacheVectors, metrics, properties);
		LlmInvocationService llm = new LlmInvocationService(llmPort, properties);
		ConversationHistoryService history = new ConversationHistoryService(
			new InMemoryConversationHistoryAdapter(), metrics, properties);
		pipeline = new AgentPipelineService(cacheService,
			new IntentClassificationService(llm, renderer, properties),
			new TopicResolverService(llm, renderer, objectMapper),
			new ContextRetrievalService(retrievalPort, metrics, properties),
			new AnswerGenerationService(llm, history, renderer, objectMapper),
			new PipelinePostProcessingService(cacheService, history),
			embeddingPort,
			metrics,
			properties);
	}

	@Test
	@DisplayName("같은 질문을 두 번 보내면 두 번째는 정확 일치 캐시로 응답하고 답변 생성은 한 번만 일어난다")
	void handle_repeatedQuestionGeneratesOnce() {
		stubEmbedding();
		stubLlm(null, "orders", null, "주문은 배송 중입니다.");
		when(retrievalPort.retrieve(eq("orders"), any(), anyInt())).thenReturn(Mono.just(
			RetrievalContext.of("orders", List.of(new RetrievalDocument("order-1", 0.9,
				Map.of("status", "shipped"))))));
		ConfigSnapshot snapshot = ConfigSnapshotFixture.create();

		StepVerifier.create(pipeline.handle(query(ORDERS_QUESTION), snapshot))
			.assertNext(response -> assertThat(response.source()).isEqualTo(ResponseSource.GENERATED))
			.verifyComplete();
		StepVerifier.create(pipeline.handle(query("  show MY orders "), snapshot))
			.assertNext(response -> {
				assertThat(response.source()).isEqualTo(ResponseSource.CACHE_EXACT);
				assertThat(response.text()).isEqualTo("주문은 배송 중입니다.");
			})
			.verifyComplete();

		assertThat(prompts).filteredOn(prompt -> prompt.startsWith("Topic:")).hasSize(1);
		assertThat(prompts.get(prompts.size() - 1)).contains("Document ID: order-1");
	}

	@Test
	@DisplayName("문서 검색이 시간 제한을 넘겨도 빈 문서로 답변을 생성한다")
	void handle_retrievalTimeoutStillGenerates() {
		stubEmbedding();
		stubLlm(null, "orders", null, "관련 문서를 찾지 못했습니다.");
		when(retrievalPort.retrieve(eq("orders"), any(), anyInt())).thenReturn(Mono.never());

		StepVerifier.create(pipeline.handle(query(ORDERS_QUESTION), ConfigSnapshotFixture.create()))
			.assertNext(response -> {
				assertThat(response.source()).isEqualTo(ResponseSource.GENERATED);
				assertThat(response.text()).isEqualTo("관련 문서를 찾지 못했습니다.");
			})
			.verify(Duration.ofSeconds(5));

		assertThat(prompts.get(prompts.size() - 1))
			.contains("Topic: none")
			.contains("No relevant documents found.");
		assertThat(meterRegistry.get("agent.pipeline.degraded").tag("stage", "retrieve").counter().count())
			.isEqualTo(1.0);
	}

	@Test
	@DisplayName("1단계가 None을 답하면 2단계 결과로 profile 인덱스를 검색해 답변한다")
	void handle_topicCascadeFallsBackToSummary() {
		stubEmbedding();
		stubLlm("data_question", "None", "profile", "사용자는 서른 살입니다.");
		when(retrievalPort.retrieve(eq("profile"), any(), anyInt())).thenReturn(Mono.just(
			RetrievalContext.of("profile", List.of(new RetrievalDocument("user-1", 0.8,
				Map.of("birth_date", "1996-03-01"))))));
		IndexSchema schema = new IndexSchema(List.of(
			new IndexDefinition("profile", "사용자 프로필", List.of("user_id", "birth_date")),
			new IndexDefinition("orders", "주문 내역", List.of("order_id", "status"))));
		ConfigSnapshot snapshot = ConfigSnapshot.of(ConfigSnapshotFixture.promptConfig(), schema);

		StepVerifier.create(pipeline.handle(query("how old is the user"), snapshot))
			.assertNext(response -> {
				assertThat(response.source()).isEqualTo(ResponseSource.GENERATED);
				assertThat(response.text()).isEqualTo("사용자는 서른 살입니다.");
			})
			.verifyComplete();

		assertThat(prompts).hasSize(4);
		assertThat(prompts.get(0)).startsWith("Intents:");
		assertThat(prompts.get(1)).startsWith("Schema: [{\"name\":\"profile\"");
		assertThat(prompts.get(3)).startsWith("Topic: profile").contains("birth_date: 1996-03-01");
		assertThat(prompts.get(2)).contains("- profile: fields=user_id, birth_date");
		verify(retrievalPort, never()).retrieve(eq("orders"), any(), anyInt());
	}

	@Test
	@DisplayName("같은 질의와 응답을 두 번 저장해도 같은 정확 일치 결과를 돌려주고 시맨틱 포인트는 하나만 남는다")
	void store_sameEntryTwiceIsIdempotent() {
		NormalizedQuery normalized = NormalizedQuery.of(ORDERS_QUESTION);

		StepVerifier.create(cacheService.store(normalized, Mono.just(embedding), "배송 중입니다."))
			.verifyComplete();
		StepVerifier.create(cacheService.store(normalized, Mono.just(embedding), "배송 중입니다."))
			.verifyComplete();

		StepVerifier.create(cacheService.lookup(normalized, Mono.just(embedding)))
			.assertNext(outcome -> {
				assertThat(outcome.type()).isEqualTo(CacheHitType.EXACT);
				assertThat(outcome.response()).isEqualTo("배송 중입니다.");
			})
			.verifyComplete();
		StepVerifier.create(cacheVectors.search(properties.getCache().getCollection(),
			embedding.vector(), 10))
			.expectNextCount(1)
			.verifyComplete();
	}

	@Test
	@DisplayName("인사는 캐시와 임베딩을 거치지 않고 고정 응답으로 처리된다")
	void handle_greetingSkipsBackends() {
		StepVerifier.create(pipeline.handle(query("hello"), ConfigSnapshotFixture.create()))
			.assertNext(response -> {
				assertThat(response.source()).isEqualTo(ResponseSource.TEMPLATE);
				assertThat(response.text()).isEqualTo(ConfigSnapshotFixture.GREETING_TEXT);
			})
			.verifyComplete();

		verify(embeddingPort, never()).embed(anyString());
		verify(llmPort, never()).complete(any());
	}

	private void stubEmbedding() {
		when(embeddingPort.embed(anyString())).thenReturn(Mono.just(embedding));
	}

	/** 프롬프트 첫 줄로 어느 단계의 호출인지 구분해 응답합니다. */
	private void stubLlm(String intent, String primaryTopic, String fallbackTopic, String answer) {
		when(llmPort.complete(any())).thenAnswer(invocation -> {
			String prompt = invocation.<CompletionRequest>getArgument(0).userPrompt();
			prompts.add(prompt);
			if (prompt.startsWith("Intents:")) {
				return Mono.justOrEmpty(intent);
			}
			if (prompt.startsWith("Schema:")) {
				return Mono.justOrEmpty(primaryTopic);
			}
			if (prompt.startsWith("Indexes:")) {
				return Mono.justOrEmpty(fallbackTopic);
			}
			return Mono.just(answer);
		});
	}

	private static Query query(String text) {
		return Query.of(ConversationTurnFixture.conversationId(), text);
	}
}
