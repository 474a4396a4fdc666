package com.study.webflux.agent.application.agent.pipeline;

import java.time.Duration;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.agent.application.agent.pipeline.stage.AnswerGenerationService;
import com.study.webflux.agent.application.agent.pipeline.stage.ContextRetrievalService;
import com.study.webflux.agent.application.agent.pipeline.stage.IntentClassificationService;
import com.study.webflux.agent.application.agent.pipeline.stage.PipelinePostProcessingService;
import com.study.webflux.agent.application.agent.pipeline.stage.TopicResolverService;
import com.study.webflux.agent.application.cache.service.ResponseCacheService;
import com.study.webflux.agent.domain.cache.model.CacheHitType;
import com.study.webflux.agent.domain.cache.model.CacheOutcome;
import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.model.IntentAction;
import com.study.webflux.agent.domain.dialogue.exception.GenerationException;
import com.study.webflux.agent.domain.dialogue.model.AgentResponse;
import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.dialogue.model.IntentMatch;
import com.study.webflux.agent.domain.dialogue.model.NormalizedQuery;
import com.study.webflux.agent.domain.dialogue.model.Query;
import com.study.webflux.agent.domain.dialogue.model.ResponseSource;
import com.study.webflux.agent.domain.dialogue.port.AgentPipelineUseCase;
import com.study.webflux.agent.domain.dialogue.port.EmbeddingPort;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import reactor.core.publisher.Mono;

/**
 * 질의 하나를 정규화 → 고정 응답 규칙 확인 → 캐시 조회 → 인텐트 분류 → 주제 결정 → 문서 검색 → 답변 생성 → 캐시 기록 → 대화 기록 저장 순서로
 * 처리합니다.
 *
 * <p>
 * 호출 시점에 전달된 설정 스냅샷 하나를 요청이 끝날 때까지 사용합니다. 임베딩은 필요한 단계에서 처음 구독될 때 한 번만 계산되어
 * 시맨틱 캐시 조회, 문서 검색, 캐시 기록에 재사용됩니다. 캐시, 검색, 기록 단계의 장애는 응답을 막지 않으며, 생성 실패만
 * GenerationException으로 전파됩니다.
 */
@Slf4j
@Service
public class AgentPipelineService implements AgentPipelineUseCase {

	private final ResponseCacheService cacheService;
	private final IntentClassificationService intentClassificationService;
	private final TopicResolverService topicResolverService;
	private final ContextRetrievalService contextRetrievalService;
	private final AnswerGenerationService answerGenerationService;
	private final PipelinePostProcessingService postProcessingService;
	private final EmbeddingPort embeddingPort;
	private final AgentMetricsConfiguration metrics;
	private final Duration embeddingTimeout;

	public AgentPipelineService(ResponseCacheService cacheService,
		IntentClassificationService intentClassificationService,
		TopicResolverService topicResolverService,
		ContextRetrievalService contextRetrievalService,
		AnswerGenerationService answerGenerationService,
		PipelinePostProcessingService postProcessingService,
		EmbeddingPort embeddingPort,
		AgentMetricsConfiguration metrics,
		AgentProperties properties) {
		this.cacheService = cacheService;
		this.intentClassificationService = intentClassificationService;
		this.topicResolverService = topicResolverService;
		this.contextRetrievalService = contextRetrievalService;
		this.answerGenerationService = answerGenerationService;
		this.postProcessingService = postProcessingService;
		this.embeddingPort = embeddingPort;
		this.metrics = metrics;
		this.embeddingTimeout = properties.getGeneration().getEmbeddingTimeout();
	}

	@Override
	public Mono<AgentResponse> handle(Query query, ConfigSnapshot snapshot) {
		PipelineInputs inputs = prepareInputs(query, snapshot);
		return templateShortcut(inputs)
			.switchIfEmpty(Mono.defer(() -> lookupOrGenerate(inputs)))
			.flatMap(response -> postProcessingService.populateAndPersist(inputs, response)
				.thenReturn(response))
			.doOnNext(response -> {
				metrics.recordResponse(response.source());
				log.info("요청 처리 완료 conversationId={}, source={}, configVersion={}",
					query.conversationId().value(), response.source().label(), snapshot.version());
			})
			.doOnError(GenerationException.class, error -> {
				metrics.recordGenerationFailure();
				log.error("답변 생성 실패 conversationId={}, reason={}, message={}",
					query.conversationId().value(), error.getReason(), error.getMessage());
			});
	}

	/**
	 * 요청 단위 입력을 준비합니다. 임베딩 Mono는 결과와 오류 모두를 캐시해 백엔드를 한 번만 호출합니다.
	 */
	private PipelineInputs prepareInputs(Query query, ConfigSnapshot snapshot) {
		NormalizedQuery normalized = NormalizedQuery.of(query);
		Mono<Embedding> embedding = Mono.defer(() -> embeddingPort.embed(normalized.value()))
			.timeout(embeddingTimeout)
			.doOnError(error -> log.warn("임베딩 생성 실패 conversationId={}, 이유={}",
				query.conversationId().value(), error.toString()))
			.cache();
		return new PipelineInputs(query, normalized, snapshot, embedding);
	}

	private AgentResponse fromCache(CacheOutcome outcome) {
		ResponseSource source = outcome.type() == CacheHitType.EXACT
			? ResponseSource.CACHE_EXACT
			: ResponseSource.CACHE_SEMANTIC;
		return AgentResponse.of(outcome.response(), source);
	}

	private Mono<AgentResponse> handleCacheMiss(PipelineInputs inputs) {
		ConfigSnapshot snapshot = inputs.snapshot();
		return intentClassificationService
			.classify(inputs.normalizedQuery(), inputs.query().text(), snapshot.promptConfig())
			.flatMap(intent -> {
				log.debug("인텐트 결정 intent={}, action={}", intent.name(), intent.action().getValue());
				return switch (intent.action()) {
					case RESPOND_TEMPLATE -> respondWithTemplate(inputs, intent);
					case GENERAL_LLM_CALL -> answerConversation(inputs, intent);
					case CALL_RAG_TOOL -> answerWithRetrieval(inputs, intent);
				};
			});
	}

	private Mono<AgentResponse> lookupOrGenerate(PipelineInputs inputs) {
		return cacheService.lookup(inputs.normalizedQuery(), inputs.embedding())
			.flatMap(outcome -> outcome.isHit()
				? Mono.just(fromCache(outcome))
				: handleCacheMiss(inputs));
	}

	/**
	 * 규칙으로 일치한 고정 응답 인텐트는 캐시와 임베딩을 거치지 않고 바로 응답합니다.
	 */
	private Mono<AgentResponse> templateShortcut(PipelineInputs inputs) {
		return Mono.justOrEmpty(intentClassificationService
			.matchRules(inputs.normalizedQuery(), inputs.snapshot().promptConfig()))
			.filter(intent -> intent.action() == IntentAction.RESPOND_TEMPLATE)
			.flatMap(intent -> Mono.justOrEmpty(templateResponse(inputs, intent)))
			.doOnNext(response -> log.debug("고정 응답으로 바로 처리합니다 conversationId={}",
				inputs.query().conversationId().value()));
	}

	private Mono<AgentResponse> respondWithTemplate(PipelineInputs inputs, IntentMatch intent) {
		return Mono.justOrEmpty(templateResponse(inputs, intent))
			.switchIfEmpty(Mono.defer(() -> {
				log.warn("응답 템플릿이 없어 일반 대화로 처리합니다 intent={}, template={}", intent.name(),
					templateName(intent));
				return answerConversation(inputs, intent);
			}));
	}

	private Optional<AgentResponse> templateResponse(PipelineInputs inputs, IntentMatch intent) {
		return inputs.snapshot().promptConfig().findResponseTemplate(templateName(intent))
			.map(text -> AgentResponse.of(text, ResponseSource.TEMPLATE));
	}

	private static String templateName(IntentMatch intent) {
		return intent.definition() != null && intent.definition().responseTemplate() != null
			? intent.definition().responseTemplate()
			: intent.name();
	}

	private Mono<AgentResponse> answerConversation(PipelineInputs inputs, IntentMatch intent) {
		return answerGenerationService.answerConversation(inputs, intent)
			.map(text -> AgentResponse.of(text, ResponseSource.GENERATED));
	}

	private Mono<AgentResponse> answerWithRetrieval(PipelineInputs inputs, IntentMatch intent) {
		return topicResolverService.resolve(inputs.query().text(), inputs.snapshot())
			.flatMap(resolution -> {
				if (!resolution.isResolved()) {
					return Mono.just(AgentResponse.of(
						PromptDefaults.clarification(inputs.snapshot().promptConfig()),
						ResponseSource.CLARIFICATION));
				}
				String index = resolution.index().name();
				return contextRetrievalService.retrieve(index, inputs.embedding())
					.flatMap(context -> answerGenerationService.answerWithContext(inputs, intent,
						resolution.index(), context))
					.map(text -> AgentResponse.of(text, ResponseSource.GENERATED));
			});
	}
}
