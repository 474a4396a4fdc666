package com.study.webflux.agent.application.agent.pipeline.stage;

import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.application.agent.pipeline.PromptDefaults;
import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.model.IndexSchema;
import com.study.webflux.agent.domain.topic.model.ResolutionStage;
import com.study.webflux.agent.domain.topic.model.TopicResolution;
import reactor.core.publisher.Mono;

/**
 * 질문이 어느 인덱스에 관한 것인지 두 단계로 추론합니다.
 *
 * <p>
 * 1단계는 스키마 전체를 JSON으로 제시하고, 1단계가 "none" 또는 스키마에 없는 이름을 반환하면 2단계에서 인덱스 요약으로
 * 다시 묻습니다. 두 단계 모두 실패하면 UNRESOLVED를 반환합니다. LLM 호출 실패는 GenerationException으로 전파됩니다.
 */
@Slf4j
@Service
public class TopicResolverService {

	private static final String NO_TOPIC = "none";

	private final LlmInvocationService llmInvocationService;
	private final PromptTemplateRenderer renderer;
	private final ObjectMapper objectMapper;

	public TopicResolverService(LlmInvocationService llmInvocationService,
		PromptTemplateRenderer renderer,
		ObjectMapper objectMapper) {
		this.llmInvocationService = llmInvocationService;
		this.renderer = renderer;
		this.objectMapper = objectMapper;
	}

	public Mono<TopicResolution> resolve(String question, ConfigSnapshot snapshot) {
		IndexSchema schema = snapshot.indexSchema();
		if (schema.isEmpty()) {
			log.warn("인덱스 스키마가 비어 있어 주제를 결정할 수 없습니다");
			return Mono.just(TopicResolution.unresolved());
		}
		Optional<String> primaryTemplate = snapshot.promptConfig()
			.findQueryTemplate(PromptDefaults.TOPIC_INFERENCE);
		Optional<String> fallbackTemplate = snapshot.promptConfig()
			.findQueryTemplate(PromptDefaults.FALLBACK_TOPIC_RESOLVER);

		String schemaJson = schemaJson(schema);
		return runStage(ResolutionStage.PRIMARY, primaryTemplate, Map.of(
			"schema_json", schemaJson,
			"schema", schemaJson,
			"schema_summary", schema.summary(),
			"user_question", question), schema)
			.switchIfEmpty(Mono.defer(() -> runStage(ResolutionStage.FALLBACK, fallbackTemplate,
				Map.of(
					"schema_summary", schema.summary(),
					"schema_json", schemaJson,
					"user_question", question),
				schema)))
			.defaultIfEmpty(TopicResolution.unresolved())
			.doOnNext(resolution -> log.info("주제 결정 결과 stage={}, index={}", resolution.stage(),
				resolution.indexName().orElse(NO_TOPIC)));
	}

	private Mono<TopicResolution> runStage(ResolutionStage stage,
		Optional<String> template,
		Map<String, String> variables,
		IndexSchema schema) {
		if (template.isEmpty()) {
			log.warn("주제 추론 템플릿이 없어 단계를 건너뜁니다 stage={}", stage);
			return Mono.empty();
		}
		String prompt = renderer.render(template.get(), variables);
		return llmInvocationService.complete(null, prompt)
			.flatMap(answer -> {
				String candidate = IntentClassificationService.cleanAnswer(answer);
				if (candidate.isEmpty() || NO_TOPIC.equals(candidate)) {
					log.debug("주제 추론 결과 없음 stage={}", stage);
					return Mono.empty();
				}
				return Mono.justOrEmpty(schema.find(candidate))
					.map(index -> TopicResolution.resolved(index, stage))
					.switchIfEmpty(Mono.fromRunnable(() -> log.info(
						"스키마에 없는 주제가 반환되었습니다 stage={}, answer={}", stage, candidate)));
			});
	}

	/** 인덱스 목록을 한 줄 JSON으로 변환합니다. */
	private String schemaJson(IndexSchema schema) {
		try {
			return objectMapper.writeValueAsString(schema.indexes());
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("인덱스 스키마를 JSON으로 변환할 수 없습니다.", e);
		}
	}
}
