package com.study.webflux.agent.application.agent.pipeline.stage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.application.agent.pipeline.PipelineInputs;
import com.study.webflux.agent.application.agent.pipeline.PromptDefaults;
import com.study.webflux.agent.domain.config.model.IndexDefinition;
import com.study.webflux.agent.domain.config.model.PromptConfig;
import com.study.webflux.agent.domain.dialogue.model.IntentMatch;
import com.study.webflux.agent.domain.dialogue.model.Message;
import com.study.webflux.agent.domain.retrieval.model.RetrievalContext;
import reactor.core.publisher.Mono;

/**
 * 템플릿을 채워 최종 답변을 생성합니다. 시스템 프롬프트, 최근 대화, 렌더링된 사용자 프롬프트 순으로 메시지를 구성합니다.
 */
@Slf4j
@Service
public class AnswerGenerationService {

	private static final String HISTORY_PLACEHOLDER = "{history}";

	private final LlmInvocationService llmInvocationService;
	private final ConversationHistoryService historyService;
	private final PromptTemplateRenderer renderer;
	private final ObjectMapper objectMapper;

	public AnswerGenerationService(LlmInvocationService llmInvocationService,
		ConversationHistoryService historyService,
		PromptTemplateRenderer renderer,
		ObjectMapper objectMapper) {
		this.llmInvocationService = llmInvocationService;
		this.historyService = historyService;
		this.renderer = renderer;
		this.objectMapper = objectMapper;
	}

	/**
	 * 검색된 문서를 근거로 답변을 생성합니다. 문서가 없으면 topic은 "none"으로 채워집니다.
	 */
	public Mono<String> answerWithContext(PipelineInputs inputs,
		IntentMatch intent,
		IndexDefinition index,
		RetrievalContext context) {
		PromptConfig config = inputs.snapshot().promptConfig();
		String template = selectTemplate(config, intent, PromptDefaults.RAG_FINAL_ANSWER,
			PromptDefaults.DEFAULT_RAG_TEMPLATE);
		Map<String, String> variables = baseVariables(inputs);
		variables.put("topic", context.isEmpty() ? "none" : index.name());
		variables.put("documents", context.toPromptText());
		variables.put("schema", indexJson(index));
		return generate(inputs, config, template, variables);
	}

	/**
	 * 검색 없이 일반 대화 응답을 생성합니다.
	 */
	public Mono<String> answerConversation(PipelineInputs inputs, IntentMatch intent) {
		PromptConfig config = inputs.snapshot().promptConfig();
		String template = selectTemplate(config, intent, PromptDefaults.GENERAL_CONVERSATION,
			PromptDefaults.DEFAULT_CONVERSATION_TEMPLATE);
		return generate(inputs, config, template, baseVariables(inputs));
	}

	/**
	 * 최근 대화를 조회한 뒤 {history}를 채워 템플릿을 렌더링합니다. 템플릿이 {history}를 쓰면 대화 기록은 프롬프트
	 * 본문에만 들어가고 별도 메시지로 중복 전송하지 않습니다.
	 */
	private Mono<String> generate(PipelineInputs inputs,
		PromptConfig config,
		String template,
		Map<String, String> variables) {
		return historyService.recent(inputs.query().conversationId())
			.flatMap(history -> {
				variables.put("history", historyService.formatForPrompt(history));
				String userPrompt = renderer.render(template, variables);
				List<Message> messages = new ArrayList<>(history.size() + 2);
				config.findCorePrompt(PromptDefaults.SYSTEM_PROMPT)
					.filter(prompt -> !prompt.isBlank())
					.ifPresent(prompt -> messages.add(Message.system(prompt)));
				if (!template.contains(HISTORY_PLACEHOLDER)) {
					messages.addAll(historyService.toMessages(history));
				}
				messages.add(Message.user(userPrompt));
				log.debug("답변 생성 요청 historyTurns={}, promptLength={}", history.size(),
					userPrompt.length());
				return llmInvocationService.complete(messages);
			});
	}

	private String selectTemplate(PromptConfig config,
		IntentMatch intent,
		String defaultKey,
		String fallback) {
		String intentTemplate = intent.template();
		if (intentTemplate != null) {
			var found = config.findTemplate(intentTemplate);
			if (found.isPresent()) {
				return found.get();
			}
			log.warn("인텐트 템플릿을 찾을 수 없어 기본 템플릿을 사용합니다 intent={}, template={}", intent.name(),
				intentTemplate);
		}
		return config.findTemplate(defaultKey).orElse(fallback);
	}

	private Map<String, String> baseVariables(PipelineInputs inputs) {
		Map<String, String> variables = new HashMap<>();
		variables.put("user_question", inputs.query().text());
		variables.put("message", inputs.query().text());
		variables.put("schema_json", toJson(inputs.snapshot().indexSchema().indexes()));
		return variables;
	}

	private String indexJson(IndexDefinition index) {
		try {
			return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(index);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("인덱스 정의를 JSON으로 변환할 수 없습니다.", e);
		}
	}

	private String toJson(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("인덱스 스키마를 JSON으로 변환할 수 없습니다.", e);
		}
	}
}
