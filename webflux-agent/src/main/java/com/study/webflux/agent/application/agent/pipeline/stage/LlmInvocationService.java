package com.study.webflux.agent.application.agent.pipeline.stage;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.agent.domain.dialogue.exception.GenerationException;
import com.study.webflux.agent.domain.dialogue.model.CompletionRequest;
import com.study.webflux.agent.domain.dialogue.model.Message;
import com.study.webflux.agent.domain.dialogue.port.LlmPort;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import reactor.core.publisher.Mono;

/**
 * 생성 백엔드 호출에 타임아웃을 적용하고 모든 실패를 GenerationException으로 변환합니다.
 */
@Slf4j
@Service
public class LlmInvocationService {

	private static final String THINK_OPEN = "<think>";
	private static final String THINK_CLOSE = "</think>";
	private static final Pattern THINK_BLOCK = Pattern.compile("(?s)<think>.*?</think>");
	private static final Pattern LATEX_WRAPPER = Pattern.compile("\\\\(?:boxed|text)\\{([^{}]*)}");
	private static final Pattern FINAL_ANSWER_LABEL = Pattern.compile("(?m)^\\s*(?:\\*\\*)?Final Answer:(?:\\*\\*)?\\s*");
	private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("(?:[ \\t]*\\r?\\n){3,}");

	private final LlmPort llmPort;
	private final Duration timeout;
	private final String model;

	public LlmInvocationService(LlmPort llmPort, AgentProperties properties) {
		this.llmPort = llmPort;
		this.timeout = properties.getGeneration().getTimeout();
		this.model = properties.getGeneration().getModel();
	}

	/**
	 * 단일 프롬프트로 LLM을 호출합니다.
	 *
	 * @param systemPrompt
	 *            시스템 프롬프트, 없으면 null
	 * @param userPrompt
	 *            사용자 프롬프트
	 * @return 공백이 아닌 응답 텍스트
	 */
	public Mono<String> complete(String systemPrompt, String userPrompt) {
		return invoke(CompletionRequest.of(systemPrompt, userPrompt, model));
	}

	/**
	 * 이전 대화가 포함된 메시지 목록으로 LLM을 호출합니다.
	 */
	public Mono<String> complete(List<Message> messages) {
		return invoke(CompletionRequest.withMessages(messages, model));
	}

	private Mono<String> invoke(CompletionRequest request) {
		return Mono.defer(() -> llmPort.complete(request))
			.timeout(timeout)
			.onErrorMap(error -> !(error instanceof GenerationException), this::toGenerationException)
			.map(LlmInvocationService::cleanResponse)
			.filter(text -> !text.isEmpty())
			.switchIfEmpty(Mono.error(new GenerationException(
				GenerationException.Reason.INVALID_RESPONSE, "LLM returned an empty response")));
	}

	/**
	 * 추론 모델이 남기는 think 구간을 제거하고 공백을 정리합니다. 닫히지 않은 think 구간은 끝까지 제거하고, 여는 태그 없이
	 * 닫는 태그만 있으면 그 앞부분을 제거합니다. \boxed{}, \text{} 감싸기와 "Final Answer:" 머리말도 벗겨 냅니다.
	 */
	static String cleanResponse(String text) {
		String cleaned = THINK_BLOCK.matcher(text).replaceAll("");
		int open = cleaned.indexOf(THINK_OPEN);
		if (open >= 0) {
			cleaned = cleaned.substring(0, open);
		}
		int close = cleaned.indexOf(THINK_CLOSE);
		if (close >= 0) {
			cleaned = cleaned.substring(close + THINK_CLOSE.length());
		}
		cleaned = LATEX_WRAPPER.matcher(cleaned).replaceAll("$1");
		cleaned = FINAL_ANSWER_LABEL.matcher(cleaned).replaceAll("");
		return EXCESS_BLANK_LINES.matcher(cleaned.strip()).replaceAll("\n\n");
	}

	private GenerationException toGenerationException(Throwable error) {
		if (error instanceof TimeoutException) {
			log.warn("LLM 호출 타임아웃 timeout={}", timeout);
			return new GenerationException(GenerationException.Reason.TIMEOUT,
				"LLM call timed out after " + timeout, error);
		}
		if (error instanceof IllegalStateException) {
			return new GenerationException(GenerationException.Reason.INVALID_RESPONSE,
				error.getMessage(), error);
		}
		return new GenerationException(GenerationException.Reason.PROVIDER_FAILURE,
			"LLM provider failure: " + error.getMessage(), error);
	}
}
