package com.study.webflux.agent.application.agent.pipeline.stage;

import java.time.Duration;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.agent.domain.dialogue.model.ConversationId;
import com.study.webflux.agent.domain.dialogue.model.ConversationTurn;
import com.study.webflux.agent.domain.dialogue.model.Message;
import com.study.webflux.agent.domain.dialogue.model.MessageRole;
import com.study.webflux.agent.domain.dialogue.port.ConversationRepository;
import com.study.webflux.agent.domain.monitoring.model.AgentPipelineStage;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import reactor.core.publisher.Mono;

/**
 * 대화 기록 조회와 저장을 담당합니다. 저장소 장애는 요청을 실패시키지 않습니다.
 */
@Slf4j
@Service
public class ConversationHistoryService {

	private static final String HISTORY_HEADER = "Previous conversation:";

	private final ConversationRepository conversationRepository;
	private final AgentMetricsConfiguration metrics;
	private final int limit;
	private final Duration timeout;

	public ConversationHistoryService(ConversationRepository conversationRepository,
		AgentMetricsConfiguration metrics,
		AgentProperties properties) {
		this.conversationRepository = conversationRepository;
		this.metrics = metrics;
		this.limit = properties.getHistory().getLimit();
		this.timeout = properties.getHistory().getTimeout();
	}

	/**
	 * 최근 대화 턴을 오래된 순서로 조회합니다.
	 */
	public Mono<List<ConversationTurn>> recent(ConversationId conversationId) {
		if (limit == 0) {
			return Mono.just(List.of());
		}
		return conversationRepository.findRecent(conversationId, limit)
			.collectList()
			.timeout(timeout)
			.onErrorResume(error -> {
				log.warn("대화 기록 조회 실패, 기록 없이 진행합니다 conversationId={}, 이유={}",
					conversationId.value(), error.toString());
				return Mono.just(List.of());
			});
	}

	/**
	 * 대화 턴을 LLM 메시지로 변환합니다.
	 */
	public List<Message> toMessages(List<ConversationTurn> turns) {
		return turns.stream()
			.map(turn -> switch (turn.role()) {
				case USER -> Message.user(turn.content());
				case ASSISTANT -> Message.assistant(turn.content());
				case SYSTEM -> Message.system(turn.content());
			})
			.toList();
	}

	/**
	 * 프롬프트의 {history} 자리에 넣을 텍스트로 변환합니다. 기록이 없으면 빈 문자열입니다.
	 */
	public String formatForPrompt(List<ConversationTurn> turns) {
		if (turns.isEmpty()) {
			return "";
		}
		StringBuilder text = new StringBuilder(HISTORY_HEADER);
		for (ConversationTurn turn : turns) {
			text.append('\n')
				.append(turn.role() == MessageRole.ASSISTANT ? "Assistant" : "User")
				.append(": ")
				.append(turn.content());
		}
		return text.toString();
	}

	/**
	 * 사용자 질문과 응답을 순서대로 저장합니다.
	 */
	public Mono<Void> appendExchange(ConversationId conversationId, String question, String answer) {
		return Mono.defer(() -> conversationRepository.save(ConversationTurn.user(conversationId, question)))
			.then(Mono.defer(() -> conversationRepository.save(
				ConversationTurn.assistant(conversationId, answer))))
			.timeout(timeout)
			.then()
			.onErrorResume(error -> {
				log.warn("대화 기록 저장 실패 conversationId={}, 이유={}", conversationId.value(),
					error.toString());
				metrics.recordDegraded(AgentPipelineStage.PERSIST_HISTORY);
				return Mono.empty();
			});
	}
}
