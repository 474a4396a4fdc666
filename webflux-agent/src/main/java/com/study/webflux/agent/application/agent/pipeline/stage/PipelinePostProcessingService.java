package com.study.webflux.agent.application.agent.pipeline.stage;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Service;

import com.study.webflux.agent.application.agent.pipeline.PipelineInputs;
import com.study.webflux.agent.application.cache.service.ResponseCacheService;
import com.study.webflux.agent.domain.dialogue.model.AgentResponse;
import com.study.webflux.agent.domain.dialogue.model.ResponseSource;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
public class PipelinePostProcessingService {

	private final ResponseCacheService cacheService;
	private final ConversationHistoryService historyService;

	/**
	 * 생성된 응답만 캐시에 기록한 뒤 대화 기록을 저장합니다. 두 작업 모두 실패해도 응답 전달에는 영향을 주지 않습니다.
	 */
	public Mono<Void> populateAndPersist(PipelineInputs inputs, AgentResponse response) {
		Mono<Void> populate = response.source() == ResponseSource.GENERATED
			? cacheService.store(inputs.normalizedQuery(), inputs.embedding(), response.text())
			: Mono.empty();
		return populate.then(historyService.appendExchange(inputs.query().conversationId(),
			inputs.query().text(), response.text()));
	}
}
