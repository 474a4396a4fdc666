package com.study.webflux.agent.domain.dialogue.port;

import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.dialogue.model.AgentResponse;
import com.study.webflux.agent.domain.dialogue.model.Query;
import reactor.core.publisher.Mono;

/**
 * AgentPipelineUseCase는 질의 하나를 처리하는 요청 파이프라인을 정의합니다.
 */
public interface AgentPipelineUseCase {

	/**
	 * 질의를 처리하고 단일 응답을 반환합니다.
	 *
	 * @param query
	 *            사용자 질의
	 * @param snapshot
	 *            요청 전체에서 사용할 설정 스냅샷
	 * @return 캐시, 템플릿, 생성, 재질문 중 하나의 응답. 생성 실패 시 GenerationException
	 */
	Mono<AgentResponse> handle(Query query, ConfigSnapshot snapshot);
}
