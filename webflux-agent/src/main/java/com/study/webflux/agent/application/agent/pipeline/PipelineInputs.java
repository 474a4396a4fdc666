package com.study.webflux.agent.application.agent.pipeline;

import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.dialogue.model.NormalizedQuery;
import com.study.webflux.agent.domain.dialogue.model.Query;
import reactor.core.publisher.Mono;

/**
 * 요청 하나를 처리하는 동안 단계 사이에 공유되는 입력입니다. embedding은 요청 단위로 캐시된 지연 Mono입니다.
 */
public record PipelineInputs(
	Query query,
	NormalizedQuery normalizedQuery,
	ConfigSnapshot snapshot,
	Mono<Embedding> embedding
) {
}
