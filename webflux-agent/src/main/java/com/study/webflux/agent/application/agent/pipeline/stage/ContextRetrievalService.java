package com.study.webflux.agent.application.agent.pipeline.stage;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.monitoring.model.AgentPipelineStage;
import com.study.webflux.agent.domain.retrieval.model.RetrievalContext;
import com.study.webflux.agent.domain.retrieval.port.RetrievalPort;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import reactor.core.publisher.Mono;

/**
 * 결정된 인덱스에서 관련 문서를 검색합니다. 실패와 타임아웃은 빈 컨텍스트로 대체됩니다.
 */
@Slf4j
@Service
public class ContextRetrievalService {

	private final RetrievalPort retrievalPort;
	private final AgentMetricsConfiguration metrics;
	private final int limit;
	private final Duration timeout;

	public ContextRetrievalService(RetrievalPort retrievalPort,
		AgentMetricsConfiguration metrics,
		AgentProperties properties) {
		this.retrievalPort = retrievalPort;
		this.metrics = metrics;
		this.limit = properties.getRetrieval().getDefaultLimit();
		this.timeout = properties.getRetrieval().getTimeout();
	}

	public Mono<RetrievalContext> retrieve(String index, Mono<Embedding> embedding) {
		return embedding
			.flatMap(vector -> retrievalPort.retrieve(index, vector, limit).timeout(timeout))
			.defaultIfEmpty(RetrievalContext.empty(index))
			.doOnNext(context -> log.debug("문서 검색 완료 index={}, count={}", index,
				context.documents().size()))
			.onErrorResume(error -> {
				log.warn("문서 검색 실패, 빈 컨텍스트로 진행합니다 index={}, 이유={}", index, error.toString());
				metrics.recordDegraded(AgentPipelineStage.RETRIEVE);
				return Mono.just(RetrievalContext.empty(index));
			});
	}
}
