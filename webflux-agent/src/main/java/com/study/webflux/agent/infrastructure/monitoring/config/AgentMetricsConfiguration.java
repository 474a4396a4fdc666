package com.study.webflux.agent.infrastructure.monitoring.config;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.cache.model.CacheHitType;
import com.study.webflux.agent.domain.config.model.SourceReloadResult;
import com.study.webflux.agent.domain.dialogue.model.ResponseSource;
import com.study.webflux.agent.domain.monitoring.model.AgentPipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 게이트웨이 연결, 캐시 적중률, 파이프라인 결과 메트릭을 제공합니다.
 */
@Component
public class AgentMetricsConfiguration {

	private final MeterRegistry meterRegistry;
	private final AtomicInteger activeConnections = new AtomicInteger(0);
	private final Counter generationFailureCounter;
	private final Counter protocolErrorCounter;

	public AgentMetricsConfiguration(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;

		Gauge.builder("agent.gateway.connections.active", activeConnections, AtomicInteger::get)
			.description("Number of open gateway connections")
			.register(meterRegistry);

		this.generationFailureCounter = Counter.builder("agent.generation.failure")
			.description("Number of requests that ended with a generation failure")
			.register(meterRegistry);

		this.protocolErrorCounter = Counter.builder("agent.gateway.protocol.error")
			.description("Number of connections closed for protocol violations")
			.register(meterRegistry);
	}

	public void connectionOpened() {
		activeConnections.incrementAndGet();
	}

	public void connectionClosed() {
		activeConnections.updateAndGet(current -> Math.max(0, current - 1));
	}

	public int activeConnections() {
		return activeConnections.get();
	}

	/**
	 * 캐시 조회 결과를 기록합니다.
	 */
	public void recordCacheOutcome(CacheHitType type) {
		Counter.builder("agent.cache.lookup")
			.tag("outcome", type.name().toLowerCase(Locale.ROOT))
			.register(meterRegistry)
			.increment();
	}

	/**
	 * 백엔드 장애로 단계가 축소 동작했음을 기록합니다.
	 */
	public void recordDegraded(AgentPipelineStage stage) {
		Counter.builder("agent.pipeline.degraded")
			.tag("stage", stage.name().toLowerCase(Locale.ROOT))
			.register(meterRegistry)
			.increment();
	}

	public void recordResponse(ResponseSource source) {
		Counter.builder("agent.pipeline.response")
			.tag("source", source.label())
			.register(meterRegistry)
			.increment();
	}

	public void recordGenerationFailure() {
		generationFailureCounter.increment();
	}

	public void recordProtocolError() {
		protocolErrorCounter.increment();
	}

	public void recordReload(SourceReloadResult result) {
		Counter.builder("agent.config.reload")
			.tag("source", result.source().label())
			.tag("status", result.status().name().toLowerCase(Locale.ROOT))
			.register(meterRegistry)
			.increment();
	}
}
