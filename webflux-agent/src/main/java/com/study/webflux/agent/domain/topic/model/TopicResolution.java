package com.study.webflux.agent.domain.topic.model;

import java.util.Optional;

import com.study.webflux.agent.domain.config.model.IndexDefinition;

/**
 * 토픽(인덱스) 판별 결과입니다. 어느 단계에서 판별되었는지 함께 기록합니다.
 */
public record TopicResolution(
	IndexDefinition index,
	ResolutionStage stage
) {
	public TopicResolution {
		if (stage == null) {
			throw new IllegalArgumentException("stage cannot be null");
		}
		if (stage == ResolutionStage.UNRESOLVED && index != null) {
			throw new IllegalArgumentException("unresolved result cannot carry an index");
		}
		if (stage != ResolutionStage.UNRESOLVED && index == null) {
			throw new IllegalArgumentException("resolved result requires an index");
		}
	}

	public static TopicResolution resolved(IndexDefinition index, ResolutionStage stage) {
		return new TopicResolution(index, stage);
	}

	public static TopicResolution unresolved() {
		return new TopicResolution(null, ResolutionStage.UNRESOLVED);
	}

	public boolean isResolved() {
		return stage != ResolutionStage.UNRESOLVED;
	}

	public Optional<String> indexName() {
		return Optional.ofNullable(index).map(IndexDefinition::name);
	}
}
