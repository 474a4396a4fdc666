package com.study.webflux.agent.domain.config.model;

import java.time.Instant;

/**
 * 현재 적용 중인 프롬프트 설정과 인덱스 스키마의 쌍입니다. 리로드 시 통째로 교체됩니다.
 */
public record ConfigSnapshot(
	PromptConfig promptConfig,
	IndexSchema indexSchema,
	long version,
	Instant loadedAt
) {
	public ConfigSnapshot {
		if (promptConfig == null) {
			throw new IllegalArgumentException("promptConfig cannot be null");
		}
		if (indexSchema == null) {
			throw new IllegalArgumentException("indexSchema cannot be null");
		}
		if (loadedAt == null) {
			loadedAt = Instant.now();
		}
	}

	public static ConfigSnapshot initial() {
		return new ConfigSnapshot(PromptConfig.empty(), IndexSchema.empty(), 0L, Instant.now());
	}

	public static ConfigSnapshot of(PromptConfig promptConfig, IndexSchema indexSchema) {
		return new ConfigSnapshot(promptConfig, indexSchema, 1L, Instant.now());
	}

	public ConfigSnapshot next(PromptConfig newPromptConfig, IndexSchema newIndexSchema) {
		return new ConfigSnapshot(
			newPromptConfig != null ? newPromptConfig : promptConfig,
			newIndexSchema != null ? newIndexSchema : indexSchema,
			version + 1,
			Instant.now());
	}
}
