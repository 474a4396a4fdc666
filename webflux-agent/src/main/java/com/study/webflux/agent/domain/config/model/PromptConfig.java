package com.study.webflux.agent.domain.config.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 인텐트 정의와 프롬프트 템플릿 묶음입니다. 생성 이후 변경되지 않으며 리로드 시 통째로 교체됩니다.
 */
public record PromptConfig(
	Map<String, IntentDefinition> intents,
	Map<String, String> corePrompts,
	Map<String, String> queryTemplates,
	Map<String, String> responseTemplates
) {
	public PromptConfig {
		intents = immutableOrderedCopy(intents);
		corePrompts = immutableOrderedCopy(corePrompts);
		queryTemplates = immutableOrderedCopy(queryTemplates);
		responseTemplates = immutableOrderedCopy(responseTemplates);
	}

	public static PromptConfig empty() {
		return new PromptConfig(Map.of(), Map.of(), Map.of(), Map.of());
	}

	public Optional<IntentDefinition> findIntent(String name) {
		return Optional.ofNullable(name).map(intents::get);
	}

	public Optional<String> findCorePrompt(String name) {
		return Optional.ofNullable(name).map(corePrompts::get);
	}

	public Optional<String> findQueryTemplate(String name) {
		return Optional.ofNullable(name).map(queryTemplates::get);
	}

	public Optional<String> findResponseTemplate(String name) {
		return Optional.ofNullable(name).map(responseTemplates::get);
	}

	/** query_templates를 먼저 찾고 없으면 response_templates에서 찾습니다. */
	public Optional<String> findTemplate(String name) {
		return findQueryTemplate(name).or(() -> findResponseTemplate(name));
	}

	private static <V> Map<String, V> immutableOrderedCopy(Map<String, V> source) {
		if (source == null || source.isEmpty()) {
			return Map.of();
		}
		return Collections.unmodifiableMap(new LinkedHashMap<>(source));
	}
}
