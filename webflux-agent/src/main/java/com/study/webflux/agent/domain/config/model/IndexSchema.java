package com.study.webflux.agent.domain.config.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 검색 가능한 인덱스(컬렉션)와 필드 목록입니다.
 */
public record IndexSchema(
	List<IndexDefinition> indexes
) {
	public IndexSchema {
		indexes = indexes == null ? List.of() : List.copyOf(indexes);
	}

	public static IndexSchema empty() {
		return new IndexSchema(List.of());
	}

	public boolean isEmpty() {
		return indexes.isEmpty();
	}

	/** 대소문자를 무시하고 인덱스를 찾습니다. 반환값은 스키마에 정의된 표기를 유지합니다. */
	public Optional<IndexDefinition> find(String name) {
		if (name == null || name.isBlank()) {
			return Optional.empty();
		}
		String candidate = name.trim().toLowerCase(Locale.ROOT);
		return indexes.stream()
			.filter(index -> index.name().toLowerCase(Locale.ROOT).equals(candidate))
			.findFirst();
	}

	public List<String> names() {
		return indexes.stream().map(IndexDefinition::name).toList();
	}

	public String summary() {
		return indexes.stream()
			.map(IndexDefinition::summaryLine)
			.collect(Collectors.joining("\n"));
	}
}
