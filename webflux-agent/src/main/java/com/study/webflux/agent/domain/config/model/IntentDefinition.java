package com.study.webflux.agent.domain.config.model;

import java.util.List;

public record IntentDefinition(
	String description,
	IntentAction action,
	List<String> keywords,
	List<String> patterns,
	String responseTemplate,
	String template
) {
	public IntentDefinition {
		if (action == null) {
			throw new IllegalArgumentException("action cannot be null");
		}
		description = description == null ? "" : description;
		keywords = keywords == null ? List.of() : List.copyOf(keywords);
		patterns = patterns == null ? List.of() : List.copyOf(patterns);
	}

	public static IntentDefinition of(String description, IntentAction action, List<String> keywords) {
		return new IntentDefinition(description, action, keywords, List.of(), null, null);
	}

	public boolean hasMatchers() {
		return !keywords.isEmpty() || !patterns.isEmpty();
	}
}
