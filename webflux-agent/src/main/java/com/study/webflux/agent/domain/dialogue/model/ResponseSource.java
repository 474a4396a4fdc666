package com.study.webflux.agent.domain.dialogue.model;

import java.util.Locale;

public enum ResponseSource {
	CACHE_EXACT,
	CACHE_SEMANTIC,
	TEMPLATE,
	GENERATED,
	CLARIFICATION;

	public boolean fromCache() {
		return this == CACHE_EXACT || this == CACHE_SEMANTIC;
	}

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
