package com.study.webflux.agent.domain.dialogue.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 공백과 대소문자를 정규화한 질의입니다. 캐시 키의 기준이 됩니다.
 */
public record NormalizedQuery(
	String value
) {
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	public NormalizedQuery {
		if (value == null) {
			throw new IllegalArgumentException("value cannot be null");
		}
	}

	public static NormalizedQuery of(String raw) {
		if (raw == null) {
			return new NormalizedQuery("");
		}
		String collapsed = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
		return new NormalizedQuery(collapsed.toLowerCase(Locale.ROOT));
	}

	public static NormalizedQuery of(Query query) {
		return of(query.text());
	}

	public boolean isEmpty() {
		return value.isEmpty();
	}
}
