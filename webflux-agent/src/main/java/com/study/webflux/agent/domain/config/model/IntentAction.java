package com.study.webflux.agent.domain.config.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * 인텐트가 매칭되었을 때 수행할 처리 방식입니다.
 */
public enum IntentAction {
	CALL_RAG_TOOL("call_rag_tool"),
	GENERAL_LLM_CALL("general_llm_call"),
	RESPOND_TEMPLATE("respond_template");

	private final String value;

	IntentAction(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static IntentAction fromValue(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("intent action cannot be null or blank");
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
			.filter(action -> action.value.equals(normalized))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("unknown intent action: " + value));
	}
}
