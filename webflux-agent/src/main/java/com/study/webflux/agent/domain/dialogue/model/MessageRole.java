package com.study.webflux.agent.domain.dialogue.model;

import java.util.Arrays;

public enum MessageRole {
	SYSTEM("system"),
	USER("user"),
	ASSISTANT("assistant");

	private final String value;

	MessageRole(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static MessageRole fromValue(String value) {
		return Arrays.stream(values())
			.filter(role -> role.value.equalsIgnoreCase(value))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("unknown message role: " + value));
	}
}
