package com.study.webflux.agent.domain.config.model;

import java.util.Locale;

public enum ConfigSource {
	LOCAL,
	REMOTE,
	BOTH;

	public boolean includesLocal() {
		return this == LOCAL || this == BOTH;
	}

	public boolean includesRemote() {
		return this == REMOTE || this == BOTH;
	}

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * 관리 요청의 source 파라미터를 해석합니다. 값이 없으면 양쪽 모두를 의미합니다.
	 */
	public static ConfigSource fromParameter(String value) {
		if (value == null || value.isBlank()) {
			return BOTH;
		}
		return switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "local" -> LOCAL;
			case "remote" -> REMOTE;
			case "both", "all" -> BOTH;
			default -> throw new IllegalArgumentException("unknown config source: " + value);
		};
	}
}
