package com.study.webflux.agent.domain.dialogue.model;

import com.study.webflux.agent.domain.config.model.IntentAction;
import com.study.webflux.agent.domain.config.model.IntentDefinition;

/**
 * 인텐트 분류 결과입니다. 매칭된 인텐트가 없으면 name과 definition이 null이고 기본 동작을 사용합니다.
 */
public record IntentMatch(
	String name,
	IntentDefinition definition,
	IntentAction action
) {
	public IntentMatch {
		if (action == null) {
			throw new IllegalArgumentException("action cannot be null");
		}
	}

	public static IntentMatch of(String name, IntentDefinition definition) {
		return new IntentMatch(name, definition, definition.action());
	}

	public static IntentMatch fallback(IntentAction action) {
		return new IntentMatch(null, null, action);
	}

	public boolean matched() {
		return definition != null;
	}

	public String template() {
		return definition != null ? definition.template() : null;
	}
}
