package com.study.webflux.agent.domain.topic.model;

public enum ResolutionStage {
	PRIMARY,
	FALLBACK,
	UNRESOLVED
}
