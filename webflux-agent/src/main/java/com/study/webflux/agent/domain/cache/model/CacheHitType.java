package com.study.webflux.agent.domain.cache.model;

public enum CacheHitType {
	EXACT,
	SEMANTIC,
	MISS
}
