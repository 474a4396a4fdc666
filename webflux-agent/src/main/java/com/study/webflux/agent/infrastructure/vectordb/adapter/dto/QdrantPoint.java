package com.study.webflux.agent.infrastructure.vectordb.adapter.dto;

import java.util.List;
import java.util.Map;

public record QdrantPoint(
	String id,
	List<Float> vector,
	Map<String, Object> payload
) {
}
