package com.study.webflux.agent.infrastructure.vectordb.adapter.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QdrantSearchRequest(
	List<Float> vector,
	int limit,
	@JsonProperty("with_payload") boolean withPayload
) {
}
