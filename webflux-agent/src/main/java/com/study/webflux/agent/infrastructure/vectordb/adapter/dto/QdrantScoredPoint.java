package com.study.webflux.agent.infrastructure.vectordb.adapter.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** id는 Qdrant 설정에 따라 정수 또는 UUID 문자열입니다. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantScoredPoint(
	Object id,
	double score,
	Map<String, Object> payload
) {
}
