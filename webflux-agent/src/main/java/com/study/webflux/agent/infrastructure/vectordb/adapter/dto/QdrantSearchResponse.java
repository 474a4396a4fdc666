package com.study.webflux.agent.infrastructure.vectordb.adapter.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantSearchResponse(
	List<QdrantScoredPoint> result,
	String status,
	Double time
) {
}
