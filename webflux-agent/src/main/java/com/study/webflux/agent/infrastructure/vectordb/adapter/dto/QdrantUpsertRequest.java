package com.study.webflux.agent.infrastructure.vectordb.adapter.dto;

import java.util.List;

public record QdrantUpsertRequest(
	List<QdrantPoint> points
) {
}
