package com.study.webflux.agent.domain.retrieval.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public record RetrievalDocument(
	String id,
	double score,
	Map<String, Object> fields
) {
	public RetrievalDocument {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id cannot be null or blank");
		}
		fields = fields == null ? Map.of() : new LinkedHashMap<>(fields);
	}

	public String toPromptText() {
		String header = String.format(Locale.ROOT, "Document ID: %s (Score: %.4f)", id, score);
		if (fields.isEmpty()) {
			return header;
		}
		return header + "\n" + fields.entrySet().stream()
			.map(entry -> "  - " + entry.getKey() + ": " + entry.getValue())
			.collect(Collectors.joining("\n"));
	}
}
