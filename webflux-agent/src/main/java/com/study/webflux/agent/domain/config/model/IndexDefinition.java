package com.study.webflux.agent.domain.config.model;

import java.util.List;

public record IndexDefinition(
	String name,
	String description,
	List<String> fields
) {
	public IndexDefinition {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("index name cannot be null or blank");
		}
		description = description == null ? "" : description;
		fields = fields == null ? List.of() : List.copyOf(fields);
	}

	public static IndexDefinition of(String name, List<String> fields) {
		return new IndexDefinition(name, null, fields);
	}

	public String summaryLine() {
		return "- " + name + ": fields=" + String.join(", ", fields);
	}
}
