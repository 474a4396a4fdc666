package com.study.webflux.agent.domain.retrieval.model;

import java.util.List;
import java.util.stream.Collectors;

public record RetrievalContext(
	String index,
	List<RetrievalDocument> documents
) {
	static final String NO_DOCUMENTS = "No relevant documents found.";

	public RetrievalContext {
		documents = documents == null ? List.of() : List.copyOf(documents);
	}

	public static RetrievalContext of(String index, List<RetrievalDocument> documents) {
		return new RetrievalContext(index, documents);
	}

	public static RetrievalContext empty(String index) {
		return new RetrievalContext(index, List.of());
	}

	public boolean isEmpty() {
		return documents.isEmpty();
	}

	public String toPromptText() {
		if (documents.isEmpty()) {
			return NO_DOCUMENTS;
		}
		return documents.stream()
			.map(RetrievalDocument::toPromptText)
			.collect(Collectors.joining("\n\n"));
	}
}
