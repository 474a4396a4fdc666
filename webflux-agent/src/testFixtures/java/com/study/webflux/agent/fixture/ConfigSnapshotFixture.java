package com.study.webflux.agent.fixture;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.model.IndexDefinition;
import com.study.webflux.agent.domain.config.model.IndexSchema;
import com.study.webflux.agent.domain.config.model.IntentAction;
import com.study.webflux.agent.domain.config.model.IntentDefinition;
import com.study.webflux.agent.domain.config.model.PromptConfig;

public final class ConfigSnapshotFixture {

	public static final String GREETING_TEXT = "안녕하세요! 무엇을 도와드릴까요?";
	public static final String CLARIFICATION_TEXT = "어떤 데이터에 대한 질문인지 알려주세요.";
	public static final String FAILURE_TEXT = "지금은 답변을 생성할 수 없습니다.";

	private ConfigSnapshotFixture() {
	}

	public static ConfigSnapshot create() {
		return new ConfigSnapshot(promptConfig(), indexSchema(), 1L, Instant.now());
	}

	public static ConfigSnapshot withoutIndexes() {
		return new ConfigSnapshot(promptConfig(), IndexSchema.empty(), 1L, Instant.now());
	}

	public static PromptConfig promptConfig() {
		Map<String, IntentDefinition> intents = new LinkedHashMap<>();
		intents.put("greeting", new IntentDefinition("인사", IntentAction.RESPOND_TEMPLATE,
			List.of("hello", "안녕"), List.of(), "greeting", null));
		intents.put("data_question", new IntentDefinition("데이터 조회 질문", IntentAction.CALL_RAG_TOOL,
			List.of(), List.of("\\border(s)?\\b", "프로필"), null, null));
		intents.put("chitchat", new IntentDefinition("잡담", IntentAction.GENERAL_LLM_CALL,
			List.of("thanks"), List.of(), null, null));

		Map<String, String> queryTemplates = new LinkedHashMap<>();
		queryTemplates.put("intent_classification",
			"Intents:\n{intent_descriptions}\nMessage: {message}");
		queryTemplates.put("rag_topic_inference",
			"Schema: {schema_json}\nQuestion: {user_question}");
		queryTemplates.put("fallback_topic_resolver",
			"Indexes:\n{schema_summary}\nQuestion: {user_question}");

		Map<String, String> responseTemplates = new LinkedHashMap<>();
		responseTemplates.put("greeting", GREETING_TEXT);
		responseTemplates.put("rag_final_answer",
			"Topic: {topic}\nDocuments:\n{documents}\nQuestion: {user_question}");
		responseTemplates.put("clarification", CLARIFICATION_TEXT);
		responseTemplates.put("generation_failure", FAILURE_TEXT);

		return new PromptConfig(intents, Map.of("system", "You are a helpful assistant."),
			queryTemplates, responseTemplates);
	}

	public static IndexSchema indexSchema() {
		return new IndexSchema(List.of(
			new IndexDefinition("profile", "사용자 프로필", List.of("user_id", "name", "email")),
			new IndexDefinition("orders", "주문 내역", List.of("order_id", "status", "total"))));
	}
}
