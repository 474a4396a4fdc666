package com.study.webflux.agent.application.agent.pipeline;

import com.study.webflux.agent.domain.config.model.PromptConfig;

/**
 * 프롬프트 설정에 항목이 없을 때 사용하는 템플릿 키와 기본 문구입니다.
 */
public final class PromptDefaults {

	public static final String SYSTEM_PROMPT = "system";
	public static final String INTENT_CLASSIFICATION = "intent_classification";
	public static final String TOPIC_INFERENCE = "rag_topic_inference";
	public static final String FALLBACK_TOPIC_RESOLVER = "fallback_topic_resolver";
	public static final String RAG_FINAL_ANSWER = "rag_final_answer";
	public static final String GENERAL_CONVERSATION = "general_conversation";
	public static final String CLARIFICATION = "clarification";
	public static final String GENERATION_FAILURE = "generation_failure";

	public static final String DEFAULT_RAG_TEMPLATE = """
        Answer the user's question using only the documents below. \
        If the documents do not contain the answer, say that the information is not available.

        Topic: {topic}

        Documents:
        {documents}

        Question: {user_question}""";

	public static final String DEFAULT_CONVERSATION_TEMPLATE = "{user_question}";

	public static final String DEFAULT_CLARIFICATION = "I could not tell which data your question is about. "
		+ "Could you rephrase it or mention what kind of information you are looking for?";

	public static final String DEFAULT_GENERATION_FAILURE = "Sorry, I could not generate an answer right now. "
		+ "Please try again in a moment.";

	private PromptDefaults() {
	}

	public static String clarification(PromptConfig config) {
		return config.findResponseTemplate(CLARIFICATION).orElse(DEFAULT_CLARIFICATION);
	}

	public static String generationFailure(PromptConfig config) {
		return config.findResponseTemplate(GENERATION_FAILURE).orElse(DEFAULT_GENERATION_FAILURE);
	}
}
