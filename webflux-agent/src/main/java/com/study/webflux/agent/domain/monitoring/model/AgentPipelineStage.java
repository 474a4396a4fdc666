package com.study.webflux.agent.domain.monitoring.model;

/** 요청 파이프라인의 처리 단계를 정의합니다. */
public enum AgentPipelineStage {
	/** 질의 공백과 대소문자를 정규화합니다. */
	NORMALIZE,

	/** 정확 일치 캐시와 시맨틱 캐시를 조회합니다. */
	CACHE_CHECK,

	/** 인텐트를 분류합니다. */
	CLASSIFY_INTENT,

	/** 검색할 인덱스를 판별합니다. */
	RESOLVE_TOPIC,

	/** 판별된 인덱스에서 문서를 검색합니다. */
	RETRIEVE,

	/** LLM으로 응답을 생성합니다. */
	GENERATE,

	/** 생성된 응답을 캐시에 기록합니다. */
	POPULATE_CACHE,

	/** 대화 기록을 저장합니다. */
	PERSIST_HISTORY,

	/** 응답을 반환합니다. */
	RESPOND
}
