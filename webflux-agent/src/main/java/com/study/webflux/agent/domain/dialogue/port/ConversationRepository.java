package com.study.webflux.agent.domain.dialogue.port;

import com.study.webflux.agent.domain.dialogue.model.ConversationId;
import com.study.webflux.agent.domain.dialogue.model.ConversationTurn;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 대화 기록 저장소입니다.
 */
public interface ConversationRepository {

	Mono<ConversationTurn> save(ConversationTurn turn);

	/**
	 * 최근 대화 턴을 오래된 순서로 반환합니다.
	 *
	 * @param conversationId
	 *            대화 식별자
	 * @param limit
	 *            최대 턴 수
	 * @return 오래된 순서의 최근 턴
	 */
	Flux<ConversationTurn> findRecent(ConversationId conversationId, int limit);
}
