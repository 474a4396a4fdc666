package com.study.webflux.agent.domain.config.port;

import com.study.webflux.agent.domain.config.model.RemoteConfigFetch;
import reactor.core.publisher.Mono;

/**
 * 원격 설정 백엔드입니다. 프롬프트 설정 전체를 하나의 JSON 문자열로 제공합니다.
 */
public interface RemoteConfigPort {

	boolean isEnabled();

	/**
	 * 원격 프롬프트 설정을 가져옵니다.
	 *
	 * @param knownEtag
	 *            마지막으로 적용한 ETag, 없으면 null
	 * @return 변경되지 않았으면 {@link RemoteConfigFetch#notModified()} 결과
	 */
	Mono<RemoteConfigFetch> fetchPrompts(String knownEtag);
}
