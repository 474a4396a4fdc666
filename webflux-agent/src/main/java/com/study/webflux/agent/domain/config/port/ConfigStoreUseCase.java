package com.study.webflux.agent.domain.config.port;

import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.model.ConfigSource;
import com.study.webflux.agent.domain.config.model.ReloadReport;
import reactor.core.publisher.Mono;

/**
 * 현재 설정 스냅샷 조회와 리로드를 제공합니다.
 */
public interface ConfigStoreUseCase {

	/**
	 * 현재 스냅샷을 반환합니다. 블로킹하지 않으며 항상 완전한 스냅샷을 반환합니다.
	 */
	ConfigSnapshot current();

	/**
	 * 지정한 소스에서 설정을 다시 읽고 스냅샷을 원자적으로 교체합니다.
	 *
	 * @param source
	 *            리로드할 소스
	 * @return 소스별 결과 리포트
	 */
	Mono<ReloadReport> reload(ConfigSource source);
}
