package com.study.webflux.agent.application.gateway.auth;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

import com.study.webflux.agent.domain.gateway.exception.AuthException;
import com.study.webflux.agent.domain.gateway.model.AuthenticatedIdentity;
import com.study.webflux.agent.fixture.AgentPropertiesFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandshakeAuthenticatorTest {

	private static final String SECRET = "test-secret";
	private static final String TS = "1700000000";
	private static final String SIGNATURE = "1b74eaf87da46877ba651ac812b24a3bf01990e9ed0101b88268f60f965729e2";

	private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
	private final HandshakeAuthenticator authenticator = new HandshakeAuthenticator(
		AgentPropertiesFixture.withSecret(SECRET), clock);

	@Test
	@DisplayName("타임스탬프의 HMAC-SHA256 16진수 서명을 계산한다")
	void sign_matchesHmacSha256() {
		assertThat(authenticator.sign(TS)).isEqualTo(SIGNATURE);
	}

	@Test
	@DisplayName("올바른 서명은 대소문자와 관계없이 인증된다")
	void authenticate_validSignature() {
		AuthenticatedIdentity identity = authenticator.authenticate(TS,
			SIGNATURE.toUpperCase(Locale.ROOT));

		assertThat(identity.authenticated()).isTrue();
		assertThat(identity.principal()).isEqualTo("shared-secret");
	}

	@Test
	@DisplayName("허용 오차 경계의 타임스탬프는 인증된다")
	void authenticate_toleranceBoundary() {
		String ts = String.valueOf(1_700_000_000L - 300);

		assertThat(authenticator.authenticate(ts, authenticator.sign(ts)).authenticated()).isTrue();
	}

	@Test
	@DisplayName("허용 오차를 벗어난 타임스탬프는 EXPIRED로 거부한다")
	void authenticate_staleTimestamp() {
		String ts = String.valueOf(1_700_000_000L + 301);

		assertReason(() -> authenticator.authenticate(ts, authenticator.sign(ts)),
			AuthException.Reason.EXPIRED);
	}

	@Test
	@DisplayName("정수가 아닌 타임스탬프는 EXPIRED로 거부한다")
	void authenticate_nonNumericTimestamp() {
		assertReason(() -> authenticator.authenticate("yesterday", SIGNATURE),
			AuthException.Reason.EXPIRED);
	}

	@Test
	@DisplayName("ts 또는 sig가 없으면 MISSING으로 거부한다")
	void authenticate_missingParameters() {
		assertReason(() -> authenticator.authenticate(null, SIGNATURE), AuthException.Reason.MISSING);
		assertReason(() -> authenticator.authenticate(TS, " "), AuthException.Reason.MISSING);
	}

	@Test
	@DisplayName("서명이 다르면 INVALID_SIGNATURE로 거부한다")
	void authenticate_wrongSignature() {
		String forged = SIGNATURE.substring(0, SIGNATURE.length() - 1) + "0";

		assertReason(() -> authenticator.authenticate(TS, forged),
			AuthException.Reason.INVALID_SIGNATURE);
	}

	@Test
	@DisplayName("비밀키가 없으면 파라미터 없이도 익명으로 허용한다")
	void authenticate_disabledAllowsAnonymous() {
		HandshakeAuthenticator open = new HandshakeAuthenticator(AgentPropertiesFixture.create(), clock);

		assertThat(open.isEnabled()).isFalse();
		assertThat(open.authenticate(null, null)).isEqualTo(AuthenticatedIdentity.anonymous());
	}

	private static void assertReason(Runnable call, AuthException.Reason reason) {
		assertThatThrownBy(call::run)
			.isInstanceOfSatisfying(AuthException.class,
				error -> assertThat(error.getReason()).isEqualTo(reason));
	}
}
