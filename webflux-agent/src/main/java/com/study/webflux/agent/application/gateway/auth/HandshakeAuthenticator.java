package com.study.webflux.agent.application.gateway.auth;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.gateway.exception.AuthException;
import com.study.webflux.agent.domain.gateway.model.AuthenticatedIdentity;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;

/**
 * 공유 비밀키 기반 핸드셰이크 인증입니다. 서명은 타임스탬프 문자열의 HMAC-SHA256 소문자 16진수 값입니다.
 *
 * <p>
 * 비밀키가 설정되지 않으면 모든 연결을 익명으로 허용합니다.
 */
@Component
public class HandshakeAuthenticator {

	private static final String ALGORITHM = "HmacSHA256";

	private final byte[] secret;
	private final Duration tolerance;
	private final Clock clock;

	public HandshakeAuthenticator(AgentProperties properties, Clock clock) {
		String configured = properties.getGateway().getAuth().getSecret();
		this.secret = configured == null || configured.isBlank()
			? null
			: configured.getBytes(StandardCharsets.UTF_8);
		this.tolerance = properties.getGateway().getAuth().getTolerance();
		this.clock = clock;
	}

	public boolean isEnabled() {
		return secret != null;
	}

	/**
	 * 핸드셰이크 파라미터를 검증합니다.
	 *
	 * @param timestamp
	 *            유닉스 초 단위 타임스탬프
	 * @param signature
	 *            HMAC-SHA256(secret, timestamp)의 16진수 문자열
	 * @return 인증된 식별자, 인증이 꺼져 있으면 익명
	 * @throws AuthException
	 *             파라미터 누락, 만료, 서명 불일치
	 */
	public AuthenticatedIdentity authenticate(String timestamp, String signature) {
		if (!isEnabled()) {
			return AuthenticatedIdentity.anonymous();
		}
		if (timestamp == null || timestamp.isBlank() || signature == null || signature.isBlank()) {
			throw new AuthException(AuthException.Reason.MISSING,
				"Missing 'ts' or 'sig' handshake parameter");
		}
		long issuedAt;
		try {
			issuedAt = Long.parseLong(timestamp.trim());
		} catch (NumberFormatException e) {
			throw new AuthException(AuthException.Reason.EXPIRED,
				"Handshake timestamp is not a unix time: " + timestamp);
		}
		long skew = Math.abs(clock.instant().getEpochSecond() - issuedAt);
		if (skew > tolerance.getSeconds()) {
			throw new AuthException(AuthException.Reason.EXPIRED,
				"Handshake timestamp outside tolerance of " + tolerance.getSeconds() + "s");
		}
		byte[] expected = sign(timestamp.trim()).getBytes(StandardCharsets.US_ASCII);
		byte[] provided = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
		if (!MessageDigest.isEqual(expected, provided)) {
			throw new AuthException(AuthException.Reason.INVALID_SIGNATURE,
				"Handshake signature mismatch");
		}
		return AuthenticatedIdentity.sharedSecret();
	}

	String sign(String timestamp) {
		try {
			Mac mac = Mac.getInstance(ALGORITHM);
			mac.init(new SecretKeySpec(secret, ALGORITHM));
			return HexFormat.of().formatHex(mac.doFinal(timestamp.getBytes(StandardCharsets.UTF_8)));
		} catch (GeneralSecurityException e) {
			throw new IllegalStateException("HMAC-SHA256 is not available", e);
		}
	}
}
