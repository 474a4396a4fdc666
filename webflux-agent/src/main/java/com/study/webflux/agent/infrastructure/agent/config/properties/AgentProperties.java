package com.study.webflux.agent.infrastructure.agent.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * agent.* 설정 전체를 바인딩합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

	@Valid
	private Gateway gateway = new Gateway();

	@Valid
	private Admin admin = new Admin();

	@Valid
	private Config config = new Config();

	@Valid
	private Cache cache = new Cache();

	@Valid
	private Qdrant qdrant = new Qdrant();

	@Valid
	private Retrieval retrieval = new Retrieval();

	@Valid
	private Generation generation = new Generation();

	@Valid
	private History history = new History();

	@Valid
	private Pipeline pipeline = new Pipeline();

	@Getter
	@Setter
	public static class Gateway {
		@NotBlank
		private String path = "/ws";
		@Min(1)
		private int maxMessageBytes = 1024 * 1024;
		@Valid
		private Auth auth = new Auth();
	}

	@Getter
	@Setter
	public static class Auth {
		/** 비어 있으면 핸드셰이크 인증을 건너뜁니다. */
		private String secret;
		@NotNull
		private Duration tolerance = Duration.ofSeconds(300);
	}

	@Getter
	@Setter
	public static class Admin {
		private boolean enabled = true;
		@NotBlank
		private String host = "127.0.0.1";
		@Min(0)
		private int port = 4001;
		@NotBlank
		private String path = "/api/reload-prompts";
	}

	@Getter
	@Setter
	public static class Config {
		@NotBlank
		private String promptsLocation = "classpath:config/prompts.json";
		@NotBlank
		private String indexSchemaLocation = "classpath:config/index_schema.json";
		@Valid
		private Watch watch = new Watch();
		@Valid
		private Remote remote = new Remote();
	}

	@Getter
	@Setter
	public static class Watch {
		private boolean enabled = false;
		@NotNull
		private Duration interval = Duration.ofSeconds(10);
	}

	@Getter
	@Setter
	public static class Remote {
		private boolean enabled = false;
		private String url;
		private String accessToken;
		@NotBlank
		private String valuePointer = "/parameters/prompts/defaultValue/value";
		@NotNull
		private Duration timeout = Duration.ofSeconds(10);
	}

	@Getter
	@Setter
	public static class Cache {
		private boolean enabled = true;
		@NotNull
		private KeyValueBackend keyValueBackend = KeyValueBackend.REDIS;
		@NotNull
		private VectorBackend vectorBackend = VectorBackend.QDRANT;
		@NotBlank
		private String keyPrefix = "agent:cache:";
		@NotBlank
		private String collection = "prompt_response_cache";
		/** 0이면 만료되지 않습니다. */
		@NotNull
		private Duration ttl = Duration.ofSeconds(3600);
		@DecimalMin("0.0")
		@DecimalMax("1.0")
		private double similarityThreshold = 0.5;
		@NotNull
		private Duration timeout = Duration.ofSeconds(2);
	}

	@Getter
	@Setter
	public static class Qdrant {
		@NotBlank
		private String url = "http://localhost:6333";
		private String apiKey;
		@Min(1)
		private int vectorDimension = 1536;
		private boolean autoCreateCacheCollection = true;
	}

	@Getter
	@Setter
	public static class Retrieval {
		@NotNull
		private VectorBackend backend = VectorBackend.QDRANT;
		@Min(1)
		private int defaultLimit = 20;
		@NotNull
		private Duration timeout = Duration.ofSeconds(5);
	}

	@Getter
	@Setter
	public static class Generation {
		/** 비어 있으면 Spring AI 기본 모델을 사용합니다. */
		private String model;
		@NotNull
		private Duration timeout = Duration.ofSeconds(60);
		@NotNull
		private Duration embeddingTimeout = Duration.ofSeconds(10);
	}

	@Getter
	@Setter
	public static class History {
		@NotNull
		private HistoryBackend backend = HistoryBackend.MONGO;
		@NotBlank
		private String keyPrefix = "history:";
		@Min(0)
		private int limit = 6;
		/** Redis 리스트에 남겨 둘 최대 턴 수입니다. */
		@Min(1)
		private int maxStoredTurns = 200;
		@NotNull
		private Duration timeout = Duration.ofSeconds(2);
	}

	@Getter
	@Setter
	public static class Pipeline {
		private boolean llmIntentFallback = true;
		@NotBlank
		private String defaultAction = "call_rag_tool";
	}

	public enum KeyValueBackend {
		REDIS,
		MEMORY
	}

	public enum VectorBackend {
		QDRANT,
		MEMORY
	}

	public enum HistoryBackend {
		MONGO,
		REDIS,
		MEMORY
	}
}
