package com.study.webflux.agent.application.agent.pipeline.stage;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.agent.application.agent.pipeline.PromptDefaults;
import com.study.webflux.agent.domain.config.model.IntentAction;
import com.study.webflux.agent.domain.config.model.IntentDefinition;
import com.study.webflux.agent.domain.config.model.PromptConfig;
import com.study.webflux.agent.domain.dialogue.model.IntentMatch;
import com.study.webflux.agent.domain.dialogue.model.NormalizedQuery;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import reactor.core.publisher.Mono;

/**
 * 설정된 인텐트 중 질의에 맞는 것을 선택합니다.
 *
 * <p>
 * 인텐트 선언 순서대로 키워드(단어 경계 일치)와 정규식 패턴을 검사하고, 첫 번째로 일치한 인텐트를 사용합니다. 일치하는
 * 인텐트가 없으면 설정에 따라 LLM 분류를 시도하고, 그래도 결정되지 않으면 기본 액션으로 진행합니다.
 */
@Slf4j
@Service
public class IntentClassificationService {

	private static final String WORD_BOUNDARY_BEFORE = "(?<![\\p{L}\\p{N}_])";
	private static final String WORD_BOUNDARY_AFTER = "(?![\\p{L}\\p{N}_])";

	private final LlmInvocationService llmInvocationService;
	private final PromptTemplateRenderer renderer;
	private final boolean llmFallbackEnabled;
	private final IntentAction defaultAction;
	private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();
	private final AtomicReference<PromptConfig> patternOwner = new AtomicReference<>();

	public IntentClassificationService(LlmInvocationService llmInvocationService,
		PromptTemplateRenderer renderer,
		AgentProperties properties) {
		this.llmInvocationService = llmInvocationService;
		this.renderer = renderer;
		this.llmFallbackEnabled = properties.getPipeline().isLlmIntentFallback();
		this.defaultAction = IntentAction.fromValue(properties.getPipeline().getDefaultAction());
	}

	/**
	 * 질의의 인텐트를 결정합니다.
	 *
	 * @param query
	 *            정규화된 질의
	 * @param originalText
	 *            LLM 분류 프롬프트에 넣을 원문
	 * @param config
	 *            현재 프롬프트 설정
	 * @return 결정된 인텐트, LLM 분류 실패는 기본 액션으로 대체되어 오류를 방출하지 않습니다.
	 */
	public Mono<IntentMatch> classify(NormalizedQuery query, String originalText, PromptConfig config) {
		Optional<IntentMatch> ruleMatch = matchRules(query, config);
		if (ruleMatch.isPresent()) {
			log.debug("규칙 기반 인텐트 일치 intent={}", ruleMatch.get().name());
			return Mono.just(ruleMatch.get());
		}
		IntentMatch fallback = IntentMatch.fallback(defaultAction);
		Optional<String> template = config.findQueryTemplate(PromptDefaults.INTENT_CLASSIFICATION);
		if (!llmFallbackEnabled || template.isEmpty() || config.intents().isEmpty()) {
			return Mono.just(fallback);
		}
		return classifyWithLlm(originalText, template.get(), config)
			.defaultIfEmpty(fallback)
			.onErrorResume(error -> {
				log.warn("LLM 인텐트 분류 실패, 기본 액션으로 진행합니다 action={}, 이유={}",
					defaultAction.getValue(), error.getMessage());
				return Mono.just(fallback);
			});
	}

	/**
	 * 키워드와 정규식 규칙만으로 인텐트를 찾습니다. LLM을 호출하지 않습니다.
	 */
	public Optional<IntentMatch> matchRules(NormalizedQuery query, PromptConfig config) {
		if (query.isEmpty()) {
			return Optional.empty();
		}
		evictPatternsOnConfigChange(config);
		for (Map.Entry<String, IntentDefinition> entry : config.intents().entrySet()) {
			IntentDefinition definition = entry.getValue();
			if (definition.hasMatchers() && matches(query.value(), definition)) {
				return Optional.of(IntentMatch.of(entry.getKey(), definition));
			}
		}
		return Optional.empty();
	}

	private boolean matches(String text, IntentDefinition definition) {
		for (String keyword : definition.keywords()) {
			if (!keyword.isBlank() && keywordPattern(keyword).matcher(text).find()) {
				return true;
			}
		}
		for (String pattern : definition.patterns()) {
			Pattern compiled = userPattern(pattern);
			if (compiled != null && compiled.matcher(text).find()) {
				return true;
			}
		}
		return false;
	}

	private Mono<IntentMatch> classifyWithLlm(String originalText,
		String template,
		PromptConfig config) {
		String prompt = renderer.render(template, Map.of(
			"intent_descriptions", describeIntents(config),
			"message", originalText,
			"user_question", originalText));
		return llmInvocationService.complete(null, prompt)
			.flatMap(answer -> {
				String candidate = cleanAnswer(answer);
				Optional<IntentMatch> match = config.intents().entrySet().stream()
					.filter(entry -> entry.getKey().toLowerCase(Locale.ROOT).equals(candidate))
					.findFirst()
					.map(entry -> IntentMatch.of(entry.getKey(), entry.getValue()));
				if (match.isEmpty()) {
					log.info("LLM이 알 수 없는 인텐트를 반환했습니다 answer={}", candidate);
				}
				return Mono.justOrEmpty(match);
			});
	}

	private String describeIntents(PromptConfig config) {
		return config.intents().entrySet().stream()
			.map(entry -> "- " + entry.getKey() + ": " + entry.getValue().description())
			.collect(Collectors.joining("\n"));
	}

	static String cleanAnswer(String answer) {
		String firstLine = answer.strip().lines().findFirst().orElse("");
		return firstLine.replaceAll("^[\"'`\\s]+|[\"'`.\\s]+$", "").toLowerCase(Locale.ROOT);
	}

	/** 설정이 교체되면 이전 설정의 컴파일된 패턴을 버립니다. */
	private void evictPatternsOnConfigChange(PromptConfig config) {
		PromptConfig previous = patternOwner.getAndSet(config);
		if (previous != null && previous != config) {
			patternCache.clear();
		}
	}

	int cachedPatternCount() {
		return patternCache.size();
	}

	private Pattern keywordPattern(String keyword) {
		String normalized = keyword.trim().toLowerCase(Locale.ROOT);
		return patternCache.computeIfAbsent("k:" + normalized,
			key -> Pattern.compile(WORD_BOUNDARY_BEFORE + Pattern.quote(normalized)
				+ WORD_BOUNDARY_AFTER));
	}

	private Pattern userPattern(String pattern) {
		try {
			return patternCache.computeIfAbsent("p:" + pattern,
				key -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
		} catch (PatternSyntaxException e) {
			log.warn("잘못된 인텐트 정규식을 건너뜁니다 pattern={}", pattern);
			return null;
		}
	}
}
