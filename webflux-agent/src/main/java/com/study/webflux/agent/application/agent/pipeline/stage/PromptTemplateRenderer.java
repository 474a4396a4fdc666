package com.study.webflux.agent.application.agent.pipeline.stage;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * {name} 형태의 플레이스홀더를 한 번의 스캔으로 치환합니다. 알 수 없는 플레이스홀더와 JSON 중괄호는 그대로 둡니다.
 */
@Component
public class PromptTemplateRenderer {

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)}");

	public String render(String template, Map<String, String> variables) {
		if (template == null || template.isEmpty()) {
			return "";
		}
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder rendered = new StringBuilder(template.length());
		while (matcher.find()) {
			String value = variables.get(matcher.group(1));
			String replacement = value != null ? value : matcher.group(0);
			matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(rendered);
		return normalizeSpacing(rendered.toString());
	}

	private String normalizeSpacing(String text) {
		return text.replaceAll("\\n{3,}", "\n\n").strip();
	}
}
