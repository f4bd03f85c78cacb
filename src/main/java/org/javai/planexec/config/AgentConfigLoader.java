package org.javai.planexec.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link AgentConfig} from YAML.
 *
 * <pre>
 * agent:
 *   max-total-steps: 20
 *   max-consecutive-regenerations: 3
 *   failure-markers: ["ticker not found"]
 *   argument-aliases:
 *     代码: stock_code
 *   report-directory: ./reports
 * oracle:
 *   base-url: http://localhost:11434
 *   api-key: ${OPENAI_API_KEY}
 *   model: qwen2.5
 *   temperature: 0.1
 * </pre>
 *
 * <p>Keys that are absent keep their defaults. List-valued keys replace the default list,
 * except {@code argument-aliases}, which is merged over the default alias table.
 * {@code ${NAME}} placeholders in string values are expanded from the environment; an
 * unset variable expands to an empty string.</p>
 */
public class AgentConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(AgentConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "planexec.yml";

	private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

	private final Yaml yaml = new Yaml();
	private final Function<String, String> environment;

	public AgentConfigLoader() {
		this(System::getenv);
	}

	/**
	 * @param environment resolves environment variable names for {@code ${NAME}} expansion
	 */
	public AgentConfigLoader(Function<String, String> environment) {
		this.environment = environment;
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if it is absent.
	 */
	public AgentConfig loadDefault() {
		InputStream in = AgentConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			logger.info("No {} on the classpath, using default configuration", DEFAULT_RESOURCE);
			return AgentConfig.defaults();
		}
		try (in) {
			return load(in);
		} catch (ConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigException("Failed to read configuration resource " + DEFAULT_RESOURCE, e);
		}
	}

	public AgentConfig load(Path path) {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return load(reader);
		} catch (ConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigException("Failed to read configuration from path: " + path, e);
		}
	}

	public AgentConfig load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (ConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigException("Failed to parse configuration from input stream", e);
		}
	}

	public AgentConfig load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (ConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigException("Failed to parse configuration from reader", e);
		}
	}

	public AgentConfig loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (ConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigException("Failed to parse configuration from string", e);
		}
	}

	private AgentConfig build(Object document) {
		if (document == null) {
			return AgentConfig.defaults();
		}
		Map<String, Object> root = asMap(document, "document root");
		Map<String, Object> agent = asMap(root.getOrDefault("agent", Map.of()), "agent");
		Map<String, Object> oracle = asMap(root.getOrDefault("oracle", Map.of()), "oracle");

		AgentConfig.Builder builder = AgentConfig.builder();
		intValue(agent, "max-total-steps").ifPresent(builder::maxTotalSteps);
		intValue(agent, "max-consecutive-regenerations").ifPresent(builder::maxConsecutiveRegenerations);
		intValue(agent, "placeholder-length-threshold").ifPresent(builder::placeholderLengthThreshold);
		intValue(agent, "recent-turns").ifPresent(builder::recentTurns);
		intValue(agent, "memory-capacity").ifPresent(builder::memoryCapacity);
		intValue(agent, "summary-window").ifPresent(builder::summaryWindow);
		intValue(agent, "raw-response-snippet-limit").ifPresent(builder::rawResponseSnippetLimit);
		stringList(agent, "placeholder-keywords").ifPresent(builder::placeholderKeywords);
		stringList(agent, "free-text-arguments").ifPresent(builder::freeTextArguments);
		stringList(agent, "failure-markers").ifPresent(builder::failureMarkers);
		stringMap(agent, "argument-aliases").ifPresent(builder::addArgumentAliases);
		stringValue(agent, "report-directory").filter(s -> !s.isBlank()).map(Path::of).ifPresent(builder::reportDirectory);

		OracleSettings defaults = OracleSettings.defaults();
		builder.oracle(new OracleSettings(
				stringValue(oracle, "base-url").orElse(defaults.baseUrl()),
				stringValue(oracle, "api-key").orElse(defaults.apiKey()),
				stringValue(oracle, "model").orElse(defaults.model()),
				doubleValue(oracle, "temperature").orElse(defaults.temperature())));

		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String section) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?>)) {
			throw new ConfigException("Section '" + section + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static Optional<Integer> intValue(Map<String, Object> section, String key) {
		Object value = section.get(key);
		if (value == null) {
			return Optional.empty();
		}
		if (value instanceof Number number) {
			return Optional.of(number.intValue());
		}
		try {
			return Optional.of(Integer.parseInt(value.toString().trim()));
		} catch (NumberFormatException e) {
			throw new ConfigException("'" + key + "' must be an integer but was: " + value, e);
		}
	}

	private static Optional<Double> doubleValue(Map<String, Object> section, String key) {
		Object value = section.get(key);
		if (value == null) {
			return Optional.empty();
		}
		if (value instanceof Number number) {
			return Optional.of(number.doubleValue());
		}
		try {
			return Optional.of(Double.parseDouble(value.toString().trim()));
		} catch (NumberFormatException e) {
			throw new ConfigException("'" + key + "' must be a number but was: " + value, e);
		}
	}

	private Optional<String> stringValue(Map<String, Object> section, String key) {
		Object value = section.get(key);
		return value != null ? Optional.of(expand(value.toString())) : Optional.empty();
	}

	private Optional<List<String>> stringList(Map<String, Object> section, String key) {
		Object value = section.get(key);
		if (value == null) {
			return Optional.empty();
		}
		if (!(value instanceof List<?> items)) {
			throw new ConfigException("'" + key + "' must be a list");
		}
		List<String> result = new ArrayList<>();
		for (Object item : items) {
			if (item != null) {
				result.add(expand(item.toString()));
			}
		}
		return Optional.of(result);
	}

	private Optional<Map<String, String>> stringMap(Map<String, Object> section, String key) {
		Object value = section.get(key);
		if (value == null) {
			return Optional.empty();
		}
		if (!(value instanceof Map<?, ?> entries)) {
			throw new ConfigException("'" + key + "' must be a mapping");
		}
		Map<String, String> result = new LinkedHashMap<>();
		entries.forEach((k, v) -> {
			if (k != null && v != null) {
				result.put(k.toString(), expand(v.toString()));
			}
		});
		return Optional.of(result);
	}

	String expand(String value) {
		Matcher matcher = ENV_PLACEHOLDER.matcher(value);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			String resolved = environment.apply(matcher.group(1));
			matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : ""));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	/**
	 * Raised when a configuration source cannot be read or holds invalid values.
	 */
	public static class ConfigException extends RuntimeException {
		public ConfigException(String message) {
			super(message);
		}

		public ConfigException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
