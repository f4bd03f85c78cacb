package org.javai.planexec.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the plan-execute-replan engine.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AgentConfig config = AgentConfig.defaults();
 *
 * AgentConfig config = AgentConfig.builder()
 *         .maxTotalSteps(12)
 *         .failureMarkers(List.of("ticker not found"))
 *         .build();
 * }</pre>
 *
 * @param maxTotalSteps maximum execute calls per run before the run is ended with a degraded answer
 * @param maxConsecutiveRegenerations maximum regeneration decisions in a row before the run is ended
 * @param placeholderLengthThreshold values longer than this that contain a placeholder keyword are rejected
 * @param placeholderKeywords words that mark descriptive prose posing as an argument value
 * @param freeTextArguments argument names exempt from argument validation
 * @param failureMarkers result substrings that force plan regeneration
 * @param argumentAliases mistranslated argument names mapped to their canonical names
 * @param recentTurns number of conversation turns included in the regeneration prompt
 * @param memoryCapacity maximum turns held by conversation memory
 * @param summaryWindow number of trailing turns that make up the rolling summary
 * @param rawResponseSnippetLimit maximum characters of a raw oracle response quoted in failure text
 * @param reportDirectory where generated reports are saved, or {@code null}
 * @param oracle chat model connection settings
 */
public record AgentConfig(
		int maxTotalSteps,
		int maxConsecutiveRegenerations,
		int placeholderLengthThreshold,
		List<String> placeholderKeywords,
		List<String> freeTextArguments,
		List<String> failureMarkers,
		Map<String, String> argumentAliases,
		int recentTurns,
		int memoryCapacity,
		int summaryWindow,
		int rawResponseSnippetLimit,
		Path reportDirectory,
		OracleSettings oracle
) {

	public static final int DEFAULT_MAX_TOTAL_STEPS = 30;
	public static final int DEFAULT_MAX_CONSECUTIVE_REGENERATIONS = 3;
	public static final int DEFAULT_PLACEHOLDER_LENGTH_THRESHOLD = 4;
	public static final int DEFAULT_RECENT_TURNS = 5;
	public static final int DEFAULT_MEMORY_CAPACITY = 20;
	public static final int DEFAULT_SUMMARY_WINDOW = 10;
	public static final int DEFAULT_RAW_RESPONSE_SNIPPET_LIMIT = 800;

	public static final List<String> DEFAULT_PLACEHOLDER_KEYWORDS = List.of(
			"提取", "列表", "步骤", "根据", "执行结果", "分析", "获取",
			"extract", "step", "result", "based on", "previous");

	public static final List<String> DEFAULT_FREE_TEXT_ARGUMENTS = List.of(
			"user_requirement", "report_content", "query");

	public static final List<String> DEFAULT_FAILURE_MARKERS = List.of(
			"未找到A股代码", "未找到美股代码", "未找到港股代码", "无法识别该公司的股票代码", "参数校验失败",
			"ticker not found", "company not recognized", "argument validation failed");

	public static final Map<String, String> DEFAULT_ARGUMENT_ALIASES = defaultAliases();

	public AgentConfig {
		if (maxTotalSteps < 1) {
			throw new IllegalArgumentException("maxTotalSteps must be >= 1");
		}
		if (maxConsecutiveRegenerations < 0) {
			throw new IllegalArgumentException("maxConsecutiveRegenerations must be non-negative");
		}
		if (placeholderLengthThreshold < 0) {
			throw new IllegalArgumentException("placeholderLengthThreshold must be non-negative");
		}
		if (recentTurns < 0 || memoryCapacity < 1 || summaryWindow < 0 || rawResponseSnippetLimit < 1) {
			throw new IllegalArgumentException("memory and snippet limits out of range");
		}
		placeholderKeywords = placeholderKeywords != null ? List.copyOf(placeholderKeywords) : List.of();
		freeTextArguments = freeTextArguments != null ? List.copyOf(freeTextArguments) : List.of();
		failureMarkers = failureMarkers != null ? List.copyOf(failureMarkers) : List.of();
		argumentAliases = argumentAliases != null ? Map.copyOf(argumentAliases) : Map.of();
		oracle = oracle != null ? oracle : OracleSettings.defaults();
	}

	public static AgentConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Starts a builder pre-populated with this configuration.
	 */
	public Builder toBuilder() {
		return new Builder()
				.maxTotalSteps(maxTotalSteps)
				.maxConsecutiveRegenerations(maxConsecutiveRegenerations)
				.placeholderLengthThreshold(placeholderLengthThreshold)
				.placeholderKeywords(placeholderKeywords)
				.freeTextArguments(freeTextArguments)
				.failureMarkers(failureMarkers)
				.argumentAliases(argumentAliases)
				.recentTurns(recentTurns)
				.memoryCapacity(memoryCapacity)
				.summaryWindow(summaryWindow)
				.rawResponseSnippetLimit(rawResponseSnippetLimit)
				.reportDirectory(reportDirectory)
				.oracle(oracle);
	}

	private static Map<String, String> defaultAliases() {
		Map<String, String> aliases = new LinkedHashMap<>();
		aliases.put("用户需求", "user_requirement");
		aliases.put("报告内容", "report_content");
		aliases.put("查询", "query");
		aliases.put("数量", "n_results");
		aliases.put("过滤条件", "filters");
		aliases.put("股票代码", "stock_code");
		aliases.put("数据类型", "data_type");
		aliases.put("开始日期", "start_date");
		aliases.put("结束日期", "end_date");
		aliases.put("时间格式", "time_format");
		aliases.put("加数1", "add1");
		aliases.put("加数2", "add2");
		return Map.copyOf(aliases);
	}

	/**
	 * Builder for {@link AgentConfig}.
	 */
	public static class Builder {
		private int maxTotalSteps = DEFAULT_MAX_TOTAL_STEPS;
		private int maxConsecutiveRegenerations = DEFAULT_MAX_CONSECUTIVE_REGENERATIONS;
		private int placeholderLengthThreshold = DEFAULT_PLACEHOLDER_LENGTH_THRESHOLD;
		private List<String> placeholderKeywords = DEFAULT_PLACEHOLDER_KEYWORDS;
		private List<String> freeTextArguments = DEFAULT_FREE_TEXT_ARGUMENTS;
		private List<String> failureMarkers = DEFAULT_FAILURE_MARKERS;
		private Map<String, String> argumentAliases = DEFAULT_ARGUMENT_ALIASES;
		private int recentTurns = DEFAULT_RECENT_TURNS;
		private int memoryCapacity = DEFAULT_MEMORY_CAPACITY;
		private int summaryWindow = DEFAULT_SUMMARY_WINDOW;
		private int rawResponseSnippetLimit = DEFAULT_RAW_RESPONSE_SNIPPET_LIMIT;
		private Path reportDirectory;
		private OracleSettings oracle;

		private Builder() {}

		public Builder maxTotalSteps(int maxTotalSteps) {
			this.maxTotalSteps = maxTotalSteps;
			return this;
		}

		public Builder maxConsecutiveRegenerations(int maxConsecutiveRegenerations) {
			this.maxConsecutiveRegenerations = maxConsecutiveRegenerations;
			return this;
		}

		public Builder placeholderLengthThreshold(int placeholderLengthThreshold) {
			this.placeholderLengthThreshold = placeholderLengthThreshold;
			return this;
		}

		public Builder placeholderKeywords(List<String> placeholderKeywords) {
			this.placeholderKeywords = placeholderKeywords;
			return this;
		}

		public Builder freeTextArguments(List<String> freeTextArguments) {
			this.freeTextArguments = freeTextArguments;
			return this;
		}

		public Builder failureMarkers(List<String> failureMarkers) {
			this.failureMarkers = failureMarkers;
			return this;
		}

		public Builder argumentAliases(Map<String, String> argumentAliases) {
			this.argumentAliases = argumentAliases;
			return this;
		}

		/**
		 * Adds aliases on top of the ones already configured.
		 */
		public Builder addArgumentAliases(Map<String, String> extra) {
			Map<String, String> merged = new LinkedHashMap<>(this.argumentAliases);
			merged.putAll(extra);
			this.argumentAliases = merged;
			return this;
		}

		public Builder recentTurns(int recentTurns) {
			this.recentTurns = recentTurns;
			return this;
		}

		public Builder memoryCapacity(int memoryCapacity) {
			this.memoryCapacity = memoryCapacity;
			return this;
		}

		public Builder summaryWindow(int summaryWindow) {
			this.summaryWindow = summaryWindow;
			return this;
		}

		public Builder rawResponseSnippetLimit(int rawResponseSnippetLimit) {
			this.rawResponseSnippetLimit = rawResponseSnippetLimit;
			return this;
		}

		public Builder reportDirectory(Path reportDirectory) {
			this.reportDirectory = reportDirectory;
			return this;
		}

		public Builder oracle(OracleSettings oracle) {
			this.oracle = oracle;
			return this;
		}

		public AgentConfig build() {
			return new AgentConfig(maxTotalSteps, maxConsecutiveRegenerations, placeholderLengthThreshold,
					placeholderKeywords, freeTextArguments, failureMarkers, argumentAliases, recentTurns,
					memoryCapacity, summaryWindow, rawResponseSnippetLimit, reportDirectory, oracle);
		}
	}
}
