package org.javai.planexec.tool.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.planexec.tool.AgentTool;
import org.javai.planexec.tool.ToolArg;
import org.javai.planexec.tool.ToolId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a markdown report from a requirement and the accumulated step results.
 *
 * <p>When the content is a JSON object it is rendered as a key/value table, otherwise it is
 * included verbatim. If a report directory is configured, each report is also written there.</p>
 */
public class MarkdownReportTools {

	private static final Logger logger = LoggerFactory.getLogger(MarkdownReportTools.class);
	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
	private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final Clock clock;
	private final Path reportDirectory;
	private final ObjectMapper mapper = new ObjectMapper();

	public MarkdownReportTools() {
		this(Clock.systemDefaultZone(), null);
	}

	/**
	 * @param clock source of the report timestamp
	 * @param reportDirectory where reports are saved, or {@code null} to keep them in memory only
	 */
	public MarkdownReportTools(Clock clock, Path reportDirectory) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.reportDirectory = reportDirectory;
	}

	@AgentTool(ToolId.MARKDOWN_REPORT)
	public String generateReport(@ToolArg("user_requirement") String userRequirement,
			@ToolArg("report_content") String reportContent) {
		LocalDateTime now = LocalDateTime.now(clock);
		Map<String, Object> data = parseObject(reportContent);

		StringBuilder report = new StringBuilder();
		report.append("# ").append(titleFor(userRequirement)).append("\n\n");
		report.append("> Generated at: ").append(TIMESTAMP.format(now)).append("\n\n");
		report.append("## Overview\n\n").append(userRequirement).append("\n\n");
		report.append("## Data\n\n");
		if (data != null) {
			report.append("| Field | Value |\n|------|-----|\n");
			data.forEach((key, value) -> report.append("| ").append(key).append(" | ").append(value).append(" |\n"));
		} else {
			report.append(reportContent);
		}
		report.append("\n\n## Risk Notice\n\n")
				.append("1. This report is for reference only and is not investment advice\n")
				.append("2. Markets carry risk; invest with caution\n")
				.append("3. Past performance does not indicate future returns\n\n");
		report.append("---\n*Generated automatically by the plan-execute agent*");

		String markdown = report.toString();
		if (reportDirectory != null) {
			save(markdown, userRequirement, now);
		}
		return markdown;
	}

	static String titleFor(String requirement) {
		String text = requirement != null ? requirement.toLowerCase(Locale.ROOT) : "";
		if (text.contains("股票") || text.contains("stock")) {
			return "Stock Analysis Report";
		}
		if (text.contains("基金") || text.contains("fund")) {
			return "Fund Analysis Report";
		}
		if (text.contains("财务") || text.contains("financial")) {
			return "Financial Data Report";
		}
		return "Analysis Report";
	}

	static String fileNameFor(String requirement) {
		String text = requirement != null ? requirement : "";
		String lower = text.toLowerCase(Locale.ROOT);
		if (text.contains("股票") || lower.contains("stock")) {
			return "stock_analysis";
		}
		if (text.contains("基金") || lower.contains("fund")) {
			return "fund_analysis";
		}
		if (text.contains("财务") || lower.contains("financial")) {
			return "financial_analysis";
		}
		if (text.contains("投资") || lower.contains("invest")) {
			return "investment_analysis";
		}
		StringBuilder safe = new StringBuilder();
		text.codePoints().limit(20)
				.filter(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_')
				.forEach(c -> safe.appendCodePoint(c == ' ' ? '_' : c));
		return safe.length() > 0 ? safe.toString() : "analysis_report";
	}

	private Map<String, Object> parseObject(String content) {
		if (content == null || !content.trim().startsWith("{")) {
			return null;
		}
		try {
			return mapper.readValue(content, MAP_TYPE);
		} catch (JsonProcessingException e) {
			// not JSON, rendered as plain text
			return null;
		}
	}

	private void save(String markdown, String requirement, LocalDateTime now) {
		String stem = fileNameFor(requirement) + "_" + FILE_STAMP.format(now);
		Path target = reportDirectory.resolve(stem + ".md");
		try {
			Files.createDirectories(reportDirectory);
			for (int n = 2; Files.exists(target); n++) {
				target = reportDirectory.resolve(stem + "_" + n + ".md");
			}
			Files.writeString(target, markdown, StandardCharsets.UTF_8);
			logger.info("Report saved to {}", target);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to save report to " + target, e);
		}
	}
}
