package org.javai.planexec.tool;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of tools a plan may reference, each with its registry name and argument schema.
 *
 * <p>The schema is consumed both when building the argument-resolution prompt and when
 * normalizing resolved argument values.</p>
 */
public enum ToolId {

	ADD("add", new ToolSchema(
			"Adds two integers",
			List.of(
					ToolParameter.required("add1", "int", "First addend"),
					ToolParameter.required("add2", "int", "Second addend")))),

	MARKET_DATA("akshare_search", new ToolSchema(
			"Stock data lookup. Accepts Chinese company names, A-share codes and US/HK tickers; "
					+ "the market is detected automatically. Several codes may be given, comma separated.",
			List.of(
					ToolParameter.required("stock_code", "str",
							"One or more stock codes, comma separated (e.g. \"NVDA, AMD\")"),
					ToolParameter.required("data_type", "str", "Kind of data to fetch")
							.withAllowedValues("realtime", "history", "info")
							.withCoercions(Map.of(
									"daily_history", "history",
									"stock_history", "history")),
					ToolParameter.optional("start_date", "str", "Start date, format YYYYMMDD (history only)"),
					ToolParameter.optional("end_date", "str", "End date, format YYYYMMDD (history only)")))),

	CURRENT_TIME("get_current_time", new ToolSchema(
			"Returns the current local time",
			List.of(
					ToolParameter.optional("time_format", "str", "Output format, defaults to standard")
							.withAllowedValues("standard", "timestamp", "detailed", "chinese")))),

	MARKDOWN_REPORT("generate_markdown_report", new ToolSchema(
			"Renders a markdown report",
			List.of(
					ToolParameter.required("user_requirement", "str", "What the user asked the report to cover"),
					ToolParameter.required("report_content", "str",
							"Full report body, composed from the results of all earlier steps")))),

	REPORT_RETRIEVAL("retrieve_reports", new ToolSchema(
			"Searches indexed research reports",
			List.of(
					ToolParameter.required("query", "str", "Search text"),
					ToolParameter.optional("n_results", "int", "Number of reports to return (default 5)"),
					ToolParameter.optional("filters", "dict", "Metadata filter, e.g. {\"ticker\": \"NVDA\"}"))));

	private final String toolName;
	private final ToolSchema schema;

	ToolId(String toolName, ToolSchema schema) {
		this.toolName = toolName;
		this.schema = schema;
	}

	public String toolName() {
		return toolName;
	}

	public ToolSchema schema() {
		return schema;
	}

	/**
	 * Resolves a registry name, ignoring case and surrounding whitespace.
	 */
	public static Optional<ToolId> fromName(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String wanted = name.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
				.filter(id -> id.toolName.equals(wanted))
				.findFirst();
	}

	public static List<String> toolNames() {
		return Arrays.stream(values()).map(ToolId::toolName).toList();
	}
}
