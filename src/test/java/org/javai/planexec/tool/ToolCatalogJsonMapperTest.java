package org.javai.planexec.tool;

import static org.assertj.core.api.Assertions.assertThat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class ToolCatalogJsonMapperTest {

	@Test
	void catalogListsEveryTool() {
		ObjectNode catalog = ToolCatalogJsonMapper.toJsonCatalog();

		assertThat(catalog.fieldNames()).toIterable()
				.containsExactly("add", "akshare_search", "get_current_time", "generate_markdown_report", "retrieve_reports");
	}

	@Test
	void parametersCarryTypesAndEnums() {
		JsonNode dataType = ToolCatalogJsonMapper.toJson(ToolId.MARKET_DATA).path("parameters").path("data_type");

		assertThat(dataType.path("type").asText()).isEqualTo("str");
		assertThat(dataType.path("enum")).extracting(JsonNode::asText).containsExactly("realtime", "history", "info");
	}

	@Test
	void optionalParametersAreMarked() {
		JsonNode params = ToolCatalogJsonMapper.toJson(ToolId.REPORT_RETRIEVAL).path("parameters");

		assertThat(params.path("n_results").path("description").asText()).endsWith("(optional)");
		assertThat(params.path("query").path("description").asText()).doesNotEndWith("(optional)");
		assertThat(params.path("filters").path("type").asText()).isEqualTo("dict");
	}

	@Test
	void renderedCatalogIsJsonText() {
		assertThat(ToolCatalogJsonMapper.renderCatalog())
				.startsWith("{")
				.contains("\"generate_markdown_report\"")
				.contains("\"report_content\"");
	}
}
