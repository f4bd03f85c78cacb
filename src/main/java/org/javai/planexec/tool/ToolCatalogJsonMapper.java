package org.javai.planexec.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders the {@link ToolId} catalog as a JSON contract suitable for LLM prompts.
 */
public final class ToolCatalogJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private ToolCatalogJsonMapper() {
	}

	public static ObjectNode toJson(ToolId id) {
		ObjectNode node = mapper.createObjectNode();
		node.put("description", id.schema().description());
		ObjectNode params = node.putObject("parameters");
		for (ToolParameter param : id.schema().parameters()) {
			ObjectNode p = params.putObject(param.name());
			p.put("type", param.type());
			p.put("description", param.required() ? param.description() : param.description() + " (optional)");
			if (!param.allowedValues().isEmpty()) {
				ArrayNode allowed = p.putArray("enum");
				param.allowedValues().forEach(allowed::add);
			}
		}
		return node;
	}

	public static ObjectNode toJsonCatalog() {
		ObjectNode catalog = mapper.createObjectNode();
		for (ToolId id : ToolId.values()) {
			catalog.set(id.toolName(), toJson(id));
		}
		return catalog;
	}

	/**
	 * The catalog as pretty-printed JSON text.
	 */
	public static String renderCatalog() {
		return toJsonCatalog().toPrettyString();
	}
}
