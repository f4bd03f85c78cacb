package org.javai.planexec.tool;

import java.util.Map;

/**
 * Programmatic implementation of a tool, for handlers supplied by the embedding application.
 */
@FunctionalInterface
public interface ToolHandler {

	Object handle(Map<String, Object> args) throws Exception;
}
