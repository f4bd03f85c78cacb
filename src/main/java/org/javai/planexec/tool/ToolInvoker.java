package org.javai.planexec.tool;

import java.util.Map;

/**
 * Boundary between the agent and side-effecting operations.
 */
public interface ToolInvoker {

	/**
	 * Invoke a tool by its registry name.
	 *
	 * @param toolName the registry name, as written in the plan
	 * @param args the resolved arguments
	 * @return the tool result
	 * @throws ToolNotRegisteredException if no tool is bound under the name
	 * @throws ToolInvocationException if the tool failed
	 */
	ToolResult invoke(String toolName, Map<String, Object> args);
}
