package org.javai.planexec.tool.builtin;

import org.javai.planexec.tool.AgentTool;
import org.javai.planexec.tool.ToolArg;
import org.javai.planexec.tool.ToolId;

public class ArithmeticTools {

	@AgentTool(ToolId.ADD)
	public long add(@ToolArg("add1") long add1, @ToolArg("add2") long add2) {
		return Math.addExact(add1, add2);
	}
}
