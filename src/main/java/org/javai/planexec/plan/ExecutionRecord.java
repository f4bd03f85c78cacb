package org.javai.planexec.plan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable log entry capturing the outcome of executing one step. Failed steps are recorded
 * too; the failure text becomes the result.
 *
 * @param index the step number of the executed step
 * @param description the step description
 * @param action the step action
 * @param result the textual outcome
 */
public record ExecutionRecord(
		int index,
		String description,
		String action,
		String result
) {

	public ExecutionRecord {
		description = description != null ? description : "";
		action = action != null ? action : "";
		result = result != null ? result : "";
	}

	public static ExecutionRecord of(Step step, String result) {
		return new ExecutionRecord(step.index(), step.description(), step.action(), result);
	}

	/**
	 * Renders records as prompt context, one {@code Step n result: ...} line per record.
	 */
	public static String render(List<ExecutionRecord> records) {
		return records.stream()
				.map(r -> "Step " + r.index() + " result: " + r.result())
				.collect(Collectors.joining("\n"));
	}
}
