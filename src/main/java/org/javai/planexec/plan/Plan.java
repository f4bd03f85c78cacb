package org.javai.planexec.plan;

import java.util.List;

/**
 * Ordered sequence of steps; insertion order is execution order.
 *
 * <p>Plans are never mutated. Regeneration produces a new plan that replaces the old one
 * wholesale.</p>
 *
 * @param steps the steps to execute
 */
public record Plan(List<Step> steps) {

	public Plan {
		steps = steps != null ? List.copyOf(steps) : List.of();
	}

	public static Plan empty() {
		return new Plan(List.of());
	}

	public static Plan of(Step... steps) {
		return new Plan(List.of(steps));
	}

	public int size() {
		return steps.size();
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	public Step step(int position) {
		return steps.get(position);
	}

	/**
	 * Returns a developer-friendly description of this plan for diagnostics.
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder("Plan[steps=").append(steps.size());
		if (!steps.isEmpty()) {
			sb.append(", stepSummaries=").append(
					steps.stream()
							.limit(3)
							.map(Step::describe)
							.toList());
			if (steps.size() > 3) {
				sb.append(" (+").append(steps.size() - 3).append(" more)");
			}
		}
		return sb.append("]").toString();
	}
}
