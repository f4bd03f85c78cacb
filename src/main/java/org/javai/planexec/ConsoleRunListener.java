package org.javai.planexec;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.Step;

/**
 * Prints the run trace to an operator console.
 */
public class ConsoleRunListener implements RunListener {

	private final PrintStream out;

	public ConsoleRunListener(PrintStream out) {
		this.out = Objects.requireNonNull(out, "out must not be null");
	}

	@Override
	public void planProduced(String userInput, Plan plan) {
		out.println("Plan (" + plan.size() + " steps):");
		for (Step step : plan.steps()) {
			out.print("  " + step.index() + ". " + step.description());
			if (step.hasTool()) {
				out.print(" [" + step.tool() + (step.toolArgs() != null ? " " + step.toolArgs() : "") + "]");
			}
			out.println();
		}
	}

	@Override
	public void stepExecuted(StepOutcome outcome) {
		if (outcome.planExhausted()) {
			out.println("All steps executed");
			return;
		}
		out.println((outcome.failed() ? "x " : "> ") + "Step " + outcome.record().index() + ": "
				+ abbreviate(outcome.record().result(), 300));
	}

	@Override
	public void decisionTaken(ReplanOutcome outcome) {
		String detail = outcome.decision().name().toLowerCase(Locale.ROOT);
		if (outcome instanceof ReplanOutcome.RegenerationAbandoned abandoned) {
			detail += " (abandoned: " + abandoned.reason() + ")";
		}
		out.println("  decision: " + detail);
	}

	@Override
	public void runFinished(RunResult result) {
		out.println();
		if (result.terminatedEarly()) {
			out.println("(run ended early after " + result.executeCalls() + " steps)");
		}
		out.println(result.finalAnswer());
	}

	private static String abbreviate(String text, int max) {
		return text.length() <= max ? text : text.substring(0, max) + "...";
	}
}
