package org.javai.planexec.tool.builtin;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.planexec.tool.AgentTool;
import org.javai.planexec.tool.ToolArg;
import org.javai.planexec.tool.ToolId;

/**
 * Current-time tool. Supports the formats {@code standard}, {@code timestamp},
 * {@code detailed} and {@code chinese}.
 */
public class ClockTools {

	private static final DateTimeFormatter STANDARD = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
	private static final DateTimeFormatter CHINESE = DateTimeFormatter.ofPattern("yyyy年MM月dd日 HH时mm分ss秒");

	private final Clock clock;

	public ClockTools() {
		this(Clock.systemDefaultZone());
	}

	public ClockTools(Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	@AgentTool(ToolId.CURRENT_TIME)
	public Object currentTime(@ToolArg("time_format") String timeFormat) {
		ZonedDateTime now = ZonedDateTime.now(clock);
		String format = timeFormat == null || timeFormat.isBlank()
				? "standard"
				: timeFormat.trim().toLowerCase(Locale.ROOT);
		return switch (format) {
			case "standard" -> STANDARD.format(now);
			case "timestamp" -> String.valueOf(now.toEpochSecond());
			case "chinese" -> CHINESE.format(now);
			case "detailed" -> detailed(now);
			default -> throw new IllegalArgumentException("Unsupported time format: " + timeFormat);
		};
	}

	private static Map<String, Object> detailed(ZonedDateTime now) {
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("year", now.getYear());
		details.put("month", now.getMonthValue());
		details.put("day", now.getDayOfMonth());
		details.put("hour", now.getHour());
		details.put("minute", now.getMinute());
		details.put("second", now.getSecond());
		// 0 = Monday
		details.put("weekday", now.getDayOfWeek().getValue() - 1);
		details.put("iso_format", now.toLocalDateTime().toString());
		details.put("timestamp", now.toEpochSecond());
		return details;
	}
}
