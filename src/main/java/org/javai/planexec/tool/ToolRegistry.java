package org.javai.planexec.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ToolInvoker}: dispatches tool names to handlers bound against the
 * {@link ToolId} catalog.
 *
 * <p>Handlers come from two sources:</p>
 * <ul>
 *   <li>{@link #register(ToolId, ToolHandler)} for programmatic handlers</li>
 *   <li>{@link #registerTools(Object)}, which reflects over a bean for methods annotated with
 *       {@link AgentTool}; each parameter must carry {@link ToolArg}, and argument values are
 *       converted to the parameter type with Jackson</li>
 * </ul>
 */
public final class ToolRegistry implements ToolInvoker {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

	private final Map<ToolId, ToolHandler> handlers = new EnumMap<>(ToolId.class);
	private final ObjectMapper mapper;

	public ToolRegistry() {
		this(new ObjectMapper());
	}

	public ToolRegistry(ObjectMapper mapper) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	public ToolRegistry register(ToolId id, ToolHandler handler) {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(handler, "handler must not be null");
		if (handlers.containsKey(id)) {
			throw new IllegalStateException("Duplicate tool definition: " + id.toolName());
		}
		handlers.put(id, handler);
		return this;
	}

	public ToolRegistry registerTools(Object bean) {
		Objects.requireNonNull(bean, "bean must not be null");
		for (Method method : bean.getClass().getMethods()) {
			AgentTool tool = method.getAnnotation(AgentTool.class);
			if (tool == null) continue;
			String[] argNames = bindArgumentNames(tool.value(), method);
			register(tool.value(), args -> invokeMethod(bean, method, argNames, tool.value(), args));
		}
		return this;
	}

	public boolean isRegistered(ToolId id) {
		return handlers.containsKey(id);
	}

	public Set<ToolId> registeredTools() {
		return Set.copyOf(handlers.keySet());
	}

	@Override
	public ToolResult invoke(String toolName, Map<String, Object> args) {
		ToolId id = ToolId.fromName(toolName).orElseThrow(() -> new ToolNotRegisteredException(toolName));
		ToolHandler handler = handlers.get(id);
		if (handler == null) {
			throw new ToolNotRegisteredException(toolName);
		}
		Map<String, Object> safeArgs = args != null ? args : Map.of();
		logger.debug("Invoking tool {} with {}", id.toolName(), safeArgs);
		try {
			return ToolResult.of(id.toolName(), handler.handle(safeArgs));
		} catch (ToolInvocationException ex) {
			throw ex;
		} catch (Exception ex) {
			throw new ToolInvocationException(ex.getMessage() != null ? ex.getMessage() : ex.toString(), ex);
		}
	}

	private static String[] bindArgumentNames(ToolId id, Method method) {
		Parameter[] parameters = method.getParameters();
		String[] names = new String[parameters.length];
		for (int i = 0; i < parameters.length; i++) {
			ToolArg arg = parameters[i].getAnnotation(ToolArg.class);
			if (arg == null) {
				throw new IllegalStateException("Parameter " + parameters[i].getName() + " of "
						+ method.getName() + " is missing @ToolArg");
			}
			if (id.schema().parameter(arg.value()).isEmpty()) {
				throw new IllegalStateException("Tool " + id.toolName() + " declares no argument named " + arg.value());
			}
			names[i] = arg.value();
		}
		return names;
	}

	private Object invokeMethod(Object bean, Method method, String[] argNames, ToolId id, Map<String, Object> args)
			throws Exception {
		Parameter[] parameters = method.getParameters();
		Object[] invokeArgs = new Object[parameters.length];
		for (int i = 0; i < parameters.length; i++) {
			Object raw = args.get(argNames[i]);
			boolean required = id.schema().parameter(argNames[i]).map(ToolParameter::required).orElse(false);
			if (raw == null && (required || parameters[i].getType().isPrimitive())) {
				throw new ToolInvocationException("Missing required argument '" + argNames[i]
						+ "' for tool " + id.toolName());
			}
			try {
				invokeArgs[i] = raw != null ? mapper.convertValue(raw, parameters[i].getType()) : null;
			} catch (IllegalArgumentException ex) {
				throw new ToolInvocationException("Argument '" + argNames[i] + "' of tool " + id.toolName()
						+ " cannot be read as " + parameters[i].getType().getSimpleName() + ": " + raw, ex);
			}
		}
		try {
			return method.invoke(bean, invokeArgs);
		} catch (InvocationTargetException ex) {
			Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
			if (cause instanceof Exception exception) {
				throw exception;
			}
			throw new ToolInvocationException(cause.toString(), cause);
		}
	}
}
