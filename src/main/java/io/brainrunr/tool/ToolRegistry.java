package io.brainrunr.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.brainrunr.memory.ErrorKind;
import io.brainrunr.memory.MemoryException;
import io.brainrunr.memory.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of memory tools. Each tool is callable by name with JSON arguments and is also
 * exposed as a Spring AI {@link ToolCallback} so a chat model can discover it.
 *
 * <p>Failures never escape as exceptions: they come back as a {@link ToolResult} carrying the
 * {@link ErrorKind} of the underlying {@link MemoryException}.</p>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, MemoryTool> tools = new LinkedHashMap<>();
    private final Map<String, ToolCallback> toolCallbacks = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Registers a tool with its description and JSON schema.
     *
     * @param name        tool name
     * @param description human-readable description for the model
     * @param inputSchema JSON Schema string for the tool's parameters
     * @param tool        the tool implementation
     */
    public void register(String name, String description, String inputSchema, MemoryTool tool) {
        tools.put(name, tool);
        toolCallbacks.put(name, new MemoryToolCallback(name, description, inputSchema, this));
        log.debug("Registered tool: {}", name);
    }

    /**
     * Returns tool callbacks for the given tool names. Unknown names are logged and skipped.
     */
    public List<ToolCallback> getToolCallbacks(List<String> toolNames) {
        List<ToolCallback> callbacks = new ArrayList<>();
        for (String name : toolNames) {
            ToolCallback cb = toolCallbacks.get(name);
            if (cb != null) {
                callbacks.add(cb);
            } else {
                log.warn("Tool '{}' not found in registry", name);
            }
        }
        return callbacks;
    }

    public List<ToolCallback> getAllToolCallbacks() {
        return new ArrayList<>(toolCallbacks.values());
    }

    public List<String> getAllToolNames() {
        return new ArrayList<>(tools.keySet());
    }

    /**
     * Executes a tool by name.
     *
     * @param toolName  the tool to execute
     * @param arguments JSON object string of arguments; blank means none
     */
    public ToolResult executeTool(String toolName, String arguments) {
        MemoryTool tool = tools.get(toolName);
        if (tool == null) {
            log.error("Tool '{}' not found", toolName);
            return ToolResult.error(ErrorKind.VALIDATION, "Tool '" + toolName + "' not found.");
        }
        try {
            return tool.execute(parseArguments(arguments));
        } catch (MemoryException e) {
            if (e.kind() == ErrorKind.STORE_IO) {
                log.error("Tool '{}' failed: {}", toolName, e.getMessage(), e);
            } else {
                log.debug("Tool '{}' rejected: {}", toolName, e.getMessage());
            }
            return ToolResult.error(e.kind(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return ToolResult.error(ErrorKind.VALIDATION, e.getMessage());
        }
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(arguments, new TypeReference<>() {});
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse tool arguments: {}", arguments);
            throw new ValidationException("Arguments must be a JSON object: " + e.getOriginalMessage());
        }
    }

    /**
     * A memory operation invoked with parsed arguments.
     */
    @FunctionalInterface
    public interface MemoryTool {
        ToolResult execute(Map<String, Object> arguments);
    }

    /**
     * Exposes a registered tool as a Spring AI ToolCallback.
     */
    static class MemoryToolCallback implements ToolCallback {

        private final String name;
        private final String description;
        private final String inputSchema;
        private final ToolRegistry registry;

        MemoryToolCallback(String name, String description, String inputSchema, ToolRegistry registry) {
            this.name = name;
            this.description = description;
            this.inputSchema = inputSchema;
            this.registry = registry;
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build();
        }

        @Override
        public String call(String toolInput) {
            return registry.executeTool(name, toolInput).render();
        }
    }
}
