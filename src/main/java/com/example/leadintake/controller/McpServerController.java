package com.example.leadintake.controller;

import com.example.leadintake.mcp.CapabilitiesTools;
import com.example.leadintake.mcp.LeadTools;
import com.example.leadintake.mcp.SyncTools;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plain JSON-RPC gateway to the MCP tools for clients that do not speak SSE.
 * The streaming MCP transport itself is served by the Spring AI server starter.
 */
@RestController
public class McpServerController {

    private static final Logger logger = LoggerFactory.getLogger(McpServerController.class);

    private static final Set<String> OPTIONAL_ARGUMENTS = Set.of("callId", "limit");

    private final LeadTools leadTools;
    private final SyncTools syncTools;
    private final CapabilitiesTools capabilitiesTools;
    private final ObjectMapper objectMapper;

    public McpServerController(LeadTools leadTools, SyncTools syncTools, CapabilitiesTools capabilitiesTools,
                               ObjectMapper objectMapper) {
        this.leadTools = leadTools;
        this.syncTools = syncTools;
        this.capabilitiesTools = capabilitiesTools;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/mcp/rpc", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> handleMcpMessage(@RequestBody Map<String, Object> request) {
        return Mono.fromCallable(() -> {
            try {
                String method = (String) request.get("method");
                if (method == null) {
                    return createErrorResponse("Missing method field", -32600);
                }

                switch (method) {
                    case "initialize":
                        return handleInitialize();
                    case "tools/list":
                        return handleToolsList();
                    case "tools/call":
                        return handleToolCall(request);
                    default:
                        return createErrorResponse("Method not found: " + method, -32601);
                }
            } catch (Exception e) {
                logger.error("MCP request failed", e);
                return createErrorResponse("Internal error: " + e.getMessage(), -32603);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Map<String, Object> handleInitialize() {
        return Map.of(
                "protocolVersion", "2024-11-05",
                "capabilities", Map.of(
                        "tools", Map.of("listChanged", false),
                        "resources", Map.of(),
                        "prompts", Map.of()
                ),
                "serverInfo", Map.of(
                        "name", "lead-intake",
                        "version", "1.0.0"
                )
        );
    }

    private Map<String, Object> handleToolsList() {
        List<Map<String, Object>> tools = new ArrayList<>();

        tools.add(createToolInfo("lead_submit", "Submit a lead payload of any supported shape to the lead inbox",
                Map.of("payload", Map.of("type", "object", "description", "Lead payload as received from the producer"))));
        tools.add(createToolInfo("lead_preview", "Classify and map a lead payload without sending it",
                Map.of("payload", Map.of("type", "object", "description", "Lead payload as received from the producer"))));
        tools.add(createToolInfo("envelope_encode", "Wrap a payload in a base64 transport envelope",
                Map.of(
                        "payload", Map.of("type", "object", "description", "Payload to encode"),
                        "callId", Map.of("type", "integer", "description", "Call ID (optional)")
                )));
        tools.add(createToolInfo("envelope_decode", "Decode a base64 transport envelope given as a JSON string",
                Map.of("envelope", Map.of("type", "string", "description", "Envelope JSON text"))));

        tools.add(createToolInfo("sync_collect", "Fetch all records of a downstream resource following pagination",
                Map.of(
                        "resource", Map.of("type", "string", "description", "Resource name, e.g. contacts"),
                        "limit", Map.of("type", "integer", "description", "Maximum number of records (optional)")
                )));
        tools.add(createToolInfo("dispatch_stats", "Outcome counts, retries and rate-limit window state", Map.of()));

        tools.add(createToolInfo("capabilities_list", "List server capabilities and sync resources", Map.of()));

        return Map.of("tools", tools);
    }

    private Map<String, Object> createToolInfo(String name, String description, Map<String, Object> properties) {
        return Map.of(
                "name", name,
                "description", description,
                "inputSchema", Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", properties.keySet().stream()
                                .filter(key -> !OPTIONAL_ARGUMENTS.contains(key))
                                .toList()
                )
        );
    }

    private Map<String, Object> handleToolCall(Map<String, Object> request) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> params = (Map<String, Object>) request.get("params");
            String toolName = params == null ? null : (String) params.get("name");
            if (toolName == null) {
                return createErrorResponse("Missing tool name", -32602);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> arguments = (Map<String, Object>) params.get("arguments");

            Object result = callTool(toolName, arguments != null ? arguments : Map.of());

            return Map.of(
                    "content", List.of(Map.of(
                            "type", "text",
                            "text", objectMapper.writeValueAsString(result)
                    )),
                    "isError", false
            );
        } catch (Exception e) {
            logger.warn("Tool call failed", e);
            return createErrorResponse("Tool execution failed: " + e.getMessage(), -32603);
        }
    }

    @SuppressWarnings("unchecked")
    private Object callTool(String toolName, Map<String, Object> arguments) {
        switch (toolName) {
            case "lead_submit":
                return leadTools.lead_submit(requireObject(arguments, "payload"));
            case "lead_preview":
                return leadTools.lead_preview(requireObject(arguments, "payload"));
            case "envelope_encode":
                Number callId = (Number) arguments.get("callId");
                return leadTools.envelope_encode(requireObject(arguments, "payload"),
                        callId != null ? callId.longValue() : null);
            case "envelope_decode":
                return leadTools.envelope_decode((String) arguments.get("envelope"));

            case "sync_collect":
                Number limit = (Number) arguments.get("limit");
                return syncTools.sync_collect((String) arguments.get("resource"),
                        limit != null ? limit.intValue() : null);
            case "dispatch_stats":
                return syncTools.dispatch_stats();

            case "capabilities_list":
                return capabilitiesTools.capabilities_list();

            default:
                throw new IllegalArgumentException("Unknown tool: " + toolName);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> requireObject(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an object");
        }
        return new HashMap<>((Map<String, Object>) value);
    }

    private Map<String, Object> createErrorResponse(String message, int code) {
        return Map.of(
                "error", Map.of(
                        "code", code,
                        "message", message
                ),
                "isError", true
        );
    }

    @GetMapping("/mcp/capabilities")
    public Map<String, Object> getCapabilities() {
        Map<String, Object> toolsList = handleToolsList();
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tools = (List<Map<String, Object>>) toolsList.get("tools");

        return Map.of(
                "server", Map.of(
                        "name", "lead-intake",
                        "version", "1.0.0"
                ),
                "capabilities", Map.of(
                        "tools", true,
                        "resources", false,
                        "prompts", false
                ),
                "tools", tools.stream()
                        .map(tool -> Map.of(
                                "name", tool.get("name"),
                                "description", tool.get("description")
                        ))
                        .toList()
        );
    }
}
