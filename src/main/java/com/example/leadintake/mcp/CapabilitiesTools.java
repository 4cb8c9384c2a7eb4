package com.example.leadintake.mcp;

import com.example.leadintake.service.BulkSyncEngine;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class CapabilitiesTools {

    private final BulkSyncEngine syncEngine;

    public CapabilitiesTools(BulkSyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @Tool(description = "List server capabilities and the resources available for bulk sync")
    public Map<String, Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "lead-intake", "version", "1.0.0"),
                "capabilities", Map.of(
                    "tools", true,
                    "resources", false,
                    "prompts", false,
                    "completion", false
                ),
                "syncResources", syncEngine.resources()
        );
    }
}
