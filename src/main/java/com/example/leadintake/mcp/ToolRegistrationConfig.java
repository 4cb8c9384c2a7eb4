package com.example.leadintake.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final LeadTools leadTools;
    private final SyncTools syncTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(LeadTools leadTools, SyncTools syncTools, CapabilitiesTools capTools) {
        this.leadTools = leadTools;
        this.syncTools = syncTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(leadTools, syncTools, capTools)
                .build();
    }
}
