package com.example.leadintake.mcp;

import com.example.leadintake.service.BulkSyncEngine;
import com.example.leadintake.service.DispatchClient;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class SyncTools {

    private final BulkSyncEngine syncEngine;
    private final DispatchClient dispatchClient;

    public SyncTools(BulkSyncEngine syncEngine, DispatchClient dispatchClient) {
        this.syncEngine = syncEngine;
        this.dispatchClient = dispatchClient;
    }

    @Tool(description = "Fetch all records of a downstream resource (contacts, custom_actions, webhook_subscriptions) following pagination, up to limit")
    public Map<String, Object> sync_collect(String resource, Integer limit) {
        int lim = (limit == null || limit <= 0) ? 100 : Math.min(limit, 10000);
        return syncEngine.collect(resource, lim).toMap();
    }

    @Tool(description = "Get dispatch statistics: outcome counts, retries and rate-limit window state")
    public Map<String, Object> dispatch_stats() {
        return dispatchClient.getStats();
    }
}
