package com.example.leadintake.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class InboxRequest {
    private HttpMethod method;
    private String url;
    @Builder.Default
    private Map<String, String> headers = Map.of();
    // serialized as JSON when present
    private Object body;
    // upper bound for this call; the transport's own timeout applies when it is shorter or unset
    private Duration timeout;

    public static InboxRequest post(String url, Object body) {
        return InboxRequest.builder().method(HttpMethod.POST).url(url).body(body).build();
    }

    public InboxRequest withTimeout(Duration timeout) {
        return toBuilder().timeout(timeout).build();
    }

    public static InboxRequest get(String url, Map<String, String> headers) {
        return InboxRequest.builder().method(HttpMethod.GET).url(url).headers(headers).build();
    }
}
