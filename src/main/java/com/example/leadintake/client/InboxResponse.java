package com.example.leadintake.client;

import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * Raw response of one outbound call: status, headers and body text.
 */
public final class InboxResponse {

    private final int status;
    private final HttpHeaders headers;
    private final String body;

    public InboxResponse(int status, HttpHeaders headers, String body) {
        this.status = status;
        this.headers = headers == null ? new HttpHeaders() : headers;
        this.body = body == null ? "" : body;
    }

    public static InboxResponse of(int status, Map<String, String> headers, String body) {
        HttpHeaders httpHeaders = new HttpHeaders();
        headers.forEach(httpHeaders::add);
        return new InboxResponse(status, httpHeaders, body);
    }

    public int getStatus() { return status; }
    public HttpHeaders getHeaders() { return headers; }
    public String getBody() { return body; }

    // header names are matched case-insensitively
    public String header(String name) {
        return headers.getFirst(name);
    }

    public boolean is2xx() {
        return status >= 200 && status < 300;
    }

    public boolean is5xx() {
        return status >= 500 && status < 600;
    }
}
