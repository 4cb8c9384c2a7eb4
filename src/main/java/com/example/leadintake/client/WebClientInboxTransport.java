package com.example.leadintake.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Spring WebClient transport (blocking exchange bounded by the request timeout).
 */
public class WebClientInboxTransport implements InboxTransport {

    private static final Logger logger = LoggerFactory.getLogger(WebClientInboxTransport.class);

    private final WebClient client;
    private final Duration requestTimeout;

    public WebClientInboxTransport(WebClient client, Duration requestTimeout) {
        this.client = client;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public InboxResponse exchange(InboxRequest request) throws TransportException {
        logger.debug("{} {}", request.getMethod(), request.getUrl());
        WebClient.RequestBodySpec spec = client.method(request.getMethod())
                .uri(request.getUrl())
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> request.getHeaders().forEach(h::set));
        WebClient.RequestHeadersSpec<?> withBody = request.getBody() != null
                ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.getBody())
                : spec;
        Duration timeout = request.getTimeout() != null && request.getTimeout().compareTo(requestTimeout) < 0
                ? request.getTimeout() : requestTimeout;
        try {
            InboxResponse response = withBody
                    .exchangeToMono(r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new InboxResponse(r.statusCode().value(),
                                    HttpHeaders.readOnlyHttpHeaders(r.headers().asHttpHeaders()), body)))
                    .timeout(timeout, Mono.error(new TimeoutException(
                            "No response within " + timeout.toMillis() + " ms")))
                    .block();
            if (response == null) {
                throw new TransportException("Empty exchange for " + request.getUrl(), null, false);
            }
            return response;
        } catch (WebClientRequestException e) {
            throw new TransportException("Request to " + request.getUrl() + " failed: " + e.getMessage(), e, false);
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                throw new TransportException(cause.getMessage(), cause, true);
            }
            throw new TransportException("Request to " + request.getUrl() + " failed: " + e.getMessage(), e, false);
        }
    }
}
