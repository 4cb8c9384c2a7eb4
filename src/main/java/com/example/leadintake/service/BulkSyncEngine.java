package com.example.leadintake.service;

import com.example.leadintake.client.InboxRequest;
import com.example.leadintake.client.InboxResponse;
import com.example.leadintake.config.IntakeProperties;
import com.example.leadintake.model.DispatchOutcome;
import com.example.leadintake.model.PageCursor;
import com.example.leadintake.model.SyncResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Paginated bulk retrieval from the downstream API. Pages go through the
 * {@link DispatchClient}, so they share its rate limit and retry policy.
 */
public class BulkSyncEngine {

    private static final Logger logger = LoggerFactory.getLogger(BulkSyncEngine.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final DispatchClient dispatchClient;
    private final IntakeProperties.Sync settings;
    private final ObjectMapper objectMapper;

    public BulkSyncEngine(DispatchClient dispatchClient, IntakeProperties properties, ObjectMapper objectMapper) {
        this.dispatchClient = dispatchClient;
        this.settings = properties.getSync();
        this.objectMapper = objectMapper;
    }

    public List<String> resources() {
        return new ArrayList<>(settings.getResources().keySet());
    }

    /**
     * Starts a new run over every record of {@code resource}. Nothing is fetched
     * until the run is iterated.
     */
    public SyncRun syncAll(String resource) {
        String path = settings.getResources().get(resource);
        if (path == null) {
            throw new IllegalArgumentException("Unknown sync resource: " + resource
                    + " (known: " + settings.getResources().keySet() + ")");
        }
        return new SyncRun(resource, settings.getBaseUrl() + path);
    }

    /**
     * Drains a run, keeping at most {@code limit} records (no limit when {@code limit <= 0}).
     */
    public SyncResult collect(String resource, int limit) {
        SyncRun run = syncAll(resource);
        List<Map<String, Object>> records = new ArrayList<>();
        // the limit is checked first so a full result never triggers another page request
        while (!(limit > 0 && records.size() >= limit) && run.hasNext()) {
            records.add(run.next());
        }
        boolean truncated = limit > 0 && records.size() >= limit && run.hasPending();
        DispatchOutcome terminal = run.terminalOutcome().orElse(null);
        logger.info("Sync of {} finished: {} records from {} pages{}", resource, records.size(),
                run.getPagesFetched(), terminal != null ? ", stopped by " + terminal.getKind() : "");
        return SyncResult.builder()
                .resource(resource)
                .records(records)
                .pagesFetched(run.getPagesFetched())
                .complete(terminal == null && !truncated && !run.isPageLimitReached())
                .terminalOutcome(terminal)
                .build();
    }

    /**
     * One pass over a paginated resource. Records from pages fetched before a
     * terminal failure remain readable; the failure is reported by
     * {@link #terminalOutcome()} once iteration ends.
     */
    public final class SyncRun implements Iterator<Map<String, Object>> {

        private final String resource;
        private final String url;
        private final Deque<Map<String, Object>> buffer = new ArrayDeque<>();
        private PageCursor cursor = PageCursor.first(settings.getPerPage());
        private DispatchOutcome terminalOutcome;
        private int pagesFetched;
        private boolean pageLimitReached;
        private boolean finished;

        private SyncRun(String resource, String url) {
            this.resource = resource;
            this.url = url;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !finished) {
                fetchNextPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        /**
         * True while records are buffered or another page may follow. Never fetches.
         */
        public boolean hasPending() {
            return !buffer.isEmpty() || (!finished && !cursor.isExhausted());
        }

        public Stream<Map<String, Object>> stream() {
            return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
        }

        public Optional<DispatchOutcome> terminalOutcome() {
            return Optional.ofNullable(terminalOutcome);
        }

        public int getPagesFetched() { return pagesFetched; }
        public boolean isPageLimitReached() { return pageLimitReached; }
        public PageCursor getCursor() { return cursor; }
        public String getResource() { return resource; }

        private void fetchNextPage() {
            if (cursor.isExhausted()) {
                finished = true;
                return;
            }
            if (pagesFetched >= settings.getMaxPages()) {
                logger.warn("Sync of {} stopped at the {} page limit", resource, settings.getMaxPages());
                pageLimitReached = true;
                finished = true;
                return;
            }
            DispatchClient.Exchange exchange = dispatchClient.exchange(InboxRequest.get(pageUrl(), requestHeaders()));
            if (!exchange.isSuccess()) {
                stop(exchange.getFailure());
                return;
            }
            InboxResponse response = exchange.getResponse();
            JsonNode root;
            try {
                root = objectMapper.readTree(response.getBody());
            } catch (JsonProcessingException e) {
                logger.debug("Page body of {} is not JSON", resource, e);
                root = null;
            }
            if (root == null || !root.path("data").isArray()) {
                logger.error("Unparsable {} page {} body={}", resource, cursor.getPage(), response.getBody());
                stop(DispatchOutcome.fatalFailure("Unparsable page body", exchange.getAttempts()));
                return;
            }
            pagesFetched++;
            JsonNode data = root.path("data");
            for (JsonNode item : data) {
                if (item.isObject()) {
                    buffer.add(objectMapper.convertValue(item, MAP_TYPE));
                }
            }
            logger.debug("Fetched {} page {} with {} records", resource, cursor.getPage(), data.size());
            cursor = advance(cursor, root, response, data.size());
        }

        private void stop(DispatchOutcome outcome) {
            logger.warn("Sync of {} stopped on page {}: {}", resource, cursor.getPage(), outcome);
            terminalOutcome = outcome;
            finished = true;
        }

        private String pageUrl() {
            if (cursor.getNextLink() != null) {
                return cursor.getNextLink();
            }
            return UriComponentsBuilder.fromUriString(url)
                    .queryParam("page", cursor.getPage())
                    .queryParam("per_page", cursor.getPerPage())
                    .build()
                    .toUriString();
        }

        private Map<String, String> requestHeaders() {
            Map<String, String> headers = new LinkedHashMap<>();
            if (settings.getAccessToken() != null && !settings.getAccessToken().isBlank()) {
                headers.put("Authorization", "Bearer " + settings.getAccessToken());
            }
            headers.put("X-API-VERSION", settings.getApiVersion());
            return headers;
        }
    }

    /**
     * Next cursor from a page: a next-link token wins, then the pagination headers.
     * Without either signal, or on an empty page, the run ends.
     */
    PageCursor advance(PageCursor current, JsonNode root, InboxResponse response, int pageSize) {
        IntakeProperties.Headers names = settings.getHeaders();
        Long totalCount = parseLong(response.header(names.getTotalCount()));
        if (pageSize == 0) {
            return PageCursor.end(current, totalCount);
        }
        JsonNode next = root.path("meta").path("paging").path("next");
        if (next.isTextual() && !next.asText().isBlank()) {
            return PageCursor.followLink(current, next.asText(), totalCount);
        }
        Long headerPage = parseLong(response.header(names.getCurrentPage()));
        int page = headerPage != null ? headerPage.intValue() : current.getPage();

        String hasNext = response.header(names.getHasNextPage());
        if (hasNext != null) {
            return "true".equalsIgnoreCase(hasNext.trim())
                    ? PageCursor.nextPage(current, page + 1, totalCount)
                    : PageCursor.end(current, totalCount);
        }
        Long totalPages = parseLong(response.header(names.getTotalPages()));
        if (totalPages != null) {
            return page < totalPages ? PageCursor.nextPage(current, page + 1, totalCount) : PageCursor.end(current, totalCount);
        }
        if (totalCount != null) {
            Long headerPerPage = parseLong(response.header(names.getPerPage()));
            long perPage = headerPerPage != null && headerPerPage > 0 ? headerPerPage : current.getPerPage();
            return (long) page * perPage < totalCount
                    ? PageCursor.nextPage(current, page + 1, totalCount)
                    : PageCursor.end(current, totalCount);
        }
        return PageCursor.end(current, null);
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
