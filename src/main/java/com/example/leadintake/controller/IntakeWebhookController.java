package com.example.leadintake.controller;

import com.example.leadintake.model.DispatchOutcome;
import com.example.leadintake.model.IntakeResult;
import com.example.leadintake.model.LeadResult;
import com.example.leadintake.model.SyncResult;
import com.example.leadintake.service.BulkSyncEngine;
import com.example.leadintake.service.DecodeException;
import com.example.leadintake.service.EnvelopeDecoder;
import com.example.leadintake.service.LeadIntakePipeline;
import com.example.leadintake.service.PayloadClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inbound webhooks for web forms and voice agents. Pipeline work blocks, so it
 * runs on the bounded elastic scheduler.
 */
@RestController
public class IntakeWebhookController {

    private static final Logger logger = LoggerFactory.getLogger(IntakeWebhookController.class);

    private final LeadIntakePipeline pipeline;
    private final EnvelopeDecoder decoder;
    private final BulkSyncEngine syncEngine;

    public IntakeWebhookController(LeadIntakePipeline pipeline, EnvelopeDecoder decoder, BulkSyncEngine syncEngine) {
        this.pipeline = pipeline;
        this.decoder = decoder;
        this.syncEngine = syncEngine;
    }

    @PostMapping(value = "/webhook/intake", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> intake(@RequestBody String body) {
        return Mono.fromCallable(() -> toResponse(pipeline.handle(body)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(value = "/webhook/direct", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> direct(@RequestBody String body) {
        return requireKey(body, PayloadClassifier.DIRECT_KEY, "Direct payload must contain 'inbox_lead' field");
    }

    @PostMapping(value = "/webhook/envelope", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> envelope(@RequestBody String body) {
        return requireKey(body, PayloadClassifier.BATCH_KEY, "Envelope payload must contain 'inbox_leads' field");
    }

    @PostMapping(value = "/webhook/preview", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> preview(@RequestBody String body) {
        return Mono.fromCallable(() -> {
            try {
                return ResponseEntity.ok(pipeline.previewDecoded(decoder.decode(body)).toMap());
            } catch (DecodeException e) {
                return toResponse(pipeline.rejectUndecodable(e));
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(value = "/sync/{resource}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> sync(@PathVariable String resource,
                                                          @RequestParam(defaultValue = "100") int limit) {
        if (!syncEngine.resources().contains(resource)) {
            return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(error("Unknown sync resource: " + resource)));
        }
        return Mono.fromCallable(() -> {
            SyncResult result = syncEngine.collect(resource, limit);
            DispatchOutcome terminal = result.getTerminalOutcome();
            if (terminal != null && result.getRecords().isEmpty()) {
                return ResponseEntity.status(statusFor(terminal)).body(result.toMap());
            }
            return ResponseEntity.ok(result.toMap());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("/webhook/intake", "Unified endpoint for any payload format");
        endpoints.put("/webhook/direct", "Direct payloads from web forms");
        endpoints.put("/webhook/envelope", "Envelope payloads from voice agents");
        endpoints.put("/webhook/preview", "Classification and mapping without dispatch");
        endpoints.put("/sync/{resource}", "Paginated bulk sync " + syncEngine.resources());
        endpoints.put("/health", "Health check");
        return Map.of("message", "Lead Intake API", "version", "1.0.0", "endpoints", endpoints);
    }

    private Mono<ResponseEntity<Map<String, Object>>> requireKey(String body, String key, String message) {
        return Mono.fromCallable(() -> {
            Map<String, Object> payload;
            try {
                payload = decoder.decode(body);
            } catch (DecodeException e) {
                return toResponse(pipeline.rejectUndecodable(e));
            }
            if (!payload.containsKey(key)) {
                logger.warn("Rejecting payload without '{}': keys={}", key, payload.keySet());
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error(message));
            }
            return toResponse(pipeline.handleDecoded(payload));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    static ResponseEntity<Map<String, Object>> toResponse(IntakeResult result) {
        return ResponseEntity.status(statusFor(result)).body(result.toMap());
    }

    /**
     * 201 when every lead was created, 207 for a mixed batch. Otherwise the
     * most actionable failure decides: unavailable, then upstream fault, then
     * downstream rejection, then malformed input.
     */
    static HttpStatus statusFor(IntakeResult result) {
        if (result.getTotal() == 0) {
            return HttpStatus.OK;
        }
        if (result.getFailed() == 0) {
            return HttpStatus.CREATED;
        }
        if (result.getSuccessful() > 0) {
            return HttpStatus.MULTI_STATUS;
        }
        List<DispatchOutcome> outcomes = result.getResults().stream().map(LeadResult::getOutcome).toList();
        HttpStatus worst = HttpStatus.BAD_REQUEST;
        for (DispatchOutcome outcome : outcomes) {
            HttpStatus status = statusFor(outcome);
            if (rank(status) > rank(worst)) {
                worst = status;
            }
        }
        return worst;
    }

    static HttpStatus statusFor(DispatchOutcome outcome) {
        switch (outcome.getKind()) {
            case CREATED:
                return HttpStatus.CREATED;
            case VALIDATION_REJECTED:
                return outcome.isInputRejected() ? HttpStatus.BAD_REQUEST : HttpStatus.UNPROCESSABLE_ENTITY;
            case AUTH_REJECTED:
            case FATAL_FAILURE:
                return HttpStatus.BAD_GATEWAY;
            case RATE_LIMITED:
            case TRANSIENT_FAILURE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static int rank(HttpStatus status) {
        switch (status) {
            case SERVICE_UNAVAILABLE: return 4;
            case BAD_GATEWAY: return 3;
            case UNPROCESSABLE_ENTITY: return 2;
            case BAD_REQUEST: return 1;
            default: return 0;
        }
    }

    private static Map<String, Object> error(String message) {
        return Map.of("success", false, "error", message);
    }
}
