package com.example.leadintake.service;

import com.example.leadintake.client.InboxRequest;
import com.example.leadintake.client.InboxResponse;
import com.example.leadintake.client.InboxTransport;
import com.example.leadintake.client.TransportException;
import com.example.leadintake.config.IntakeProperties;
import com.example.leadintake.model.DispatchOutcome;
import com.example.leadintake.model.NormalizedLead;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DispatchClientTest {

    @Mock
    private InboxTransport transport;

    private ManualClock clock;
    private IntakeProperties properties;
    private NormalizedLead lead;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        properties = new IntakeProperties();
        properties.getInbox().setUrl("https://inbox.test/inbox_leads");
        properties.getInbox().setToken("secret-token");
        properties.getRetry().setJitter(false);
        lead = NormalizedLead.builder()
                .firstName("Jane").lastName("Doe").message("...").email("jane@x.com")
                .phone("555").referringUrl("https://x.com").source("Web")
                .build();
    }

    private DispatchClient newClient() {
        return newClient(new RateLimitWindow(100, Duration.ofSeconds(60), clock, clock));
    }

    private DispatchClient newClient(RateLimitWindow window) {
        IntakeProperties.Retry retry = properties.getRetry();
        BackoffPolicy backoff = new ExponentialBackoffPolicy(retry.getBaseDelay(), retry.getMaxDelay(), retry.isJitter());
        return new DispatchClient(transport, window, backoff, properties, clock, clock, new ObjectMapper());
    }

    private static InboxResponse response(int status, String body) {
        return InboxResponse.of(status, Map.of(), body);
    }

    @Test
    void testDispatch_CreatedWithRemoteId() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(response(201, "{\"inbox_lead\":{\"id\":27173864}}"));
        DispatchClient client = newClient();

        // When
        DispatchOutcome outcome = client.dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.CREATED, outcome.getKind());
        assertEquals("27173864", outcome.getRemoteId());
        assertEquals(1, outcome.getAttempts());

        ArgumentCaptor<InboxRequest> captor = ArgumentCaptor.forClass(InboxRequest.class);
        verify(transport).exchange(captor.capture());
        InboxRequest sent = captor.getValue();
        assertEquals(HttpMethod.POST, sent.getMethod());
        assertEquals("https://inbox.test/inbox_leads", sent.getUrl());
        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) sent.getBody();
        assertEquals("secret-token", body.get("inbox_lead_token"));
        assertEquals(lead.toInboxLead(), body.get("inbox_lead"));
    }

    @Test
    void testDispatch_CreatedWithoutReadableIdIsStillCreated() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(response(200, "<html>ok</html>"));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertTrue(outcome.isCreated());
        assertNull(outcome.getRemoteId());
    }

    @Test
    void testDispatch_ServerErrorsExhaustAttempts() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(response(500, "boom"));
        DispatchClient client = newClient();

        // When
        DispatchOutcome outcome = client.dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.TRANSIENT_FAILURE, outcome.getKind());
        assertEquals(3, outcome.getAttempts());
        assertEquals("HTTP 500", outcome.getCause());
        verify(transport, times(3)).exchange(any());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000)), clock.sleeps());

        @SuppressWarnings("unchecked")
        Map<String, Object> outcomes = (Map<String, Object>) client.getStats().get("outcomes");
        assertEquals(1L, outcomes.get("TRANSIENT_FAILURE"));
        assertEquals(2L, client.getStats().get("retries"));
    }

    @Test
    void testDispatch_TooManyRequestsHonorsRetryAfter() throws Exception {
        // Given
        when(transport.exchange(any()))
                .thenReturn(InboxResponse.of(429, Map.of("Retry-After", "2"), ""))
                .thenReturn(response(201, "{\"id\":\"abc\"}"));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertTrue(outcome.isCreated());
        assertEquals("abc", outcome.getRemoteId());
        assertEquals(2, outcome.getAttempts());
        assertEquals(List.of(Duration.ofSeconds(2)), clock.sleeps());
    }

    @Test
    void testDispatch_RetryAfterBeyondBudgetIsRateLimited() throws Exception {
        // Given
        properties.getRetry().setRequestBudget(Duration.ofSeconds(30));
        when(transport.exchange(any())).thenReturn(InboxResponse.of(429, Map.of("retry-after", "45"), ""));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.RATE_LIMITED, outcome.getKind());
        assertEquals(Duration.ofSeconds(45), outcome.getRetryAfter());
        assertEquals(1, outcome.getAttempts());
        verify(transport, times(1)).exchange(any());
        assertTrue(clock.sleeps().isEmpty());
    }

    @Test
    void testDispatch_RetryAfterAboveCeilingIsNeverShortened() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(InboxResponse.of(429, Map.of("Retry-After", "90"), ""));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.RATE_LIMITED, outcome.getKind());
        assertEquals(Duration.ofSeconds(90), outcome.getRetryAfter());
        assertEquals(1, outcome.getAttempts());
        assertTrue(clock.sleeps().isEmpty());
        verify(transport, times(1)).exchange(any());
    }

    @Test
    void testDispatch_TooManyRequestsWithoutRetryAfterExhausts() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(response(429, ""));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.TRANSIENT_FAILURE, outcome.getKind());
        assertEquals(3, outcome.getAttempts());
        assertEquals("HTTP 429", outcome.getCause());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofSeconds(1)), clock.sleeps());
        verify(transport, times(3)).exchange(any());
    }

    @Test
    void testDispatch_CallTimeoutNeverExceedsRemainingBudget() throws Exception {
        // Given
        when(transport.exchange(any()))
                .thenReturn(response(503, ""))
                .thenReturn(response(201, "{\"id\":1}"));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertTrue(outcome.isCreated());
        ArgumentCaptor<InboxRequest> captor = ArgumentCaptor.forClass(InboxRequest.class);
        verify(transport, times(2)).exchange(captor.capture());
        assertEquals(Duration.ofSeconds(120), captor.getAllValues().get(0).getTimeout());
        assertEquals(Duration.ofMillis(119_500), captor.getAllValues().get(1).getTimeout());
    }

    @Test
    void testDispatch_AuthRejectedIsNotRetried() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(response(401, "{\"error\":\"invalid token\"}"));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.AUTH_REJECTED, outcome.getKind());
        assertEquals(1, outcome.getAttempts());
        verify(transport, times(1)).exchange(any());
    }

    @Test
    void testDispatch_UnprocessableCarriesFieldErrors() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(response(422,
                "{\"inbox_lead\":{\"errors\":{\"from_email\":[\"is invalid\"],\"from_phone\":\"too short\"}}}"));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.VALIDATION_REJECTED, outcome.getKind());
        assertEquals(DispatchOutcome.Stage.DISPATCH, outcome.getStage());
        assertFalse(outcome.isInputRejected());
        assertEquals(List.of("is invalid"), outcome.getFieldErrors().get("from_email"));
        assertEquals(List.of("too short"), outcome.getFieldErrors().get("from_phone"));
        verify(transport, times(1)).exchange(any());
    }

    @Test
    void testDispatch_UnparsableValidationBodyIsFatal() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(response(422, "Unprocessable"));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.FATAL_FAILURE, outcome.getKind());
    }

    @Test
    void testDispatch_UnexpectedStatusIsFatal() throws Exception {
        // Given
        when(transport.exchange(any())).thenReturn(response(418, "teapot"));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.FATAL_FAILURE, outcome.getKind());
        assertEquals("Unexpected HTTP status 418", outcome.getCause());
        verify(transport, times(1)).exchange(any());
    }

    @Test
    void testDispatch_NetworkErrorThenSuccess() throws Exception {
        // Given
        when(transport.exchange(any()))
                .thenThrow(new TransportException("Connection refused", null, false))
                .thenReturn(response(201, "{\"inbox_lead\":{\"id\":1}}"));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertTrue(outcome.isCreated());
        assertEquals(2, outcome.getAttempts());
        assertEquals(List.of(Duration.ofMillis(500)), clock.sleeps());
    }

    @Test
    void testDispatch_RepeatedTimeoutsReportTimeout() throws Exception {
        // Given
        when(transport.exchange(any())).thenThrow(new TransportException("Read timed out", null, true));

        // When
        DispatchOutcome outcome = newClient().dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.TRANSIENT_FAILURE, outcome.getKind());
        assertEquals("timeout", outcome.getCause());
        assertEquals(3, outcome.getAttempts());
    }

    @Test
    void testDispatch_NoSlotWithinAcquireTimeoutIsRateLimited() throws Exception {
        // Given
        properties.getRateLimit().setAcquireTimeout(Duration.ofSeconds(5));
        RateLimitWindow window = new RateLimitWindow(1, Duration.ofSeconds(60), clock, clock);
        when(transport.exchange(any())).thenReturn(response(201, "{\"id\":1}"));
        DispatchClient client = newClient(window);
        assertTrue(client.dispatch(lead).isCreated());

        // When
        DispatchOutcome outcome = client.dispatch(lead);

        // Then
        assertEquals(DispatchOutcome.Kind.RATE_LIMITED, outcome.getKind());
        assertEquals(0, outcome.getAttempts());
        assertEquals(Duration.ofSeconds(60), outcome.getRetryAfter());
        verify(transport, times(1)).exchange(any());
    }

    @Test
    void testParseRetryAfter_SecondsAndHttpDate() {
        DispatchClient client = newClient();
        String httpDate = DateTimeFormatter.RFC_1123_DATE_TIME.format(
                ZonedDateTime.ofInstant(clock.instant().plusSeconds(5), ZoneOffset.UTC));

        assertEquals(Duration.ofSeconds(7), client.parseRetryAfter("7"));
        assertEquals(Duration.ofSeconds(5), client.parseRetryAfter(httpDate));
        assertNull(client.parseRetryAfter("soon"));
        assertNull(client.parseRetryAfter(null));
    }
}
