package com.example.leadintake.controller;

import com.example.leadintake.config.IntakeProperties;
import com.example.leadintake.model.FallbackPolicy;
import com.example.leadintake.model.LeadField;
import com.example.leadintake.service.DispatchClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.EnumMap;
import java.util.Map;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private DispatchClient dispatchClient;

    private IntakeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new IntakeProperties();
        when(dispatchClient.getStats()).thenReturn(Map.of("retries", 0));
    }

    private WebTestClient client(FallbackPolicy policy) {
        return WebTestClient.bindToController(new HealthController(dispatchClient, policy, properties)).build();
    }

    @Test
    void testHealth_CompletePolicyAndConfiguredToken() {
        // Given
        properties.getInbox().setToken("secret-token");

        // When / Then
        client(properties.getFallback().toPolicy()).get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.inboxToken").isEqualTo("CONFIGURED")
                .jsonPath("$.fallbackPolicy").isEqualTo("COMPLETE")
                .jsonPath("$.fallbackMissing").doesNotExist()
                .jsonPath("$.dispatch.retries").isEqualTo(0);
    }

    @Test
    void testHealth_IncompletePolicyAndMissingToken() {
        // Given
        Map<LeadField, String> defaults = new EnumMap<>(properties.getFallback().toPolicy().asMap());
        defaults.put(LeadField.EMAIL, " ");

        // When / Then
        client(new FallbackPolicy(defaults)).get().uri("/actuator/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.inboxToken").isEqualTo("MISSING")
                .jsonPath("$.fallbackPolicy").isEqualTo("INCOMPLETE")
                .jsonPath("$.fallbackMissing[0]").isEqualTo("EMAIL");
    }
}
