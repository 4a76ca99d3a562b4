package com.carescore.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.cors.CorsConfiguration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SecurityConfig Unit Tests")
class SecurityConfigTest {

    @Test
    @DisplayName("Should trim origins and skip empty entries")
    void shouldParseOrigins() {
        assertThat(SecurityConfig.parseOrigins(" http://ward.local , ,http://localhost:3000,"))
            .containsExactly("http://ward.local", "http://localhost:3000");
        assertThat(SecurityConfig.parseOrigins(null)).isEmpty();
    }

    @Test
    @DisplayName("Should expose Retry-After and accept the acting clinician header on API routes")
    void shouldConfigureApiCors() {
        // Given
        SecurityConfig config = new SecurityConfig();
        ReflectionTestUtils.setField(config, "allowedOriginsConfig", "http://ward.local");

        // When
        CorsConfiguration cors = config.corsConfigurationSource()
            .getCorsConfiguration(new MockHttpServletRequest("GET", "/api/risk/aggregate"));

        // Then
        assertThat(cors).isNotNull();
        assertThat(cors.getAllowedOrigins()).containsExactly("http://ward.local");
        assertThat(cors.getExposedHeaders()).containsExactly("Retry-After");
        assertThat(cors.getAllowedHeaders()).contains("X-User-Id");
        assertThat(cors.getAllowedMethods()).doesNotContain("PATCH");
    }

    @Test
    @DisplayName("Should not apply CORS outside the API")
    void shouldLeaveOtherRoutesAlone() {
        SecurityConfig config = new SecurityConfig();
        ReflectionTestUtils.setField(config, "allowedOriginsConfig", "http://ward.local");

        assertThat(config.corsConfigurationSource()
            .getCorsConfiguration(new MockHttpServletRequest("GET", "/h2-console"))).isNull();
    }
}
