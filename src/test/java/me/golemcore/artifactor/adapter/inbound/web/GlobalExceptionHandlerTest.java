package me.golemcore.artifactor.adapter.inbound.web;

import me.golemcore.artifactor.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.artifactor.domain.exception.GuardrailViolationException;
import me.golemcore.artifactor.domain.exception.ProjectNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapMissingProjectToNotFound() {
        ResponseEntity<ApiErrorResponse> response = handler.handleNotFound(new ProjectNotFoundException("p9")).block();

        assertNotNull(response);
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals(404, response.getBody().getStatus());
        assertTrue(response.getBody().getMessage().contains("p9"));
    }

    @Test
    void shouldMapGuardrailViolationToBadRequest() {
        ResponseEntity<ApiErrorResponse> response = handler
                .handleBadRequest(new GuardrailViolationException("input_not_empty", "Input is empty")).block();

        assertNotNull(response);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Input is empty", response.getBody().getMessage());
    }

    @Test
    void shouldHideInternalErrorDetails() {
        ResponseEntity<ApiErrorResponse> response = handler.handleGeneric(new IllegalStateException("secret")).block();

        assertNotNull(response);
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().getMessage());
    }
}
