package me.golemcore.scheduler.adapter.inbound.web;

import me.golemcore.scheduler.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.scheduler.domain.exception.UnknownTaskException;
import me.golemcore.scheduler.domain.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: x");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Job not found: x", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapValidationErrorsToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new ValidationException("interval must be positive")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("interval must be positive", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapUnknownTaskToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new UnknownTaskException("nope")))
                .assertNext(response -> assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldMapStateConflictsToConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("Job is already running: a")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals(409, response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret stack detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
