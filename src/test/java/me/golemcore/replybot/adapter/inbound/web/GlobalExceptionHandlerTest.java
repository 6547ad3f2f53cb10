package me.golemcore.replybot.adapter.inbound.web;

import me.golemcore.replybot.adapter.inbound.web.dto.ApiErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    private final MockServerWebExchange exchange = MockServerWebExchange
            .from(MockServerHttpRequest.post("/api/replies").build());

    @Test
    void shouldKeepStatusOfResponseStatusException() {
        ResponseEntity<ApiErrorResponse> response = handler
                .handleResponseStatus(new ResponseStatusException(HttpStatus.BAD_REQUEST, "'sender' is required"), exchange)
                .block();

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(400, response.getBody().getStatus());
        assertEquals("Bad Request", response.getBody().getError());
        assertEquals("'sender' is required", response.getBody().getMessage());
        assertEquals("/api/replies", response.getBody().getPath());
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        ResponseEntity<ApiErrorResponse> response = handler
                .handleIllegalArgument(new IllegalArgumentException("Unknown AI provider: x"), exchange)
                .block();

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Unknown AI provider: x", response.getBody().getMessage());
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        ResponseEntity<ApiErrorResponse> response = handler.handleGeneric(new RuntimeException("secret detail"), exchange)
                .block();

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().getMessage());
        assertEquals("Internal Server Error", response.getBody().getError());
    }

    @Test
    void shouldFallBackToReasonPhraseWhenExceptionHasNoReason() {
        ResponseEntity<ApiErrorResponse> response = handler
                .handleResponseStatus(new ResponseStatusException(HttpStatus.NOT_FOUND), exchange)
                .block();

        assertEquals(404, response.getBody().getStatus());
        assertEquals("Not Found", response.getBody().getMessage());
    }
}
