package com.williamcallahan.mdcanvas.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.mdcanvas.domain.errors.ApiErrorResponse;
import com.williamcallahan.mdcanvas.domain.errors.ApiResponse;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies error payloads and exception summaries.
 */
class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_includesRootCause() {
        UncheckedIOException wrapped = new UncheckedIOException("encode failed", new IOException("disk full"));

        assertEquals("UncheckedIOException: encode failed (caused by IOException: disk full)",
            builder.describeException(wrapped));
    }

    @Test
    void describeException_nullException_isNull() {
        assertNull(builder.describeException(null));
    }

    @Test
    void buildErrorResponse_withException_carriesDetails() {
        ResponseEntity<ApiResponse> response =
            builder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed", new IllegalStateException("x"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        ApiErrorResponse body = assertInstanceOf(ApiErrorResponse.class, response.getBody());
        assertEquals("error", body.status());
        assertEquals("IllegalStateException: x", body.details());
    }
}
