package com.ammann.biometrics.exception;

import com.ammann.biometrics.enumeration.AlertStatus;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null; // default path handling
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(ValidationException.invalidParameter("days", 0, "1-365"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isNull();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
        assertThat(body.status).isEqualTo(400);
        assertThat(body.message).contains("days");
    }

    @Test
    void mapsSourceFailureToServiceUnavailable()
    {
        Response response = handler.toResponse(
                new TimeSeriesSourceException("alice", "glucose", new IllegalStateException("connection reset")));

        assertThat(response.getStatus()).isEqualTo(Response.Status.SERVICE_UNAVAILABLE.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("TIME_SERIES_SOURCE_ERROR");
        assertThat(body.message).isEqualTo("Failed to load glucose for user alice: connection reset");
    }

    @Test
    void mapsRejectedTransitionToConflict()
    {
        Response response = handler.toResponse(
                new InvalidAlertTransitionException("a-1", AlertStatus.RESOLVED, AlertStatus.ACKNOWLEDGED));

        assertThat(response.getStatus()).isEqualTo(Response.Status.CONFLICT.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INVALID_TRANSITION");
        assertThat(body.message).isEqualTo("Alert a-1 cannot move from resolved to acknowledged");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("NOT_FOUND");
        assertThat(body.message).contains("missing");
    }

    @Test
    void mapsUnhandledTo500()
    {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message).isEqualTo("An unexpected error occurred");
        assertThat(body.timestamp).isNotNull();
    }
}
