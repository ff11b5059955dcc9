package org.nowstart.rampart.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.nowstart.rampart.data.exception.FeedIntegrityException;
import org.nowstart.rampart.data.exception.RampartApiException;
import org.nowstart.rampart.service.RuntimeRouter;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

class RampartExceptionHandlerTest {

    private final RampartExceptionHandler handler = new RampartExceptionHandler();

    @Test
    void handleRampartApiException_returnsProblemDetailWithCode() {
        RampartApiException exception = new RampartApiException(
                HttpStatus.NOT_FOUND, RuntimeRouter.ERROR_UNKNOWN_INSTRUMENT, "Unknown instrument: USD_JPY");

        ProblemDetail detail = handler.handleRampartApiException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
        assertThat(detail.getDetail()).isEqualTo("Unknown instrument: USD_JPY");
        assertThat(detail.getProperties()).containsEntry("code", "unknown_instrument");
    }

    @Test
    void handleFeedIntegrityException_returnsUnprocessableEntity() {
        Instant ts = Instant.parse("2024-01-02T00:00:00Z");
        FeedIntegrityException exception = new FeedIntegrityException("EUR_USD", ts, "duplicate bar timestamp");

        ProblemDetail detail = handler.handleFeedIntegrityException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY.value());
        assertThat(detail.getDetail()).contains("duplicate bar timestamp");
        assertThat(detail.getProperties())
                .containsEntry("code", "feed_integrity")
                .containsEntry("instrument", "EUR_USD")
                .containsEntry("timestamp", "2024-01-02T00:00:00Z");
    }

    @Test
    void handleValidationException_collectsFieldMessages() throws Exception {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "request");
        bindingResult.addError(new FieldError("request", "bars", "must not be empty"));
        MethodParameter parameter = new MethodParameter(
                RampartExceptionHandlerTest.class.getDeclaredMethod("handleValidationException_collectsFieldMessages"),
                -1
        );

        ProblemDetail detail = handler.handleValidationException(new MethodArgumentNotValidException(parameter, bindingResult));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties())
                .containsEntry("code", "validation_error")
                .containsEntry("details", List.of("must not be empty"));
    }

    @Test
    void handleConstraintViolationException_collectsViolationMessages() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = mock(ConstraintViolation.class);
        when(violation.getMessage()).thenReturn("must be greater than 0");

        ProblemDetail detail = handler.handleConstraintViolationException(
                new ConstraintViolationException(Set.of(violation)));

        assertThat(detail.getProperties())
                .containsEntry("code", "validation_error")
                .containsEntry("details", List.of("must be greater than 0"));
    }

    @Test
    void handleIllegalArgumentException_returnsBadRequest() {
        ProblemDetail detail = handler.handleIllegalArgumentException(new IllegalArgumentException("skipFloor must be in [0, 1]"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getDetail()).isEqualTo("skipFloor must be in [0, 1]");
        assertThat(detail.getProperties()).containsEntry("code", "invalid_argument");
    }

    @Test
    void handleUnreadableBody_surfacesRejectedOverrideAsBadRequest() {
        HttpMessageNotReadableException exception = new HttpMessageNotReadableException(
                "JSON parse error",
                new IllegalStateException("instantiation failed", new IllegalArgumentException("maxStopLossPips must be > 0")),
                mock(HttpInputMessage.class)
        );

        ProblemDetail detail = handler.handleUnreadableBody(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getDetail()).isEqualTo("maxStopLossPips must be > 0");
        assertThat(detail.getProperties()).containsEntry("code", "invalid_argument");
    }

    @Test
    void handleUnreadableBody_returnsValidationErrorForMalformedJson() {
        HttpMessageNotReadableException exception = new HttpMessageNotReadableException(
                "JSON parse error", mock(HttpInputMessage.class));

        ProblemDetail detail = handler.handleUnreadableBody(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
    }

    @Test
    void handleUnexpectedException_returnsInternalErrorProblemDetail() {
        ProblemDetail detail = handler.handleUnexpectedException(new IllegalStateException("boom"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getDetail()).isEqualTo("Unexpected server error");
        assertThat(detail.getProperties()).containsEntry("code", "internal_error");
    }
}
