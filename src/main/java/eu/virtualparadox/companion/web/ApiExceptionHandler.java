package eu.virtualparadox.companion.web;

import eu.virtualparadox.companion.error.ConversationBusyException;
import eu.virtualparadox.companion.error.EmbeddingUnavailableException;
import eu.virtualparadox.companion.error.IndexCorruptionException;
import eu.virtualparadox.companion.error.NoProviderAvailableException;
import eu.virtualparadox.companion.error.NotFoundException;
import eu.virtualparadox.companion.error.StreamInterruptedException;
import eu.virtualparadox.companion.error.UnsupportedFormatException;
import eu.virtualparadox.companion.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;

/**
 * Maps domain failures to HTTP status codes with an {@code {error, detail}} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({UnsupportedFormatException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class, MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> badRequest(final Exception e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(final NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({ConversationBusyException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> conflict(final RuntimeException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> tooLarge(final MaxUploadSizeExceededException e) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, e);
    }

    @ExceptionHandler({EmbeddingUnavailableException.class, NoProviderAvailableException.class,
            TaskRejectedException.class})
    public ResponseEntity<ErrorResponse> unavailable(final RuntimeException e) {
        log.warn("Service unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(StreamInterruptedException.class)
    public ResponseEntity<ErrorResponse> badGateway(final StreamInterruptedException e) {
        log.warn("Generation interrupted: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler({IndexCorruptionException.class, IOException.class})
    public ResponseEntity<ErrorResponse> internal(final Exception e) {
        log.error("Request failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    /**
     * Body used both for error responses and for the {@code error} event of a chat stream.
     */
    static ErrorResponse toErrorResponse(final Throwable error) {
        return new ErrorResponse(statusOf(error).getReasonPhrase(), error.getMessage());
    }

    static HttpStatus statusOf(final Throwable error) {
        if (error instanceof UnsupportedFormatException || error instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof ConversationBusyException || error instanceof IllegalStateException) {
            return HttpStatus.CONFLICT;
        }
        if (error instanceof EmbeddingUnavailableException || error instanceof NoProviderAvailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (error instanceof StreamInterruptedException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<ErrorResponse> respond(final HttpStatus status, final Exception e) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.getReasonPhrase(), e.getMessage()));
    }
}
