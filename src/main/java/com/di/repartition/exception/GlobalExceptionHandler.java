package com.di.repartition.exception;

import com.di.repartition.config.MdcRequestFilter;
import com.di.repartition.environment.EnvironmentConfigException;
import com.di.repartition.plan.PlanDocumentException;
import com.di.repartition.plan.ProvenanceException;
import com.di.repartition.session.CatalogAccessException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.UncheckedIOException;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Maps exceptions escaping the controllers to an {@link ErrorResponse} labelled with its
 * {@link ErrorCategory}.
 * <ul>
 *   <li>connectivity loss or no configured database: 503</li>
 *   <li>unreadable documents, bad parameters, provenance gate: 400</li>
 *   <li>catalog query failures that abort an operation: 502</li>
 *   <li>environment profile file problems: 500</li>
 *   <li>plan or report files that cannot be written: 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CatalogAccessException.class)
    public ResponseEntity<ErrorResponse> handleCatalogAccess(CatalogAccessException e, HttpServletRequest request) {
        return respond("CATALOG_ACCESS", e, HttpStatus.SERVICE_UNAVAILABLE, request);
    }

    @ExceptionHandler({PlanDocumentException.class, ProvenanceException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        return respond("BAD_REQUEST", e, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e, HttpServletRequest request) {
        ResponseEntity<ErrorResponse> response = respond("DATA_ACCESS", e, HttpStatus.BAD_GATEWAY, request);
        if (e.getMostSpecificCause() instanceof SQLException sqlEx && response.getBody() != null) {
            response.getBody().addDetail("sql_state", sqlEx.getSQLState());
            response.getBody().addDetail("error_code", sqlEx.getErrorCode());
        }
        return response;
    }

    @ExceptionHandler(EnvironmentConfigException.class)
    public ResponseEntity<ErrorResponse> handleEnvironmentConfig(EnvironmentConfigException e, HttpServletRequest request) {
        return respond("ENVIRONMENT_CONFIG", e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ErrorResponse> handleIo(UncheckedIOException e, HttpServletRequest request) {
        return respond("FILE_IO", e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e, HttpServletRequest request) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Exception e, HttpStatus status, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        if (status.is5xxServerError()) {
            log.error("[API] {} {} [{}]: {}", eventType, e.getClass().getSimpleName(), category.getName(), e.getMessage(), e);
        } else {
            log.warn("[API] {} {} [{}]: {}", eventType, e.getClass().getSimpleName(), category.getName(), e.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status, request));
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status,
                                             HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(request != null ? request.getRequestURI() : "/unknown");
        response.addDetail("exception_type", exception.getClass().getName());
        String requestId = MDC.get(MdcRequestFilter.REQUEST_ID);
        if (requestId != null) {
            response.addDetail("request_id", requestId);
        }

        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            response.addDetail("root_cause_type", rootCause.getClass().getName());
            response.addDetail("root_cause_message", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
