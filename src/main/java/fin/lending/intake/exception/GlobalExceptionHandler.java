package fin.lending.intake.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import fin.lending.intake.config.LoanIntakeProperties;
import fin.lending.intake.dto.ApiResponse;
import fin.lending.intake.validation.FieldViolation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler.
 * Maps each {@link ErrorKind} to one HTTP status.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String GENERIC_ERROR_MESSAGE = "Internal server error, please try again later";

    @Autowired
    private LoanIntakeProperties properties;

    /**
     * Handle request validation failures raised by use cases and entities
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getViolations());
        return validationResponse(e.getMessage(), e.getViolations());
    }

    /**
     * Handle Spring binding failures (query parameters, @Valid bodies)
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleBindException(BindException e) {
        List<FieldViolation> violations = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::toViolation)
                .sorted(Comparator.comparing(FieldViolation::getField))
                .collect(Collectors.toList());

        log.warn("Request binding failed: {}", violations);
        return validationResponse(ValidationException.DEFAULT_MESSAGE, violations);
    }

    /**
     * Handle malformed path variables such as non-UUID identifiers
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        String message = UUID.class.equals(e.getRequiredType())
                ? "Invalid UUID format"
                : "Invalid value: " + e.getValue();
        log.warn("Invalid request parameter: name={}, value={}", e.getName(), e.getValue());
        return validationResponse(ValidationException.DEFAULT_MESSAGE,
                List.of(new FieldViolation(e.getName(), message)));
    }

    /**
     * Handle unreadable JSON bodies and values of the wrong type
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleUnreadableBody(HttpMessageNotReadableException e) {
        String field = "";
        String message = "Malformed request body";
        if (e.getCause() instanceof JsonMappingException) {
            JsonMappingException mapping = (JsonMappingException) e.getCause();
            field = mapping.getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                    .collect(Collectors.joining("."));
            if (!field.isEmpty()) {
                message = "Invalid value for field " + field;
            }
        }
        log.warn("Unreadable request body: {}", e.getMessage());
        return validationResponse(ValidationException.DEFAULT_MESSAGE, List.of(new FieldViolation(field, message)));
    }

    @ExceptionHandler(MoneyAmountException.class)
    public ResponseEntity<ApiResponse<Void>> handleMoneyAmount(MoneyAmountException e) {
        log.warn("Invalid money amount: reason={}, message={}", e.getReason(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException e) {
        log.warn("{} not found: key={}", e.getResource(), e.getKey());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ConflictException e) {
        log.warn("Conflict: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(409, e.getMessage()));
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnauthorized(UnauthorizedException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ApiResponse.error(401, e.getMessage()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ApiResponse.error(405, e.getMessage()));
    }

    /**
     * Handle static resource not found (e.g., favicon.ico)
     * Do not log as error since this is expected behavior
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, "Resource not found"));
    }

    /**
     * Handle all uncaught exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        log.error("Internal server error: {}", e.getMessage(), e);
        String message = properties.getErrors().isExposeDetails() && e.getMessage() != null
                ? e.getMessage()
                : GENERIC_ERROR_MESSAGE;
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(500, message));
    }

    private static ResponseEntity<ApiResponse<List<FieldViolation>>> validationResponse(
            String message, List<FieldViolation> violations) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, message, violations));
    }

    private static FieldViolation toViolation(FieldError error) {
        String message = error.isBindingFailure()
                ? "Invalid value: " + error.getRejectedValue()
                : error.getDefaultMessage();
        return new FieldViolation(error.getField(), message);
    }
}
