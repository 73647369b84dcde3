package uk.gegc.antidote.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authorization.AuthorizationDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.antidote.features.dispute.domain.exception.DisputeAlreadyResolvedException;
import uk.gegc.antidote.features.dispute.domain.exception.DuplicateDisputeException;
import uk.gegc.antidote.features.ledger.domain.exception.DuplicateLedgerEntryException;
import uk.gegc.antidote.features.promo.domain.exception.PromoInvalidException;
import uk.gegc.antidote.shared.api.problem.ErrorTypes;
import uk.gegc.antidote.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.antidote.shared.exception.BillingErrorKind;
import uk.gegc.antidote.shared.exception.BillingException;

import java.net.URI;
import java.util.List;

/**
 * Maps billing failures to RFC 7807 problem responses. The status always comes from the
 * exception's {@link BillingErrorKind}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BillingException.class)
    public ResponseEntity<ProblemDetail> handleBillingException(BillingException ex, HttpServletRequest request) {
        BillingErrorKind kind = ex.getKind();
        if (kind.getStatus().is5xxServerError()) {
            logger.error("{}: {}", kind, ex.getMessage(), ex);
        } else {
            logger.warn("{}: {}", kind, ex.getMessage());
        }

        ProblemDetail problem = ProblemDetailBuilder.create(
                kind.getStatus(),
                typeOf(kind),
                titleOf(kind),
                ex.getMessage(),
                request
        );
        problem.setProperty("errorCode", kind.name());

        if (ex instanceof PromoInvalidException promo) {
            problem.setProperty("code", promo.getCode());
            problem.setProperty("reason", promo.getReason());
        } else if (ex instanceof DuplicateLedgerEntryException duplicate) {
            problem.setProperty("idempotencyKey", duplicate.getIdempotencyKey());
        } else if (ex instanceof DuplicateDisputeException duplicate) {
            problem.setProperty("disputeId", duplicate.getDisputeId());
        } else if (ex instanceof DisputeAlreadyResolvedException resolved) {
            problem.setProperty("disputeId", resolved.getDisputeId());
        }
        return ResponseEntity.status(kind.getStatus()).body(problem);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        logger.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.CONSTRAINT_VIOLATION,
                "Constraint Violation",
                "The request conflicts with data that already exists",
                request
        );
        problem.setProperty("errorCode", BillingErrorKind.CONSTRAINT_VIOLATION.name());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleOptimisticLock(OptimisticLockingFailureException ex, HttpServletRequest request) {
        logger.warn("Optimistic lock conflict: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.OPTIMISTIC_LOCK_CONFLICT,
                "Conflict",
                "The account was modified concurrently. Please retry.",
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "One or more validation constraints were violated",
                request
        );
        List<ViolationDetail> violations = ex.getConstraintViolations().stream()
                .map(this::toViolationDetail)
                .toList();
        problem.setProperty("violations", violations);
        return ResponseEntity.badRequest().body(problem);
    }

    private ViolationDetail toViolationDetail(ConstraintViolation<?> violation) {
        return new ViolationDetail(
                violation.getPropertyPath().toString(),
                violation.getMessage(),
                violation.getInvalidValue()
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String param = ex.getName();
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch",
                "Invalid value for parameter '" + param + "'. Expected type: " + requiredType + ".",
                request
        );
        problem.setProperty("parameter", param);
        problem.setProperty("expectedType", requiredType);
        problem.setProperty("providedValue", ex.getValue());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler({AccessDeniedException.class, AuthorizationDeniedException.class})
    public ResponseEntity<ProblemDetail> handleAccessDenied(Exception ex, HttpServletRequest request) {
        String detail = ex.getMessage() != null ? ex.getMessage() : "You do not have permission to access this resource";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.ACCESS_DENIED,
                "Access Denied",
                detail,
                request
        );
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        String msg = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                "Malformed JSON",
                "Request body is malformed or cannot be read",
                request
        );
        problem.setProperty("parseError", msg);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new FieldValidationError(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more fields",
                request
        );
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private static URI typeOf(BillingErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT -> ErrorTypes.INVALID_INPUT;
            case NOT_FOUND -> ErrorTypes.RESOURCE_NOT_FOUND;
            case CONSTRAINT_VIOLATION -> ErrorTypes.CONSTRAINT_VIOLATION;
            case SIGNATURE_MISMATCH -> ErrorTypes.SIGNATURE_MISMATCH;
            case INSUFFICIENT_PRIVILEGE -> ErrorTypes.ACCESS_DENIED;
            case DUPLICATE_DISPUTE -> ErrorTypes.DUPLICATE_DISPUTE;
            case DISPUTE_ALREADY_RESOLVED -> ErrorTypes.DISPUTE_ALREADY_RESOLVED;
            case PROMO_INVALID -> ErrorTypes.PROMO_INVALID;
            case GATEWAY_UNAVAILABLE -> ErrorTypes.GATEWAY_UNAVAILABLE;
        };
    }

    private static String titleOf(BillingErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT -> "Invalid Input";
            case NOT_FOUND -> "Resource Not Found";
            case CONSTRAINT_VIOLATION -> "Constraint Violation";
            case SIGNATURE_MISMATCH -> "Signature Mismatch";
            case INSUFFICIENT_PRIVILEGE -> "Access Denied";
            case DUPLICATE_DISPUTE -> "Duplicate Dispute";
            case DISPUTE_ALREADY_RESOLVED -> "Dispute Already Resolved";
            case PROMO_INVALID -> "Promo Code Invalid";
            case GATEWAY_UNAVAILABLE -> "Payment Gateway Unavailable";
        };
    }

    private record ViolationDetail(String field, String message, Object invalidValue) {
    }

    private record FieldValidationError(String field, String message, Object rejectedValue) {
    }
}
