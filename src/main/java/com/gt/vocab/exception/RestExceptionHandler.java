package com.gt.vocab.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        ProblemDetail problem = createProblem(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", ex.getMessage(), request);
        problem.setProperty("field", ex.getField());
        if (!ex.getDetails().isEmpty()) {
            problem.setProperty("details", ex.getDetails());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(createProblem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request));
    }

    @ExceptionHandler(DuplicateTermException.class)
    public ResponseEntity<ProblemDetail> handleDuplicateTerm(DuplicateTermException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(createProblem(HttpStatus.CONFLICT, "Duplicate Term", ex.getMessage(), request));
    }

    @ExceptionHandler(UnsupportedVersionException.class)
    public ResponseEntity<ProblemDetail> handleUnsupportedVersion(UnsupportedVersionException ex, HttpServletRequest request) {
        ProblemDetail problem = createProblem(HttpStatus.BAD_REQUEST, "Unsupported Schema Version", ex.getMessage(), request);
        problem.setProperty("schemaVersion", ex.getSchemaVersion());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
    }

    @ExceptionHandler({DaoException.class, MappingException.class})
    public ResponseEntity<ProblemDetail> handleStoreFailure(RuntimeException ex, HttpServletRequest request) {
        log.error("Request to {} failed", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createProblem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Error", ex.getMessage(), request));
    }

    private static ProblemDetail createProblem(HttpStatus status, String title, String detail, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setInstance(URI.create(request.getRequestURI()));
        return problem;
    }
}
