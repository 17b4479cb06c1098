package com.project.environmental.segmentation.exceptions;

import com.project.environmental.segmentation.DTOs.SegmentationResult;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Turns every failure into the segmentation failure body. */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<SegmentationResult> handleInvalidInput(InvalidInputException ex) {
        log.warn("Invalid input: {}", ex.getMessage());
        return failure(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ImageLoadException.class)
    public ResponseEntity<SegmentationResult> handleImageLoad(ImageLoadException ex) {
        log.warn("Image load error: {}", ex.getMessage());
        return failure(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    @ExceptionHandler({OutputWriteException.class, UnsupportedClassException.class})
    public ResponseEntity<SegmentationResult> handleServerSide(SegmentationException ex) {
        log.error("Segmentation error [{}]", ex.getCode(), ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<SegmentationResult> handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return failure(HttpStatus.PAYLOAD_TOO_LARGE, "File too large. Maximum size: 10MB");
    }

    @ExceptionHandler({ConstraintViolationException.class, MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class, HandlerMethodValidationException.class})
    public ResponseEntity<SegmentationResult> handleValidationErrors(Exception ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return failure(HttpStatus.BAD_REQUEST, "Invalid parameters: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<SegmentationResult> handleUnknownException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Spring MVC errors (unknown route, wrong method, ...) keep their own status
            log.warn("Request error: {}", ex.getMessage());
            return failure(errorResponse.getStatusCode(), ex.getMessage());
        }
        log.error("Unhandled error occurred", ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + ex.getMessage());
    }

    private static ResponseEntity<SegmentationResult> failure(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(SegmentationResult.failure(message));
    }
}
