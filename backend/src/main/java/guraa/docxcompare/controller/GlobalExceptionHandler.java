package guraa.docxcompare.controller;

import guraa.docxcompare.exception.MalformedDocumentException;
import guraa.docxcompare.exception.UnsupportedComparisonException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handle documents that cannot be read as WordprocessingML
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(MalformedDocumentException.class)
    public ResponseEntity<Map<String, String>> handleMalformedDocument(MalformedDocumentException e) {
        log.warn("Malformed document: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    /**
     * Handle option combinations no engine can serve
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(UnsupportedComparisonException.class)
    public ResponseEntity<Map<String, String>> handleUnsupportedComparison(UnsupportedComparisonException e) {
        log.warn("Unsupported comparison: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        log.warn("Bad comparison request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Handle file upload size exceeded exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleMaxSizeException(MaxUploadSizeExceededException e) {
        log.error("File size exceeded the maximum limit", e);
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "File size exceeds the maximum limit");
    }

    /**
     * Handle IO exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException e) {
        log.error("IO Exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error processing file: " + e.getMessage());
    }

    /**
     * Handle all other exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("error", message);
        return ResponseEntity.status(status).body(response);
    }
}
