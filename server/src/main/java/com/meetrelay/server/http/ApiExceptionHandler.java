package com.meetrelay.server.http;

import com.meetrelay.server.media.RoomNotFoundException;
import com.meetrelay.server.media.RoomServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RoomServiceException.class)
    public ResponseEntity<Map<String, Object>> roomService(RoomServiceException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("detail", e.getMessage()));
    }

    @ExceptionHandler(RoomNotFoundException.class)
    public ResponseEntity<Map<String, Object>> roomNotFound(RoomNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("detail", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(MethodArgumentNotValidException e) {
        log.warn("[WARN] validation failed: {}", e.getBindingResult().getFieldErrors());
        return ResponseEntity.badRequest().body(Map.of("detail", "Invalid request: " + describe(e)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("detail", "Malformed request body"));
    }

    @ExceptionHandler(NoHandlerFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NoHandlerFoundException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Endpoint not found");
        body.put("message", "The requested endpoint does not exist");
        body.put("available_endpoints", StatusController.ENDPOINTS);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    private static String describe(MethodArgumentNotValidException e) {
        StringBuilder sb = new StringBuilder();
        e.getBindingResult().getFieldErrors().forEach(fe -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(fe.getField()).append(' ').append(fe.getDefaultMessage());
        });
        return sb.toString();
    }
}
