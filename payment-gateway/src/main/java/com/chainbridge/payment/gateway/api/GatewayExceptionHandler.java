package com.chainbridge.payment.gateway.api;

import com.chainbridge.payment.error.CurrencyValidationException;
import com.chainbridge.payment.error.MalformedXmlException;
import com.chainbridge.payment.error.SchemaValidationException;
import com.chainbridge.payment.gateway.ledger.LedgerPublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps adapter failures to JSON error responses.
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler(MalformedXmlException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedXml(MalformedXmlException e) {
        log.warn("Rejected malformed XML: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(SchemaValidationException.class)
    public ResponseEntity<Map<String, Object>> handleSchemaValidation(SchemaValidationException e) {
        log.warn("Rejected message failing schema validation at {}: {}", e.getElement(), e.getMessage());
        Map<String, Object> body = errorBody(e.getErrorCode(), e.getMessage());
        body.put("element", e.getElement());
        return ResponseEntity.unprocessableEntity().body(body);
    }

    @ExceptionHandler(CurrencyValidationException.class)
    public ResponseEntity<Map<String, Object>> handleCurrencyValidation(CurrencyValidationException e) {
        log.warn("Rejected message with currency outside allow-list: {}", e.getCurrency());
        Map<String, Object> body = errorBody(e.getErrorCode(), e.getMessage());
        body.put("currency", e.getCurrency());
        return ResponseEntity.unprocessableEntity().body(body);
    }

    @ExceptionHandler(LedgerPublishException.class)
    public ResponseEntity<Map<String, Object>> handleLedgerPublish(LedgerPublishException e) {
        log.error("Ledger publishing failed", e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(errorBody("LEDGER_PUBLISH_ERROR", e.getMessage()));
    }

    static Map<String, Object> errorBody(String errorCode, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", "ERROR");
        error.put("errorCode", errorCode);
        error.put("message", message);
        error.put("timestamp", System.currentTimeMillis());
        return error;
    }
}
