package com.chainbridge.payment.gateway.api;

import com.chainbridge.payment.canonical.CreditTransferCommand;
import com.chainbridge.payment.canonical.PaymentInstruction;
import com.chainbridge.payment.error.CurrencyValidationException;
import com.chainbridge.payment.error.MalformedXmlException;
import com.chainbridge.payment.error.SchemaValidationException;
import com.chainbridge.payment.gateway.iso20022.AdapterStatistics;
import com.chainbridge.payment.gateway.iso20022.Iso20022Adapter;
import com.chainbridge.payment.gateway.ledger.LedgerCommandPublisher;
import com.chainbridge.payment.gateway.validation.ValidationResult;
import jakarta.validation.Valid;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for the ISO 20022 adapter.
 *
 * - POST /pacs008: parse and validate a pacs.008 message
 * - POST /pacs002: generate a pacs.002 status report from a decision
 * - POST /pacs008/ledger-command: parse, validate and forward to the ledger topic
 * - GET/DELETE /stats: adapter counters
 *
 * Parse failures are mapped to error responses by {@link GatewayExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/iso20022")
public class Iso20022GatewayController {

    private static final Logger log = LoggerFactory.getLogger(Iso20022GatewayController.class);

    private final Iso20022Adapter adapter;
    private final ObjectProvider<LedgerCommandPublisher> ledgerCommandPublisher;

    public Iso20022GatewayController(Iso20022Adapter adapter,
                                     ObjectProvider<LedgerCommandPublisher> ledgerCommandPublisher) {
        this.adapter = adapter;
        this.ledgerCommandPublisher = ledgerCommandPublisher;
    }

    /**
     * Parse a pacs.008 message and report its validity.
     */
    @PostMapping(value = "/pacs008",
        consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE},
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> parseCreditTransfer(@RequestBody String pacs008Xml)
            throws MalformedXmlException, SchemaValidationException, CurrencyValidationException {
        log.info("Received pacs.008 parse request, message length: {}", pacs008Xml.length());

        PaymentInstruction instruction = adapter.parseCreditTransfer(pacs008Xml);
        ValidationResult validation = adapter.validateInstruction(instruction);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("instruction", instruction);
        response.put("valid", validation.isValid());
        response.put("errors", validation.getErrors());
        return ResponseEntity.ok(response);
    }

    /**
     * Generate a pacs.002 status report.
     */
    @PostMapping(value = "/pacs002",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> generateStatusReport(@Valid @RequestBody StatusReportRequest request) {
        log.info("Received pacs.002 request - OrgnlEndToEndId: {}, Status: {}",
            request.getOriginalEndToEndId(), request.getStatus());
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_XML)
            .body(adapter.generateStatusReport(request.toStatusReport()));
    }

    /**
     * Parse a pacs.008 message and publish the resulting credit transfer command to the ledger.
     */
    @PostMapping(value = "/pacs008/ledger-command",
        consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE},
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> forwardToLedger(@RequestBody String pacs008Xml)
            throws MalformedXmlException, SchemaValidationException, CurrencyValidationException {
        LedgerCommandPublisher publisher = ledgerCommandPublisher.getIfAvailable();
        if (publisher == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(GatewayExceptionHandler.errorBody("LEDGER_DISABLED", "Ledger command publishing is disabled"));
        }

        PaymentInstruction instruction = adapter.parseCreditTransfer(pacs008Xml);
        ValidationResult validation = adapter.validateInstruction(instruction);
        if (!validation.isValid()) {
            log.warn("Instruction not forwarded - EndToEndId: {}, Errors: {}",
                instruction.getEndToEndId(), validation.getErrors());
            Map<String, Object> body = GatewayExceptionHandler.errorBody("INVALID_INSTRUCTION",
                "Instruction failed validation");
            body.put("errors", validation.getErrors());
            return ResponseEntity.unprocessableEntity().body(body);
        }

        CreditTransferCommand command = instruction.toCreditTransferCommand();
        RecordMetadata metadata = publisher.publish(instruction.getEndToEndId(), command);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ACCEPTED");
        response.put("command", command);
        response.put("topic", metadata.topic());
        response.put("partition", metadata.partition());
        response.put("offset", metadata.offset());
        return ResponseEntity.accepted().body(response);
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public AdapterStatistics.Snapshot statistics() {
        return adapter.getStatistics();
    }

    @DeleteMapping("/stats")
    public ResponseEntity<Void> resetStatistics() {
        adapter.resetStatistics();
        return ResponseEntity.noContent().build();
    }
}
