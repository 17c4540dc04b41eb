package com.fundrecon.reconciliation.api;

import com.fundrecon.common.exception.BusinessException;
import com.fundrecon.common.exception.ErrorCode;
import com.fundrecon.reconciliation.exception.StatementDocumentException;
import com.fundrecon.reconciliation.service.ReconciliationReport;
import com.fundrecon.reconciliation.service.StatementReconciliationRequest;
import com.fundrecon.reconciliation.service.StatementReconciliationService;
import com.fundrecon.reconciliation.service.TransactionOutcome;
import com.fundrecon.reconciliation.service.WireReconciliationService;
import com.fundrecon.reconciliation.statement.StatementLineExtractor;
import com.fundrecon.reconciliation.statement.StatementTransaction;
import com.fundrecon.reconciliation.wire.WireMessage;
import com.fundrecon.reconciliation.wire.WireMessageParser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * REST API for wire and statement reconciliation
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController {

    private final WireMessageParser wireMessageParser;
    private final StatementLineExtractor statementLineExtractor;
    private final WireReconciliationService wireReconciliationService;
    private final StatementReconciliationService statementReconciliationService;

    @PostMapping(value = "/wires/parse", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<WireMessage> parseWire(@RequestBody String rawMessage) {
        log.debug("REST: Parse wire message ({} characters)", rawMessage.length());
        return ResponseEntity.ok(wireMessageParser.parse(rawMessage));
    }

    @PostMapping(value = "/wires", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<TransactionOutcome> reconcileWire(@RequestBody String rawMessage) {
        log.info("REST: Reconcile wire message");
        return ResponseEntity.ok(wireReconciliationService.reconcileWire(rawMessage));
    }

    @PostMapping(value = "/wires/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<TransactionOutcome>> reconcileWires(@RequestBody List<String> rawMessages) {
        log.info("REST: Reconcile batch of {} wire messages", rawMessages.size());
        return ResponseEntity.ok(wireReconciliationService.reconcileWires(rawMessages));
    }

    @PostMapping(value = "/statements/extract", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<List<StatementTransaction>> extractStatement(@RequestBody String statementText) {
        return ResponseEntity.ok(statementLineExtractor.extract(statementText));
    }

    @PostMapping(value = "/statements", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReconciliationReport> reconcileStatement(
        @Valid @RequestBody StatementReconciliationRequest request) {

        if (request.getStatementText() == null || request.getStatementText().isBlank()) {
            throw new BusinessException(ErrorCode.VAL_REQUIRED_FIELD, "statementText is required")
                .withMetadata("field", "statementText");
        }
        log.info("REST: Reconcile statement {}", request.getStatementId());
        return ResponseEntity.ok(statementReconciliationService.reconcile(request));
    }

    @PostMapping(value = "/statements/document", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ReconciliationReport> reconcileStatementDocument(
        @RequestPart("file") MultipartFile file,
        @RequestParam("statementId") String statementId,
        @RequestParam(value = "currency", required = false) String currency,
        @RequestParam(value = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
        @RequestParam(value = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("REST: Reconcile statement document {} ({} bytes)", statementId, file.getSize());
        StatementReconciliationRequest request = StatementReconciliationRequest.builder()
            .statementId(statementId)
            .currency(currency)
            .startDate(startDate)
            .endDate(endDate)
            .build();
        return ResponseEntity.ok(statementReconciliationService.reconcileDocument(readBytes(file), request));
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new StatementDocumentException("Failed to read uploaded statement " + file.getOriginalFilename(), e);
        }
    }
}
