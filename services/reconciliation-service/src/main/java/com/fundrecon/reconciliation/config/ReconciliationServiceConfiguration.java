package com.fundrecon.reconciliation.config;

import com.fundrecon.reconciliation.fraud.FraudScorer;
import com.fundrecon.reconciliation.matching.ObligationMatcher;
import com.fundrecon.reconciliation.service.FraudScreeningService;
import com.fundrecon.reconciliation.service.ReconciliationMetrics;
import com.fundrecon.reconciliation.service.StatementReconciliationService;
import com.fundrecon.reconciliation.service.WireReconciliationService;
import com.fundrecon.reconciliation.statement.ReferenceExtractor;
import com.fundrecon.reconciliation.statement.StatementLineExtractor;
import com.fundrecon.reconciliation.statement.document.OcrEngine;
import com.fundrecon.reconciliation.statement.document.StatementDocumentReader;
import com.fundrecon.reconciliation.statement.document.TesseractOcrEngine;
import com.fundrecon.reconciliation.store.CounterpartyHistoryProvider;
import com.fundrecon.reconciliation.store.InMemoryCounterpartyHistoryProvider;
import com.fundrecon.reconciliation.store.InMemoryObligationStore;
import com.fundrecon.reconciliation.store.ObligationStore;
import com.fundrecon.reconciliation.wire.WireMessageParser;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the reconciliation pipeline. The in-memory store and history provider
 * back off when a deployment supplies its own implementations.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
public class ReconciliationServiceConfiguration {

    @Bean
    public WireMessageParser wireMessageParser() {
        return new WireMessageParser();
    }

    @Bean
    public StatementLineExtractor statementLineExtractor() {
        return new StatementLineExtractor(new ReferenceExtractor());
    }

    @Bean
    public ObligationMatcher obligationMatcher(ReconciliationProperties properties) {
        return new ObligationMatcher(properties.toMatchingPolicy());
    }

    @Bean
    public FraudScorer fraudScorer(ReconciliationProperties properties) {
        return new FraudScorer(properties.toFraudRules());
    }

    @Bean
    @ConditionalOnProperty(prefix = "fundrecon.reconciliation.statement.ocr", name = "enabled", havingValue = "true")
    public OcrEngine tesseractOcrEngine(ReconciliationProperties properties) {
        ReconciliationProperties.Ocr ocr = properties.getStatement().getOcr();
        log.info("OCR fallback enabled: language={}, dpi={}", ocr.getLanguage(), ocr.getDpi());
        return new TesseractOcrEngine(ocr.getDatapath(), ocr.getLanguage(), ocr.getDpi());
    }

    @Bean
    public StatementDocumentReader statementDocumentReader(ObjectProvider<OcrEngine> ocrEngine,
                                                           ReconciliationProperties properties) {
        return new StatementDocumentReader(ocrEngine.getIfAvailable(), properties.getStatement().getMinimumTextLength());
    }

    @Bean
    @ConditionalOnMissingBean(ObligationStore.class)
    public InMemoryObligationStore inMemoryObligationStore(ReconciliationProperties properties) {
        log.warn("No ObligationStore configured, using in-memory store");
        return new InMemoryObligationStore(properties.getCandidates().getMaxCandidates());
    }

    @Bean
    @ConditionalOnMissingBean(CounterpartyHistoryProvider.class)
    public InMemoryCounterpartyHistoryProvider inMemoryCounterpartyHistoryProvider() {
        return new InMemoryCounterpartyHistoryProvider(Clock.systemDefaultZone());
    }

    @Bean
    public ReconciliationMetrics reconciliationMetrics(MeterRegistry meterRegistry) {
        return new ReconciliationMetrics(meterRegistry);
    }

    @Bean
    public FraudScreeningService fraudScreeningService(FraudScorer fraudScorer,
                                                       CounterpartyHistoryProvider historyProvider,
                                                       ReconciliationProperties properties) {
        return new FraudScreeningService(fraudScorer, historyProvider,
            properties.getCandidates().getHistoryWindowDays());
    }

    @Bean
    public StatementReconciliationService statementReconciliationService(StatementLineExtractor lineExtractor,
                                                                         ObligationMatcher matcher,
                                                                         ObligationStore obligationStore,
                                                                         FraudScreeningService fraudScreening,
                                                                         StatementDocumentReader documentReader,
                                                                         ReconciliationMetrics metrics,
                                                                         ReconciliationProperties properties) {
        return new StatementReconciliationService(lineExtractor, matcher, obligationStore, fraudScreening,
            documentReader, metrics, properties);
    }

    @Bean
    public WireReconciliationService wireReconciliationService(WireMessageParser parser,
                                                               ObligationMatcher matcher,
                                                               ObligationStore obligationStore,
                                                               FraudScreeningService fraudScreening,
                                                               ReconciliationMetrics metrics,
                                                               ReconciliationProperties properties) {
        return new WireReconciliationService(parser, matcher, obligationStore, fraudScreening, metrics, properties);
    }
}
