package com.fundrecon.reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Capital call payment reconciliation service.
 *
 * Matches incoming wires and bank statement credits against the capital call
 * obligations awaiting payment and flags anomalous payments for review.
 */
@SpringBootApplication(scanBasePackages = "com.fundrecon")
public class ReconciliationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconciliationServiceApplication.class, args);
    }
}
