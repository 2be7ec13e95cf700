package com.chainbridge.payment.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ISO 20022 Gateway Application.
 *
 * Exposes the pacs.008 parser and pacs.002 generator over HTTP and, when enabled,
 * forwards validated instructions to the ledger as credit transfer commands.
 */
@SpringBootApplication
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
