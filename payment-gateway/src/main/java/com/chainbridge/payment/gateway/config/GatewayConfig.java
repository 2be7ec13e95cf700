package com.chainbridge.payment.gateway.config;

import com.chainbridge.payment.canonical.CreditTransferCommand;
import com.chainbridge.payment.currency.CurrencyAllowList;
import com.chainbridge.payment.gateway.iso20022.Iso20022Adapter;
import com.chainbridge.payment.gateway.ledger.LedgerCommandPublisher;
import com.chainbridge.payment.kafka.CreditTransferCommandSerializer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Spring wiring for the ISO 20022 adapter and the optional ledger command publisher.
 *
 * Configuration Properties:
 * - iso20022.currency.extensions: extra currency codes accepted on top of the defaults
 * - iso20022.ledger.enabled: publish credit transfer commands to Kafka (default: false)
 * - iso20022.ledger.topic: ledger command topic
 * - kafka.bootstrap.servers: Kafka broker addresses
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Value("${iso20022.currency.extensions:}")
    private String[] currencyExtensions;

    @Value("${iso20022.ledger.topic:ledger.credit-transfer.commands}")
    private String ledgerTopic;

    @Value("${kafka.bootstrap.servers:localhost:9092}")
    private String bootstrapServers;

    @Bean
    public CurrencyAllowList currencyAllowList() {
        CurrencyAllowList allowList = CurrencyAllowList.withExtensions(Arrays.asList(currencyExtensions));
        log.info("Currency allow-list loaded with {} codes", allowList.getCodes().size());
        return allowList;
    }

    @Bean
    public Iso20022Adapter iso20022Adapter(CurrencyAllowList currencyAllowList) {
        return new Iso20022Adapter(currencyAllowList);
    }

    /**
     * Producer for ledger commands: all-replica acknowledgment with idempotence.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "iso20022.ledger.enabled", havingValue = "true")
    public LedgerCommandPublisher ledgerCommandPublisher() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, CreditTransferCommandSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 10);

        KafkaProducer<String, CreditTransferCommand> producer = new KafkaProducer<>(props);
        log.info("Ledger command publishing enabled - Topic: {}, Brokers: {}", ledgerTopic, bootstrapServers);
        return new LedgerCommandPublisher(producer, ledgerTopic);
    }
}
