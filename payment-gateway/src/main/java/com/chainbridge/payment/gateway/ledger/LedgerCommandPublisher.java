package com.chainbridge.payment.gateway.ledger;

import com.chainbridge.payment.canonical.CreditTransferCommand;
import com.chainbridge.payment.canonical.PaymentInstruction;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;

/**
 * Publishes credit transfer commands to the ledger topic, keyed by end-to-end id.
 *
 * Sends are synchronous: the call returns once the broker has acknowledged the record.
 */
public class LedgerCommandPublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LedgerCommandPublisher.class);

    private final Producer<String, CreditTransferCommand> producer;
    private final String topic;

    public LedgerCommandPublisher(Producer<String, CreditTransferCommand> producer, String topic) {
        this.producer = producer;
        this.topic = topic;
    }

    /**
     * Translate the instruction and publish the resulting command.
     */
    public RecordMetadata publish(PaymentInstruction instruction) {
        return publish(instruction.getEndToEndId(), instruction.toCreditTransferCommand());
    }

    public RecordMetadata publish(String key, CreditTransferCommand command) {
        ProducerRecord<String, CreditTransferCommand> record = new ProducerRecord<>(topic, key, command);
        String source = command.getSource() != null ? command.getSource() : "";
        record.headers().add("source", source.getBytes(StandardCharsets.UTF_8));
        try {
            RecordMetadata metadata = producer.send(record).get();
            log.info("Published credit transfer command - Key: {}, Topic: {}, Partition: {}, Offset: {}",
                key, metadata.topic(), metadata.partition(), metadata.offset());
            return metadata;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerPublishException("Interrupted while publishing credit transfer command " + key, e);
        } catch (ExecutionException e) {
            log.error("Failed to publish credit transfer command - Key: {}, Topic: {}", key, topic, e.getCause());
            throw new LedgerPublishException("Failed to publish credit transfer command " + key, e.getCause());
        } catch (KafkaException e) {
            log.error("Failed to send credit transfer command - Key: {}, Topic: {}", key, topic, e);
            throw new LedgerPublishException("Failed to send credit transfer command " + key, e);
        }
    }

    @Override
    public void close() {
        log.info("Closing ledger command producer for topic {}", topic);
        producer.close();
    }
}
