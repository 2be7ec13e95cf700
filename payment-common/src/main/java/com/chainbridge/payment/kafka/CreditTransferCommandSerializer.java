package com.chainbridge.payment.kafka;

import com.chainbridge.payment.canonical.CreditTransferCommand;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

/**
 * Writes ledger credit transfer commands as UTF-8 JSON using the snake_case property
 * names declared on {@link CreditTransferCommand}. A null command becomes a null payload
 * (tombstone).
 */
public class CreditTransferCommandSerializer implements Serializer<CreditTransferCommand> {

    private static final ObjectWriter WRITER = new ObjectMapper().writerFor(CreditTransferCommand.class);

    @Override
    public byte[] serialize(String topic, CreditTransferCommand command) {
        if (command == null) {
            return null;
        }
        try {
            return WRITER.writeValueAsBytes(command);
        } catch (JsonProcessingException e) {
            throw new SerializationException(
                "Cannot write credit transfer command " + command.getTransactionId() + " for topic " + topic, e);
        }
    }
}
