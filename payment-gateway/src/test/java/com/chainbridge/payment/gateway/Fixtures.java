package com.chainbridge.payment.gateway;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads pacs.008 test messages from src/test/resources/fixtures.
 */
public final class Fixtures {

    public static final String SAMPLE = "pacs008-sample.xml";
    public static final String NO_NAMESPACE = "pacs008-no-namespace.xml";
    public static final String PREFIXED = "pacs008-prefixed.xml";
    public static final String UETR = "pacs008-uetr.xml";
    public static final String INSTRUCTED_AMOUNT = "pacs008-instructed-amount.xml";
    public static final String AMBIGUOUS_IDS = "pacs008-ambiguous-ids.xml";

    private Fixtures() {
    }

    public static String load(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String sample() {
        return load(SAMPLE);
    }
}
