package com.chainbridge.payment.canonical.enums;

/**
 * ISO 20022 message definitions known to the gateway.
 * Only PACS_008 is parsed and only PACS_002 is generated.
 */
public enum Iso20022MessageType {
    PACS_008("pacs.008.001.08"),
    PACS_002("pacs.002.001.10");

    private static final String NAMESPACE_PREFIX = "urn:iso:std:iso:20022:tech:xsd:";

    private final String messageNameId;

    Iso20022MessageType(String messageNameId) {
        this.messageNameId = messageNameId;
    }

    /**
     * Full message name identifier including variant and version, e.g. "pacs.008.001.08".
     */
    public String getMessageNameId() {
        return messageNameId;
    }

    /**
     * Message family without variant/version, e.g. "pacs.008".
     */
    public String getFamily() {
        return messageNameId.substring(0, 8);
    }

    public String getNamespace() {
        return NAMESPACE_PREFIX + messageNameId;
    }

    /**
     * True if the namespace URI belongs to any version of this message family.
     */
    public boolean matchesNamespace(String namespaceUri) {
        return namespaceUri != null && namespaceUri.startsWith(NAMESPACE_PREFIX + getFamily() + ".");
    }
}
