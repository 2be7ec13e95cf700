package com.chainbridge.payment.gateway.iso20022;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extraction table for pacs.008 customer credit transfers.
 *
 * Each field names the block it is looked up in and the candidate paths tried in order;
 * the first candidate that resolves wins. Lookups never leave the block element, so a
 * local-name fallback cannot pick up an element of the same name from a sibling block.
 */
public enum Pacs008Field {

    GROUP_HEADER(Block.DOCUMENT, ".//GrpHdr"),
    TRANSACTION(Block.DOCUMENT, ".//CdtTrfTxInf"),

    MESSAGE_ID(Block.GROUP_HEADER, "MsgId"),
    CREATION_DATE_TIME(Block.GROUP_HEADER, "CreDtTm"),

    PAYMENT_ID(Block.TRANSACTION, "PmtId"),
    INSTRUCTION_ID(Block.PAYMENT_ID, "InstrId"),
    END_TO_END_ID(Block.PAYMENT_ID, "EndToEndId"),
    /**
     * UETR is more authoritative than TxId when both are present.
     */
    TRANSACTION_ID(Block.PAYMENT_ID, "UETR", "TxId"),

    SETTLEMENT_AMOUNT(Block.TRANSACTION, ".//IntrBkSttlmAmt", ".//InstdAmt"),
    SETTLEMENT_DATE(Block.TRANSACTION, ".//IntrBkSttlmDt"),
    REMITTANCE_INFO(Block.TRANSACTION, ".//RmtInf/Ustrd"),

    DEBTOR(Block.TRANSACTION, "Dbtr"),
    DEBTOR_ACCOUNT(Block.TRANSACTION, "DbtrAcct"),
    DEBTOR_AGENT(Block.TRANSACTION, "DbtrAgt"),
    CREDITOR(Block.TRANSACTION, "Cdtr"),
    CREDITOR_ACCOUNT(Block.TRANSACTION, "CdtrAcct"),
    CREDITOR_AGENT(Block.TRANSACTION, "CdtrAgt"),

    PARTY_NAME(Block.PARTY, "Nm"),
    POSTAL_ADDRESS(Block.PARTY, "PstlAdr"),
    STREET_NAME(Block.POSTAL_ADDRESS, "StrtNm"),
    BUILDING_NUMBER(Block.POSTAL_ADDRESS, "BldgNb"),
    TOWN_NAME(Block.POSTAL_ADDRESS, "TwnNm"),
    COUNTRY(Block.POSTAL_ADDRESS, "Ctry"),

    ACCOUNT_ID(Block.ACCOUNT, ".//IBAN", ".//Othr/Id"),

    AGENT_BIC(Block.AGENT, "FinInstnId/BICFI", "FinInstnId/BIC", "FinInstnId/ClrSysMmbId/MmbId"),
    AGENT_NAME(Block.AGENT, "FinInstnId/Nm"),
    AGENT_POSTAL_ADDRESS(Block.AGENT, "FinInstnId/PstlAdr");

    /**
     * Element a field is resolved against, identified by its local name. The document block
     * is the root element, whatever its name.
     */
    public enum Block {
        DOCUMENT,
        GROUP_HEADER("GrpHdr"),
        TRANSACTION("CdtTrfTxInf"),
        PAYMENT_ID("PmtId"),
        PARTY("Dbtr", "Cdtr"),
        POSTAL_ADDRESS("PstlAdr"),
        ACCOUNT("DbtrAcct", "CdtrAcct"),
        AGENT("DbtrAgt", "CdtrAgt");

        private final Set<String> elementNames;

        Block(String... elementNames) {
            this.elementNames = Set.of(elementNames);
        }

        public boolean accepts(Element element) {
            if (this == DOCUMENT) {
                return element.getParentNode() != null
                    && element.getParentNode().getNodeType() == Node.DOCUMENT_NODE;
            }
            return elementNames.contains(LookupStrategy.localName(element));
        }
    }

    private final Block block;
    private final List<ElementPath> candidates;

    Pacs008Field(Block block, String... candidates) {
        this.block = block;
        this.candidates = Stream.of(candidates).map(ElementPath::parse).collect(Collectors.toUnmodifiableList());
    }

    public Block getBlock() {
        return block;
    }

    public List<ElementPath> getCandidates() {
        return candidates;
    }

    /**
     * Local name of the primary candidate, used in error messages.
     */
    public String getElementName() {
        return candidates.get(0).getTargetName();
    }
}
