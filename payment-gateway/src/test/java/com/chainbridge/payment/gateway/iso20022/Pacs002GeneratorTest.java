package com.chainbridge.payment.gateway.iso20022;

import com.chainbridge.payment.canonical.StatusReport;
import com.chainbridge.payment.canonical.enums.StatusReasonCode;
import com.chainbridge.payment.canonical.enums.TransactionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class Pacs002GeneratorTest {

    private static final String REPORT_ID = "1b4e28ba-2fa1-11d2-883f-0016d3cca427";
    private static final Instant CREATED_AT = Instant.parse("2026-01-11T14:30:05.123Z");

    private Pacs002Generator generator;

    @BeforeEach
    public void setUp() {
        generator = new Pacs002Generator();
    }

    private StatusReport.StatusReportBuilder report(TransactionStatus status) {
        return StatusReport.builder()
            .originalMessageId("MSGID-2026-01-11-001")
            .originalInstructionId("INSTR-20260111-ABC123")
            .originalEndToEndId("E2E-REF-INVOICE-9876")
            .status(status)
            .reportId(REPORT_ID)
            .createdAt(CREATED_AT);
    }

    @Test
    public void testAcceptanceHasNoReasonBlock() {
        String xml = generator.generate(report(TransactionStatus.ACCP).build());

        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"));
        assertTrue(xml.contains("xmlns=\"urn:iso:std:iso:20022:tech:xsd:pacs.002.001.10\""));
        assertTrue(xml.contains("<MsgId>PACS002-1b4e28ba</MsgId>"));
        assertTrue(xml.contains("<CreDtTm>2026-01-11T14:30:05.123Z</CreDtTm>"));
        assertTrue(xml.contains("<OrgnlMsgId>MSGID-2026-01-11-001</OrgnlMsgId>"));
        assertTrue(xml.contains("<OrgnlMsgNmId>pacs.008.001.08</OrgnlMsgNmId>"));
        assertTrue(xml.contains("<OrgnlInstrId>INSTR-20260111-ABC123</OrgnlInstrId>"));
        assertTrue(xml.contains("<OrgnlEndToEndId>E2E-REF-INVOICE-9876</OrgnlEndToEndId>"));
        assertTrue(xml.contains("<TxSts>ACCP</TxSts>"));
        assertFalse(xml.contains("StsRsnInf"), "No reason block without a reason code");
    }

    @Test
    public void testRejectionCarriesReasonAndAdditionalInfo() {
        String xml = generator.generate(report(TransactionStatus.RJCT)
            .reasonCode(StatusReasonCode.AM04)
            .additionalInfo("Insufficient funds")
            .build());

        assertTrue(xml.contains("<TxSts>RJCT</TxSts>"));
        assertTrue(xml.contains("<StsRsnInf>"));
        assertTrue(xml.contains("<Cd>AM04</Cd>"));
        assertTrue(xml.contains("<AddtlInf>Insufficient funds</AddtlInf>"));
    }

    @Test
    public void testEmptyAdditionalInfoOmitted() {
        String xml = generator.generate(report(TransactionStatus.RJCT)
            .reasonCode(StatusReasonCode.AC01)
            .additionalInfo("")
            .build());

        assertTrue(xml.contains("<Cd>AC01</Cd>"));
        assertFalse(xml.contains("AddtlInf"));
    }

    @Test
    public void testAdditionalInfoWithoutReasonIgnored() {
        String xml = generator.generate(report(TransactionStatus.ACSC).additionalInfo("Settled").build());

        assertFalse(xml.contains("StsRsnInf"));
        assertFalse(xml.contains("Settled"));
    }

    @Test
    public void testSpecialCharactersEscaped() throws Exception {
        String xml = generator.generate(report(TransactionStatus.RJCT)
            .originalEndToEndId("E2E<&>\"'")
            .reasonCode(StatusReasonCode.FF01)
            .additionalInfo("Bad <tag> & \"quote\"")
            .build());

        assertTrue(xml.contains("<OrgnlEndToEndId>E2E&lt;&amp;&gt;&quot;&apos;</OrgnlEndToEndId>"));
        assertTrue(xml.contains("<AddtlInf>Bad &lt;tag&gt; &amp; &quot;quote&quot;</AddtlInf>"));

        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder()
            .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        assertEquals("E2E<&>\"'", document.getElementsByTagName("OrgnlEndToEndId").item(0).getTextContent());
    }

    @Test
    public void testOutputIsWellFormedXml() throws Exception {
        String xml = generator.generate(report(TransactionStatus.RJCT).reasonCode(StatusReasonCode.AM04).build());

        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        Document document = factory.newDocumentBuilder()
            .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));

        assertEquals("Document", document.getDocumentElement().getLocalName());
        assertEquals("FIToFIPmtStsRpt", document.getDocumentElement()
            .getElementsByTagNameNS("*", "FIToFIPmtStsRpt").item(0).getLocalName());
    }

    @Test
    public void testSameReportGeneratesSameXml() {
        StatusReport statusReport = report(TransactionStatus.RJCT).reasonCode(StatusReasonCode.AC04).build();

        assertEquals(generator.generate(statusReport), generator.generate(statusReport));
    }

    @Test
    public void testMessageIdFromShortReportId() {
        StatusReport statusReport = report(TransactionStatus.ACCP).reportId("abc").build();

        assertEquals("PACS002-abc", Pacs002Generator.generateMessageId(statusReport));
    }

    @Test
    public void testEscapeXmlNull() {
        assertEquals("", Pacs002Generator.escapeXml(null));
    }
}
