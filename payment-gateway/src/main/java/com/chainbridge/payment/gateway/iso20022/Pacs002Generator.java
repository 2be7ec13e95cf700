package com.chainbridge.payment.gateway.iso20022;

import com.chainbridge.payment.canonical.StatusReport;
import com.chainbridge.payment.canonical.enums.Iso20022MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Generator for pacs.002 (FI to FI payment status report) messages.
 *
 * Output depends only on the report: identical reports produce identical XML. The
 * StsRsnInf block is emitted only when the report carries a reason code, and AddtlInf
 * only when there is additional text.
 */
public class Pacs002Generator {

    private static final Logger log = LoggerFactory.getLogger(Pacs002Generator.class);

    private static final String MESSAGE_ID_PREFIX = "PACS002-";
    private static final int REPORT_ID_LENGTH = 8;
    private static final DateTimeFormatter CREATION_DATE_TIME_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    /**
     * Generate pacs.002 XML for the given report.
     *
     * @param report status report to serialize
     * @return pacs.002 XML message
     */
    public String generate(StatusReport report) {
        String msgId = generateMessageId(report);
        String creDtTm = CREATION_DATE_TIME_FORMATTER.format(report.getCreatedAt());

        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<Document xmlns=\"").append(Iso20022MessageType.PACS_002.getNamespace()).append("\">\n");
        xml.append("  <FIToFIPmtStsRpt>\n");

        // Group Header
        xml.append("    <GrpHdr>\n");
        xml.append("      <MsgId>").append(escapeXml(msgId)).append("</MsgId>\n");
        xml.append("      <CreDtTm>").append(creDtTm).append("</CreDtTm>\n");
        xml.append("    </GrpHdr>\n");

        // Transaction Information and Status
        xml.append("    <TxInfAndSts>\n");
        xml.append("      <OrgnlMsgId>").append(escapeXml(report.getOriginalMessageId())).append("</OrgnlMsgId>\n");
        xml.append("      <OrgnlMsgNmId>").append(Iso20022MessageType.PACS_008.getMessageNameId()).append("</OrgnlMsgNmId>\n");
        xml.append("      <OrgnlInstrId>").append(escapeXml(report.getOriginalInstructionId())).append("</OrgnlInstrId>\n");
        xml.append("      <OrgnlEndToEndId>").append(escapeXml(report.getOriginalEndToEndId())).append("</OrgnlEndToEndId>\n");
        xml.append("      <TxSts>").append(report.getStatus().getValue()).append("</TxSts>\n");

        if (report.hasReason()) {
            xml.append("      <StsRsnInf>\n");
            xml.append("        <Rsn>\n");
            xml.append("          <Cd>").append(report.getReasonCode().getValue()).append("</Cd>\n");
            xml.append("        </Rsn>\n");
            String additionalInfo = report.getAdditionalInfo();
            if (additionalInfo != null && !additionalInfo.isEmpty()) {
                xml.append("        <AddtlInf>").append(escapeXml(additionalInfo)).append("</AddtlInf>\n");
            }
            xml.append("      </StsRsnInf>\n");
        }

        xml.append("    </TxInfAndSts>\n");
        xml.append("  </FIToFIPmtStsRpt>\n");
        xml.append("</Document>");

        log.info("Generated pacs.002: MsgId={}, OrgnlEndToEndId={}, Status={}",
            msgId, report.getOriginalEndToEndId(), report.getStatus().getValue());
        return xml.toString();
    }

    /**
     * Message id derived from the report id, e.g. "PACS002-1b4e28ba".
     */
    static String generateMessageId(StatusReport report) {
        String reportId = report.getReportId();
        return MESSAGE_ID_PREFIX + reportId.substring(0, Math.min(REPORT_ID_LENGTH, reportId.length()));
    }

    /**
     * Escape XML special characters.
     */
    static String escapeXml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                   .replace("<", "&lt;")
                   .replace(">", "&gt;")
                   .replace("\"", "&quot;")
                   .replace("'", "&apos;");
    }
}
