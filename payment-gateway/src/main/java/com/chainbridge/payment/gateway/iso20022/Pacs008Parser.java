package com.chainbridge.payment.gateway.iso20022;

import com.chainbridge.payment.canonical.PaymentAmount;
import com.chainbridge.payment.canonical.PaymentInstruction;
import com.chainbridge.payment.canonical.PaymentParty;
import com.chainbridge.payment.canonical.enums.Iso20022MessageType;
import com.chainbridge.payment.currency.CurrencyAllowList;
import com.chainbridge.payment.error.CurrencyValidationException;
import com.chainbridge.payment.error.MalformedXmlException;
import com.chainbridge.payment.error.SchemaValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Parser for ISO 20022 pacs.008 (FI to FI customer credit transfer) messages.
 *
 * Accepts any pacs.008 schema version, a prefixed namespace, or no namespace at all.
 * Only the first CdtTrfTxInf block of a message is read.
 */
public class Pacs008Parser {

    private static final Logger log = LoggerFactory.getLogger(Pacs008Parser.class);

    private static final String CURRENCY_ATTRIBUTE = "Ccy";
    private static final String DEFAULT_CURRENCY = "USD";
    // ActiveCurrencyAndAmount: plain decimal, at most 18 integer and 5 fraction digits
    private static final Pattern AMOUNT_PATTERN = Pattern.compile("[+-]?\\d{1,18}(\\.\\d{1,5})?");
    private static final int MAX_ELEMENT_DEPTH = 64;
    private static final String MAX_ELEMENT_DEPTH_PROPERTY = "http://www.oracle.com/xml/jaxp/properties/maxElementDepth";

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY;

    static {
        DOCUMENT_BUILDER_FACTORY = DocumentBuilderFactory.newInstance();
        DOCUMENT_BUILDER_FACTORY.setNamespaceAware(true);
        DOCUMENT_BUILDER_FACTORY.setXIncludeAware(false);
        DOCUMENT_BUILDER_FACTORY.setExpandEntityReferences(false);
        try {
            DOCUMENT_BUILDER_FACTORY.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-general-entities", false);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            log.warn("Failed to configure XML parser security features", e);
        }
        try {
            DOCUMENT_BUILDER_FACTORY.setAttribute(MAX_ELEMENT_DEPTH_PROPERTY, String.valueOf(MAX_ELEMENT_DEPTH));
        } catch (IllegalArgumentException e) {
            log.warn("XML parser does not support an element depth limit", e);
        }
    }

    private static final ErrorHandler RAISING_ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private final CurrencyAllowList currencyAllowList;

    public Pacs008Parser() {
        this(CurrencyAllowList.defaults());
    }

    public Pacs008Parser(CurrencyAllowList currencyAllowList) {
        this.currencyAllowList = currencyAllowList;
    }

    /**
     * Parses a pacs.008 XML string into a PaymentInstruction.
     *
     * @param xmlMessage raw pacs.008 message
     * @return fully populated instruction retaining the sanitized XML
     * @throws MalformedXmlException if the input is empty or not well-formed
     * @throws SchemaValidationException if a required element is missing or the amount is unparsable
     * @throws CurrencyValidationException if the amount currency is not in the allow-list
     */
    public PaymentInstruction parse(String xmlMessage)
            throws MalformedXmlException, SchemaValidationException, CurrencyValidationException {
        if (xmlMessage == null || xmlMessage.trim().isEmpty()) {
            throw new MalformedXmlException("XML message cannot be null or empty");
        }

        String sanitized = XmlSanitizer.sanitize(xmlMessage);
        Element root = parseDocument(sanitized).getDocumentElement();

        ElementLocator locator = ElementLocator.forRoot(root);
        if (locator.getNamespace() != null && !Iso20022MessageType.PACS_008.matchesNamespace(locator.getNamespace())) {
            log.debug("Parsing pacs.008 under unrecognized namespace {}", locator.getNamespace());
        }
        FieldExtractor extractor = new FieldExtractor(locator);

        Element groupHeader = extractor.element(root, Pacs008Field.GROUP_HEADER);
        Element transaction = extractor.element(root, Pacs008Field.TRANSACTION);
        if (transaction == null) {
            throw new SchemaValidationException(Pacs008Field.TRANSACTION.getElementName(),
                "Missing CdtTrfTxInf element");
        }
        Element paymentId = extractor.element(transaction, Pacs008Field.PAYMENT_ID);

        PaymentParty debtor = extractParty(extractor,
            extractor.element(transaction, Pacs008Field.DEBTOR),
            extractor.element(transaction, Pacs008Field.DEBTOR_ACCOUNT));
        PaymentParty creditor = extractParty(extractor,
            extractor.element(transaction, Pacs008Field.CREDITOR),
            extractor.element(transaction, Pacs008Field.CREDITOR_ACCOUNT));

        PaymentInstruction instruction = PaymentInstruction.builder()
            .messageId(extractor.textOrEmpty(groupHeader, Pacs008Field.MESSAGE_ID))
            .creationDateTime(extractor.textOrEmpty(groupHeader, Pacs008Field.CREATION_DATE_TIME))
            .instructionId(extractor.textOrEmpty(paymentId, Pacs008Field.INSTRUCTION_ID))
            .endToEndId(extractor.textOrEmpty(paymentId, Pacs008Field.END_TO_END_ID))
            .transactionId(extractor.textOrEmpty(paymentId, Pacs008Field.TRANSACTION_ID))
            .amount(extractAmount(extractor, transaction))
            .settlementDate(extractor.textOrEmpty(transaction, Pacs008Field.SETTLEMENT_DATE))
            .debtor(debtor)
            .creditor(creditor)
            .debtorAgent(extractAgent(extractor, extractor.element(transaction, Pacs008Field.DEBTOR_AGENT)))
            .creditorAgent(extractAgent(extractor, extractor.element(transaction, Pacs008Field.CREDITOR_AGENT)))
            .remittanceInfo(extractor.textOrEmpty(transaction, Pacs008Field.REMITTANCE_INFO))
            .rawXml(sanitized)
            .build();

        log.info("Parsed pacs.008: MsgId={}, EndToEndId={}, Amount={}",
            instruction.getMessageId(), instruction.getEndToEndId(), instruction.getAmount());
        return instruction;
    }

    private Document parseDocument(String sanitized) throws MalformedXmlException {
        try {
            DocumentBuilder documentBuilder = DOCUMENT_BUILDER_FACTORY.newDocumentBuilder();
            documentBuilder.setErrorHandler(RAISING_ERROR_HANDLER);
            // Already decoded text: the declared encoding must not be applied a second time
            Document document = documentBuilder.parse(new InputSource(new StringReader(sanitized)));
            if (document.getDocumentElement() == null) {
                throw new MalformedXmlException("XML document has no root element");
            }
            return document;
        } catch (ParserConfigurationException e) {
            throw new MalformedXmlException("Failed to configure XML parser", e);
        } catch (SAXException e) {
            throw new MalformedXmlException("Failed to parse XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedXmlException("Failed to read XML message", e);
        }
    }

    /**
     * Settlement amount, falling back to the instructed amount. The currency comes from the Ccy attribute.
     */
    private PaymentAmount extractAmount(FieldExtractor extractor, Element transaction)
            throws SchemaValidationException, CurrencyValidationException {
        Element amountElement = extractor.element(transaction, Pacs008Field.SETTLEMENT_AMOUNT);
        if (amountElement == null) {
            throw new SchemaValidationException(Pacs008Field.SETTLEMENT_AMOUNT.getElementName(),
                "Missing amount element (IntrBkSttlmAmt or InstdAmt)");
        }
        String elementName = LookupStrategy.localName(amountElement);

        String text = ElementLocator.text(amountElement);
        BigDecimal value = BigDecimal.ZERO;
        if (text != null) {
            if (!AMOUNT_PATTERN.matcher(text).matches()) {
                throw new SchemaValidationException(elementName,
                    String.format("Invalid amount format in %s: '%s'", elementName, text));
            }
            value = new BigDecimal(text);
        }

        String currency = amountElement.getAttribute(CURRENCY_ATTRIBUTE).trim();
        if (currency.isEmpty()) {
            log.warn("{} has no Ccy attribute, defaulting to {}", elementName, DEFAULT_CURRENCY);
            currency = DEFAULT_CURRENCY;
        }
        if (!currencyAllowList.isAllowed(currency)) {
            throw new CurrencyValidationException(currency);
        }
        return PaymentAmount.of(value, currency);
    }

    private PaymentParty extractParty(FieldExtractor extractor, Element party, Element account) {
        PaymentParty.PaymentPartyBuilder builder = PaymentParty.builder();
        if (party != null) {
            builder.name(extractor.textOrEmpty(party, Pacs008Field.PARTY_NAME));
            Element postalAddress = extractor.element(party, Pacs008Field.POSTAL_ADDRESS);
            if (postalAddress != null) {
                builder.address(formatAddress(extractor, postalAddress));
                builder.country(extractor.textOrEmpty(postalAddress, Pacs008Field.COUNTRY));
            }
        }
        if (account != null) {
            builder.accountId(extractor.textOrEmpty(account, Pacs008Field.ACCOUNT_ID));
        }
        return builder.build();
    }

    private PaymentParty extractAgent(FieldExtractor extractor, Element agent) {
        if (agent == null) {
            return PaymentParty.EMPTY;
        }
        String bic = extractor.textOrEmpty(agent, Pacs008Field.AGENT_BIC);
        PaymentParty.PaymentPartyBuilder builder = PaymentParty.builder()
            .bic(bic)
            .name(extractor.textOrEmpty(agent, Pacs008Field.AGENT_NAME));

        Element postalAddress = extractor.element(agent, Pacs008Field.AGENT_POSTAL_ADDRESS);
        String country = "";
        if (postalAddress != null) {
            builder.address(formatAddress(extractor, postalAddress));
            country = extractor.textOrEmpty(postalAddress, Pacs008Field.COUNTRY);
        }
        // BIC format: 4 bank code + 2 country + 2 location + optional 3 branch
        if (country.isEmpty() && (bic.length() == 8 || bic.length() == 11)) {
            country = bic.substring(4, 6);
        }
        return builder.country(country).build();
    }

    /**
     * "street building, town" without dangling separators.
     */
    private String formatAddress(FieldExtractor extractor, Element postalAddress) {
        String street = join(" ",
            extractor.textOrEmpty(postalAddress, Pacs008Field.STREET_NAME),
            extractor.textOrEmpty(postalAddress, Pacs008Field.BUILDING_NUMBER));
        return join(", ", street, extractor.textOrEmpty(postalAddress, Pacs008Field.TOWN_NAME));
    }

    private static String join(String separator, String first, String second) {
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        return first + separator + second;
    }
}
