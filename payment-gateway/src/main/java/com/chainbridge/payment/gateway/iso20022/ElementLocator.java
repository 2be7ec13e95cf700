package com.chainbridge.payment.gateway.iso20022;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.Collections;
import java.util.List;

/**
 * Namespace-tolerant element lookup over one parsed document.
 *
 * Each lookup walks the configured strategies in order and returns the first hit.
 * The default order is unqualified, then qualified with the root element's namespace,
 * then a local-name scan of the context element's subtree.
 */
public class ElementLocator {

    private static final Logger log = LoggerFactory.getLogger(ElementLocator.class);

    public static final List<LookupStrategy> DEFAULT_STRATEGIES = List.of(
        LookupStrategy.UNQUALIFIED,
        LookupStrategy.NAMESPACE_QUALIFIED,
        LookupStrategy.LOCAL_NAME_SCAN);

    private final String namespace;
    private final List<LookupStrategy> strategies;

    public ElementLocator(String namespace) {
        this(namespace, DEFAULT_STRATEGIES);
    }

    public ElementLocator(String namespace, List<LookupStrategy> strategies) {
        this.namespace = namespace;
        this.strategies = Collections.unmodifiableList(List.copyOf(strategies));
    }

    /**
     * Locator bound to the namespace of the document's root element (may be none).
     */
    public static ElementLocator forRoot(Element root) {
        return new ElementLocator(root.getNamespaceURI());
    }

    public String getNamespace() {
        return namespace;
    }

    public List<LookupStrategy> getStrategies() {
        return strategies;
    }

    public Element find(Element context, String path) {
        return find(context, ElementPath.parse(path));
    }

    public Element find(Element context, ElementPath path) {
        if (context == null) {
            return null;
        }
        for (LookupStrategy strategy : strategies) {
            Element element = strategy.find(context, path, namespace);
            if (element != null) {
                if (strategy != strategies.get(0)) {
                    log.debug("Resolved '{}' under <{}> via {}", path, LookupStrategy.localName(context), strategy);
                }
                return element;
            }
        }
        return null;
    }

    /**
     * Trimmed text of the located element, or null if the element is absent or has no text.
     */
    public String findText(Element context, ElementPath path) {
        return text(find(context, path));
    }

    /**
     * Trimmed character data directly inside the element (text before and between child
     * elements, not the text of descendants). Null if there is none.
     */
    public static String text(Element element) {
        if (element == null) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            short type = node.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                text.append(node.getNodeValue());
            }
        }
        String trimmed = text.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
