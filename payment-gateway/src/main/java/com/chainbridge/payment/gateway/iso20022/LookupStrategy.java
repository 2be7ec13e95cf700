package com.chainbridge.payment.gateway.iso20022;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ways of resolving an {@link ElementPath} against a DOM subtree, in the order the
 * {@link ElementLocator} tries them.
 */
public enum LookupStrategy {

    /**
     * Every step must match an element with no namespace.
     */
    UNQUALIFIED {
        @Override
        Element find(Element context, ElementPath path, String namespace) {
            return resolve(context, path, null);
        }
    },

    /**
     * Every step must match an element in the namespace detected on the document root.
     */
    NAMESPACE_QUALIFIED {
        @Override
        Element find(Element context, ElementPath path, String namespace) {
            if (namespace == null || namespace.isEmpty()) {
                return null;
            }
            return resolve(context, path, namespace);
        }
    },

    /**
     * First element below the context, in document order, whose local name equals the
     * path's target name, in any namespace. Intermediate steps are ignored.
     */
    LOCAL_NAME_SCAN {
        @Override
        Element find(Element context, ElementPath path, String namespace) {
            return scan(context, path.getTargetName());
        }
    };

    abstract Element find(Element context, ElementPath path, String namespace);

    private static Element resolve(Element context, ElementPath path, String namespace) {
        List<String> steps = path.getSteps();
        List<Element> current = new ArrayList<>();
        if (path.isDescendant()) {
            collectDescendants(context, steps.get(0), namespace, current);
        } else {
            Element first = child(context, steps.get(0), namespace);
            if (first != null) {
                current.add(first);
            }
        }

        for (Element start : current) {
            Element element = start;
            for (int i = 1; i < steps.size() && element != null; i++) {
                element = child(element, steps.get(i), namespace);
            }
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    private static Element child(Element parent, String localName, String namespace) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && matches((Element) node, localName, namespace)) {
                return (Element) node;
            }
        }
        return null;
    }

    private static void collectDescendants(Element parent, String localName, String namespace, List<Element> out) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                Element element = (Element) node;
                if (matches(element, localName, namespace)) {
                    out.add(element);
                }
                collectDescendants(element, localName, namespace, out);
            }
        }
    }

    private static Element scan(Element parent, String localName) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                Element element = (Element) node;
                if (localName.equals(localName(element))) {
                    return element;
                }
                Element found = scan(element, localName);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static boolean matches(Element element, String localName, String namespace) {
        return localName.equals(localName(element)) && Objects.equals(namespace, element.getNamespaceURI());
    }

    static String localName(Element element) {
        String localName = element.getLocalName();
        if (localName != null) {
            return localName;
        }
        String tagName = element.getTagName();
        int colon = tagName.indexOf(':');
        return colon >= 0 ? tagName.substring(colon + 1) : tagName;
    }
}
