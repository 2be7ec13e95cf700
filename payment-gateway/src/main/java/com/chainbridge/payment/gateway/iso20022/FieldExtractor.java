package com.chainbridge.payment.gateway.iso20022;

import org.w3c.dom.Element;

/**
 * Resolves {@link Pacs008Field} entries against a block element using an {@link ElementLocator}.
 *
 * The block element must be the one the field is declared for; a field is never looked up
 * under another block.
 */
public class FieldExtractor {

    private final ElementLocator locator;

    public FieldExtractor(ElementLocator locator) {
        this.locator = locator;
    }

    /**
     * First candidate element of the field found under the block, or null.
     */
    public Element element(Element block, Pacs008Field field) {
        if (block == null) {
            return null;
        }
        checkBlock(block, field);
        for (ElementPath candidate : field.getCandidates()) {
            Element element = locator.find(block, candidate);
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    /**
     * Text of the first candidate that resolves to an element with text, or null.
     */
    public String text(Element block, Pacs008Field field) {
        if (block == null) {
            return null;
        }
        checkBlock(block, field);
        for (ElementPath candidate : field.getCandidates()) {
            String text = locator.findText(block, candidate);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    /**
     * Text of the field, or the empty string when absent.
     */
    public String textOrEmpty(Element block, Pacs008Field field) {
        String text = text(block, field);
        return text != null ? text : "";
    }

    private static void checkBlock(Element block, Pacs008Field field) {
        if (!field.getBlock().accepts(block)) {
            throw new IllegalArgumentException(String.format("%s is resolved under %s, not <%s>",
                field, field.getBlock(), LookupStrategy.localName(block)));
        }
    }
}
