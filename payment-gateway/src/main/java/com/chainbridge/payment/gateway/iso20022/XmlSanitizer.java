package com.chainbridge.payment.gateway.iso20022;

import java.util.regex.Pattern;

/**
 * Removes DOCTYPE and ENTITY declarations from raw XML text before it reaches a parser.
 *
 * A DOCTYPE is removed together with its bracketed internal subset. Entity references
 * left in the body (e.g. {@code &xxe;}) are not touched and fail parsing as undeclared.
 */
public final class XmlSanitizer {

    private static final Pattern DOCTYPE = Pattern.compile(
        "<!DOCTYPE[^\\[>]*(\\[.*?\\]\\s*)?>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern ENTITY = Pattern.compile(
        "<!ENTITY[^>]*>", Pattern.CASE_INSENSITIVE);

    private XmlSanitizer() {
    }

    /**
     * Strip DOCTYPE and ENTITY declarations. Never fails; null becomes the empty string.
     */
    public static String sanitize(String xml) {
        if (xml == null) {
            return "";
        }
        String withoutDoctype = DOCTYPE.matcher(xml).replaceAll("");
        return ENTITY.matcher(withoutDoctype).replaceAll("");
    }

    /**
     * True if the text still contains a DOCTYPE or ENTITY declaration.
     */
    public static boolean containsDeclarations(String xml) {
        return xml != null && (DOCTYPE.matcher(xml).find() || ENTITY.matcher(xml).find());
    }
}
