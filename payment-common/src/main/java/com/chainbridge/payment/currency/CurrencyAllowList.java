package com.chainbridge.payment.currency;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fixed set of currency codes accepted in settlement amounts.
 *
 * The defaults are ISO 4217 major fiat codes plus precious metals, SDR and two native
 * asset codes. Extensions can be added at construction time; codes outside the resulting
 * set are never accepted. Matching ignores case.
 *
 * This class is immutable and thread-safe.
 */
public final class CurrencyAllowList {

    public static final Set<String> DEFAULT_CODES = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
        // Major fiat
        "USD", "EUR", "GBP", "JPY", "CHF", "CAD", "AUD", "NZD",
        "CNY", "HKD", "SGD", "KRW", "INR", "MXN", "BRL", "ZAR",
        // Nordic
        "SEK", "NOK", "DKK",
        // Middle East
        "AED", "SAR", "ILS",
        // Other
        "RUB", "TRY", "PLN", "CZK", "HUF", "THB", "MYR", "IDR", "PHP",
        // Precious metals
        "XAU", "XAG", "XPT", "XPD",
        // Special drawing right
        "XDR",
        // Native assets
        "CBT", "CUSD"
    )));

    private static final CurrencyAllowList DEFAULT = new CurrencyAllowList(Collections.emptyList());

    private final Set<String> codes;

    private CurrencyAllowList(Collection<String> extensions) {
        Set<String> all = new LinkedHashSet<>(DEFAULT_CODES);
        for (String code : extensions) {
            if (code != null && !code.isBlank()) {
                all.add(code.trim().toUpperCase(Locale.ROOT));
            }
        }
        this.codes = Collections.unmodifiableSet(all);
    }

    public static CurrencyAllowList defaults() {
        return DEFAULT;
    }

    /**
     * Default codes plus the given extension codes.
     */
    public static CurrencyAllowList withExtensions(Collection<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return DEFAULT;
        }
        return new CurrencyAllowList(extensions);
    }

    public boolean isAllowed(String currencyCode) {
        if (currencyCode == null || currencyCode.isEmpty()) {
            return false;
        }
        return codes.contains(currencyCode.toUpperCase(Locale.ROOT));
    }

    public Set<String> getCodes() {
        return codes;
    }
}
