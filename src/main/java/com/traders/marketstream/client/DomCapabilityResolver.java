package com.traders.marketstream.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.traders.marketstream.domain.SymbolInfo;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a symbol gets the depth-of-market topics.
 * <p>
 * Precedence: explicit metadata flag, security type, exchange, capabilities from the last ACK for
 * the symbol. Symbols nothing is known about are treated as DOM-capable.
 */
public class DomCapabilityResolver {
    static final boolean DEFAULT_DOM_CAPABLE = true;

    private static final Set<String> NO_DOM_SEC_TYPES = Set.of("STK", "ETF", "CFD");
    private static final Set<String> DOM_SEC_TYPES = Set.of("FUT", "FOP", "FUTOPT", "FWD", "CMDTY");
    private static final Set<String> DOM_EXCHANGES = Set.of(
            "CME", "CBOT", "NYMEX", "COMEX", "ICE", "ICEUS", "ICEEU", "EUREX", "SGX", "CFE");
    private static final Set<String> NO_DOM_EXCHANGES = Set.of("SMART", "NASDAQ", "NYSE", "ARCA", "BATS", "IEX");
    private static final List<String> CAPABILITY_KEYS = List.of(
            "market.dom", "market.depth", "dom", "depth", "enable_dom", "enable_depth",
            "has_dom", "has_depth", "supports_dom", "supports_depth");
    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "y", "enabled", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "n", "disabled", "off");

    public boolean isDomCapable(SymbolInfo metadata, JsonNode cachedCapabilities) {
        if (metadata != null) {
            if (metadata.domCapable() != null) {
                return metadata.domCapable();
            }
            String secType = upper(metadata.secType());
            if (secType != null) {
                if (NO_DOM_SEC_TYPES.contains(secType)) {
                    return false;
                }
                if (DOM_SEC_TYPES.contains(secType)) {
                    return true;
                }
            }
            String exchange = upper(metadata.exchange());
            if (exchange != null) {
                if (DOM_EXCHANGES.contains(exchange)) {
                    return true;
                }
                if (NO_DOM_EXCHANGES.contains(exchange)) {
                    return false;
                }
            }
        }
        Boolean advertised = findCapabilityFlag(cachedCapabilities);
        return advertised != null ? advertised : DEFAULT_DOM_CAPABLE;
    }

    /**
     * Searches a capability payload for a DOM flag, descending into nested objects.
     *
     * @return the flag, or {@code null} when the payload says nothing about depth
     */
    static Boolean findCapabilityFlag(JsonNode capabilities) {
        if (capabilities == null || !capabilities.isObject()) {
            return null;
        }
        for (String key : CAPABILITY_KEYS) {
            Boolean flag = parseCapabilityFlag(capabilities.get(key));
            if (flag != null) {
                return flag;
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = capabilities.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isObject()) {
                Boolean nested = findCapabilityFlag(value);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    static Boolean parseCapabilityFlag(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            double number = value.asDouble();
            if (!Double.isFinite(number)) {
                return null;
            }
            return number > 0;
        }
        if (value.isTextual()) {
            String word = value.asText().trim().toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(word)) {
                return true;
            }
            if (FALSE_WORDS.contains(word)) {
                return false;
            }
            return null;
        }
        if (value.isArray()) {
            return anyFlag(value.elements());
        }
        if (value.isObject()) {
            Boolean keyed = findCapabilityFlag(value);
            return keyed != null ? keyed : anyFlag(value.elements());
        }
        return null;
    }

    private static Boolean anyFlag(Iterator<JsonNode> values) {
        boolean sawFalse = false;
        while (values.hasNext()) {
            Boolean flag = parseCapabilityFlag(values.next());
            if (Boolean.TRUE.equals(flag)) {
                return true;
            }
            if (Boolean.FALSE.equals(flag)) {
                sawFalse = true;
            }
        }
        return sawFalse ? Boolean.FALSE : null;
    }

    private static String upper(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
