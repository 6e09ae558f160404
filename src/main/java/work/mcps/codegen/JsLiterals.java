package work.mcps.codegen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Literal rendering for the JavaScript target.
 */
public final class JsLiterals {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private JsLiterals() {}

    public static String string(String value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to encode string literal", ex);
        }
    }

    /**
     * Formats a double the way JavaScript's {@code Number.prototype.toString} does:
     * plain decimals between 1e-6 and 1e21, exponent notation outside that range.
     */
    public static String number(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0) {
            return "0";
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        double abs = Math.abs(value);
        if (abs >= 1e-6 && abs < 1e21) {
            return decimal.toPlainString();
        }
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        StringBuilder out = new StringBuilder();
        if (value < 0) {
            out.append('-');
        }
        out.append(digits.charAt(0));
        if (digits.length() > 1) {
            out.append('.').append(digits, 1, digits.length());
        }
        out.append('e').append(exponent >= 0 ? '+' : '-').append(Math.abs(exponent));
        return out.toString();
    }

    /**
     * Object keys stay bare when they are valid identifiers, otherwise they are quoted.
     */
    public static String propertyKey(String key) {
        return IDENTIFIER.matcher(key).matches() ? key : string(key);
    }
}
