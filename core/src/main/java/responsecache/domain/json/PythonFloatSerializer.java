package responsecache.domain.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Writes floating point numbers the way the legacy producer did: the shortest repr, fixed notation between 1e-4
 * and 1e16, and a signed two digit exponent outside that range (1e-05, 1.5e+16).
 */
public class PythonFloatSerializer extends StdSerializer<Number> {

    public PythonFloatSerializer() {
        super(Number.class);
    }

    @Override
    public void serialize(final Number value, final JsonGenerator gen, final SerializerProvider provider) throws IOException {
        gen.writeNumber(repr(value.doubleValue()));
    }

    public static String repr(final double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }

        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }

        if (value == 0) {
            return 1 / value < 0 ? "-0.0" : "0.0";
        }

        final BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        final String digits = decimal.unscaledValue().abs().toString();
        final int exponent = digits.length() - 1 - decimal.scale();
        final String sign = value < 0 ? "-" : "";

        if (exponent >= -4 && exponent < 16) {
            final String plain = decimal.abs().toPlainString();
            return sign + (plain.contains(".") ? plain : plain + ".0");
        }

        final String mantissa = digits.length() == 1
                ? digits
                : digits.charAt(0) + "." + digits.substring(1);
        return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + String.format("%02d", Math.abs(exponent));
    }
}
