package responsecache.domain.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;

import java.io.IOException;

/**
 * Single line output using ", " between items and ": " between keys and values.
 */
public class PythonSeparatorsPrettyPrinter extends MinimalPrettyPrinter {

    @Override
    public void writeObjectFieldValueSeparator(final JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeObjectEntrySeparator(final JsonGenerator g) throws IOException {
        g.writeRaw(", ");
    }

    @Override
    public void writeArrayValueSeparator(final JsonGenerator g) throws IOException {
        g.writeRaw(", ");
    }
}
