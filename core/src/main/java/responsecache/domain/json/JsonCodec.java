package responsecache.domain.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.vavr.control.Try;
import responsecache.domain.exceptions.DeserializationFailed;
import responsecache.domain.exceptions.SerializationFailed;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Serializes and deserializes the JSON held in cache files, SQLite rows and cache keys.
 * <p>
 * Everything written here must be byte-for-byte what the legacy producer wrote, because the parameter map is
 * hashed as part of the cache key. That means ", " and ": " separators, ASCII-only output with lowercase escapes,
 * and the legacy float format.
 */
public final class JsonCodec {
    private static final Logger logger = Logger.getLogger(JsonCodec.class.getName());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper OBJECT_MAPPER = createObjectMapper();
    private static final ObjectWriter WRITER = OBJECT_MAPPER.writer(new PythonSeparatorsPrettyPrinter());
    private static final ObjectWriter SORTED_WRITER = WRITER.with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private JsonCodec() {
    }

    /**
     * Serialize a value, keeping map entries in insertion order.
     */
    public static String serialize(final Object object) {
        return Try.of(() -> WRITER.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + typeName(object) + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new SerializationFailed(ex));
    }

    /**
     * Serialize a value with the keys of every map sorted. This is the form used in cache keys.
     */
    public static String serializeSorted(final Object object) {
        return Try.of(() -> SORTED_WRITER.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + typeName(object) + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new SerializationFailed(ex));
    }

    public static Map<String, Object> deserializeMap(final String json) {
        return Try.of(() -> OBJECT_MAPPER.readValue(json, MAP_TYPE))
                .filter(map -> map != null, () -> new DeserializationFailed("JSON document was null"))
                .onFailure(ex -> logger.warning("Failed to deserialize map: " + ex.getMessage()))
                .getOrElseThrow(ex -> ex instanceof DeserializationFailed
                        ? (DeserializationFailed) ex
                        : new DeserializationFailed(ex));
    }

    public static <T> T deserialize(final String json, final Class<T> clazz) {
        return Try.of(() -> OBJECT_MAPPER.readValue(json, clazz))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    private static String typeName(final Object object) {
        return object == null ? "null" : object.getClass().getSimpleName();
    }

    private static ObjectMapper createObjectMapper() {
        final SimpleModule floats = new SimpleModule("PythonFloats");
        floats.addSerializer(Double.class, new PythonFloatSerializer());
        floats.addSerializer(Double.TYPE, new PythonFloatSerializer());
        floats.addSerializer(Float.class, new PythonFloatSerializer());
        floats.addSerializer(Float.TYPE, new PythonFloatSerializer());

        final ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(floats);
        objectMapper.getFactory().setCharacterEscapes(new PythonCharacterEscapes());
        return objectMapper;
    }
}
