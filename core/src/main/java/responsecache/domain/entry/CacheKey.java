package responsecache.domain.entry;

import org.apache.commons.codec.digest.DigestUtils;
import responsecache.domain.json.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Derives the content address of a request. The parameter map is serialized with sorted keys, so two maps holding
 * the same entries produce the same key regardless of insertion order.
 */
public final class CacheKey {
    private CacheKey() {
    }

    public static String generate(
            final String model,
            final Map<String, ?> parameters,
            final String systemPrompt,
            final String userPrompt,
            final int iteration) {
        final String longKey = model
                + JsonCodec.serializeSorted(parameters)
                + systemPrompt
                + userPrompt
                + iteration;
        return DigestUtils.md5Hex(longKey.getBytes(StandardCharsets.UTF_8));
    }
}
