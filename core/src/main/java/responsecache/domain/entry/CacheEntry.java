package responsecache.domain.entry;

import org.jspecify.annotations.Nullable;
import responsecache.domain.exceptions.CacheValidationFailed;
import responsecache.domain.json.JsonCodec;

import java.time.Instant;
import java.util.*;

/**
 * A single cached model response, along with the request that produced it.
 *
 * @param model        The model identifier, e.g. gpt-3.5-turbo
 * @param parameters   The model parameters, e.g. temperature
 * @param systemPrompt The system prompt sent to the model
 * @param userPrompt   The user prompt sent to the model
 * @param output       The JSON encoded response
 * @param iteration    Distinguishes repeated samples of the same request
 * @param timestamp    Unix seconds when the response was produced
 * @param service      The service that hosted the model, if known
 */
public record CacheEntry(String model,
                         Map<String, Object> parameters,
                         String systemPrompt,
                         String userPrompt,
                         String output,
                         int iteration,
                         long timestamp,
                         @Nullable String service) {

    public static final List<String> FIELDS = List.of(
            "model", "parameters", "system_prompt", "user_prompt", "output", "iteration", "timestamp", "service");

    public CacheEntry {
        requireField(model, "model", "a string");
        requireField(parameters, "parameters", "a dictionary");
        requireField(systemPrompt, "system_prompt", "a string");
        requireField(userPrompt, "user_prompt", "a string");
        requireField(output, "output", "a string");
        // JSON parameters can legitimately hold nulls, so Map.copyOf is not an option
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds an entry from the map written by {@link #toMap()}, validating the type of each field.
     */
    public static CacheEntry fromMap(final Map<String, ?> data) {
        if (data == null) {
            throw new CacheValidationFailed("Cache entry data must not be null");
        }

        final List<String> unknown = data.keySet().stream()
                .filter(key -> !FIELDS.contains(key))
                .toList();
        if (!unknown.isEmpty()) {
            throw new CacheValidationFailed("Unexpected cache entry fields " + unknown);
        }

        final Builder builder = builder()
                .model(stringField(data, "model"))
                .parameters(mapField(data))
                .systemPrompt(stringField(data, "system_prompt"))
                .userPrompt(stringField(data, "user_prompt"))
                .output(stringField(data, "output"));

        final Object iteration = data.get("iteration");
        if (iteration != null) {
            final long value = integerField(iteration, "iteration");
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new CacheValidationFailed("`iteration` is out of range: " + value);
            }
            builder.iteration((int) value);
        }

        final Object timestamp = data.get("timestamp");
        if (timestamp != null) {
            builder.timestamp(integerField(timestamp, "timestamp"));
        }

        final Object service = data.get("service");
        if (service != null && !(service instanceof String)) {
            throw new CacheValidationFailed("`service` should be either a string or None");
        }

        return builder.service((String) service).build();
    }

    public String key() {
        return CacheKey.generate(model, parameters, systemPrompt, userPrompt, iteration);
    }

    /**
     * All eight fields, in the order they are written to cache files.
     */
    public Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("model", model);
        map.put("parameters", parameters);
        map.put("system_prompt", systemPrompt);
        map.put("user_prompt", userPrompt);
        map.put("output", output);
        map.put("iteration", iteration);
        map.put("timestamp", timestamp);
        map.put("service", service);
        return map;
    }

    /**
     * Returns a copy of this entry produced at a different time.
     */
    public CacheEntry withTimestamp(final long newTimestamp) {
        return new CacheEntry(model, parameters, systemPrompt, userPrompt, output, iteration, newTimestamp, service);
    }

    /**
     * Two entries are the same cached response no matter when they were produced, so the timestamp is ignored.
     * Parameters are compared in their canonical JSON form, so 100 and 100L are the same value.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheEntry other)) {
            return false;
        }
        return iteration == other.iteration
                && model.equals(other.model)
                && canonicalParameters().equals(other.canonicalParameters())
                && systemPrompt.equals(other.systemPrompt)
                && userPrompt.equals(other.userPrompt)
                && output.equals(other.output)
                && Objects.equals(service, other.service);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, canonicalParameters(), systemPrompt, userPrompt, output, iteration, service);
    }

    private String canonicalParameters() {
        return JsonCodec.serializeSorted(parameters);
    }

    private static void requireField(@Nullable final Object value, final String name, final String type) {
        if (value == null) {
            throw new CacheValidationFailed("`" + name + "` should be " + type + ".");
        }
    }

    private static String stringField(final Map<String, ?> data, final String name) {
        final Object value = data.get(name);
        if (!(value instanceof String)) {
            throw new CacheValidationFailed("`" + name + "` should be a string.");
        }
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapField(final Map<String, ?> data) {
        final Object value = data.get("parameters");
        if (!(value instanceof Map<?, ?> map) || !map.keySet().stream().allMatch(String.class::isInstance)) {
            throw new CacheValidationFailed("`parameters` should be a dictionary.");
        }
        return (Map<String, Object>) value;
    }

    private static long integerField(final Object value, final String name) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new CacheValidationFailed("`" + name + "` should be an integer");
    }

    public static final class Builder {
        private @Nullable String model;
        private @Nullable Map<String, Object> parameters;
        private @Nullable String systemPrompt;
        private @Nullable String userPrompt;
        private @Nullable String output;
        private int iteration;
        private @Nullable Long timestamp;
        private @Nullable String service;

        private Builder() {
        }

        public Builder model(final String model) {
            this.model = model;
            return this;
        }

        public Builder parameters(final Map<String, ?> parameters) {
            this.parameters = parameters == null ? null : new LinkedHashMap<>(parameters);
            return this;
        }

        public Builder systemPrompt(final String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder userPrompt(final String userPrompt) {
            this.userPrompt = userPrompt;
            return this;
        }

        public Builder output(final String output) {
            this.output = output;
            return this;
        }

        public Builder iteration(final int iteration) {
            this.iteration = iteration;
            return this;
        }

        public Builder timestamp(final long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder service(@Nullable final String service) {
            this.service = service;
            return this;
        }

        public CacheEntry build() {
            return new CacheEntry(
                    model,
                    parameters,
                    systemPrompt,
                    userPrompt,
                    output,
                    iteration,
                    timestamp == null ? Instant.now().getEpochSecond() : timestamp,
                    service);
        }
    }
}
