package responsecache.infrastructure.remotecache;

import responsecache.domain.exceptions.CacheValidationFailed;

import java.util.Arrays;
import java.util.Locale;

public enum RemoteCacheVisibility {
    PRIVATE,
    PUBLIC,
    UNLISTED;

    public static RemoteCacheVisibility fromString(final String value) {
        return Arrays.stream(values())
                .filter(visibility -> visibility.name().equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new CacheValidationFailed("Unknown remote cache visibility " + value
                        + ". Must be one of " + Arrays.toString(values())));
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
