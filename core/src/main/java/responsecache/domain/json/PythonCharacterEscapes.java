package responsecache.domain.json;

import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;

/**
 * ASCII-only output with lowercase hex escapes. Jackson's own escapes are uppercase, which would change the
 * bytes that go into a cache key. The short escapes (\n, \t, \r, \b, \f) are kept as they are.
 */
public class PythonCharacterEscapes extends CharacterEscapes {
    private static final int DELETE = 0x7f;
    private static final String SHORT_ESCAPES = "\b\t\n\f\r";

    private final int[] asciiEscapes;

    public PythonCharacterEscapes() {
        asciiEscapes = standardAsciiEscapesForJSON();
        for (int i = 0; i < asciiEscapes.length; i++) {
            if (asciiEscapes[i] == ESCAPE_STANDARD && SHORT_ESCAPES.indexOf(i) < 0) {
                asciiEscapes[i] = ESCAPE_CUSTOM;
            }
        }
        asciiEscapes[DELETE] = ESCAPE_CUSTOM;
    }

    @Override
    public int[] getEscapeCodesForAscii() {
        return asciiEscapes;
    }

    @Override
    public SerializableString getEscapeSequence(final int ch) {
        return new SerializedString(String.format("\\u%04x", ch));
    }
}
