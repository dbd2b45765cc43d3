package com.example.jestadapter.model;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.Objects;

/**
 * Identifier of a test case or a whole test file, encoded as {@code <relativeFilePath>?<testName>}.
 * <p>
 * The first {@code ?} separates the path from the name; an empty name addresses the whole file.
 * Paths always use forward slashes.
 *
 * @param path relative file path
 * @param name test name, empty for "whole file"
 */
public record TestSelector(String path, String name) {

    public static final char SEPARATOR = '?';

    /** Characters left untouched by {@link #encodeUri(String)}; mirrors ECMAScript {@code encodeURI}. */
    private static final BitSet URI_SAFE = new BitSet(128);

    static {
        for (char c = 'a'; c <= 'z'; c++) URI_SAFE.set(c);
        for (char c = 'A'; c <= 'Z'; c++) URI_SAFE.set(c);
        for (char c = '0'; c <= '9'; c++) URI_SAFE.set(c);
        for (char c : "-_.!~*'();/?:@&=+$,#".toCharArray()) URI_SAFE.set(c);
    }

    /** Escapes that {@link #decodeUri(String)} leaves encoded. */
    private static final BitSet URI_RESERVED = new BitSet(128);

    static {
        for (char c : ";/?:@&=+$,#".toCharArray()) URI_RESERVED.set(c);
    }

    public TestSelector {
        Objects.requireNonNull(path, "path");
        path = path.replace('\\', '/');
        name = name != null ? name : "";
    }

    /**
     * Splits a selector on its first {@code ?}; a selector without one addresses the whole file.
     */
    public static TestSelector parse(String selector) {
        int idx = selector.indexOf(SEPARATOR);
        if (idx < 0) {
            return new TestSelector(selector, "");
        }
        return new TestSelector(selector.substring(0, idx), selector.substring(idx + 1));
    }

    public static TestSelector wholeFile(String path) {
        return new TestSelector(path, "");
    }

    public boolean isWholeFile() {
        return name.isEmpty();
    }

    /** Encoded form {@code path?name}. */
    public String value() {
        return path + SEPARATOR + name;
    }

    @Override
    public String toString() {
        return value();
    }

    /**
     * Percent-encodes a selector for transport, leaving URI reserved characters (including
     * {@code /} and {@code ?}) intact.
     */
    public static String encodeUri(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (byte b : raw.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (c < 128 && URI_SAFE.get(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(Character.toUpperCase(Character.forDigit(c >> 4, 16)))
                        .append(Character.toUpperCase(Character.forDigit(c & 0xF, 16)));
            }
        }
        return sb.toString();
    }

    /**
     * Decodes percent-escapes like ECMAScript {@code decodeURI}: escapes of reserved characters
     * ({@code ;/?:@&=+$,#}) stay encoded. A string with a malformed escape is returned unchanged.
     */
    public static String decodeUri(String encoded) {
        if (encoded.indexOf('%') < 0) {
            return encoded;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(encoded.length());
        int i = 0;
        while (i < encoded.length()) {
            char c = encoded.charAt(i);
            if (c != '%') {
                int end = i + 1;
                while (end < encoded.length() && encoded.charAt(end) != '%') end++;
                out.writeBytes(encoded.substring(i, end).getBytes(StandardCharsets.UTF_8));
                i = end;
                continue;
            }
            if (i + 2 >= encoded.length()) {
                return encoded;
            }
            int hi = Character.digit(encoded.charAt(i + 1), 16);
            int lo = Character.digit(encoded.charAt(i + 2), 16);
            if (hi < 0 || lo < 0) {
                return encoded;
            }
            int b = (hi << 4) | lo;
            if (URI_RESERVED.get(b)) {
                out.writeBytes(encoded.substring(i, i + 3).getBytes(StandardCharsets.US_ASCII));
            } else {
                out.write(b);
            }
            i += 3;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(out.toByteArray())).toString();
        } catch (CharacterCodingException e) {
            return encoded;
        }
    }
}
