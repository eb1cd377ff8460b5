package com.postal.directory.parser;

import java.nio.charset.StandardCharsets;

/**
 * Decodes ISO-8859-1 bytes. Each byte maps to the code point with the same
 * value, so decoding never fails and keeps the length.
 */
public final class Latin1Decoder {

    private Latin1Decoder() {
    }

    public static String decode(byte[] bytes) {
        if (bytes == null) {
            throw ParseException.encoding("no input bytes");
        }
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }
}
