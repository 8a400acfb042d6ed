package com.consulthub.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * UTF-8 encoded size of a text frame payload.
     */
    public static long getBytesLength(String str) {
        return str == null ? 0 : str.getBytes(StandardCharsets.UTF_8).length;
    }

}
