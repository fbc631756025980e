package com.jstubhttp.components.services;

import java.util.Arrays;

public final class RawRequest {
    private static final RawRequest EMPTY = new RawRequest(new byte[0]);

    private final byte[] data;

    private RawRequest(byte[] data) {
        this.data = data;
    }

    public static RawRequest of(byte[] buffer, int length) {
        if (length <= 0) {
            return EMPTY;
        }
        return new RawRequest(Arrays.copyOf(buffer, length));
    }

    public byte[] getData() {
        return data.clone();
    }

    public int length() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }
}
