package com.aejis.processor.support;

import java.nio.charset.StandardCharsets;

/**
 * Bounds-checked fixed-width reads from untrusted binary structures. Every read past the
 * end throws {@link MalformedStructureException} instead of an index error.
 */
public final class ByteReader {

    private final byte[] data;

    public ByteReader(byte[] data) {
        this.data = data;
    }

    public int length() {
        return data.length;
    }

    public boolean has(long offset, long length) {
        return offset >= 0 && length >= 0 && offset + length <= data.length;
    }

    private void require(long offset, long length) {
        if (!has(offset, length)) {
            throw new MalformedStructureException("read of " + length + " bytes at " + offset
                    + " outside " + data.length + "-byte input");
        }
    }

    public int u8(long offset) {
        require(offset, 1);
        return data[(int) offset] & 0xFF;
    }

    public int u16le(long offset) {
        require(offset, 2);
        int o = (int) offset;
        return (data[o] & 0xFF) | (data[o + 1] & 0xFF) << 8;
    }

    public int u16be(long offset) {
        require(offset, 2);
        int o = (int) offset;
        return (data[o] & 0xFF) << 8 | (data[o + 1] & 0xFF);
    }

    public long u32le(long offset) {
        require(offset, 4);
        int o = (int) offset;
        return ((long) (data[o] & 0xFF)) | ((long) (data[o + 1] & 0xFF) << 8)
                | ((long) (data[o + 2] & 0xFF) << 16) | ((long) (data[o + 3] & 0xFF) << 24);
    }

    public long u32be(long offset) {
        require(offset, 4);
        int o = (int) offset;
        return ((long) (data[o] & 0xFF) << 24) | ((long) (data[o + 1] & 0xFF) << 16)
                | ((long) (data[o + 2] & 0xFF) << 8) | ((long) (data[o + 3] & 0xFF));
    }

    public long u64le(long offset) {
        return u32le(offset) | (u32le(offset + 4) << 32);
    }

    public long u64be(long offset) {
        return (u32be(offset) << 32) | u32be(offset + 4);
    }

    public String ascii(long offset, int length) {
        require(offset, length);
        return new String(data, (int) offset, length, StandardCharsets.ISO_8859_1);
    }

    /** NUL-terminated ASCII, at most {@code max} bytes. */
    public String cstring(long offset, int max) {
        int end = (int) offset;
        int limit = (int) Math.min(data.length, offset + max);
        while (end < limit && data[end] != 0) {
            end++;
        }
        require(offset, end - offset);
        return new String(data, (int) offset, end - (int) offset, StandardCharsets.ISO_8859_1);
    }

    public byte[] slice(long offset, int length) {
        require(offset, length);
        byte[] out = new byte[length];
        System.arraycopy(data, (int) offset, out, 0, length);
        return out;
    }
}
