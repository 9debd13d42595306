package com.apkinfo.androlib.res.decoder;

import com.google.common.io.LittleEndianDataOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Little-endian byte builder for hand-made chunk fixtures.
 */
public final class ChunkWriter {

    public static final int NONE = 0xFFFFFFFF;

    private final ByteArrayOutputStream mBytes = new ByteArrayOutputStream();
    private final LittleEndianDataOutputStream mOut = new LittleEndianDataOutputStream(mBytes);

    public ChunkWriter u8(int value) {
        try {
            mOut.writeByte(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ChunkWriter u16(int value) {
        try {
            mOut.writeShort(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ChunkWriter u32(int value) {
        try {
            mOut.writeInt(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ChunkWriter bytes(byte[] data) {
        try {
            mOut.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /** UTF-16 text padded with NULs to exactly {@code chars} characters. */
    public ChunkWriter utf16Fixed(String text, int chars) {
        for (int i = 0; i < chars; i++) {
            u16(i < text.length() ? text.charAt(i) : 0);
        }
        return this;
    }

    public ChunkWriter pad4() {
        while (mBytes.size() % 4 != 0) {
            u8(0);
        }
        return this;
    }

    public int size() {
        return mBytes.size();
    }

    public byte[] toByteArray() {
        return mBytes.toByteArray();
    }

    /** A chunk whose header is the 8 common bytes followed by {@code headerFields}. */
    public static byte[] chunk(int type, byte[] headerFields, byte[] body) {
        int headerSize = 8 + headerFields.length;
        return new ChunkWriter()
            .u16(type)
            .u16(headerSize)
            .u32(headerSize + body.length)
            .bytes(headerFields)
            .bytes(body)
            .toByteArray();
    }

    public static byte[] concat(byte[]... parts) {
        ChunkWriter writer = new ChunkWriter();
        for (byte[] part : parts) {
            writer.bytes(part);
        }
        return writer.toByteArray();
    }

    public static byte[] stringPool(boolean utf8, String... strings) {
        ChunkWriter data = new ChunkWriter();
        int[] offsets = new int[strings.length];
        for (int i = 0; i < strings.length; i++) {
            offsets[i] = data.size();
            if (utf8) {
                byte[] encoded = strings[i].getBytes(StandardCharsets.UTF_8);
                writeUtf8Length(data, strings[i].length());
                writeUtf8Length(data, encoded.length);
                data.bytes(encoded).u8(0);
            } else {
                data.u16(strings[i].length());
                for (int c = 0; c < strings[i].length(); c++) {
                    data.u16(strings[i].charAt(c));
                }
                data.u16(0);
            }
        }
        data.pad4();

        int headerSize = 28;
        ChunkWriter header = new ChunkWriter()
            .u32(strings.length)
            .u32(0)
            .u32(utf8 ? 0x100 : 0)
            .u32(headerSize + 4 * strings.length)
            .u32(0);
        ChunkWriter body = new ChunkWriter();
        for (int offset : offsets) {
            body.u32(offset);
        }
        body.bytes(data.toByteArray());
        return chunk(ChunkHeader.TYPE_STRING_POOL, header.toByteArray(), body.toByteArray());
    }

    private static void writeUtf8Length(ChunkWriter writer, int length) {
        if (length > 0x7f) {
            writer.u8(0x80 | (length >> 8)).u8(length & 0xff);
        } else {
            writer.u8(length);
        }
    }
}
