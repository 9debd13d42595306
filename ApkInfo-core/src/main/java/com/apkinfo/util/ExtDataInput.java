package com.apkinfo.util;

import com.google.common.io.LittleEndianDataInputStream;

import org.apache.commons.io.input.CountingInputStream;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;

/**
 * Little-endian reader over an in-memory chunk stream. Keeps track of the
 * absolute read position so chunk decoders can seek to declared boundaries.
 */
public class ExtDataInput extends DataInputDelegate {

    private final byte[]              mData;
    private final CountingInputStream mCounter;
    private final long                mLength;

    public ExtDataInput(byte[] data) {
        this(data, new CountingInputStream(new ByteArrayInputStream(data)));
    }

    private ExtDataInput(byte[] data, CountingInputStream counter) {
        super(new LittleEndianDataInputStream(counter));
        this.mData = data;
        this.mCounter = counter;
        this.mLength = data.length;
    }

    /** A second reader over the same bytes, positioned at the start. */
    public ExtDataInput fork() {
        return new ExtDataInput(mData);
    }

    public long position() {
        return mCounter.getByteCount();
    }

    public long length() {
        return mLength;
    }

    public long remaining() {
        return mLength - position();
    }

    public int[] readIntArray(int length) throws IOException {
        if (length < 0 || (long) length * 4 > remaining()) {
            throw new EOFException(String.format("int array of %d entries runs past the end of stream", length));
        }
        int[] array = new int[length];
        for (int i = 0; i < length; i++) {
            array[i] = readInt();
        }
        return array;
    }

    public void skipInt() throws IOException {
        skipFully(4);
    }

    /**
     * Skips exactly {@code count} bytes or throws {@link EOFException}; unlike
     * {@link #skipBytes(int)} a short skip is never silently accepted.
     */
    public void skipFully(long count) throws IOException {
        if (count < 0) {
            throw new IOException(String.format("negative skip: %d", count));
        }
        if (count > remaining()) {
            throw new EOFException(String.format("skip of %d bytes runs past the end of stream (%d left)",
                count, remaining()));
        }
        long left = count;
        while (left > 0) {
            int step = (int) Math.min(left, Integer.MAX_VALUE);
            int skipped = skipBytes(step);
            if (skipped <= 0) {
                throw new EOFException("unexpected end of stream while skipping");
            }
            left -= skipped;
        }
    }

    /** Moves forward to the absolute offset {@code target}. */
    public void seek(long target) throws IOException {
        long current = position();
        if (target < current) {
            throw new IOException(String.format("can not seek backwards: at %d, target %d", current, target));
        }
        skipFully(target - current);
    }

    /**
     * Reads a fixed-width UTF-16 field (such as a package name) and stops at
     * the first NUL; the rest of the field is skipped.
     */
    public String readNullEndedString(int length, boolean fixed) throws IOException {
        StringBuilder string = new StringBuilder(16);
        while (length-- != 0) {
            short ch = readShort();
            if (ch == 0) {
                break;
            }
            string.append((char) ch);
        }
        if (fixed) {
            skipFully(Math.max(length, 0) * 2L);
        }
        return string.toString();
    }
}
