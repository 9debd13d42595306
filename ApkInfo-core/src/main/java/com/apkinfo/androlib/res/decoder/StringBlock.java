/**
 *  Copyright 2014 Ryszard Wiśniewski <brut.alll@gmail.com>
 *  Copyright 2016 sim sun <sunsj1231@gmail.com>
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package com.apkinfo.androlib.res.decoder;

import com.apkinfo.androlib.AndrolibException;
import com.apkinfo.androlib.FormatException;
import com.apkinfo.util.ExtDataInput;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * A decoded {@code ResStringPool}. Strings are kept in their encoded form and
 * decoded on first access; both UTF-8 and UTF-16 pools come out as
 * {@link String}.
 */
public class StringBlock {

    private static final Logger LOGGER        = Logger.getLogger(StringBlock.class.getName());

    private static final int    UTF8_FLAG     = 0x00000100;
    private static final int    POOL_HEADER   = 28;
    private static final int    NO_ENTRY      = 0xFFFFFFFF;

    // CharsetDecoder is stateful, so every block gets its own
    private final CharsetDecoder m_decoder;

    private int[]    m_stringOffsets;
    private byte[]   m_strings;
    private boolean  m_isUTF8;
    private String[] m_cache;

    private StringBlock(boolean isUTF8) {
        m_isUTF8 = isUTF8;
        m_decoder = (isUTF8 ? StandardCharsets.UTF_8 : StandardCharsets.UTF_16LE).newDecoder();
    }

    /**
     * Reads a whole string pool chunk, header included. Stream must be at the
     * chunk type.
     * @param reader reader
     * @return stringblock
     */
    public static StringBlock read(ExtDataInput reader) throws IOException, AndrolibException {
        ChunkHeader header = ChunkHeader.read(reader);
        if (header.type != ChunkHeader.TYPE_STRING_POOL) {
            throw new FormatException(String.format("Expected string pool chunk, got: %s", header));
        }
        return read(reader, header);
    }

    /**
     * Reads the rest of a string pool chunk whose header was already consumed.
     * Leaves the stream at the end of the chunk.
     */
    public static StringBlock read(ExtDataInput reader, ChunkHeader header) throws IOException, AndrolibException {
        if (header.headerSize < POOL_HEADER) {
            throw new FormatException(String.format("string pool header too small: %s", header));
        }
        int stringCount = reader.readInt();
        int styleCount = reader.readInt();
        int flags = reader.readInt();
        int stringsOffset = reader.readInt();
        int stylesOffset = reader.readInt();
        header.seekToBody(reader);

        if (stringCount < 0 || styleCount < 0
            || (long) (stringCount + (long) styleCount) * 4 > header.getBodySize()) {
            throw new FormatException(String.format(
                "string pool declares %d strings and %d styles, too many for %s", stringCount, styleCount, header));
        }

        StringBlock block = new StringBlock((flags & UTF8_FLAG) != 0);
        block.m_stringOffsets = reader.readIntArray(stringCount);
        block.m_cache = new String[stringCount];
        // style spans are not needed for plain text
        reader.skipFully(styleCount * 4L);

        if (stringCount > 0) {
            int end = (stylesOffset == 0) ? header.chunkSize : stylesOffset;
            if (stringsOffset < header.headerSize || stringsOffset > end || end > header.chunkSize) {
                throw new FormatException(String.format(
                    "string data [%d, %d) outside of %s", stringsOffset, end, header));
            }
            int size = end - stringsOffset;
            if ((size % 4) != 0) {
                LOGGER.fine(String.format("String data size is not multiple of 4 (%d).", size));
            }
            reader.seek(header.start + stringsOffset);
            block.m_strings = new byte[size];
            reader.readFully(block.m_strings);
        } else {
            block.m_strings = new byte[0];
        }
        header.skipToEnd(reader);
        return block;
    }

    private static int[] getUtf8(byte[] array, int offset) {
        int val = array[offset];
        int length;
        // We skip the utf16 length of the string
        if ((val & 0x80) != 0) {
            offset += 2;
        } else {
            offset += 1;
        }
        // And we read only the utf-8 encoded length of the string
        val = array[offset];
        offset += 1;
        if ((val & 0x80) != 0) {
            int low = (array[offset] & 0xFF);
            length = ((val & 0x7F) << 8) + low;
            offset += 1;
        } else {
            length = val;
        }
        return new int[] { offset, length};
    }

    private static int[] getUtf16(byte[] array, int offset) {
        int val = ((array[offset + 1] & 0xFF) << 8 | array[offset] & 0xFF);

        if ((val & 0x8000) != 0) {
            int high = (array[offset + 3] & 0xFF) << 8;
            int low = (array[offset + 2] & 0xFF);
            int len_value =  ((val & 0x7FFF) << 16) + (high + low);
            return new int[] {4, len_value * 2};

        }
        return new int[] {2, val * 2};
    }

    /**
     * Returns number of strings in block.
     * @return int number of strings in block.
     */
    public int getCount() {
        return m_stringOffsets != null ? m_stringOffsets.length : 0;
    }

    public boolean isUTF8() {
        return m_isUTF8;
    }

    /**
     * Returns raw string (without any styling information) at specified index,
     * or null when the index is out of range or the bytes do not decode.
     * @param index index
     * @return raw string
     */
    public String getString(int index) {
        if (index < 0 || m_stringOffsets == null || index >= m_stringOffsets.length) {
            return null;
        }
        if (m_cache[index] != null) {
            return m_cache[index];
        }
        int offset = m_stringOffsets[index];
        if (offset < 0 || offset + 2 > m_strings.length) {
            LOGGER.warning(String.format("string %d starts outside of the pool (offset %d)", index, offset));
            return null;
        }
        int length;

        try {
            if (m_isUTF8) {
                int[] val = getUtf8(m_strings, offset);
                offset = val[0];
                length = val[1];
            } else {
                int[] val = getUtf16(m_strings, offset);
                offset += val[0];
                length = val[1];
            }
        } catch (ArrayIndexOutOfBoundsException ex) {
            LOGGER.warning(String.format("length prefix of string %d is cut off by the end of the pool", index));
            return null;
        }
        if (offset + length > m_strings.length) {
            LOGGER.warning(String.format("string %d runs past the end of the pool", index));
            return null;
        }
        m_cache[index] = decodeString(offset, length);
        return m_cache[index];
    }

    /**
     * Looks up a string referenced from another chunk. The "no string" marker
     * (0xFFFFFFFF) yields null; any other index outside the pool is a format
     * error.
     */
    public String resolve(int index) throws FormatException {
        if (index == NO_ENTRY) {
            return null;
        }
        if (index < 0 || index >= getCount()) {
            throw new FormatException(String.format("string index %d out of range, pool holds %d strings",
                index, getCount()));
        }
        return getString(index);
    }

    private String decodeString(int offset, int length) {
        try {
            m_decoder.reset();
            return m_decoder.decode(ByteBuffer.wrap(m_strings, offset, length)).toString();
        } catch (CharacterCodingException ex) {
            LOGGER.log(Level.WARNING, null, ex);
            return null;
        }
    }

}
