package com.apkinfo.androlib.res.decoder;

import com.apkinfo.androlib.AndrolibException;
import com.apkinfo.androlib.FormatException;
import com.apkinfo.androlib.TruncatedInputException;
import com.apkinfo.util.ExtDataInput;

import java.io.IOException;

/**
 * The eight byte {@code ResChunk_header} that starts every chunk of a binary
 * xml file or resource table: type, header size and total chunk size.
 */
public final class ChunkHeader {
  public final static int TYPE_NULL = 0x0000, TYPE_STRING_POOL = 0x0001, TYPE_TABLE = 0x0002, TYPE_XML = 0x0003;

  public final static int TYPE_XML_START_NAMESPACE = 0x0100, TYPE_XML_END_NAMESPACE = 0x0101,
      TYPE_XML_START_ELEMENT = 0x0102, TYPE_XML_END_ELEMENT = 0x0103, TYPE_XML_CDATA = 0x0104,
      TYPE_XML_RESOURCE_MAP = 0x0180;

  public final static int TYPE_PACKAGE = 0x0200, TYPE_TYPE = 0x0201, TYPE_SPEC_TYPE = 0x0202,
      TYPE_LIBRARY = 0x0203, TYPE_OVERLAYABLE = 0x0204, TYPE_OVERLAYABLE_POLICY = 0x0205,
      TYPE_STAGED_ALIAS = 0x0206;

  public static final int SIZE = 8;

  public final int type;
  public final int headerSize;
  public final int chunkSize;
  public final long start;

  public ChunkHeader(int type, int headerSize, int chunkSize, long start) {
    this.type = type;
    this.headerSize = headerSize;
    this.chunkSize = chunkSize;
    this.start = start;
  }

  /**
   * Reads the header at the current position and checks it against the bytes
   * left in the stream.
   *
   * @throws TruncatedInputException fewer than eight bytes are left
   * @throws FormatException the sizes are inconsistent or run past the stream
   */
  public static ChunkHeader read(ExtDataInput in) throws IOException, AndrolibException {
    long start = in.position();
    if (in.remaining() < SIZE) {
      throw new TruncatedInputException(String.format(
          "chunk header at offset %d needs %d bytes, only %d left", start, SIZE, in.remaining()));
    }
    int type = in.readUnsignedShort();
    int headerSize = in.readUnsignedShort();
    long chunkSize = in.readInt() & 0xffffffffL;

    if (headerSize < SIZE) {
      throw new FormatException(String.format(
          "chunk 0x%04x at offset %d: header size %d smaller than %d", type, start, headerSize, SIZE));
    }
    if (chunkSize < headerSize) {
      throw new FormatException(String.format(
          "chunk 0x%04x at offset %d: header size %d exceeds chunk size %d", type, start, headerSize, chunkSize));
    }
    if (chunkSize > in.length() - start) {
      throw new FormatException(String.format(
          "chunk 0x%04x at offset %d: size %d runs past the end of stream (%d bytes left)",
          type, start, chunkSize, in.length() - start));
    }
    return new ChunkHeader(type, headerSize, (int) chunkSize, start);
  }

  public long getEnd() {
    return start + chunkSize;
  }

  public long getBodyStart() {
    return start + headerSize;
  }

  public int getBodySize() {
    return chunkSize - headerSize;
  }

  /** Skips any header bytes this reader does not know about. */
  public void seekToBody(ExtDataInput in) throws IOException {
    in.seek(getBodyStart());
  }

  public void skipToEnd(ExtDataInput in) throws IOException {
    in.seek(getEnd());
  }

  @Override
  public String toString() {
    return String.format("chunk(type=0x%04x, header=%d, size=%d, at=%d)", type, headerSize, chunkSize, start);
  }
}
