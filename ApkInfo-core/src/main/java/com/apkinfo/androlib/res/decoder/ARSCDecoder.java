/**
 * Copyright 2014 Ryszard Wiśniewski <brut.alll@gmail.com>
 * Copyright 2016 sim sun <sunsj1231@gmail.com>
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apkinfo.androlib.res.decoder;

import com.apkinfo.androlib.AndrolibException;
import com.apkinfo.androlib.FormatException;
import com.apkinfo.androlib.TruncatedInputException;
import com.apkinfo.androlib.res.data.ResConfig;
import com.apkinfo.androlib.res.data.ResEntry;
import com.apkinfo.androlib.res.data.ResPackage;
import com.apkinfo.androlib.res.data.ResTable;
import com.apkinfo.androlib.res.data.ResType;
import com.apkinfo.androlib.res.data.ResValue;
import com.apkinfo.util.ExtDataInput;
import com.apkinfo.util.TypedValue;

import java.io.EOFException;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads {@code resources.arsc} into a {@link ResTable}: every package, every
 * type chunk with its configuration, and every present entry of it.
 */
public class ARSCDecoder {

  private final static int ENTRY_FLAG_COMPLEX = 0x0001;
  private final static int ENTRY_FLAG_COMPACT = 0x0008;
  private final static int TYPE_FLAG_SPARSE = 0x01;
  private final static int TYPE_FLAG_OFFSET16 = 0x02;
  private final static int NO_ENTRY = 0xFFFFFFFF;
  private final static int NO_ENTRY16 = 0xFFFF;

  private static final Logger LOGGER = Logger.getLogger(ARSCDecoder.class.getName());
  private static final int KNOWN_CONFIG_BYTES = 64;
  private static final int MIN_CONFIG_BYTES = 28;
  private static final int PACKAGE_NAME_LENGTH = 128;

  private final ExtDataInput mIn;
  private StringBlock mTableStrings;
  private StringBlock mTypeNames;
  private StringBlock mSpecNames;
  private ResPackage mPkg;
  private int mTypeIdOffset;

  private ARSCDecoder(byte[] data) {
    mIn = new ExtDataInput(data);
  }

  /**
   * Decodes a complete resource table. The input array is not modified.
   *
   * @throws FormatException the chunk stream is malformed or references a missing string
   * @throws TruncatedInputException the stream stops inside a chunk
   */
  public static ResTable decode(byte[] data) throws AndrolibException {
    if (data == null) {
      throw new IllegalArgumentException("data is null");
    }
    try {
      ARSCDecoder decoder = new ARSCDecoder(data);
      return new ResTable(decoder.readTable());
    } catch (EOFException ex) {
      throw new TruncatedInputException("resource table ended in the middle of a chunk", ex);
    } catch (IOException ex) {
      throw new FormatException("Could not decode arsc file", ex);
    }
  }

  private List<ResPackage> readTable() throws IOException, AndrolibException {
    ChunkHeader table = ChunkHeader.read(mIn);
    checkChunkType(table, ChunkHeader.TYPE_TABLE);
    int packageCount = mIn.readInt();
    table.seekToBody(mIn);

    List<ResPackage> packages = new ArrayList<>(Math.max(packageCount, 0));
    while (mIn.position() < table.getEnd()) {
      ChunkHeader chunk = nextChunk(table);
      switch (chunk.type) {
        case ChunkHeader.TYPE_STRING_POOL:
          if (mTableStrings != null) {
            throw new FormatException(String.format("second global string pool at offset %d", chunk.start));
          }
          mTableStrings = StringBlock.read(mIn, chunk);
          break;
        case ChunkHeader.TYPE_PACKAGE:
          packages.add(readPackage(chunk));
          break;
        default:
          LOGGER.fine(String.format("skipping %s in table", chunk));
          break;
      }
      chunk.skipToEnd(mIn);
    }
    if (packages.size() != packageCount) {
      LOGGER.warning(String.format("table declares %d package(s), found %d", packageCount, packages.size()));
    }
    return packages;
  }

  private ResPackage readPackage(ChunkHeader header) throws IOException, AndrolibException {
    int id = mIn.readInt();
    String name = mIn.readNullEndedString(PACKAGE_NAME_LENGTH, true);
    int typeStrings = mIn.readInt();
    /* lastPublicType */
    mIn.skipInt();
    int keyStrings = mIn.readInt();
    /* lastPublicKey */
    mIn.skipInt();
    mTypeIdOffset = 0;
    if (header.headerSize >= 288) {
      mTypeIdOffset = mIn.readInt();
    }
    if (id < 0 || id > 0xff) {
      throw new FormatException(String.format("package id 0x%x of %s out of range", id, name));
    }
    LOGGER.fine(String.format("reading package %s (0x%02x)", name, id));

    mPkg = new ResPackage(id, name);
    mTypeNames = null;
    mSpecNames = null;
    header.seekToBody(mIn);

    while (mIn.position() < header.getEnd()) {
      ChunkHeader chunk = nextChunk(header);
      long relative = chunk.start - header.start;
      switch (chunk.type) {
        case ChunkHeader.TYPE_STRING_POOL:
          if (relative == typeStrings || (mTypeNames == null && typeStrings == 0)) {
            mTypeNames = StringBlock.read(mIn, chunk);
          } else if (relative == keyStrings || (mSpecNames == null && keyStrings == 0)) {
            mSpecNames = StringBlock.read(mIn, chunk);
          } else {
            LOGGER.fine(String.format("skipping extra string pool %s in package %s", chunk, name));
          }
          break;
        case ChunkHeader.TYPE_SPEC_TYPE:
          /* per-entry configuration change masks are not needed for lookups */
          break;
        case ChunkHeader.TYPE_TYPE:
          readConfig(chunk);
          break;
        case ChunkHeader.TYPE_LIBRARY:
          readLibraryType();
          break;
        default:
          LOGGER.fine(String.format("skipping %s in package %s", chunk, name));
          break;
      }
      chunk.skipToEnd(mIn);
    }
    return mPkg;
  }

  private void readLibraryType() throws IOException {
    int libraryCount = mIn.readInt();
    for (int i = 0; i < libraryCount; i++) {
      int packageId = mIn.readInt();
      String packageName = mIn.readNullEndedString(PACKAGE_NAME_LENGTH, true);
      LOGGER.fine(String.format("shared library %s, pkgId: %d", packageName, packageId));
    }
  }

  private void readConfig(ChunkHeader header) throws IOException, AndrolibException {
    if (mTypeNames == null || mSpecNames == null) {
      throw new FormatException(String.format("%s appears before the package string pools", header));
    }
    int id = mIn.readUnsignedByte();
    int flags = mIn.readUnsignedByte();
    /* reserved */
    mIn.skipFully(2);
    int entryCount = mIn.readInt();
    int entriesStart = mIn.readInt();
    ResConfig config = readConfigFlags();
    header.seekToBody(mIn);

    if (id == 0) {
      throw new FormatException(String.format("type id 0 in %s", header));
    }
    if (entryCount < 0 || entriesStart < header.headerSize || entriesStart > header.chunkSize) {
      throw new FormatException(String.format("type chunk with %d entries at %d does not fit %s",
          entryCount, entriesStart, header));
    }
    ResType type = mPkg.getOrCreateType(id, mTypeNames.resolve(id - 1 - mTypeIdOffset));

    int[] indices = new int[entryCount];
    int[] offsets = new int[entryCount];
    if ((flags & TYPE_FLAG_SPARSE) != 0) {
      for (int i = 0; i < entryCount; i++) {
        indices[i] = mIn.readUnsignedShort();
        offsets[i] = mIn.readUnsignedShort() * 4;
      }
    } else if ((flags & TYPE_FLAG_OFFSET16) != 0) {
      for (int i = 0; i < entryCount; i++) {
        int offset = mIn.readUnsignedShort();
        indices[i] = i;
        offsets[i] = offset == NO_ENTRY16 ? NO_ENTRY : offset * 4;
      }
    } else {
      int[] raw = mIn.readIntArray(entryCount);
      for (int i = 0; i < entryCount; i++) {
        indices[i] = i;
        offsets[i] = raw[i];
      }
    }

    long entriesBase = header.start + entriesStart;
    for (int i = 0; i < entryCount; i++) {
      if (offsets[i] == NO_ENTRY) {
        continue;
      }
      long entryStart = entriesBase + (offsets[i] & 0xffffffffL);
      if (entryStart + 8 > header.getEnd()) {
        throw new FormatException(String.format("entry %d of type %s at %d runs past %s",
            indices[i], type.getName(), entryStart, header));
      }
      if (entryStart < mIn.position()) {
        // offsets are normally ascending; a shared entry needs a fresh reader
        type.addEntry(indices[i], readEntryAt(entryStart, header, config));
        continue;
      }
      mIn.seek(entryStart);
      type.addEntry(indices[i], readEntry(mIn, header, config));
    }
  }

  private ResEntry readEntryAt(long entryStart, ChunkHeader header, ResConfig config)
      throws IOException, AndrolibException {
    ExtDataInput in = mIn.fork();
    in.seek(entryStart);
    return readEntry(in, header, config);
  }

  private ResEntry readEntry(ExtDataInput in, ChunkHeader header, ResConfig config)
      throws IOException, AndrolibException {
    int size = in.readUnsignedShort();
    int flags = in.readUnsignedShort();

    if ((flags & ENTRY_FLAG_COMPACT) != 0) {
      String name = mSpecNames.resolve(size);
      int type = (flags >>> 8) & 0xff;
      int data = in.readInt();
      return ResEntry.simple(config, name, toValue(type, data));
    }

    String name = mSpecNames.resolve(in.readInt());
    if ((flags & ENTRY_FLAG_COMPLEX) == 0) {
      return ResEntry.simple(config, name, readValue(in));
    }
    return readComplexEntry(in, header, config, name);
  }

  private ResEntry readComplexEntry(ExtDataInput in, ChunkHeader header, ResConfig config, String name)
      throws IOException, AndrolibException {
    int parent = in.readInt();
    int count = in.readInt();
    if (count < 0 || in.position() + 12L * count > header.getEnd()) {
      throw new FormatException(String.format("complex entry %s declares %d items, more than fit in %s",
          name, count, header));
    }
    Map<Integer, ResValue> bag = new LinkedHashMap<>();
    for (int i = 0; i < count; i++) {
      int key = in.readInt();
      bag.put(key, readValue(in));
    }
    return ResEntry.complex(config, name, parent, bag);
  }

  private ResValue readValue(ExtDataInput in) throws IOException, AndrolibException {
    int size = in.readUnsignedShort();
    if (size < 8) {
      throw new FormatException(String.format("value size %d at %d smaller than 8", size, in.position() - 2));
    }
    /* zero */
    in.skipFully(1);
    int type = in.readUnsignedByte();
    int data = in.readInt();
    return toValue(type, data);
  }

  private ResValue toValue(int type, int data) throws AndrolibException {
    if (type != TypedValue.TYPE_STRING) {
      return new ResValue(type, data, null);
    }
    if (mTableStrings == null) {
      throw new FormatException(String.format("string value %d without a global string pool", data));
    }
    return new ResValue(type, data, mTableStrings.resolve(data));
  }

  private ResConfig readConfigFlags() throws IOException, AndrolibException {
    long start = mIn.position();
    int size = mIn.readInt();
    if (size < MIN_CONFIG_BYTES) {
      throw new FormatException("Config size < " + MIN_CONFIG_BYTES);
    }
    ResConfig.Builder builder = new ResConfig.Builder();

    builder.setMcc(mIn.readUnsignedShort());
    builder.setMnc(mIn.readUnsignedShort());

    builder.setLanguage(unpackLanguageOrRegion(mIn.readByte(), mIn.readByte(), 'a'));
    builder.setCountry(unpackLanguageOrRegion(mIn.readByte(), mIn.readByte(), '0'));

    builder.setOrientation(mIn.readUnsignedByte());
    builder.setTouchscreen(mIn.readUnsignedByte());

    builder.setDensity(mIn.readUnsignedShort());

    builder.setKeyboard(mIn.readUnsignedByte());
    builder.setNavigation(mIn.readUnsignedByte());
    builder.setInputFlags(mIn.readUnsignedByte());
    /* inputPad0 */
    mIn.skipFully(1);

    builder.setScreenSize(mIn.readUnsignedShort(), mIn.readUnsignedShort());

    builder.setSdkVersion(mIn.readUnsignedShort());
    /* minorVersion, now must always be 0 */
    mIn.skipFully(2);

    if (size >= 32) {
      builder.setScreenLayout(mIn.readUnsignedByte());
      builder.setUiMode(mIn.readUnsignedByte());
      builder.setSmallestScreenWidthDp(mIn.readUnsignedShort());
    }

    if (size >= 36) {
      builder.setScreenSizeDp(mIn.readUnsignedShort(), mIn.readUnsignedShort());
    }

    if (size >= 48) {
      builder.setLocaleScript(readScriptOrVariantChar(4));
      builder.setLocaleVariant(readScriptOrVariantChar(8));
    }

    if (size >= 52) {
      builder.setScreenLayout2(mIn.readUnsignedByte());
      builder.setColorMode(mIn.readUnsignedByte());
      /* screenConfigPad2 */
      mIn.skipFully(2);
    }

    long read = mIn.position() - start;
    int exceedingSize = (int) (size - read);
    if (exceedingSize > 0) {
      byte[] buf = new byte[exceedingSize];
      mIn.readFully(buf);
      BigInteger exceedingBI = new BigInteger(1, buf);
      if (exceedingBI.equals(BigInteger.ZERO) || size <= KNOWN_CONFIG_BYTES) {
        LOGGER.fine(String.format("Config flags carry %d bytes this reader ignores", exceedingSize));
      } else {
        LOGGER.warning(String.format("Config flags size > %d. Exceeding bytes: 0x%X.",
            KNOWN_CONFIG_BYTES, exceedingBI));
      }
    }
    return builder.create();
  }

  /**
   * Two-letter codes are stored as plain ASCII; three-letter codes are packed
   * into 15 bits with the high bit of the first byte set.
   */
  private static String unpackLanguageOrRegion(byte in0, byte in1, char base) {
    if ((in0 & 0x80) != 0) {
      char first = (char) (base + (in1 & 0x1f));
      char second = (char) (base + ((in1 & 0xe0) >> 5) + ((in0 & 0x03) << 3));
      char third = (char) (base + ((in0 & 0x7c) >> 2));
      return new String(new char[] {first, second, third});
    }
    if (in0 == 0) {
      return "";
    }
    if (in1 == 0) {
      return String.valueOf((char) in0);
    }
    return new String(new char[] {(char) in0, (char) in1});
  }

  private String readScriptOrVariantChar(int length) throws IOException {
    StringBuilder string = new StringBuilder(16);

    while (length-- != 0) {
      short ch = mIn.readByte();
      if (ch == 0) {
        break;
      }
      string.append((char) ch);
    }
    mIn.skipFully(Math.max(length, 0));

    return string.toString();
  }

  private ChunkHeader nextChunk(ChunkHeader parent) throws IOException, AndrolibException {
    ChunkHeader chunk = ChunkHeader.read(mIn);
    if (chunk.getEnd() > parent.getEnd()) {
      throw new FormatException(String.format("%s runs past the end of its parent %s", chunk, parent));
    }
    return chunk;
  }

  private static void checkChunkType(ChunkHeader header, int expectedType) throws AndrolibException {
    if (header.type != expectedType) {
      throw new FormatException(String.format("Invalid chunk type: expected=0x%04x, got=0x%04x",
          expectedType, header.type));
    }
  }
}
