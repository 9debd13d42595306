package com.apkinfo.androlib.res.decoder;

import com.apkinfo.androlib.AndrolibException;
import com.apkinfo.androlib.FormatException;
import com.apkinfo.androlib.TruncatedInputException;
import com.apkinfo.androlib.res.data.ResValue;
import com.apkinfo.androlib.res.data.ResXmlDocument;
import com.apkinfo.androlib.res.data.XmlAttribute;
import com.apkinfo.androlib.res.data.XmlNamespace;
import com.apkinfo.androlib.res.data.XmlNode;
import com.apkinfo.util.ExtDataInput;
import com.apkinfo.util.TypedValue;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Decodes Android binary xml (compiled {@code AndroidManifest.xml} and
 * friends) into an {@link XmlNode} tree.
 * <p>
 * The stream is one {@code RES_XML_TYPE} chunk holding a string pool, an
 * optional resource map and a flat run of namespace / element / cdata
 * chunks. Every interior chunk is handed to the reader registered for its
 * type; unknown types are skipped by their declared size.
 */
public class AXMLDecoder {

  private static final Logger LOGGER = Logger.getLogger(AXMLDecoder.class.getName());

  // line number + comment index
  private static final int NODE_HEADER = 16;
  private static final int ATTRIBUTE_SIZE = 20;
  private static final int ELEMENT_BODY = 20;

  private interface ChunkReader {
    void read(ChunkHeader header) throws IOException, AndrolibException;
  }

  private final ExtDataInput mIn;
  private final Map<Integer, ChunkReader> mReaders;
  private final Deque<XmlNamespace> mNamespaces = new ArrayDeque<>();
  private final List<XmlNamespace> mPendingNamespaces = new ArrayList<>();
  private final Deque<XmlNode> mElements = new ArrayDeque<>();
  private final List<String> mDiagnostics = new ArrayList<>();
  private StringBlock mStrings;
  private int[] mResourceMap = new int[0];
  private XmlNode mRoot;

  private AXMLDecoder(byte[] data) {
    mIn = new ExtDataInput(data);
    Map<Integer, ChunkReader> readers = new HashMap<>();
    readers.put(ChunkHeader.TYPE_STRING_POOL, this::readStringPool);
    readers.put(ChunkHeader.TYPE_XML_RESOURCE_MAP, this::readResourceMap);
    readers.put(ChunkHeader.TYPE_XML_START_NAMESPACE, this::readStartNamespace);
    readers.put(ChunkHeader.TYPE_XML_END_NAMESPACE, this::readEndNamespace);
    readers.put(ChunkHeader.TYPE_XML_START_ELEMENT, this::readStartElement);
    readers.put(ChunkHeader.TYPE_XML_END_ELEMENT, this::readEndElement);
    readers.put(ChunkHeader.TYPE_XML_CDATA, this::readCData);
    mReaders = Collections.unmodifiableMap(readers);
  }

  /**
   * Decodes a complete binary xml document. The input array is not modified.
   *
   * @throws FormatException the chunk stream is malformed
   * @throws TruncatedInputException the stream stops inside a chunk or with open scopes
   */
  public static ResXmlDocument decode(byte[] data) throws AndrolibException {
    if (data == null) {
      throw new IllegalArgumentException("data is null");
    }
    AXMLDecoder decoder = new AXMLDecoder(data);
    try {
      return decoder.readDocument();
    } catch (EOFException ex) {
      throw new TruncatedInputException("binary xml ended in the middle of a chunk", ex);
    } catch (IOException ex) {
      throw new FormatException("Could not decode binary xml", ex);
    }
  }

  private ResXmlDocument readDocument() throws IOException, AndrolibException {
    ChunkHeader document = ChunkHeader.read(mIn);
    if (document.type != ChunkHeader.TYPE_XML) {
      throw new FormatException(String.format("Invalid chunk type: expected=0x%04x, got=0x%04x",
          ChunkHeader.TYPE_XML, document.type));
    }
    document.seekToBody(mIn);

    while (mIn.position() < document.getEnd()) {
      ChunkHeader chunk = ChunkHeader.read(mIn);
      if (chunk.getEnd() > document.getEnd()) {
        throw new FormatException(String.format("%s runs past the end of its document chunk", chunk));
      }
      ChunkReader reader = mReaders.get(chunk.type);
      if (reader == null) {
        diagnostic(String.format("skipped unknown %s", chunk));
      } else {
        reader.read(chunk);
      }
      if (mIn.position() > chunk.getEnd()) {
        throw new FormatException(String.format("%s body is larger than its declared size", chunk));
      }
      chunk.skipToEnd(mIn);
    }

    if (!mNamespaces.isEmpty()) {
      throw new TruncatedInputException(String.format("document ended with %d open namespace(s), innermost %s",
          mNamespaces.size(), mNamespaces.peek()));
    }
    if (!mElements.isEmpty()) {
      throw new TruncatedInputException(String.format("document ended with %d open element(s), innermost <%s>",
          mElements.size(), mElements.peek().getTag()));
    }
    if (mRoot == null) {
      throw new FormatException("binary xml holds no element");
    }
    if (mIn.remaining() > 0) {
      diagnostic(String.format("ignored %d trailing bytes after the document chunk", mIn.remaining()));
    }
    return new ResXmlDocument(mRoot, mDiagnostics);
  }

  private void readStringPool(ChunkHeader header) throws IOException, AndrolibException {
    if (mStrings != null) {
      throw new FormatException(String.format("second string pool in binary xml at offset %d", header.start));
    }
    mStrings = StringBlock.read(mIn, header);
  }

  private void readResourceMap(ChunkHeader header) throws IOException {
    header.seekToBody(mIn);
    mResourceMap = mIn.readIntArray(header.getBodySize() / 4);
  }

  /**
   * Skips the line number / comment part shared by every node chunk and
   * checks the string pool is already known.
   */
  private void enterNode(ChunkHeader header, int bodySize) throws IOException, AndrolibException {
    if (header.headerSize < NODE_HEADER) {
      throw new FormatException(String.format("xml node header too small: %s", header));
    }
    if (header.getBodySize() < bodySize) {
      throw new FormatException(String.format("xml node body too small: %s", header));
    }
    if (mStrings == null) {
      throw new FormatException(String.format("%s appears before the string pool", header));
    }
    header.seekToBody(mIn);
  }

  private void readStartNamespace(ChunkHeader header) throws IOException, AndrolibException {
    enterNode(header, 8);
    String prefix = mStrings.resolve(mIn.readInt());
    String uri = mStrings.resolve(mIn.readInt());
    XmlNamespace namespace = new XmlNamespace(prefix, uri);
    mNamespaces.push(namespace);
    mPendingNamespaces.add(namespace);
  }

  private void readEndNamespace(ChunkHeader header) throws IOException, AndrolibException {
    enterNode(header, 8);
    String prefix = mStrings.resolve(mIn.readInt());
    String uri = mStrings.resolve(mIn.readInt());
    if (mNamespaces.isEmpty()) {
      throw new FormatException(String.format("namespace end (%s) without a matching start at offset %d",
          uri, header.start));
    }
    XmlNamespace open = mNamespaces.pop();
    if (uri != null && !uri.equals(open.getUri())) {
      diagnostic(String.format("namespace end %s closes %s", uri, open.getUri()));
    }
    if (prefix == null) {
      LOGGER.fine("namespace end without prefix");
    }
  }

  private void readStartElement(ChunkHeader header) throws IOException, AndrolibException {
    enterNode(header, ELEMENT_BODY);
    long bodyStart = header.getBodyStart();
    String namespace = mStrings.resolve(mIn.readInt());
    String name = mStrings.resolve(mIn.readInt());
    int attributeStart = mIn.readUnsignedShort();
    int attributeSize = mIn.readUnsignedShort();
    int attributeCount = mIn.readUnsignedShort();
    /* idIndex, classIndex, styleIndex */
    mIn.skipFully(6);

    if (name == null) {
      throw new FormatException(String.format("element without a name at offset %d", header.start));
    }
    if (attributeCount > 0) {
      if (attributeSize < ATTRIBUTE_SIZE) {
        throw new FormatException(String.format("<%s> declares attribute size %d", name, attributeSize));
      }
      long attributesEnd = bodyStart + attributeStart + (long) attributeSize * attributeCount;
      if (attributesEnd > header.getEnd()) {
        throw new FormatException(String.format("<%s> declares %d attributes, more than fit in %s",
            name, attributeCount, header));
      }
    }

    List<XmlAttribute> attributes = new ArrayList<>(attributeCount);
    for (int i = 0; i < attributeCount; i++) {
      mIn.seek(bodyStart + attributeStart + (long) attributeSize * i);
      attributes.add(readAttribute());
    }

    XmlNode node = new XmlNode(namespace, name, attributes, mPendingNamespaces);
    mPendingNamespaces.clear();
    mElements.push(node);
  }

  private XmlAttribute readAttribute() throws IOException, AndrolibException {
    String namespace = mStrings.resolve(mIn.readInt());
    int nameIndex = mIn.readInt();
    int rawValueIndex = mIn.readInt();
    ResValue typedValue = readValue();

    int resourceId = nameIndex >= 0 && nameIndex < mResourceMap.length ? mResourceMap[nameIndex] : 0;
    String name = mStrings.resolve(nameIndex);
    if ((name == null || name.isEmpty()) && resourceId != 0) {
      name = AndroidAttributes.nameOf(resourceId);
      if (name == null) {
        name = String.format("attr_0x%08x", resourceId);
      }
    }
    String rawValue = mStrings.resolve(rawValueIndex);
    return new XmlAttribute(namespace, name, resourceId, rawValue, typedValue);
  }

  private ResValue readValue() throws IOException, AndrolibException {
    /* size */
    mIn.skipFully(2);
    /* res0 */
    mIn.skipFully(1);
    int type = mIn.readUnsignedByte();
    int data = mIn.readInt();
    String string = type == TypedValue.TYPE_STRING ? mStrings.resolve(data) : null;
    return new ResValue(type, data, string);
  }

  private void readEndElement(ChunkHeader header) throws IOException, AndrolibException {
    enterNode(header, 8);
    /* namespace */
    mIn.skipInt();
    String name = mStrings.resolve(mIn.readInt());
    if (mElements.isEmpty()) {
      throw new FormatException(String.format("end tag </%s> without a matching start at offset %d",
          name, header.start));
    }
    XmlNode node = mElements.pop();
    if (name != null && !name.equals(node.getTag())) {
      diagnostic(String.format("end tag </%s> closes <%s>", name, node.getTag()));
    }
    if (mElements.isEmpty()) {
      if (mRoot != null) {
        throw new FormatException(String.format("second root element <%s>", node.getTag()));
      }
      mRoot = node;
    } else {
      mElements.peek().addChild(node);
    }
  }

  private void readCData(ChunkHeader header) throws IOException, AndrolibException {
    enterNode(header, 4);
    String data = mStrings.resolve(mIn.readInt());
    if (data == null) {
      return;
    }
    if (mElements.isEmpty()) {
      diagnostic("character data outside of any element");
      return;
    }
    mElements.peek().appendText(data);
  }

  private void diagnostic(String message) {
    LOGGER.fine(message);
    mDiagnostics.add(message);
  }
}
