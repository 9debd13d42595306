package com.apkinfo.androlib.res.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of decoding a binary xml file: the root element plus anything the
 * decoder skipped or tolerated on the way.
 */
public final class ResXmlDocument {
  private final XmlNode mRoot;
  private final List<String> mDiagnostics;

  public ResXmlDocument(XmlNode root, List<String> diagnostics) {
    this.mRoot = root;
    this.mDiagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public XmlNode getRoot() {
    return mRoot;
  }

  public List<String> getDiagnostics() {
    return mDiagnostics;
  }
}
