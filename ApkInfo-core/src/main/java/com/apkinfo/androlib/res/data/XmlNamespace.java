package com.apkinfo.androlib.res.data;

public final class XmlNamespace {
  private final String mPrefix;
  private final String mUri;

  public XmlNamespace(String prefix, String uri) {
    this.mPrefix = prefix;
    this.mUri = uri;
  }

  public String getPrefix() {
    return mPrefix;
  }

  public String getUri() {
    return mUri;
  }

  @Override
  public String toString() {
    return "xmlns:" + mPrefix + "=\"" + mUri + "\"";
  }
}
