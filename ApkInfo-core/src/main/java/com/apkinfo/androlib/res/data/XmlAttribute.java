package com.apkinfo.androlib.res.data;

/**
 * A decoded binary xml attribute. {@link #getValue()} is the resolved text:
 * the raw string when the document kept one, otherwise the typed value
 * rendered as text.
 */
public final class XmlAttribute {
  private final String mNamespace;
  private final String mName;
  private final int mResourceId;
  private final String mRawValue;
  private final ResValue mTypedValue;

  public XmlAttribute(String namespace, String name, int resourceId, String rawValue, ResValue typedValue) {
    this.mNamespace = namespace;
    this.mName = name;
    this.mResourceId = resourceId;
    this.mRawValue = rawValue;
    this.mTypedValue = typedValue;
  }

  public String getNamespace() {
    return mNamespace;
  }

  public String getName() {
    return mName;
  }

  /** Framework attribute id from the resource map, 0 for plain attributes. */
  public int getResourceId() {
    return mResourceId;
  }

  public String getRawValue() {
    return mRawValue;
  }

  public ResValue getTypedValue() {
    return mTypedValue;
  }

  public String getValue() {
    if (mRawValue != null) {
      return mRawValue;
    }
    return mTypedValue == null ? null : mTypedValue.coerceToString();
  }

  @Override
  public String toString() {
    return mName + "=\"" + getValue() + "\"";
  }
}
