package com.apkinfo.androlib.res.data;

import com.apkinfo.util.TypedValue;

/**
 * A typed value as stored in a {@code Res_value}: a type tag, 32 bits of data
 * and, for string values, the text looked up in the owning string pool.
 */
public final class ResValue {
  private final int mType;
  private final int mData;
  private final String mString;

  public ResValue(int type, int data, String string) {
    this.mType = type;
    this.mData = data;
    this.mString = string;
  }

  public static ResValue ofString(String value) {
    return new ResValue(TypedValue.TYPE_STRING, -1, value);
  }

  public static ResValue ofReference(int resId) {
    return new ResValue(TypedValue.TYPE_REFERENCE, resId, null);
  }

  public int getType() {
    return mType;
  }

  public int getData() {
    return mData;
  }

  public boolean isString() {
    return mType == TypedValue.TYPE_STRING;
  }

  public boolean isReference() {
    return mType == TypedValue.TYPE_REFERENCE || mType == TypedValue.TYPE_DYNAMIC_REFERENCE;
  }

  public boolean isInteger() {
    return mType >= TypedValue.TYPE_FIRST_INT && mType <= TypedValue.TYPE_LAST_INT
        && mType != TypedValue.TYPE_INT_BOOLEAN;
  }

  public ResID getReference() {
    return isReference() ? new ResID(mData) : null;
  }

  public String getString() {
    return mString;
  }

  /**
   * Text form of the value: the pooled string for string values, the aapt
   * style rendering for everything else, {@code null} for TYPE_NULL.
   */
  public String coerceToString() {
    if (isString()) {
      return mString;
    }
    return TypedValue.coerceToString(mType, mData);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ResValue other = (ResValue) obj;
    if (isString()) {
      return other.isString() && (mString == null ? other.mString == null : mString.equals(other.mString));
    }
    return mType == other.mType && mData == other.mData;
  }

  @Override
  public int hashCode() {
    if (isString()) {
      return mString == null ? 0 : mString.hashCode();
    }
    return 31 * mType + mData;
  }

  @Override
  public String toString() {
    String text = coerceToString();
    return String.format("(0x%02x) %s", mType, text);
  }
}
