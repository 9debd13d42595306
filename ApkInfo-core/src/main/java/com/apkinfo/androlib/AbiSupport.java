package com.apkinfo.androlib;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Archive path prefixes that mark native code as built for a 64-bit or a
 * 32-bit ABI. A prefix also covers every directory that starts with it, so
 * {@code lib/armeabi} matches {@code lib/armeabi-v7a}.
 */
public final class AbiSupport {

  public static final List<String> DEFAULT_64_BIT = Collections.singletonList("lib/arm64-v8a");
  public static final List<String> DEFAULT_32_BIT = Collections.singletonList("lib/armeabi");

  public static final AbiSupport DEFAULT = new AbiSupport(DEFAULT_64_BIT, DEFAULT_32_BIT);

  private final List<String> mPrefixes64;
  private final List<String> mPrefixes32;

  public AbiSupport(List<String> prefixes64, List<String> prefixes32) {
    this.mPrefixes64 = Collections.unmodifiableList(new ArrayList<>(prefixes64));
    this.mPrefixes32 = Collections.unmodifiableList(new ArrayList<>(prefixes32));
  }

  public List<String> getPrefixes64() {
    return mPrefixes64;
  }

  public List<String> getPrefixes32() {
    return mPrefixes32;
  }

  @Override
  public String toString() {
    return "64-bit " + mPrefixes64 + ", 32-bit " + mPrefixes32;
  }
}
