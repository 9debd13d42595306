package com.apkinfo.androlib.res.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One configuration variant of a resource: either a simple value or a
 * complex (map/bag) value with a parent reference and keyed items.
 */
public final class ResEntry {
  private final ResConfig mConfig;
  private final String mName;
  private final ResValue mValue;
  private final int mParent;
  private final Map<Integer, ResValue> mBag;

  private ResEntry(ResConfig config, String name, ResValue value, int parent, Map<Integer, ResValue> bag) {
    this.mConfig = config;
    this.mName = name;
    this.mValue = value;
    this.mParent = parent;
    this.mBag = bag;
  }

  public static ResEntry simple(ResConfig config, String name, ResValue value) {
    return new ResEntry(config, name, value, 0, null);
  }

  public static ResEntry complex(ResConfig config, String name, int parent, Map<Integer, ResValue> bag) {
    return new ResEntry(config, name, null, parent,
        Collections.unmodifiableMap(new LinkedHashMap<>(bag)));
  }

  public ResConfig getConfig() {
    return mConfig;
  }

  public String getName() {
    return mName;
  }

  public boolean isComplex() {
    return mBag != null;
  }

  /** The simple value, {@code null} for complex entries. */
  public ResValue getValue() {
    return mValue;
  }

  public int getParent() {
    return mParent;
  }

  public Map<Integer, ResValue> getBag() {
    return mBag == null ? Collections.<Integer, ResValue>emptyMap() : mBag;
  }

  @Override
  public String toString() {
    return String.format("%s [%s] %s", mName, mConfig, isComplex() ? mBag : mValue);
  }
}
