package com.apkinfo.androlib.res.decoder;

import java.util.HashMap;
import java.util.Map;

/**
 * Ids of the framework attributes the manifest reader cares about, used to
 * name attributes whose string pool entry was stripped by a shrinker.
 */
public final class AndroidAttributes {
  public static final int LABEL = 0x01010001;
  public static final int ICON = 0x01010002;
  public static final int NAME = 0x01010003;
  public static final int PROTECTION_LEVEL = 0x01010009;
  public static final int MIN_SDK_VERSION = 0x0101020c;
  public static final int VERSION_CODE = 0x0101021b;
  public static final int VERSION_NAME = 0x0101021c;
  public static final int TARGET_SDK_VERSION = 0x01010270;
  public static final int MAX_SDK_VERSION = 0x01010271;

  private static final Map<Integer, String> NAMES = new HashMap<>();

  static {
    NAMES.put(LABEL, "label");
    NAMES.put(ICON, "icon");
    NAMES.put(NAME, "name");
    NAMES.put(PROTECTION_LEVEL, "protectionLevel");
    NAMES.put(MIN_SDK_VERSION, "minSdkVersion");
    NAMES.put(VERSION_CODE, "versionCode");
    NAMES.put(VERSION_NAME, "versionName");
    NAMES.put(TARGET_SDK_VERSION, "targetSdkVersion");
    NAMES.put(MAX_SDK_VERSION, "maxSdkVersion");
  }

  private AndroidAttributes() {
  }

  /** Attribute name for a framework id, {@code null} when unknown. */
  public static String nameOf(int resId) {
    return NAMES.get(resId);
  }
}
