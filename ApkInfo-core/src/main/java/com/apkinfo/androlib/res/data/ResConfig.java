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

package com.apkinfo.androlib.res.data;

import java.util.ArrayList;
import java.util.List;

/**
 * The qualifier set of a {@code ResTable_config}. Every axis uses 0 (or the
 * empty string) for "not specified"; a config with no axis set is the default
 * variant.
 */
public final class ResConfig implements Comparable<ResConfig> {

  public static final int DENSITY_DEFAULT = 0;
  public static final int DENSITY_LOW = 120;
  public static final int DENSITY_MEDIUM = 160;
  public static final int DENSITY_TV = 213;
  public static final int DENSITY_HIGH = 240;
  public static final int DENSITY_XHIGH = 320;
  public static final int DENSITY_XXHIGH = 480;
  public static final int DENSITY_XXXHIGH = 640;
  public static final int DENSITY_ANY = 0xfffe;
  public static final int DENSITY_NONE = 0xffff;

  public static final ResConfig DEFAULT = new Builder().create();

  private static final String[] LAYOUT_DIR_NAMES = {null, "ldltr", "ldrtl"};
  private static final String[] SCREEN_SIZE_NAMES = {null, "small", "normal", "large", "xlarge"};
  private static final String[] SCREEN_LONG_NAMES = {null, "notlong", "long"};
  private static final String[] SCREEN_ROUND_NAMES = {null, "notround", "round"};
  private static final String[] WIDE_COLOR_NAMES = {null, "nowidecg", "widecg"};
  private static final String[] HDR_NAMES = {null, "lowdr", "highdr"};
  private static final String[] ORIENTATION_NAMES = {null, "port", "land", "square"};
  private static final String[] UI_MODE_TYPE_NAMES =
      {null, null, "desk", "car", "television", "appliance", "watch", "vrheadset"};
  private static final String[] UI_MODE_NIGHT_NAMES = {null, "notnight", "night"};
  private static final String[] TOUCHSCREEN_NAMES = {null, "notouch", "stylus", "finger"};
  private static final String[] KEYBOARD_NAMES = {null, "nokeys", "qwerty", "12key"};
  private static final String[] KEYS_HIDDEN_NAMES = {null, "keysexposed", "keyshidden", "keyssoft"};
  private static final String[] NAVIGATION_NAMES = {null, "nonav", "dpad", "trackball", "wheel"};
  private static final String[] NAV_HIDDEN_NAMES = {null, "navexposed", "navhidden"};

  private final int mMcc;
  private final int mMnc;
  private final String mLanguage;
  private final String mCountry;
  private final int mOrientation;
  private final int mTouchscreen;
  private final int mDensity;
  private final int mKeyboard;
  private final int mNavigation;
  private final int mInputFlags;
  private final int mScreenWidth;
  private final int mScreenHeight;
  private final int mSdkVersion;
  private final int mScreenLayout;
  private final int mUiMode;
  private final int mSmallestScreenWidthDp;
  private final int mScreenWidthDp;
  private final int mScreenHeightDp;
  private final String mLocaleScript;
  private final String mLocaleVariant;
  private final int mScreenLayout2;
  private final int mColorMode;

  private ResConfig(Builder builder) {
    mMcc = builder.mcc;
    mMnc = builder.mnc;
    mLanguage = builder.language;
    mCountry = builder.country;
    mOrientation = builder.orientation;
    mTouchscreen = builder.touchscreen;
    mDensity = builder.density;
    mKeyboard = builder.keyboard;
    mNavigation = builder.navigation;
    mInputFlags = builder.inputFlags;
    mScreenWidth = builder.screenWidth;
    mScreenHeight = builder.screenHeight;
    mSdkVersion = builder.sdkVersion;
    mScreenLayout = builder.screenLayout;
    mUiMode = builder.uiMode;
    mSmallestScreenWidthDp = builder.smallestScreenWidthDp;
    mScreenWidthDp = builder.screenWidthDp;
    mScreenHeightDp = builder.screenHeightDp;
    mLocaleScript = builder.localeScript;
    mLocaleVariant = builder.localeVariant;
    mScreenLayout2 = builder.screenLayout2;
    mColorMode = builder.colorMode;
  }

  public static ResConfig forDensity(int density) {
    return new Builder().setDensity(density).create();
  }

  public int getDensity() {
    return mDensity;
  }

  public String getLanguage() {
    return mLanguage;
  }

  public String getCountry() {
    return mCountry;
  }

  public int getSdkVersion() {
    return mSdkVersion;
  }

  public boolean isDefault() {
    return getQualifierCount() == 0;
  }

  /**
   * True when the density axis holds a real dpi value, i.e. neither unset nor
   * one of the {@code anydpi} / {@code nodpi} markers.
   */
  public boolean hasNumericDensity() {
    return mDensity != DENSITY_DEFAULT && mDensity != DENSITY_ANY && mDensity != DENSITY_NONE;
  }

  /** Number of axes this configuration declares. */
  public int getQualifierCount() {
    int count = 0;
    for (int value : intAxes()) {
      if (value != 0) {
        count++;
      }
    }
    for (String value : stringAxes()) {
      if (!value.isEmpty()) {
        count++;
      }
    }
    for (int value : minimumAxes()) {
      if (value != 0) {
        count++;
      }
    }
    if (mDensity != DENSITY_DEFAULT) {
      count++;
    }
    return count;
  }

  /**
   * Whether a resource variant qualified with this config may be used for a
   * device described by {@code request}. Density never disqualifies a
   * variant; it is ranked separately. Exclusive axes must be equal when this
   * config sets them; minimum-style axes must not exceed the request.
   */
  public boolean matches(ResConfig request) {
    if (request == null) {
      request = DEFAULT;
    }
    int[] mine = intAxes();
    int[] theirs = request.intAxes();
    for (int i = 0; i < mine.length; i++) {
      if (mine[i] != 0 && mine[i] != theirs[i]) {
        return false;
      }
    }
    String[] myStrings = stringAxes();
    String[] theirStrings = request.stringAxes();
    for (int i = 0; i < myStrings.length; i++) {
      if (!myStrings[i].isEmpty() && !myStrings[i].equals(theirStrings[i])) {
        return false;
      }
    }
    return atMost(mSdkVersion, request.mSdkVersion)
        && atMost(mSmallestScreenWidthDp, request.mSmallestScreenWidthDp)
        && atMost(mScreenWidthDp, request.mScreenWidthDp)
        && atMost(mScreenHeightDp, request.mScreenHeightDp);
  }

  private static boolean atMost(int candidate, int requested) {
    return candidate == 0 || requested == 0 || candidate <= requested;
  }

  // exclusive integer axes, density and the minimum-style axes excluded
  private int[] intAxes() {
    return new int[] {
        mMcc, mMnc, mOrientation, mTouchscreen, mKeyboard, mNavigation, mInputFlags,
        mScreenWidth, mScreenHeight, mScreenLayout, mUiMode, mScreenLayout2, mColorMode
    };
  }

  private String[] stringAxes() {
    return new String[] {mLanguage, mCountry, mLocaleScript, mLocaleVariant};
  }

  private int[] minimumAxes() {
    return new int[] {mSdkVersion, mSmallestScreenWidthDp, mScreenWidthDp, mScreenHeightDp};
  }

  @Override
  public int compareTo(ResConfig other) {
    int result = Integer.compare(mDensity, other.mDensity);
    if (result != 0) {
      return result;
    }
    result = compareArrays(intAxes(), other.intAxes());
    if (result != 0) {
      return result;
    }
    result = compareArrays(minimumAxes(), other.minimumAxes());
    if (result != 0) {
      return result;
    }
    String[] mine = stringAxes();
    String[] theirs = other.stringAxes();
    for (int i = 0; i < mine.length; i++) {
      result = mine[i].compareTo(theirs[i]);
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  private static int compareArrays(int[] a, int[] b) {
    for (int i = 0; i < a.length; i++) {
      int result = Integer.compare(a[i], b[i]);
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return compareTo((ResConfig) obj) == 0;
  }

  @Override
  public int hashCode() {
    int hash = mDensity;
    for (int value : intAxes()) {
      hash = 31 * hash + value;
    }
    for (int value : minimumAxes()) {
      hash = 31 * hash + value;
    }
    for (String value : stringAxes()) {
      hash = 31 * hash + value.hashCode();
    }
    return hash;
  }

  /**
   * Qualifier string in resource directory order, e.g. {@code fr-rFR-xxhdpi-v26};
   * {@code default} for the unqualified config. Values without a directory
   * name are rendered as {@code axis<value>} so unequal configs never print
   * the same.
   */
  @Override
  public String toString() {
    if (isDefault()) {
      return "default";
    }
    List<String> parts = new ArrayList<>();
    if (mMcc != 0) {
      parts.add("mcc" + mMcc);
    }
    if (mMnc != 0) {
      parts.add("mnc" + mMnc);
    }
    if (!mLocaleScript.isEmpty() || !mLocaleVariant.isEmpty()) {
      StringBuilder tag = new StringBuilder("b+").append(mLanguage.isEmpty() ? "und" : mLanguage);
      if (!mLocaleScript.isEmpty()) {
        tag.append('+').append(mLocaleScript);
      }
      if (!mCountry.isEmpty()) {
        tag.append('+').append(mCountry);
      }
      if (!mLocaleVariant.isEmpty()) {
        tag.append('+').append(mLocaleVariant);
      }
      parts.add(tag.toString());
    } else {
      if (!mLanguage.isEmpty()) {
        parts.add(mLanguage);
      }
      if (!mCountry.isEmpty()) {
        parts.add("r" + mCountry);
      }
    }
    addMasked(parts, "layoutdir", mScreenLayout, 0xc0, LAYOUT_DIR_NAMES);
    if (mSmallestScreenWidthDp != 0) {
      parts.add("sw" + mSmallestScreenWidthDp + "dp");
    }
    if (mScreenWidthDp != 0) {
      parts.add("w" + mScreenWidthDp + "dp");
    }
    if (mScreenHeightDp != 0) {
      parts.add("h" + mScreenHeightDp + "dp");
    }
    addMasked(parts, "screensize", mScreenLayout, 0x0f, SCREEN_SIZE_NAMES);
    addMasked(parts, "screenlong", mScreenLayout, 0x30, SCREEN_LONG_NAMES);
    addRemainder(parts, "screenlayout", mScreenLayout, 0xff);
    addMasked(parts, "screenround", mScreenLayout2, 0x03, SCREEN_ROUND_NAMES);
    addRemainder(parts, "screenlayout2", mScreenLayout2, 0x03);
    addMasked(parts, "widecg", mColorMode, 0x03, WIDE_COLOR_NAMES);
    addMasked(parts, "hdr", mColorMode, 0x0c, HDR_NAMES);
    addRemainder(parts, "colormode", mColorMode, 0x0f);
    addMasked(parts, "orientation", mOrientation, 0xff, ORIENTATION_NAMES);
    addMasked(parts, "uimode", mUiMode, 0x0f, UI_MODE_TYPE_NAMES);
    addMasked(parts, "night", mUiMode, 0x30, UI_MODE_NIGHT_NAMES);
    addRemainder(parts, "uimode", mUiMode, 0x3f);
    if (mDensity != DENSITY_DEFAULT) {
      parts.add(densityName(mDensity));
    }
    addMasked(parts, "touchscreen", mTouchscreen, 0xff, TOUCHSCREEN_NAMES);
    addMasked(parts, "keyboard", mKeyboard, 0xff, KEYBOARD_NAMES);
    addMasked(parts, "keys", mInputFlags, 0x03, KEYS_HIDDEN_NAMES);
    addMasked(parts, "navigation", mNavigation, 0xff, NAVIGATION_NAMES);
    addMasked(parts, "nav", mInputFlags, 0x0c, NAV_HIDDEN_NAMES);
    addRemainder(parts, "inputflags", mInputFlags, 0x0f);
    if (mScreenWidth != 0 || mScreenHeight != 0) {
      parts.add(mScreenWidth + "x" + mScreenHeight);
    }
    if (mSdkVersion != 0) {
      parts.add("v" + mSdkVersion);
    }
    return String.join("-", parts);
  }

  private static void addMasked(List<String> parts, String axis, int value, int mask, String[] names) {
    int field = (value & mask) >>> Integer.numberOfTrailingZeros(mask);
    if (field == 0) {
      return;
    }
    if (field < names.length && names[field] != null) {
      parts.add(names[field]);
    } else {
      parts.add(axis + field);
    }
  }

  // bits outside every mask the axis is rendered with
  private static void addRemainder(List<String> parts, String axis, int value, int covered) {
    int rest = value & ~covered;
    if (rest != 0) {
      parts.add(axis + "0x" + Integer.toHexString(rest));
    }
  }

  private static String densityName(int density) {
    switch (density) {
      case DENSITY_LOW:
        return "ldpi";
      case DENSITY_MEDIUM:
        return "mdpi";
      case DENSITY_TV:
        return "tvdpi";
      case DENSITY_HIGH:
        return "hdpi";
      case DENSITY_XHIGH:
        return "xhdpi";
      case DENSITY_XXHIGH:
        return "xxhdpi";
      case DENSITY_XXXHIGH:
        return "xxxhdpi";
      case DENSITY_ANY:
        return "anydpi";
      case DENSITY_NONE:
        return "nodpi";
      default:
        return density + "dpi";
    }
  }

  public static class Builder {
    private int mcc;
    private int mnc;
    private String language = "";
    private String country = "";
    private int orientation;
    private int touchscreen;
    private int density;
    private int keyboard;
    private int navigation;
    private int inputFlags;
    private int screenWidth;
    private int screenHeight;
    private int sdkVersion;
    private int screenLayout;
    private int uiMode;
    private int smallestScreenWidthDp;
    private int screenWidthDp;
    private int screenHeightDp;
    private String localeScript = "";
    private String localeVariant = "";
    private int screenLayout2;
    private int colorMode;

    public Builder setMcc(int mcc) {
      this.mcc = mcc;
      return this;
    }

    public Builder setMnc(int mnc) {
      this.mnc = mnc;
      return this;
    }

    public Builder setLanguage(String language) {
      this.language = language == null ? "" : language;
      return this;
    }

    public Builder setCountry(String country) {
      this.country = country == null ? "" : country;
      return this;
    }

    public Builder setOrientation(int orientation) {
      this.orientation = orientation;
      return this;
    }

    public Builder setTouchscreen(int touchscreen) {
      this.touchscreen = touchscreen;
      return this;
    }

    public Builder setDensity(int density) {
      this.density = density;
      return this;
    }

    public Builder setKeyboard(int keyboard) {
      this.keyboard = keyboard;
      return this;
    }

    public Builder setNavigation(int navigation) {
      this.navigation = navigation;
      return this;
    }

    public Builder setInputFlags(int inputFlags) {
      this.inputFlags = inputFlags;
      return this;
    }

    public Builder setScreenSize(int screenWidth, int screenHeight) {
      this.screenWidth = screenWidth;
      this.screenHeight = screenHeight;
      return this;
    }

    public Builder setSdkVersion(int sdkVersion) {
      this.sdkVersion = sdkVersion;
      return this;
    }

    public Builder setScreenLayout(int screenLayout) {
      this.screenLayout = screenLayout;
      return this;
    }

    public Builder setUiMode(int uiMode) {
      this.uiMode = uiMode;
      return this;
    }

    public Builder setSmallestScreenWidthDp(int smallestScreenWidthDp) {
      this.smallestScreenWidthDp = smallestScreenWidthDp;
      return this;
    }

    public Builder setScreenSizeDp(int screenWidthDp, int screenHeightDp) {
      this.screenWidthDp = screenWidthDp;
      this.screenHeightDp = screenHeightDp;
      return this;
    }

    public Builder setLocaleScript(String localeScript) {
      this.localeScript = localeScript == null ? "" : localeScript;
      return this;
    }

    public Builder setLocaleVariant(String localeVariant) {
      this.localeVariant = localeVariant == null ? "" : localeVariant;
      return this;
    }

    public Builder setScreenLayout2(int screenLayout2) {
      this.screenLayout2 = screenLayout2;
      return this;
    }

    public Builder setColorMode(int colorMode) {
      this.colorMode = colorMode;
      return this;
    }

    public ResConfig create() {
      return new ResConfig(this);
    }
  }
}
