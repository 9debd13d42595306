/*
 * Copyright (C) 2007 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apkinfo.util;

/**
 * Container for a dynamically typed data value. Primarily used with
 * compiled resources and binary xml attributes.
 */
public class TypedValue {
  public static final String APK_FILE = ".apk";

  public static final String MANIFEST_FILE = "AndroidManifest.xml";

  public static final String ARSC_FILE = "resources.arsc";

  public static final String NATIVE_LIB_PATH = "lib/";

  public static final String NATIVE_LIB_FILE = ".so";

  public static final String XML_FILE = ".xml";

  public static final String CONFIG_FILE = "config.xml";

  /**
   * The value contains no data.
   */
  public static final int TYPE_NULL = 0x00;

  /**
   * The <var>data</var> field holds a resource identifier.
   */
  public static final int TYPE_REFERENCE = 0x01;

  /**
   * The <var>data</var> field holds an attribute resource
   * identifier (referencing an attribute in the current theme
   * style, not a resource entry).
   */
  public static final int TYPE_ATTRIBUTE = 0x02;

  /**
   * The <var>string</var> field holds string data.  In addition, if
   * <var>data</var> is non-zero then it is the string block
   * index of the string.
   */
  public static final int TYPE_STRING = 0x03;

  public static final int TYPE_FLOAT = 0x04;

  /**
   * The <var>data</var> field holds a complex number encoding a
   * dimension value.
   */
  public static final int TYPE_DIMENSION = 0x05;

  /**
   * The <var>data</var> field holds a complex number encoding a fraction
   * of a container.
   */
  public static final int TYPE_FRACTION = 0x06;

  public static final int TYPE_DYNAMIC_REFERENCE = 0x07;

  public static final int TYPE_DYNAMIC_ATTRIBUTE = 0x08;

  public static final int TYPE_FIRST_INT = 0x10;

  public static final int TYPE_INT_DEC = 0x10;

  public static final int TYPE_INT_HEX = 0x11;

  public static final int TYPE_INT_BOOLEAN = 0x12;

  public static final int TYPE_FIRST_COLOR_INT = 0x1c;

  public static final int TYPE_INT_COLOR_ARGB8 = 0x1c;

  public static final int TYPE_INT_COLOR_RGB8 = 0x1d;

  public static final int TYPE_INT_COLOR_ARGB4 = 0x1e;

  public static final int TYPE_INT_COLOR_RGB4 = 0x1f;

  public static final int TYPE_LAST_COLOR_INT = 0x1f;

  public static final int TYPE_LAST_INT = 0x1f;

  public static final int COMPLEX_UNIT_SHIFT = 0;
  public static final int COMPLEX_UNIT_MASK = 0xf;
  public static final int COMPLEX_UNIT_FRACTION = 0;
  public static final int COMPLEX_UNIT_FRACTION_PARENT = 1;
  public static final int COMPLEX_RADIX_SHIFT = 4;
  public static final int COMPLEX_RADIX_MASK = 0x3;
  public static final int COMPLEX_MANTISSA_SHIFT = 8;
  public static final int COMPLEX_MANTISSA_MASK = 0xffffff;

  private static final float MANTISSA_MULT = 1.0f / (1 << COMPLEX_MANTISSA_SHIFT);
  private static final float[] RADIX_MULTS = new float[] {
      1.0f * MANTISSA_MULT, 1.0f / (1 << 7) * MANTISSA_MULT,
      1.0f / (1 << 15) * MANTISSA_MULT, 1.0f / (1 << 23) * MANTISSA_MULT
  };

  private static final String[] DIMENSION_UNIT_STRS = new String[] {
      "px", "dip", "sp", "pt", "in", "mm"
  };
  private static final String[] FRACTION_UNIT_STRS = new String[] {
      "%", "%p"
  };

  private TypedValue() {
  }

  public static float complexToFloat(int complex) {
    return (complex & (COMPLEX_MANTISSA_MASK << COMPLEX_MANTISSA_SHIFT))
        * RADIX_MULTS[(complex >> COMPLEX_RADIX_SHIFT) & COMPLEX_RADIX_MASK];
  }

  /**
   * Renders a primitive value the way aapt dumps it; references print as
   * their id. Returns null for strings, which need a string pool, and for
   * unknown types.
   */
  public static String coerceToString(int type, int data) {
    switch (type) {
      case TYPE_NULL:
        return null;
      case TYPE_REFERENCE:
        return "@" + String.format("0x%08x", data);
      case TYPE_ATTRIBUTE:
        return "?" + String.format("0x%08x", data);
      case TYPE_FLOAT:
        return Float.toString(Float.intBitsToFloat(data));
      case TYPE_DIMENSION:
        return complexToFloat(data) + unitString(DIMENSION_UNIT_STRS, data);
      case TYPE_FRACTION:
        return complexToFloat(data) * 100 + unitString(FRACTION_UNIT_STRS, data);
      case TYPE_INT_HEX:
        return "0x" + Integer.toHexString(data);
      case TYPE_INT_BOOLEAN:
        return data != 0 ? "true" : "false";
      default:
        break;
    }

    if (type >= TYPE_FIRST_COLOR_INT && type <= TYPE_LAST_COLOR_INT) {
      return "#" + String.format("%08x", data);
    } else if (type >= TYPE_FIRST_INT && type <= TYPE_LAST_INT) {
      return Integer.toString(data);
    }
    return null;
  }

  private static String unitString(String[] units, int complex) {
    int unit = (complex >> COMPLEX_UNIT_SHIFT) & COMPLEX_UNIT_MASK;
    return unit < units.length ? units[unit] : "";
  }
}
