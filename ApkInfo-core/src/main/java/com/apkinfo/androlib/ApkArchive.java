package com.apkinfo.androlib;

import com.apkinfo.util.TypedValue;

import org.apache.commons.io.IOUtils;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Read access to the entries of an apk. Entry names are listed once when the
 * archive is opened; entry contents are read on demand.
 */
public class ApkArchive implements Closeable {

  private final ZipFile mZipFile;
  private final List<String> mEntryNames;
  private final boolean mHasSharedLibrary;

  private ApkArchive(ZipFile zipFile) {
    mZipFile = zipFile;
    List<String> names = new ArrayList<>();
    boolean sharedLibrary = false;
    Enumeration<? extends ZipEntry> entries = zipFile.entries();
    while (entries.hasMoreElements()) {
      ZipEntry entry = entries.nextElement();
      if (entry.isDirectory()) {
        continue;
      }
      names.add(entry.getName());
      if (entry.getName().endsWith(TypedValue.NATIVE_LIB_FILE)) {
        sharedLibrary = true;
      }
    }
    mEntryNames = Collections.unmodifiableList(names);
    mHasSharedLibrary = sharedLibrary;
  }

  public static ApkArchive open(File file) throws IOException {
    return new ApkArchive(new ZipFile(file));
  }

  /** Content of entry {@code name}, or {@code null} when the archive has no such entry. */
  public byte[] readEntry(String name) throws IOException {
    ZipEntry entry = mZipFile.getEntry(name);
    if (entry == null || entry.isDirectory()) {
      return null;
    }
    try (InputStream in = mZipFile.getInputStream(entry)) {
      return IOUtils.toByteArray(in);
    }
  }

  public boolean hasEntryUnder(List<String> prefixes) {
    for (String name : mEntryNames) {
      for (String prefix : prefixes) {
        if (name.startsWith(prefix)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Without native code the app runs on any ABI. Native code is any shared
   * library, or any entry under one of the ABI prefixes.
   */
  public boolean supports64Bit(AbiSupport abiSupport) {
    boolean under64 = hasEntryUnder(abiSupport.getPrefixes64());
    return under64 || !hasNativeCode(abiSupport);
  }

  public boolean supports32Bit(AbiSupport abiSupport) {
    boolean under32 = hasEntryUnder(abiSupport.getPrefixes32());
    return under32 || !hasNativeCode(abiSupport);
  }

  private boolean hasNativeCode(AbiSupport abiSupport) {
    return mHasSharedLibrary
        || hasEntryUnder(abiSupport.getPrefixes64())
        || hasEntryUnder(abiSupport.getPrefixes32());
  }

  /** ABI directory names under {@code lib/} holding native libraries, in archive order. */
  public List<String> getNativeAbis() {
    Set<String> abis = new LinkedHashSet<>();
    for (String name : mEntryNames) {
      if (!name.startsWith(TypedValue.NATIVE_LIB_PATH) || !name.endsWith(TypedValue.NATIVE_LIB_FILE)) {
        continue;
      }
      int slash = name.indexOf('/', TypedValue.NATIVE_LIB_PATH.length());
      if (slash > TypedValue.NATIVE_LIB_PATH.length()) {
        abis.add(name.substring(TypedValue.NATIVE_LIB_PATH.length(), slash));
      }
    }
    return new ArrayList<>(abis);
  }

  @Override
  public void close() throws IOException {
    mZipFile.close();
  }
}
