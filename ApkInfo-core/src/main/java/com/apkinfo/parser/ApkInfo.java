package com.apkinfo.parser;

import com.apkinfo.androlib.ApkIcon;
import com.apkinfo.androlib.ManifestInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Metadata of one apk. Best-effort fields (label, icon, digests) are empty
 * strings or {@code null} when they could not be determined.
 */
public final class ApkInfo {

  public final String label;
  public final String packageName;
  public final String versionName;
  public final int versionCode;
  public final int minSdkVersion;
  public final int targetSdkVersion;
  public final ApkIcon icon;
  public final long size;
  public final String fileMd5;
  public final String signatureMd5;
  public final String signatureSha1;
  public final String signatureSha256;
  public final List<String> permissions;
  public final List<ManifestInfo.Permission> declaredPermissions;
  public final List<String> nativeAbis;
  public final boolean supports64Bit;
  public final boolean supports32Bit;

  private ApkInfo(Builder builder) {
    this.label = builder.label;
    this.packageName = builder.packageName;
    this.versionName = builder.versionName;
    this.versionCode = builder.versionCode;
    this.minSdkVersion = builder.minSdkVersion;
    this.targetSdkVersion = builder.targetSdkVersion;
    this.icon = builder.icon;
    this.size = builder.size;
    this.fileMd5 = builder.fileMd5;
    this.signatureMd5 = builder.signatureMd5;
    this.signatureSha1 = builder.signatureSha1;
    this.signatureSha256 = builder.signatureSha256;
    this.permissions = Collections.unmodifiableList(new ArrayList<>(builder.permissions));
    this.declaredPermissions = Collections.unmodifiableList(new ArrayList<>(builder.declaredPermissions));
    this.nativeAbis = Collections.unmodifiableList(new ArrayList<>(builder.nativeAbis));
    this.supports64Bit = builder.supports64Bit;
    this.supports32Bit = builder.supports32Bit;
  }

  @Override
  public String toString() {
    return String.format("%s %s (%d) \"%s\"", packageName, versionName, versionCode, label);
  }

  public static class Builder {
    private String label = "";
    private String packageName = "";
    private String versionName = "";
    private int versionCode;
    private int minSdkVersion;
    private int targetSdkVersion;
    private ApkIcon icon;
    private long size;
    private String fileMd5 = "";
    private String signatureMd5 = "";
    private String signatureSha1 = "";
    private String signatureSha256 = "";
    private List<String> permissions = Collections.emptyList();
    private List<ManifestInfo.Permission> declaredPermissions = Collections.emptyList();
    private List<String> nativeAbis = Collections.emptyList();
    private boolean supports64Bit;
    private boolean supports32Bit;

    public Builder setLabel(String label) {
      this.label = label;
      return this;
    }

    public Builder setManifest(ManifestInfo manifest) {
      this.packageName = manifest.getPackageName();
      this.versionName = manifest.getVersionName();
      this.versionCode = manifest.getVersionCode();
      this.minSdkVersion = manifest.getMinSdkVersion();
      this.targetSdkVersion = manifest.getTargetSdkVersion();
      this.permissions = manifest.getUsesPermissions();
      this.declaredPermissions = manifest.getPermissions();
      return this;
    }

    public Builder setIcon(ApkIcon icon) {
      this.icon = icon;
      return this;
    }

    public Builder setSize(long size) {
      this.size = size;
      return this;
    }

    public Builder setFileMd5(String fileMd5) {
      this.fileMd5 = fileMd5;
      return this;
    }

    public Builder setSignature(String md5, String sha1, String sha256) {
      this.signatureMd5 = md5;
      this.signatureSha1 = sha1;
      this.signatureSha256 = sha256;
      return this;
    }

    public Builder setNativeAbis(List<String> nativeAbis) {
      this.nativeAbis = nativeAbis;
      return this;
    }

    public Builder setSupports64Bit(boolean supports64Bit) {
      this.supports64Bit = supports64Bit;
      return this;
    }

    public Builder setSupports32Bit(boolean supports32Bit) {
      this.supports32Bit = supports32Bit;
      return this;
    }

    public ApkInfo create() {
      return new ApkInfo(this);
    }
  }
}
