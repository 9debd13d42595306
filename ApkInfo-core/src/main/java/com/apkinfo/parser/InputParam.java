package com.apkinfo.parser;

import java.io.File;

/**
 * Per-call inputs of an extraction. Values left unset fall back to the
 * config file, then to the built-in defaults.
 */
public class InputParam {

  public static final int UNSET = -1;

  public final String apkPath;
  public final String keytoolPath;
  public final boolean decodeIcon;
  public final int iconDensity;
  public final String labelLocale;
  public final long keytoolTimeoutSeconds;
  public final File iconOutput;
  public final File configFile;

  private InputParam(
      String apkPath,
      String keytoolPath,
      boolean decodeIcon,
      int iconDensity,
      String labelLocale,
      long keytoolTimeoutSeconds,
      File iconOutput,
      File configFile) {

    this.apkPath = apkPath;
    this.keytoolPath = keytoolPath;
    this.decodeIcon = decodeIcon;
    this.iconDensity = iconDensity;
    this.labelLocale = labelLocale;
    this.keytoolTimeoutSeconds = keytoolTimeoutSeconds;
    this.iconOutput = iconOutput;
    this.configFile = configFile;
  }

  public static class Builder {

    private String apkPath;
    private String keytoolPath;
    private boolean decodeIcon;
    private int iconDensity;
    private String labelLocale;
    private long keytoolTimeoutSeconds;
    private File iconOutput;
    private File configFile;

    public Builder() {
      decodeIcon = false;
      iconDensity = UNSET;
      keytoolTimeoutSeconds = UNSET;
    }

    public Builder setApkPath(String apkPath) {
      this.apkPath = apkPath;
      return this;
    }

    public Builder setKeytoolPath(String keytoolPath) {
      this.keytoolPath = keytoolPath;
      return this;
    }

    public Builder setDecodeIcon(boolean decodeIcon) {
      this.decodeIcon = decodeIcon;
      return this;
    }

    public Builder setIconDensity(int iconDensity) {
      this.iconDensity = iconDensity;
      return this;
    }

    public Builder setLabelLocale(String labelLocale) {
      this.labelLocale = labelLocale;
      return this;
    }

    public Builder setKeytoolTimeoutSeconds(long keytoolTimeoutSeconds) {
      this.keytoolTimeoutSeconds = keytoolTimeoutSeconds;
      return this;
    }

    /** Where the CLI writes the icon; implies icon decoding. */
    public Builder setIconOutput(File iconOutput) {
      this.iconOutput = iconOutput;
      if (iconOutput != null) {
        this.decodeIcon = true;
      }
      return this;
    }

    public Builder setConfigFile(File configFile) {
      this.configFile = configFile;
      return this;
    }

    public InputParam create() {
      if (apkPath == null || apkPath.isEmpty()) {
        throw new IllegalArgumentException("apk path is required");
      }
      return new InputParam(
          apkPath,
          keytoolPath,
          decodeIcon,
          iconDensity,
          labelLocale,
          keytoolTimeoutSeconds,
          iconOutput,
          configFile
      );
    }
  }
}
