package com.apkinfo.parser;

import com.apkinfo.androlib.AndrolibException;
import com.apkinfo.androlib.ApkDecoder;
import com.apkinfo.sign.SignatureExtractor;

import java.io.File;
import java.io.IOException;

/**
 * Library entry point: turns an {@link InputParam} into {@link ApkInfo}.
 * Independent calls share no state and may run concurrently.
 */
public class Main {

  public static final int ERRNO_ERRORS = 1;
  public static final int ERRNO_USAGE = 2;

  protected Configuration config;

  public static ApkInfo parse(InputParam inputParam) throws AndrolibException, IOException {
    return new Main().run(inputParam, null);
  }

  /**
   * @param signatureExtractor replaces the keytool based extractor when not {@code null}
   */
  protected ApkInfo run(InputParam inputParam, SignatureExtractor signatureExtractor)
      throws AndrolibException, IOException {
    config = new Configuration(inputParam);
    File apkFile = new File(inputParam.apkPath);
    ApkDecoder decoder = signatureExtractor == null
        ? new ApkDecoder(config, apkFile)
        : new ApkDecoder(config, apkFile, signatureExtractor);
    return decoder.decode();
  }
}
