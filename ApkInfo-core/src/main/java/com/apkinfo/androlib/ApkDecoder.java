package com.apkinfo.androlib;

import com.apkinfo.androlib.res.ResourceResolver;
import com.apkinfo.androlib.res.data.ResValue;
import com.apkinfo.androlib.res.data.ResXmlDocument;
import com.apkinfo.androlib.res.data.XmlAttribute;
import com.apkinfo.androlib.res.decoder.ARSCDecoder;
import com.apkinfo.androlib.res.decoder.AXMLDecoder;
import com.apkinfo.parser.ApkInfo;
import com.apkinfo.parser.Configuration;
import com.apkinfo.sign.CertificateDigests;
import com.apkinfo.sign.KeytoolSignatureExtractor;
import com.apkinfo.sign.SignatureExtractor;
import com.apkinfo.util.Md5Util;
import com.apkinfo.util.Result;
import com.apkinfo.util.TypedValue;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Extracts the metadata of one apk. Archive and manifest problems abort the
 * extraction; label, icon, content hash and signature digests are best
 * effort and stay empty when they can not be determined.
 */
public class ApkDecoder {

  private static final Logger LOGGER = Logger.getLogger(ApkDecoder.class.getName());

  private final Configuration config;
  private final File apkFile;
  private final SignatureExtractor signatureExtractor;

  public ApkDecoder(Configuration config, File apkFile) {
    this(config, apkFile, new KeytoolSignatureExtractor(config.mKeytoolPath, config.mKeytoolTimeoutSeconds));
  }

  public ApkDecoder(Configuration config, File apkFile, SignatureExtractor signatureExtractor) {
    this.config = config;
    this.apkFile = apkFile;
    this.signatureExtractor = signatureExtractor;
  }

  public Configuration getConfig() {
    return config;
  }

  /**
   * @throws FormatException the file is not an apk, has no manifest or the manifest is malformed
   * @throws TruncatedInputException the manifest ends in the middle of a chunk
   * @throws IOException the archive can not be read
   */
  public ApkInfo decode() throws AndrolibException, IOException {
    if (!apkFile.getName().toLowerCase(Locale.ROOT).endsWith(TypedValue.APK_FILE)) {
      throw new FormatException(String.format("%s is not an %s file", apkFile.getName(), TypedValue.APK_FILE));
    }
    if (!apkFile.isFile()) {
      throw new FileNotFoundException(String.format("The input apk %s does not exist", apkFile.getAbsolutePath()));
    }

    ApkInfo.Builder builder = new ApkInfo.Builder().setSize(apkFile.length());
    try (ApkArchive archive = ApkArchive.open(apkFile)) {
      byte[] manifestData = archive.readEntry(TypedValue.MANIFEST_FILE);
      if (manifestData == null) {
        throw new FormatException(String.format("%s has no %s", apkFile.getName(), TypedValue.MANIFEST_FILE));
      }
      ResXmlDocument document = AXMLDecoder.decode(manifestData);
      for (String diagnostic : document.getDiagnostics()) {
        LOGGER.fine(String.format("%s: %s", TypedValue.MANIFEST_FILE, diagnostic));
      }
      ManifestInfo manifest = ManifestInfo.from(document);
      builder.setManifest(manifest);

      ResourceResolver resolver = readResources(archive);

      Result<String> label = resolveLabel(manifest.getLabel(), resolver);
      builder.setLabel(orEmpty("label", label));

      if (config.mDecodeIcon) {
        Result<ApkIcon> icon = resolveIcon(manifest.getIcon(), resolver, archive);
        if (icon.isSuccess()) {
          builder.setIcon(icon.getValue());
        } else {
          LOGGER.warning(String.format("icon unavailable: %s", icon.getError().getMessage()));
        }
      }

      builder.setSupports64Bit(archive.supports64Bit(config.mAbiSupport))
          .setSupports32Bit(archive.supports32Bit(config.mAbiSupport))
          .setNativeAbis(archive.getNativeAbis());
    }

    builder.setFileMd5(orEmpty("content hash", fileMd5()));

    Result<CertificateDigests> digests = signatureExtractor.extractDigests(apkFile);
    CertificateDigests certificate = digests.isSuccess() ? digests.getValue() : CertificateDigests.EMPTY;
    builder.setSignature(certificate.getMd5(), certificate.getSha1(), certificate.getSha256());

    return builder.create();
  }

  /** A broken resource table only costs the label and the icon. */
  private ResourceResolver readResources(ApkArchive archive) throws IOException {
    byte[] tableData = archive.readEntry(TypedValue.ARSC_FILE);
    if (tableData == null) {
      LOGGER.fine(String.format("%s has no %s", apkFile.getName(), TypedValue.ARSC_FILE));
      return null;
    }
    try {
      return new ResourceResolver(ARSCDecoder.decode(tableData));
    } catch (AndrolibException e) {
      LOGGER.warning(String.format("can not decode %s: %s", TypedValue.ARSC_FILE, e.getMessage()));
      return null;
    }
  }

  private Result<String> resolveLabel(XmlAttribute attribute, ResourceResolver resolver) {
    if (attribute == null) {
      return Result.success("");
    }
    ResValue value = attribute.getTypedValue();
    if (value == null || !value.isReference()) {
      return Result.success(attribute.getValue());
    }
    if (resolver == null) {
      return Result.failure(new ResourceNotFoundException(value.getReference(),
          String.format("label %s refers to a missing resource table", value.getReference())));
    }
    try {
      return Result.success(resolver.resolve(value.getReference(), config.getLabelConfig()).coerceToString());
    } catch (AndrolibException e) {
      return Result.failure(e);
    }
  }

  private Result<ApkIcon> resolveIcon(XmlAttribute attribute, ResourceResolver resolver, ApkArchive archive) {
    if (attribute == null) {
      return Result.failure(new FormatException("manifest declares no icon"));
    }
    String path = attribute.getValue();
    ResValue value = attribute.getTypedValue();
    if (value != null && value.isReference()) {
      if (resolver == null) {
        return Result.failure(new ResourceNotFoundException(value.getReference(),
            String.format("icon %s refers to a missing resource table", value.getReference())));
      }
      try {
        path = resolver.resolve(value.getReference(), config.getIconConfig()).coerceToString();
      } catch (AndrolibException e) {
        return Result.failure(e);
      }
    }
    if (path == null || path.isEmpty()) {
      return Result.failure(new FormatException("icon does not name a file"));
    }
    try {
      byte[] bytes = archive.readEntry(path);
      if (bytes == null) {
        return Result.failure(new FileNotFoundException(String.format("icon %s is not in the archive", path)));
      }
      return Result.success(ApkIcon.decode(path, bytes));
    } catch (IOException e) {
      return Result.failure(e);
    }
  }

  private Result<String> fileMd5() {
    try {
      return Result.success(Md5Util.getMD5Str(apkFile));
    } catch (IOException e) {
      return Result.failure(e);
    }
  }

  private static String orEmpty(String what, Result<String> result) {
    if (result.isSuccess()) {
      return result.orElse("");
    }
    LOGGER.warning(String.format("%s unavailable: %s", what, result.getError().getMessage()));
    return "";
  }
}
