package com.apkinfo.androlib;

import com.apkinfo.androlib.res.data.ResXmlDocument;
import com.apkinfo.androlib.res.data.XmlAttribute;
import com.apkinfo.androlib.res.data.XmlNode;
import com.apkinfo.androlib.res.decoder.AndroidAttributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * The fields of a decoded {@code AndroidManifest.xml} that make up the apk
 * metadata. Label and icon are kept as attributes since they usually point
 * into the resource table.
 */
public final class ManifestInfo {

  private static final Logger LOGGER = Logger.getLogger(ManifestInfo.class.getName());

  static final String TAG_MANIFEST = "manifest";
  static final String TAG_APPLICATION = "application";
  static final String TAG_USES_SDK = "uses-sdk";
  static final String TAG_USES_PERMISSION = "uses-permission";
  static final String TAG_PERMISSION = "permission";
  static final String ATTR_PACKAGE = "package";

  private static final String[] PROTECTION_BASES = {"normal", "dangerous", "signature", "signatureOrSystem"};
  private static final String[] PROTECTION_FLAGS = {
      "privileged", "development", "appop", "pre23", "installer", "verifier", "preinstalled", "setup"
  };

  private final String mPackageName;
  private final String mVersionName;
  private final int mVersionCode;
  private final int mMinSdkVersion;
  private final int mTargetSdkVersion;
  private final XmlAttribute mLabel;
  private final XmlAttribute mIcon;
  private final List<String> mUsesPermissions;
  private final List<Permission> mPermissions;

  private ManifestInfo(XmlNode manifest) {
    mPackageName = nullToEmpty(manifest.getAttributeValue(ATTR_PACKAGE));
    mVersionName = nullToEmpty(value(manifest.getAttribute("versionName", AndroidAttributes.VERSION_NAME)));
    mVersionCode = intValue(manifest.getAttribute("versionCode", AndroidAttributes.VERSION_CODE));

    XmlNode usesSdk = manifest.getFirstChild(TAG_USES_SDK);
    if (usesSdk != null) {
      mMinSdkVersion = intValue(usesSdk.getAttribute("minSdkVersion", AndroidAttributes.MIN_SDK_VERSION));
      mTargetSdkVersion = intValue(usesSdk.getAttribute("targetSdkVersion", AndroidAttributes.TARGET_SDK_VERSION));
    } else {
      mMinSdkVersion = 0;
      mTargetSdkVersion = 0;
    }

    XmlNode application = manifest.getFirstChild(TAG_APPLICATION);
    if (application != null) {
      mLabel = application.getAttribute("label", AndroidAttributes.LABEL);
      mIcon = application.getAttribute("icon", AndroidAttributes.ICON);
    } else {
      mLabel = null;
      mIcon = null;
    }

    List<String> usesPermissions = new ArrayList<>();
    for (XmlNode node : manifest.getChildren(TAG_USES_PERMISSION)) {
      String name = value(node.getAttribute("name", AndroidAttributes.NAME));
      if (name != null) {
        usesPermissions.add(name);
      }
    }
    mUsesPermissions = Collections.unmodifiableList(usesPermissions);

    List<Permission> permissions = new ArrayList<>();
    for (XmlNode node : manifest.getChildren(TAG_PERMISSION)) {
      String name = value(node.getAttribute("name", AndroidAttributes.NAME));
      if (name != null) {
        permissions.add(new Permission(name,
            protectionLevel(node.getAttribute("protectionLevel", AndroidAttributes.PROTECTION_LEVEL))));
      }
    }
    mPermissions = Collections.unmodifiableList(permissions);
  }

  /**
   * @throws FormatException the root element is not {@code <manifest>}
   */
  public static ManifestInfo from(ResXmlDocument document) throws FormatException {
    XmlNode root = document.getRoot();
    if (!TAG_MANIFEST.equals(root.getTag())) {
      throw new FormatException(String.format("root element is <%s>, expected <%s>", root.getTag(), TAG_MANIFEST));
    }
    return new ManifestInfo(root);
  }

  public String getPackageName() {
    return mPackageName;
  }

  public String getVersionName() {
    return mVersionName;
  }

  public int getVersionCode() {
    return mVersionCode;
  }

  public int getMinSdkVersion() {
    return mMinSdkVersion;
  }

  public int getTargetSdkVersion() {
    return mTargetSdkVersion;
  }

  /** {@code android:label} of {@code <application>}, {@code null} when absent. */
  public XmlAttribute getLabel() {
    return mLabel;
  }

  public XmlAttribute getIcon() {
    return mIcon;
  }

  /** Names of every {@code <uses-permission>}, in document order, duplicates kept. */
  public List<String> getUsesPermissions() {
    return mUsesPermissions;
  }

  public List<Permission> getPermissions() {
    return mPermissions;
  }

  private static String value(XmlAttribute attribute) {
    return attribute == null ? null : attribute.getValue();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  /** Integer attributes are usually typed; a literal string is parsed leniently to 0. */
  private static int intValue(XmlAttribute attribute) {
    if (attribute == null) {
      return 0;
    }
    if (attribute.getTypedValue() != null && attribute.getTypedValue().isInteger()) {
      return attribute.getTypedValue().getData();
    }
    String text = attribute.getValue();
    if (text == null) {
      return 0;
    }
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException e) {
      LOGGER.fine(String.format("%s=\"%s\" is not a number", attribute.getName(), text));
      return 0;
    }
  }

  static String protectionLevel(XmlAttribute attribute) {
    if (attribute == null) {
      return PROTECTION_BASES[0];
    }
    if (attribute.getTypedValue() == null || !attribute.getTypedValue().isInteger()) {
      return nullToEmpty(attribute.getValue());
    }
    int level = attribute.getTypedValue().getData();
    int base = level & 0xf;
    StringBuilder name = new StringBuilder(
        base < PROTECTION_BASES.length ? PROTECTION_BASES[base] : String.format("0x%x", base));
    for (int i = 0; i < PROTECTION_FLAGS.length; i++) {
      if ((level & (0x10 << i)) != 0) {
        name.append('|').append(PROTECTION_FLAGS[i]);
      }
    }
    return name.toString();
  }

  /** A {@code <permission>} the app declares. */
  public static final class Permission {
    private final String mName;
    private final String mProtectionLevel;

    public Permission(String name, String protectionLevel) {
      this.mName = name;
      this.mProtectionLevel = protectionLevel;
    }

    public String getName() {
      return mName;
    }

    public String getProtectionLevel() {
      return mProtectionLevel;
    }

    @Override
    public String toString() {
      return mName + " (" + mProtectionLevel + ")";
    }
  }
}
