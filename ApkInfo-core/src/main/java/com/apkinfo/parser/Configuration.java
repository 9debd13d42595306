package com.apkinfo.parser;

import com.apkinfo.androlib.AbiSupport;
import com.apkinfo.androlib.res.data.ResConfig;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

/**
 * Settings of an extraction: the optional xml config file overlaid with the
 * values set in {@link InputParam}.
 */
public class Configuration {

  public static final int DEFAULT_ICON_DENSITY = 720;
  public static final long DEFAULT_KEYTOOL_TIMEOUT_SECONDS = 30;

  private static final Logger LOGGER = Logger.getLogger(Configuration.class.getName());

  private static final String TAG_ISSUE = "issue";
  private static final String ATTR_VALUE = "value";
  private static final String ATTR_ID = "id";
  private static final String ATTR_ACTIVE = "isactive";
  private static final String ATTR_BITS = "bits";
  private static final String PROPERTY_ISSUE = "property";
  private static final String KEYTOOL_ISSUE = "keytool";
  private static final String ABI_ISSUE = "abi";
  private static final String ATTR_ICON_DENSITY = "iconDensity";
  private static final String ATTR_KEYTOOL_TIMEOUT = "keytoolTimeoutSeconds";
  private static final String ATTR_KEYTOOL_PATH = "path";
  private static final String ATTR_ABI_PATH = "path";

  public String mKeytoolPath;
  public long mKeytoolTimeoutSeconds = DEFAULT_KEYTOOL_TIMEOUT_SECONDS;
  public int mIconDensity = DEFAULT_ICON_DENSITY;
  public boolean mDecodeIcon;
  public String mLabelLanguage = "";
  public String mLabelCountry = "";
  public AbiSupport mAbiSupport = AbiSupport.DEFAULT;

  /**
   * @param param {@link InputParam} parameter
   * @throws IOException the config file can not be read or is invalid
   */
  public Configuration(InputParam param) throws IOException {
    if (param.configFile != null) {
      readXmlConfig(param.configFile);
    }
    if (param.keytoolPath != null) {
      mKeytoolPath = param.keytoolPath;
    }
    if (param.keytoolTimeoutSeconds > 0) {
      mKeytoolTimeoutSeconds = param.keytoolTimeoutSeconds;
    }
    if (param.iconDensity != InputParam.UNSET) {
      mIconDensity = param.iconDensity;
    }
    mDecodeIcon = param.decodeIcon;
    setLabelLocale(param.labelLocale);
  }

  /** Device configuration used to pick the icon variant. */
  public ResConfig getIconConfig() {
    return ResConfig.forDensity(mIconDensity);
  }

  /** Device configuration used to pick the label variant. */
  public ResConfig getLabelConfig() {
    return new ResConfig.Builder().setLanguage(mLabelLanguage).setCountry(mLabelCountry).create();
  }

  /** Accepts {@code fr}, {@code fr-FR}, {@code fr-rFR} and {@code fr_FR}. */
  void setLabelLocale(String locale) {
    if (locale == null || locale.trim().isEmpty()) {
      return;
    }
    String[] parts = locale.trim().split("[-_]", 2);
    mLabelLanguage = parts[0].toLowerCase(Locale.ROOT);
    if (parts.length > 1) {
      String country = parts[1];
      if (country.length() == 3 && country.charAt(0) == 'r') {
        country = country.substring(1);
      }
      mLabelCountry = country.toUpperCase(Locale.ROOT);
    }
  }

  private void readXmlConfig(File xmlConfigFile) throws IOException {
    if (!xmlConfigFile.exists()) {
      throw new IOException(String.format("the config file %s does not exist", xmlConfigFile.getAbsolutePath()));
    }
    LOGGER.fine(String.format("reading config file, %s", xmlConfigFile.getAbsolutePath()));
    try (InputStream input = new BufferedInputStream(new FileInputStream(xmlConfigFile))) {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(false);
      factory.setValidating(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      Document document = builder.parse(new InputSource(input));
      NodeList issues = document.getElementsByTagName(TAG_ISSUE);
      for (int i = 0, count = issues.getLength(); i < count; i++) {
        Element element = (Element) issues.item(i);
        String id = element.getAttribute(ATTR_ID);
        String isActive = element.getAttribute(ATTR_ACTIVE);
        if (id.length() == 0) {
          LOGGER.warning("Invalid config file: Missing required issue id attribute");
          continue;
        }
        boolean active = isActive.isEmpty() || isActive.equals("true");
        if (!active) {
          continue;
        }

        switch (id) {
          case PROPERTY_ISSUE:
            readPropertyFromXml(element);
            break;
          case KEYTOOL_ISSUE:
            readKeytoolFromXml(element);
            break;
          case ABI_ISSUE:
            readAbiFromXml(element);
            break;
          default:
            LOGGER.warning("unknown issue " + id);
            break;
        }
      }
    } catch (ParserConfigurationException | SAXException e) {
      throw new IOException(String.format("Invalid config file %s", xmlConfigFile.getAbsolutePath()), e);
    }
  }

  private static List<Element> childElements(Node node) {
    List<Element> elements = new ArrayList<>();
    NodeList childNodes = node.getChildNodes();
    for (int j = 0, n = childNodes.getLength(); j < n; j++) {
      Node child = childNodes.item(j);
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        elements.add((Element) child);
      }
    }
    return elements;
  }

  private static String requiredValue(Element element) throws IOException {
    String value = element.getAttribute(ATTR_VALUE);
    if (value.length() == 0) {
      throw new IOException(String.format("Invalid config file: Missing required attribute %s of <%s>",
          ATTR_VALUE, element.getTagName()));
    }
    return value.trim();
  }

  private void readPropertyFromXml(Node node) throws IOException {
    for (Element check : childElements(node)) {
      String tagName = check.getTagName();
      String value = requiredValue(check);
      switch (tagName) {
        case ATTR_ICON_DENSITY:
          mIconDensity = parseInt(tagName, value);
          break;
        case ATTR_KEYTOOL_TIMEOUT:
          mKeytoolTimeoutSeconds = parseInt(tagName, value);
          if (mKeytoolTimeoutSeconds <= 0) {
            throw new IOException(String.format("Invalid config file: %s must be positive", tagName));
          }
          break;
        default:
          LOGGER.warning("unknown tag " + tagName);
          break;
      }
    }
  }

  private void readKeytoolFromXml(Node node) throws IOException {
    for (Element check : childElements(node)) {
      String tagName = check.getTagName();
      String value = requiredValue(check);
      if (ATTR_KEYTOOL_PATH.equals(tagName)) {
        // ~ stands for the home directory of the current user
        if (value.charAt(0) == '~') {
          value = System.getProperty("user.home") + value.substring(1);
        }
        mKeytoolPath = value;
      } else {
        LOGGER.warning("unknown tag " + tagName);
      }
    }
  }

  private void readAbiFromXml(Node node) throws IOException {
    List<String> prefixes64 = new ArrayList<>();
    List<String> prefixes32 = new ArrayList<>();
    for (Element check : childElements(node)) {
      String tagName = check.getTagName();
      if (!ATTR_ABI_PATH.equals(tagName)) {
        LOGGER.warning("unknown tag " + tagName);
        continue;
      }
      String value = requiredValue(check);
      String bits = check.getAttribute(ATTR_BITS);
      if ("64".equals(bits)) {
        prefixes64.add(value);
      } else if ("32".equals(bits)) {
        prefixes32.add(value);
      } else {
        throw new IOException(String.format("Invalid config file: abi path %s needs %s=\"32\" or \"64\"",
            value, ATTR_BITS));
      }
    }
    mAbiSupport = new AbiSupport(
        prefixes64.isEmpty() ? mAbiSupport.getPrefixes64() : prefixes64,
        prefixes32.isEmpty() ? mAbiSupport.getPrefixes32() : prefixes32);
  }

  private static int parseInt(String name, String value) throws IOException {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IOException(String.format("Invalid config file: %s=\"%s\" is not a number", name, value), e);
    }
  }
}
