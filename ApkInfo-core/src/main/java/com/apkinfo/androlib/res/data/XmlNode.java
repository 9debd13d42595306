package com.apkinfo.androlib.res.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An element of a decoded binary xml document. Attributes and children keep
 * the order of the source document.
 */
public final class XmlNode {
  private final String mNamespace;
  private final String mTag;
  private final List<XmlAttribute> mAttributes;
  private final List<XmlNamespace> mNamespaces;
  private final List<XmlNode> mChildren;
  private final StringBuilder mText;

  public XmlNode(String namespace, String tag, List<XmlAttribute> attributes, List<XmlNamespace> namespaces) {
    this.mNamespace = namespace;
    this.mTag = tag;
    this.mAttributes = Collections.unmodifiableList(new ArrayList<>(attributes));
    this.mNamespaces = Collections.unmodifiableList(new ArrayList<>(namespaces));
    this.mChildren = new ArrayList<>();
    this.mText = new StringBuilder();
  }

  public String getNamespace() {
    return mNamespace;
  }

  public String getTag() {
    return mTag;
  }

  public List<XmlAttribute> getAttributes() {
    return mAttributes;
  }

  /** Namespaces whose scope opened right before this element. */
  public List<XmlNamespace> getNamespaces() {
    return mNamespaces;
  }

  public List<XmlNode> getChildren() {
    return Collections.unmodifiableList(mChildren);
  }

  public String getText() {
    return mText.toString();
  }

  public void addChild(XmlNode child) {
    mChildren.add(child);
  }

  public void appendText(String text) {
    mText.append(text);
  }

  public List<XmlNode> getChildren(String tag) {
    List<XmlNode> matched = new ArrayList<>();
    for (XmlNode child : mChildren) {
      if (child.mTag.equals(tag)) {
        matched.add(child);
      }
    }
    return matched;
  }

  public XmlNode getFirstChild(String tag) {
    for (XmlNode child : mChildren) {
      if (child.mTag.equals(tag)) {
        return child;
      }
    }
    return null;
  }

  /**
   * Finds an attribute by local name, or by framework id when the document
   * stripped the name from its string pool. Pass 0 as {@code resourceId} to
   * match by name only.
   */
  public XmlAttribute getAttribute(String name, int resourceId) {
    for (XmlAttribute attribute : mAttributes) {
      if (name.equals(attribute.getName())) {
        return attribute;
      }
    }
    if (resourceId != 0) {
      for (XmlAttribute attribute : mAttributes) {
        if (attribute.getResourceId() == resourceId) {
          return attribute;
        }
      }
    }
    return null;
  }

  public XmlAttribute getAttribute(String name) {
    return getAttribute(name, 0);
  }

  public String getAttributeValue(String name) {
    XmlAttribute attribute = getAttribute(name);
    return attribute == null ? null : attribute.getValue();
  }

  @Override
  public String toString() {
    return "<" + mTag + " " + mAttributes + "> (" + mChildren.size() + " children)";
  }
}
