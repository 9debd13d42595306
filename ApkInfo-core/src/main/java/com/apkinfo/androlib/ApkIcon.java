package com.apkinfo.androlib;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

/**
 * The launcher icon picked from the resource table: its archive path, raw
 * bytes and the decoded image.
 */
public final class ApkIcon {
  private final String mPath;
  private final byte[] mBytes;
  private final BufferedImage mImage;

  private ApkIcon(String path, byte[] bytes, BufferedImage image) {
    this.mPath = path;
    this.mBytes = bytes;
    this.mImage = image;
  }

  /**
   * @throws IOException the bytes are not in a format the image codecs know
   */
  public static ApkIcon decode(String path, byte[] bytes) throws IOException {
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
    if (image == null) {
      throw new IOException(String.format("%s is not a supported image", path));
    }
    return new ApkIcon(path, bytes, image);
  }

  public String getPath() {
    return mPath;
  }

  public byte[] getBytes() {
    return mBytes.clone();
  }

  public BufferedImage getImage() {
    return mImage;
  }

  public int getWidth() {
    return mImage.getWidth();
  }

  public int getHeight() {
    return mImage.getHeight();
  }

  @Override
  public String toString() {
    return String.format("%s (%dx%d)", mPath, getWidth(), getHeight());
  }
}
