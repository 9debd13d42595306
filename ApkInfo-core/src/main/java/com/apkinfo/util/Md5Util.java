package com.apkinfo.util;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class Md5Util {

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * MD5 of the whole file as 32 lower-case hex characters. The file is
     * streamed, never loaded at once.
     */
    public static String getMD5Str(File file) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = FileUtils.openInputStream(file)) {
            int read;
            while ((read = IOUtils.read(in, buffer)) > 0) {
                digest.update(buffer, 0, read);
            }
        }
        return bytesToHexString(digest.digest());
    }

    public static String getMD5Str(byte[] data) {
        MessageDigest digest = newDigest();
        digest.update(data);
        return bytesToHexString(digest.digest());
    }

    public static String bytesToHexString(byte[] src) {
        if (src.length <= 0) {
            return "";
        }
        StringBuilder stringBuilder = new StringBuilder(src.length * 2);
        for (byte b : src) {
            int v = b & 0xFF;
            String hv = Integer.toHexString(v);
            if (hv.length() < 2) {
                stringBuilder.append(0);
            }
            stringBuilder.append(hv);
        }
        return stringBuilder.toString();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException(e);
        }
    }
}
