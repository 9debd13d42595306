package com.apkinfo.sign;

import com.apkinfo.util.Result;

import java.io.File;

/**
 * Reads the signing certificate fingerprints of an archive. Failures are
 * reported through the result, never thrown.
 */
public interface SignatureExtractor {

    Result<CertificateDigests> extractDigests(File apkFile);
}
