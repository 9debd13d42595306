package com.apkinfo.sign;

import com.apkinfo.util.Result;

import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Runs {@code keytool -printcert -jarfile <apk>} and scrapes the certificate
 * fingerprints from its output.
 */
public class KeytoolSignatureExtractor implements SignatureExtractor {

    private static final Logger LOGGER = Logger.getLogger(KeytoolSignatureExtractor.class.getName());

    public static final String DEFAULT_KEYTOOL = "keytool";

    private static final String MD5_LABEL    = "MD5:";
    private static final String SHA1_LABEL   = "SHA1:";
    private static final String SHA256_LABEL = "SHA256:";

    private final String mKeytool;
    private final long   mTimeoutMillis;

    /**
     * @param keytool path of the keytool binary, {@code null} for the one on {@code PATH}
     * @param timeoutSeconds how long the process may run before it is killed
     */
    public KeytoolSignatureExtractor(String keytool, long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + timeoutSeconds);
        }
        this.mKeytool = keytool == null || keytool.isEmpty() ? DEFAULT_KEYTOOL : keytool;
        this.mTimeoutMillis = TimeUnit.SECONDS.toMillis(timeoutSeconds);
    }

    @Override
    public Result<CertificateDigests> extractDigests(File apkFile) {
        try {
            return Result.success(parse(runCmd(mKeytool, "-printcert", "-jarfile", apkFile.getAbsolutePath())));
        } catch (ToolUnavailableException e) {
            LOGGER.warning(String.format("signature digests unavailable for %s: %s", apkFile, e.getMessage()));
            return Result.failure(e);
        }
    }

    /**
     * Picks the MD5, SHA1 and SHA256 fingerprint lines out of keytool output.
     * Each value loses its spaces and colons and is lower-cased; a missing
     * line leaves that digest empty.
     */
    public static CertificateDigests parse(String output) {
        String md5 = "";
        String sha1 = "";
        String sha256 = "";
        for (String line : output.split("\\r?\\n")) {
            if (md5.isEmpty() && line.contains(MD5_LABEL)) {
                md5 = valueAfter(line, MD5_LABEL);
            } else if (sha1.isEmpty() && line.contains(SHA1_LABEL)) {
                sha1 = valueAfter(line, SHA1_LABEL);
            } else if (sha256.isEmpty() && line.contains(SHA256_LABEL)) {
                sha256 = valueAfter(line, SHA256_LABEL);
            }
        }
        return new CertificateDigests(md5, sha1, sha256);
    }

    private static String valueAfter(String line, String label) {
        String value = line.substring(line.indexOf(label) + label.length());
        return value.replace(" ", "").replace("\t", "").replace(":", "").toLowerCase(Locale.ROOT);
    }

    private String runCmd(String... cmd) throws ToolUnavailableException {
        Process process;
        try {
            process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new ToolUnavailableException(String.format("can not start %s", cmd[0]), e);
        }
        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            Future<String> output = reader.submit(
                () -> IOUtils.toString(process.getInputStream(), Charset.defaultCharset()));
            if (!process.waitFor(mTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new ToolUnavailableException(String.format("%s did not finish within %d ms",
                    cmd[0], mTimeoutMillis));
            }
            String text = output.get(mTimeoutMillis, TimeUnit.MILLISECONDS);
            if (process.exitValue() != 0) {
                throw new ToolUnavailableException(String.format("%s Failed with exit code %d: %s",
                    cmd[0], process.exitValue(), text.trim()));
            }
            return text;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolUnavailableException(String.format("interrupted while waiting for %s", cmd[0]), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ToolUnavailableException(String.format("can not read the output of %s", cmd[0]), e);
        } finally {
            process.destroyForcibly();
            reader.shutdownNow();
        }
    }
}
