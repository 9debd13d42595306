package com.apkinfo.androlib;

import com.apkinfo.androlib.res.decoder.BinaryXmlBuilder;
import com.apkinfo.parser.ApkInfo;
import com.apkinfo.parser.Configuration;
import com.apkinfo.parser.InputParam;
import com.apkinfo.sign.CertificateDigests;
import com.apkinfo.sign.SignatureExtractor;
import com.apkinfo.sign.ToolUnavailableException;
import com.apkinfo.util.Md5Util;
import com.apkinfo.util.Result;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class ApkDecoderTest {

    private static final CertificateDigests DIGESTS = new CertificateDigests(
        "0123456789abcdef0123456789abcdef",
        "0123456789abcdef0123456789abcdef01234567",
        "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef");

    private static final SignatureExtractor FIXED = apk -> Result.success(DIGESTS);
    private static final SignatureExtractor UNAVAILABLE =
        apk -> Result.failure(new ToolUnavailableException("keytool not found"));

    @TempDir
    File tempDir;

    private static Configuration config() throws Exception {
        return new Configuration(new InputParam.Builder().setApkPath("unused.apk").create());
    }

    private static ApkInfo decode(File apk) throws Exception {
        return new ApkDecoder(config(), apk, FIXED).decode();
    }

    private File fullApk() throws Exception {
        return new ApkFixture()
            .manifest(ApkFixture.fullManifest())
            .table(ApkFixture.fullTable())
            .add(ApkFixture.ICON_XHDPI, ApkFixture.png(96))
            .add(ApkFixture.ICON_XXXHDPI, ApkFixture.png(192))
            .add(ApkFixture.ICON_ADAPTIVE, new byte[] {3, 0, 8, 0})
            .write(new File(tempDir, "app.apk"));
    }

    @Test
    void testRejectsOtherExtensionsBeforeOpening() {
        File missing = new File(tempDir, "app.zip");

        assertThrows(FormatException.class, () -> decode(missing));
    }

    @Test
    void testExtensionIsCaseInsensitive() throws Exception {
        File apk = new ApkFixture().manifest(ApkFixture.literalManifest("Upper"))
            .write(new File(tempDir, "APP.APK"));

        assertEquals("Upper", decode(apk).label);
    }

    @Test
    void testMissingFile() {
        assertThrows(FileNotFoundException.class, () -> decode(new File(tempDir, "missing.apk")));
    }

    @Test
    void testMissingManifest() throws Exception {
        File apk = new ApkFixture().table(ApkFixture.fullTable()).write(new File(tempDir, "app.apk"));

        assertThrows(FormatException.class, () -> decode(apk));
    }

    @Test
    void testMalformedManifest() throws Exception {
        File apk = new ApkFixture().manifest(new byte[] {2, 0, 8, 0, 8, 0, 0, 0})
            .write(new File(tempDir, "app.apk"));

        assertThrows(FormatException.class, () -> decode(apk));
    }

    @Test
    void testRootMustBeManifest() throws Exception {
        byte[] manifest = new BinaryXmlBuilder().startElement("resources").endElement("resources").build();
        File apk = new ApkFixture().manifest(manifest).write(new File(tempDir, "app.apk"));

        assertThrows(FormatException.class, () -> decode(apk));
    }

    @Test
    void testManifestFields() throws Exception {
        ApkInfo info = decode(fullApk());

        assertEquals("com.example.app", info.packageName);
        assertEquals("1.2.3", info.versionName);
        assertEquals(45, info.versionCode);
        assertEquals(21, info.minSdkVersion);
        assertEquals(33, info.targetSdkVersion);
        assertEquals(Arrays.asList("android.permission.INTERNET", "android.permission.CAMERA"), info.permissions);
    }

    @Test
    void testDeclaredPermissions() throws Exception {
        ApkInfo info = decode(fullApk());

        assertEquals(2, info.declaredPermissions.size());
        assertEquals("com.example.app.permission.SYNC", info.declaredPermissions.get(0).getName());
        assertEquals("signature|privileged", info.declaredPermissions.get(0).getProtectionLevel());
        assertEquals("com.example.app.permission.READ", info.declaredPermissions.get(1).getName());
        assertEquals("normal", info.declaredPermissions.get(1).getProtectionLevel());
    }

    @Test
    void testLabelFromResourceTable() throws Exception {
        assertEquals("Example", decode(fullApk()).label);
    }

    @Test
    void testLabelForLocale() throws Exception {
        Configuration config = new Configuration(new InputParam.Builder()
            .setApkPath("unused.apk").setLabelLocale("fr-FR").create());

        assertEquals("Exemple", new ApkDecoder(config, fullApk(), FIXED).decode().label);
    }

    @Test
    void testLiteralLabel() throws Exception {
        File apk = new ApkFixture().manifest(ApkFixture.literalManifest("Plain Label"))
            .write(new File(tempDir, "app.apk"));

        assertEquals("Plain Label", decode(apk).label);
    }

    @Test
    void testBrokenTableLeavesLabelEmpty() throws Exception {
        File apk = new ApkFixture()
            .manifest(ApkFixture.fullManifest())
            .table(Arrays.copyOf(ApkFixture.fullTable(), 40))
            .write(new File(tempDir, "app.apk"));

        ApkInfo info = decode(apk);
        assertEquals("", info.label);
        assertEquals("com.example.app", info.packageName);
    }

    @Test
    void testIconSkippedUnlessRequested() throws Exception {
        assertNull(decode(fullApk()).icon);
    }

    @Test
    void testIconPrefersLargestNumericDensity() throws Exception {
        Configuration config = config();
        config.mDecodeIcon = true;

        ApkInfo info = new ApkDecoder(config, fullApk(), FIXED).decode();
        assertNotNull(info.icon);
        assertEquals(ApkFixture.ICON_XXXHDPI, info.icon.getPath());
        assertEquals(192, info.icon.getWidth());
        assertEquals(192, info.icon.getHeight());
        assertEquals(0xff3ddc84, info.icon.getImage().getRGB(0, 0));
    }

    @Test
    void testIconForRequestedDensity() throws Exception {
        Configuration config = new Configuration(new InputParam.Builder()
            .setApkPath("unused.apk").setDecodeIcon(true).setIconDensity(320).create());

        ApkInfo info = new ApkDecoder(config, fullApk(), FIXED).decode();
        assertEquals(ApkFixture.ICON_XHDPI, info.icon.getPath());
        assertEquals(96, info.icon.getWidth());
    }

    @Test
    void testMissingIconFileIsNotFatal() throws Exception {
        File apk = new ApkFixture()
            .manifest(ApkFixture.fullManifest())
            .table(ApkFixture.fullTable())
            .write(new File(tempDir, "app.apk"));
        Configuration config = config();
        config.mDecodeIcon = true;

        ApkInfo info = new ApkDecoder(config, apk, FIXED).decode();
        assertNull(info.icon);
        assertEquals("Example", info.label);
    }

    @Test
    void testNoNativeCodeSupportsBoth() throws Exception {
        ApkInfo info = decode(fullApk());

        assertTrue(info.supports64Bit);
        assertTrue(info.supports32Bit);
        assertEquals(Collections.emptyList(), info.nativeAbis);
    }

    @Test
    void testArm64Only() throws Exception {
        File apk = new ApkFixture().manifest(ApkFixture.fullManifest()).nativeLib("arm64-v8a")
            .write(new File(tempDir, "app.apk"));

        ApkInfo info = decode(apk);
        assertTrue(info.supports64Bit);
        assertFalse(info.supports32Bit);
        assertEquals(Collections.singletonList("arm64-v8a"), info.nativeAbis);
    }

    @Test
    void testAbiDirectoryWithoutSharedLibrary() throws Exception {
        File apk = new ApkFixture().manifest(ApkFixture.fullManifest())
            .add("lib/arm64-v8a/gdbserver", new byte[] {0x7f, 'E', 'L', 'F'})
            .write(new File(tempDir, "app.apk"));

        ApkInfo info = decode(apk);
        assertTrue(info.supports64Bit);
        assertFalse(info.supports32Bit);
    }

    @Test
    void testArmeabiPrefixCoversV7a() throws Exception {
        File apk = new ApkFixture().manifest(ApkFixture.fullManifest()).nativeLib("armeabi-v7a")
            .write(new File(tempDir, "app.apk"));

        ApkInfo info = decode(apk);
        assertFalse(info.supports64Bit);
        assertTrue(info.supports32Bit);
    }

    @Test
    void testOtherAbisSupportNeither() throws Exception {
        File apk = new ApkFixture().manifest(ApkFixture.fullManifest()).nativeLib("x86_64").nativeLib("x86")
            .write(new File(tempDir, "app.apk"));

        ApkInfo info = decode(apk);
        assertFalse(info.supports64Bit);
        assertFalse(info.supports32Bit);
        assertEquals(Arrays.asList("x86_64", "x86"), info.nativeAbis);
    }

    @Test
    void testConfiguredAbiPrefixes() throws Exception {
        File apk = new ApkFixture().manifest(ApkFixture.fullManifest()).nativeLib("x86_64")
            .write(new File(tempDir, "app.apk"));
        Configuration config = config();
        config.mAbiSupport = new AbiSupport(Arrays.asList("lib/arm64-v8a", "lib/x86_64"), AbiSupport.DEFAULT_32_BIT);

        ApkInfo info = new ApkDecoder(config, apk, FIXED).decode();
        assertTrue(info.supports64Bit);
        assertFalse(info.supports32Bit);
    }

    @Test
    void testSizeAndContentHash() throws Exception {
        File apk = fullApk();
        ApkInfo info = decode(apk);

        assertEquals(apk.length(), info.size);
        assertEquals(32, info.fileMd5.length());
        assertTrue(info.fileMd5.matches("[0-9a-f]{32}"));
        assertEquals(Md5Util.getMD5Str(apk), info.fileMd5);
    }

    @Test
    void testSignatureDigests() throws Exception {
        ApkInfo info = decode(fullApk());

        assertEquals(DIGESTS.getMd5(), info.signatureMd5);
        assertEquals(DIGESTS.getSha1(), info.signatureSha1);
        assertEquals(DIGESTS.getSha256(), info.signatureSha256);
    }

    @Test
    void testUnavailableSignatureLeavesDigestsEmpty() throws Exception {
        ApkInfo info = new ApkDecoder(config(), fullApk(), UNAVAILABLE).decode();

        assertEquals("", info.signatureMd5);
        assertEquals("", info.signatureSha1);
        assertEquals("", info.signatureSha256);
        assertEquals("com.example.app", info.packageName);
    }
}
