package com.apkinfo.androlib;

import com.apkinfo.androlib.res.decoder.AXMLDecoder;
import com.apkinfo.androlib.res.decoder.AndroidAttributes;
import com.apkinfo.androlib.res.decoder.BinaryXmlBuilder;
import com.apkinfo.util.TypedValue;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.apkinfo.androlib.res.decoder.BinaryXmlBuilder.ANDROID_NS;
import static com.apkinfo.androlib.res.decoder.BinaryXmlBuilder.Attr;
import static org.junit.jupiter.api.Assertions.*;

class ManifestInfoTest {

    private static ManifestInfo read(BinaryXmlBuilder builder) throws Exception {
        return ManifestInfo.from(AXMLDecoder.decode(builder.build()));
    }

    private static String protection(int level) throws Exception {
        ManifestInfo manifest = read(new BinaryXmlBuilder()
            .startElement("manifest", Attr.string(null, "package", "com.example.app"))
            .startElement("permission",
                Attr.string(ANDROID_NS, "name", "p"),
                Attr.integer(ANDROID_NS, "protectionLevel", level))
            .endElement("permission")
            .endElement("manifest"));
        return manifest.getPermissions().get(0).getProtectionLevel();
    }

    @Test
    void testLiteralAttributes() throws Exception {
        ManifestInfo manifest = read(new BinaryXmlBuilder()
            .startNamespace("android", ANDROID_NS)
            .startElement("manifest",
                Attr.string(null, "package", "com.example.app"),
                Attr.string(ANDROID_NS, "versionName", "1.2.3"),
                Attr.string(ANDROID_NS, "versionCode", "45"))
            .startElement("uses-permission", Attr.string(ANDROID_NS, "name", "android.permission.CAMERA"))
            .endElement("uses-permission")
            .startElement("uses-permission", Attr.string(ANDROID_NS, "name", "android.permission.INTERNET"))
            .endElement("uses-permission")
            .startElement("uses-permission", Attr.string(ANDROID_NS, "name", "android.permission.CAMERA"))
            .endElement("uses-permission")
            .endElement("manifest")
            .endNamespace("android", ANDROID_NS));

        assertEquals("com.example.app", manifest.getPackageName());
        assertEquals("1.2.3", manifest.getVersionName());
        assertEquals(45, manifest.getVersionCode());
        assertEquals(Arrays.asList("android.permission.CAMERA", "android.permission.INTERNET",
            "android.permission.CAMERA"), manifest.getUsesPermissions());
        assertEquals(0, manifest.getMinSdkVersion());
        assertEquals(0, manifest.getTargetSdkVersion());
        assertNull(manifest.getLabel());
        assertNull(manifest.getIcon());
    }

    @Test
    void testUnparsableVersionCodeIsZero() throws Exception {
        ManifestInfo manifest = read(new BinaryXmlBuilder()
            .startElement("manifest", Attr.string(ANDROID_NS, "versionCode", "forty-five"))
            .endElement("manifest"));

        assertEquals(0, manifest.getVersionCode());
        assertEquals("", manifest.getPackageName());
        assertEquals("", manifest.getVersionName());
    }

    @Test
    void testStrippedNamesFoundByResourceId() throws Exception {
        BinaryXmlBuilder builder = new BinaryXmlBuilder()
            .framework("", AndroidAttributes.VERSION_CODE);
        builder.startElement("manifest",
                Attr.byIndex(ANDROID_NS, 0, TypedValue.TYPE_INT_DEC, 7))
            .endElement("manifest");

        assertEquals(7, read(builder).getVersionCode());
    }

    @Test
    void testProtectionLevels() throws Exception {
        assertEquals("normal", protection(0));
        assertEquals("dangerous", protection(1));
        assertEquals("signature", protection(2));
        assertEquals("signatureOrSystem", protection(3));
        assertEquals("signature|privileged", protection(0x12));
        assertEquals("signature|development|appop", protection(0x62));
        assertEquals("0xf", protection(0xf));
    }

    @Test
    void testRootMustBeManifest() throws Exception {
        BinaryXmlBuilder builder = new BinaryXmlBuilder().startElement("application").endElement("application");

        assertThrows(FormatException.class, () -> read(builder));
    }
}
