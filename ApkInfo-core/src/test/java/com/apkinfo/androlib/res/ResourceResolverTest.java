package com.apkinfo.androlib.res;

import com.apkinfo.androlib.ResourceCycleException;
import com.apkinfo.androlib.ResourceNotFoundException;
import com.apkinfo.androlib.res.data.ResConfig;
import com.apkinfo.androlib.res.data.ResEntry;
import com.apkinfo.androlib.res.data.ResID;
import com.apkinfo.androlib.res.data.ResPackage;
import com.apkinfo.androlib.res.data.ResTable;
import com.apkinfo.androlib.res.data.ResType;
import com.apkinfo.androlib.res.data.ResValue;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ResourceResolverTest {

    private static final ResID ICON = new ResID(0x7f, 1, 0);
    private static final ResID LABEL = new ResID(0x7f, 2, 0);

    private static ResourceResolver resolver(ResID id, List<ResEntry> entries) {
        ResPackage pkg = new ResPackage(id.package_, "com.example.app");
        ResType type = pkg.getOrCreateType(id.type, "mipmap");
        for (ResEntry entry : entries) {
            type.addEntry(id.entry, entry);
        }
        return new ResourceResolver(new ResTable(Collections.singletonList(pkg)));
    }

    private static ResEntry density(int density) {
        return ResEntry.simple(ResConfig.forDensity(density), "ic_launcher", ResValue.ofString("d" + density));
    }

    private static String resolveIcon(int requested, ResEntry... entries) throws Exception {
        return resolver(ICON, Arrays.asList(entries)).resolve(ICON, ResConfig.forDensity(requested)).getString();
    }

    @Test
    void testRoundsUpToNextDensity() throws Exception {
        assertEquals("d480", resolveIcon(400, density(0), density(320), density(480), density(640)));
        assertEquals("d480", resolveIcon(480, density(320), density(640), density(480)));
    }

    @Test
    void testRoundsDownWhenNothingIsLarger() throws Exception {
        assertEquals("d640", resolveIcon(720, density(160), density(640), density(480)));
    }

    @Test
    void testDefaultIsFallback() throws Exception {
        assertEquals("d0", resolveIcon(720, density(0)));
        assertEquals("d320", resolveIcon(720, density(0), density(320)));
    }

    @Test
    void testUnspecifiedRequestPrefersDefault() throws Exception {
        assertEquals("d0", resolveIcon(0, density(480), density(0)));
        assertEquals("d160", resolveIcon(0, density(120), density(160), density(480)));
    }

    @Test
    void testAnyAndNoDensityRankLast() throws Exception {
        ResEntry any = ResEntry.simple(new ResConfig.Builder().setDensity(ResConfig.DENSITY_ANY).setSdkVersion(26).create(),
            "ic_launcher", ResValue.ofString("anydpi"));
        ResEntry none = density(ResConfig.DENSITY_NONE);

        assertEquals("d480", resolveIcon(720, any, none, density(480)));
        assertEquals("d0", resolveIcon(720, any, none, density(0)));
        assertEquals("anydpi", resolver(ICON, Arrays.asList(none, any))
            .resolve(ICON, new ResConfig.Builder().setDensity(720).setSdkVersion(30).create()).getString());
        assertEquals("d65535", resolveIcon(720, none));
    }

    @Test
    void testSpecificityBreaksTies() throws Exception {
        ResEntry plain = density(480);
        ResEntry v21 = ResEntry.simple(new ResConfig.Builder().setDensity(480).setSdkVersion(21).create(),
            "ic_launcher", ResValue.ofString("v21"));
        ResConfig request = new ResConfig.Builder().setDensity(480).setSdkVersion(30).create();

        assertEquals("v21", resolver(ICON, Arrays.asList(plain, v21)).resolve(ICON, request).getString());
        assertEquals("v21", resolver(ICON, Arrays.asList(v21, plain)).resolve(ICON, request).getString());
    }

    @Test
    void testVersionQualifierOutranksUnversionedTwin() throws Exception {
        ResEntry v4 = ResEntry.simple(new ResConfig.Builder().setDensity(480).setSdkVersion(4).create(),
            "ic_launcher", ResValue.ofString("v4"));

        assertEquals("v4", resolveIcon(480, density(480), v4));
        assertEquals("v4", resolveIcon(480, v4, density(480)));
    }

    @Test
    void testSelectionIgnoresDeclarationOrder() throws Exception {
        List<ResEntry> entries = new ArrayList<>(Arrays.asList(
            density(0), density(120), density(160), density(240), density(320), density(480), density(640),
            density(ResConfig.DENSITY_ANY), density(ResConfig.DENSITY_NONE),
            ResEntry.simple(new ResConfig.Builder().setDensity(480).setSdkVersion(21).create(),
                "ic_launcher", ResValue.ofString("v21")),
            ResEntry.simple(new ResConfig.Builder().setDensity(480).setLanguage("de").create(),
                "ic_launcher", ResValue.ofString("de"))));
        int[] requests = {0, 100, 160, 200, 400, 480, 720};

        for (int requested : requests) {
            ResConfig request = new ResConfig.Builder().setDensity(requested).setSdkVersion(28).create();
            String expected = resolver(ICON, entries).resolve(ICON, request).getString();
            for (int round = 0; round < 10; round++) {
                Collections.shuffle(entries, new Random(round));
                assertEquals(expected, resolver(ICON, entries).resolve(ICON, request).getString(),
                    "request " + requested);
            }
        }
    }

    @Test
    void testLocaleFiltersCandidates() throws Exception {
        List<ResEntry> entries = Arrays.asList(
            ResEntry.simple(ResConfig.DEFAULT, "app_name", ResValue.ofString("Example")),
            ResEntry.simple(new ResConfig.Builder().setLanguage("fr").create(), "app_name", ResValue.ofString("Exemple")),
            ResEntry.simple(new ResConfig.Builder().setLanguage("fr").setCountry("CA").create(),
                "app_name", ResValue.ofString("Exemple CA")));
        ResourceResolver resolver = resolver(LABEL, entries);

        assertEquals("Example", resolver.resolve(LABEL, null).getString());
        assertEquals("Example", resolver.resolve(LABEL, new ResConfig.Builder().setLanguage("de").create()).getString());
        assertEquals("Exemple", resolver.resolve(LABEL, new ResConfig.Builder().setLanguage("fr").create()).getString());
        assertEquals("Exemple CA", resolver.resolve(LABEL,
            new ResConfig.Builder().setLanguage("fr").setCountry("CA").create()).getString());
    }

    @Test
    void testFollowsReferences() throws Exception {
        ResPackage pkg = new ResPackage(0x7f, "com.example.app");
        ResType string = pkg.getOrCreateType(2, "string");
        string.addEntry(0, ResEntry.simple(ResConfig.DEFAULT, "label", ResValue.ofReference(0x7f020001)));
        string.addEntry(1, ResEntry.simple(ResConfig.DEFAULT, "alias", ResValue.ofReference(0x7f020002)));
        string.addEntry(2, ResEntry.simple(ResConfig.DEFAULT, "app_name", ResValue.ofString("Example")));
        ResourceResolver resolver = new ResourceResolver(new ResTable(Collections.singletonList(pkg)));

        assertEquals("Example", resolver.resolve(LABEL, null).getString());
        assertTrue(resolver.resolveEntry(LABEL, null).getValue().isReference());
    }

    @Test
    void testSelfReferenceIsACycle() {
        ResourceResolver resolver = resolver(LABEL, Collections.singletonList(
            ResEntry.simple(ResConfig.DEFAULT, "loop", ResValue.ofReference(LABEL.id))));

        ResourceCycleException e = assertThrows(ResourceCycleException.class, () -> resolver.resolve(LABEL, null));
        assertEquals(LABEL, e.getResID());
        assertEquals(ResourceResolver.MAX_DEPTH, e.getDepth());
    }

    @Test
    void testLongChainWithinLimitResolves() throws Exception {
        ResPackage pkg = new ResPackage(0x7f, "com.example.app");
        ResType string = pkg.getOrCreateType(2, "string");
        for (int i = 0; i < ResourceResolver.MAX_DEPTH; i++) {
            string.addEntry(i, ResEntry.simple(ResConfig.DEFAULT, "hop" + i, ResValue.ofReference(0x7f020000 | (i + 1))));
        }
        string.addEntry(ResourceResolver.MAX_DEPTH, ResEntry.simple(ResConfig.DEFAULT, "end", ResValue.ofString("end")));
        ResourceResolver resolver = new ResourceResolver(new ResTable(Collections.singletonList(pkg)));

        assertEquals("end", resolver.resolve(LABEL, null).getString());
    }

    @Test
    void testUnknownIdsAreNotFound() {
        ResourceResolver resolver = resolver(ICON, Collections.singletonList(density(480)));

        assertThrows(ResourceNotFoundException.class, () -> resolver.resolve(new ResID(0x7e010000), null));
        assertThrows(ResourceNotFoundException.class, () -> resolver.resolve(new ResID(0x7f050000), null));
        assertThrows(ResourceNotFoundException.class, () -> resolver.resolve(new ResID(0x7f010001), null));
    }

    @Test
    void testNoMatchingVariantIsNotFound() {
        ResourceResolver resolver = resolver(LABEL, Collections.singletonList(
            ResEntry.simple(new ResConfig.Builder().setLanguage("fr").create(), "app_name", ResValue.ofString("x"))));

        assertThrows(ResourceNotFoundException.class,
            () -> resolver.resolve(LABEL, new ResConfig.Builder().setLanguage("en").create()));
    }

    @Test
    void testDanglingReferenceIsNotFound() {
        ResourceResolver resolver = resolver(LABEL, Collections.singletonList(
            ResEntry.simple(ResConfig.DEFAULT, "label", ResValue.ofReference(0x7f020063))));

        assertThrows(ResourceNotFoundException.class, () -> resolver.resolve(LABEL, null));
    }
}
