package com.apkinfo.androlib.res.decoder;

import com.apkinfo.androlib.FormatException;
import com.apkinfo.androlib.TruncatedInputException;
import com.apkinfo.androlib.res.data.ResConfig;
import com.apkinfo.androlib.res.data.ResEntry;
import com.apkinfo.androlib.res.data.ResID;
import com.apkinfo.androlib.res.data.ResPackage;
import com.apkinfo.androlib.res.data.ResTable;
import com.apkinfo.androlib.res.data.ResType;
import com.apkinfo.util.TypedValue;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

import static com.apkinfo.androlib.res.decoder.ResTableBuilder.Config;
import static org.junit.jupiter.api.Assertions.*;

class ARSCDecoderTest {

    private static ResTableBuilder sample() {
        ResTableBuilder builder = new ResTableBuilder(0x7f, "com.example.app");
        int string = builder.type("string");
        int mipmap = builder.type("mipmap");
        builder.config(string, Config.density(0))
            .string(0, "app_name", "Example")
            .string(2, "greeting", "Hello");
        builder.config(string, Config.locale("fr", "FR"))
            .string(0, "app_name", "Exemple");
        builder.config(mipmap, Config.density(ResConfig.DENSITY_XHIGH))
            .string(0, "ic_launcher", "res/mipmap-xhdpi/ic_launcher.png");
        builder.config(mipmap, Config.density(ResConfig.DENSITY_ANY).sdk(26))
            .string(0, "ic_launcher", "res/mipmap-anydpi-v26/ic_launcher.xml");
        return builder;
    }

    @Test
    void testPackagesAndTypes() throws Exception {
        ResTable table = ARSCDecoder.decode(sample().build());

        assertEquals(1, table.getPackages().size());
        ResPackage pkg = table.getPackage(0x7f);
        assertEquals("com.example.app", pkg.getName());
        assertEquals("string", pkg.getType(1).getName());
        assertEquals("mipmap", pkg.getType(2).getName());
        assertEquals(2, pkg.getTypes().size());
        assertNull(table.getPackage(0x01));
    }

    @Test
    void testEntriesKeepDeclarationOrder() throws Exception {
        ResTable table = ARSCDecoder.decode(sample().build());

        List<ResEntry> appName = table.getEntries(new ResID(0x7f010000));
        assertEquals(2, appName.size());
        assertEquals("Example", appName.get(0).getValue().getString());
        assertTrue(appName.get(0).getConfig().isDefault());
        assertEquals("Exemple", appName.get(1).getValue().getString());
        assertEquals("fr", appName.get(1).getConfig().getLanguage());
        assertEquals("FR", appName.get(1).getConfig().getCountry());
        assertEquals("app_name", appName.get(1).getName());

        List<ResEntry> icons = table.getEntries(new ResID(0x7f020000));
        assertEquals(ResConfig.DENSITY_XHIGH, icons.get(0).getConfig().getDensity());
        assertEquals(ResConfig.DENSITY_ANY, icons.get(1).getConfig().getDensity());
        assertEquals(26, icons.get(1).getConfig().getSdkVersion());
    }

    @Test
    void testMissingEntriesAreNotRecorded() throws Exception {
        ResTable table = ARSCDecoder.decode(sample().build());

        assertTrue(table.getEntries(new ResID(0x7f010001)).isEmpty());
        assertEquals("Hello", table.getEntries(new ResID(0x7f010002)).get(0).getValue().getString());
        assertTrue(table.getEntries(new ResID(0x7f030000)).isEmpty());
        assertTrue(table.getEntries(new ResID(0x02010000)).isEmpty());
    }

    @Test
    void testResourceName() throws Exception {
        ResTable table = ARSCDecoder.decode(sample().build());

        assertEquals("com.example.app:string/greeting", table.getResourceName(new ResID(0x7f010002)));
        assertNull(table.getResourceName(new ResID(0x7f010001)));
    }

    @Test
    void testComplexEntry() throws Exception {
        ResTableBuilder builder = new ResTableBuilder(0x7f, "com.example.app");
        int style = builder.type("style");
        LinkedHashMap<Integer, Integer> items = new LinkedHashMap<>();
        items.put(0x01010098, 3);
        items.put(0x01010036, 5);
        builder.config(style, Config.density(0)).bag(0, "AppTheme", 0x01030005, items);

        ResEntry entry = ARSCDecoder.decode(builder.build()).getEntries(new ResID(0x7f010000)).get(0);

        assertTrue(entry.isComplex());
        assertNull(entry.getValue());
        assertEquals(0x01030005, entry.getParent());
        assertEquals(Arrays.asList(0x01010098, 0x01010036), Arrays.asList(entry.getBag().keySet().toArray()));
        assertEquals(5, entry.getBag().get(0x01010036).getData());
    }

    @Test
    void testTypedValues() throws Exception {
        ResTableBuilder builder = new ResTableBuilder(0x7f, "com.example.app");
        int integer = builder.type("integer");
        builder.config(integer, Config.density(0))
            .value(0, "count", TypedValue.TYPE_INT_DEC, 12)
            .reference(1, "alias", 0x7f010000);

        ResType type = ARSCDecoder.decode(builder.build()).getPackage(0x7f).getType(integer);

        assertEquals("12", type.getEntries(0).get(0).getValue().coerceToString());
        assertTrue(type.getEntries(1).get(0).getValue().isReference());
        assertEquals(0x7f010000, type.getEntries(1).get(0).getValue().getReference().id);
    }

    @Test
    void testSparseOffsets() throws Exception {
        ResTableBuilder builder = new ResTableBuilder(0x7f, "com.example.app");
        int string = builder.type("string");
        builder.config(string, Config.density(0)).layout(ResTableBuilder.Layout.SPARSE)
            .string(1, "first", "one")
            .string(7, "last", "seven");

        ResType type = ARSCDecoder.decode(builder.build()).getPackage(0x7f).getType(string);

        assertEquals("one", type.getEntries(1).get(0).getValue().getString());
        assertEquals("seven", type.getEntries(7).get(0).getValue().getString());
        assertEquals("last", type.getEntries(7).get(0).getName());
        assertTrue(type.getEntries(0).isEmpty());
        assertTrue(type.getEntries(2).isEmpty());
    }

    @Test
    void testSixteenBitOffsets() throws Exception {
        ResTableBuilder builder = new ResTableBuilder(0x7f, "com.example.app");
        int integer = builder.type("integer");
        builder.config(integer, Config.density(0)).layout(ResTableBuilder.Layout.OFFSET16)
            .value(0, "zero", TypedValue.TYPE_INT_DEC, 10)
            .value(2, "two", TypedValue.TYPE_INT_DEC, 12);

        ResType type = ARSCDecoder.decode(builder.build()).getPackage(0x7f).getType(integer);

        assertEquals(10, type.getEntries(0).get(0).getValue().getData());
        assertTrue(type.getEntries(1).isEmpty());
        assertEquals(12, type.getEntries(2).get(0).getValue().getData());
    }

    @Test
    void testCompactEntries() throws Exception {
        ResTableBuilder builder = new ResTableBuilder(0x7f, "com.example.app");
        int string = builder.type("string");
        int label = builder.globalString("Compact");
        builder.config(string, Config.density(0))
            .compact(0, "app_name", TypedValue.TYPE_STRING, label)
            .compact(1, "alias", TypedValue.TYPE_REFERENCE, 0x7f010000);

        ResType type = ARSCDecoder.decode(builder.build()).getPackage(0x7f).getType(string);

        ResEntry name = type.getEntries(0).get(0);
        assertFalse(name.isComplex());
        assertEquals("app_name", name.getName());
        assertEquals("Compact", name.getValue().getString());
        assertEquals("alias", type.getEntries(1).get(0).getName());
        assertEquals(0x7f010000, type.getEntries(1).get(0).getValue().getReference().id);
    }

    @Test
    void testSharedEntryOffset() throws Exception {
        ResTableBuilder builder = new ResTableBuilder(0x7f, "com.example.app");
        int string = builder.type("string");
        builder.config(string, Config.density(0))
            .string(0, "app_name", "Example")
            .string(1, "greeting", "Hello")
            .shared(2, 0);

        ResType type = ARSCDecoder.decode(builder.build()).getPackage(0x7f).getType(string);

        assertEquals("Example", type.getEntries(2).get(0).getValue().getString());
        assertEquals("app_name", type.getEntries(2).get(0).getName());
        assertEquals("Hello", type.getEntries(1).get(0).getValue().getString());
    }

    @Test
    void testLibraryChunkIsRead() throws Exception {
        ResTableBuilder builder = sample();
        builder.extraPackageChunk(ResTableBuilder.libraryChunk(0x02, "com.example.shared"));

        ResTable table = ARSCDecoder.decode(builder.build());

        assertEquals(2, table.getEntries(new ResID(0x7f010000)).size());
        assertEquals("com.example.app:string/greeting", table.getResourceName(new ResID(0x7f010002)));
    }

    @Test
    void testUnknownPackageChunkIsSkipped() throws Exception {
        ResTableBuilder builder = sample();
        builder.extraPackageChunk(ChunkWriter.chunk(ChunkHeader.TYPE_OVERLAYABLE, new byte[8], new byte[16]));

        ResTable table = ARSCDecoder.decode(builder.build());

        assertEquals(2, table.getEntries(new ResID(0x7f010000)).size());
    }

    @Test
    void testStringIndexOutOfRange() {
        ResTableBuilder builder = new ResTableBuilder(0x7f, "com.example.app");
        int string = builder.type("string");
        builder.config(string, Config.density(0)).value(0, "broken", TypedValue.TYPE_STRING, 42);

        assertThrows(FormatException.class, () -> ARSCDecoder.decode(builder.build()));
    }

    @Test
    void testWrongFirstChunk() {
        byte[] data = ChunkWriter.chunk(ChunkHeader.TYPE_XML, new byte[0], new byte[0]);

        assertThrows(FormatException.class, () -> ARSCDecoder.decode(data));
    }

    @Test
    void testTruncatedTable() {
        byte[] data = sample().build();

        assertThrows(FormatException.class, () -> ARSCDecoder.decode(Arrays.copyOf(data, data.length / 2)));
        assertThrows(TruncatedInputException.class, () -> ARSCDecoder.decode(Arrays.copyOf(data, 6)));
    }

    @Test
    void testDecodedTableIsReadOnly() throws Exception {
        ResTable table = ARSCDecoder.decode(sample().build());
        ResType type = table.getPackage(0x7f).getType(1);

        assertThrows(IllegalStateException.class,
            () -> type.addEntry(5, ResEntry.simple(ResConfig.DEFAULT, "late", null)));
        assertThrows(UnsupportedOperationException.class, () -> type.getEntries(0).clear());
    }
}
