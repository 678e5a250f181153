package com.cywriter.dumptool;

import com.cywriter.CyWriter;
import com.cywriter.jackson.JacksonAstJsonProvider;
import com.cywriter.jackson.SampleTrees;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class TreeDumpTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private TreeDump dump;
    private Path input;

    @BeforeEach
    void setUp() throws Exception {
        dump = new TreeDump(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        input = tempDir.resolve("tree.json");
        Files.writeString(input, new JacksonAstJsonProvider().getSerializer().serializePretty(SampleTrees.module()));
    }

    private TreeDump.Config parse(String... args) {
        return TreeDump.Config.parse(args, new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private List<String> stdoutLines() {
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }

    @Test
    void testParseDefaults() {
        TreeDump.Config config = parse("tree.json");
        assertEquals(TreeDump.Mode.CODE, config.mode());
        assertNull(config.output());
        assertEquals(Path.of("tree.json"), config.input());
    }

    @Test
    void testParseOptions() {
        TreeDump.Config config = parse("--mode=pxd", "--output=out.pxd", "tree.json");
        assertEquals(TreeDump.Mode.PXD, config.mode());
        assertEquals(Path.of("out.pxd"), config.output());
    }

    @Test
    void testParseModeIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(TreeDump.Mode.CODE, parse("--mode=code", "tree.json").mode());
            assertEquals(TreeDump.Mode.PXD, parse("--mode=pxd", "tree.json").mode());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void testParseErrors() {
        assertNull(parse());
        assertNull(parse("--mode=html", "tree.json"));
        assertNull(parse("--verbose", "tree.json"));
        assertNull(parse("a.json", "b.json"));
        assertNull(parse("--help"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Invalid mode: html"));
    }

    @Test
    void testCodeToStdout() {
        int exit = dump.run(parse(input.toString()));
        assertEquals(0, exit, err::toString);
        assertEquals(CyWriter.writeCode(SampleTrees.module()), stdoutLines());
    }

    @Test
    void testPxdToFile() throws Exception {
        Path output = tempDir.resolve("sample.pxd");
        int exit = dump.run(parse("--mode=pxd", "--output=" + output, input.toString()));

        assertEquals(0, exit, err::toString);
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        List<String> written = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(CyWriter.writeDeclarations(SampleTrees.module()), written);
        assertTrue(written.contains("cpdef long add(int a, int b = 1UL)"), written::toString);
        assertFalse(written.stream().anyMatch(line -> line.contains("helper")), written::toString);
    }

    @Test
    void testMissingInput() {
        int exit = dump.run(parse(tempDir.resolve("missing.json").toString()));
        assertEquals(2, exit);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Cannot read"));
    }

    @Test
    void testInvalidTree() throws Exception {
        Files.writeString(input, "{\"type\": \"ModuleNode\", \"body\": {\"type\": \"NoSuchNode\"}}");
        assertEquals(2, dump.run(parse(input.toString())));
    }

    @Test
    void testUnsupportedConstruct() throws Exception {
        Files.writeString(input, """
            {"type": "ModuleNode", "body": {"type": "StatListNode", "stats": [
                {"type": "ExprStatNode", "expr": {"type": "TempRefNode", "handle": {"id": 1}}}
            ]}}
            """);
        assertEquals(2, dump.run(parse(input.toString())));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("TempRefNode"));
    }
}
