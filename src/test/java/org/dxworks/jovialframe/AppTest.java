package org.dxworks.jovialframe;

import org.dxworks.jovialframe.model.Analysis;
import org.dxworks.jovialframe.model.JovialFileAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void collectsOnlyJovialSourcesWithinTheLineLimit() throws IOException {
        Path program = Files.writeString(tempDir.resolve("main.jov"), "ITEM A S 8;\n");
        Path lib = Files.createDirectories(tempDir.resolve("lib"));
        Path compool = Files.writeString(lib.resolve("shared.cpl"), "START COMPOOL SHARED;\nTERM;\n");
        Files.writeString(tempDir.resolve("notes.txt"), "not a source\n");
        Files.writeString(tempDir.resolve("huge.j73"), "ITEM A S 8;\n".repeat(5));

        List<Path> files = App.collectSourceFiles(tempDir, 3);

        assertEquals(List.of(compool, program), files);
    }

    @Test
    void singleFileInputIsCollected() throws IOException {
        Path program = Files.writeString(tempDir.resolve("main.jov"), "ITEM A S 8;\n");

        assertEquals(List.of(program), App.collectSourceFiles(program, 100));
        assertTrue(App.collectSourceFiles(tempDir.resolve("missing.jov"), 100).isEmpty());
    }

    @Test
    void byteOrderMarkIsStripped() throws IOException {
        Path program = Files.writeString(tempDir.resolve("bom.jov"), "﻿ITEM A S 8;\n");

        Analysis analysis = App.analyzeFile(program);

        JovialFileAnalysis jovial = assertInstanceOf(JovialFileAnalysis.class, analysis);
        assertTrue(jovial.diagnostics.isEmpty());
        assertEquals("A", jovial.symbols.get(0).name);
    }
}
