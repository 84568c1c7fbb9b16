package org.dxworks.jovialframe;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SourceRoleDetectorTest {

    @Test
    void programExtensions() {
        assertEquals(Optional.of(SourceRole.PROGRAM), SourceRoleDetector.detectRole(Paths.get("src", "nav.jov")));
        assertEquals(Optional.of(SourceRole.PROGRAM), SourceRoleDetector.detectRole("GUIDANCE.J73"));
        assertEquals(Optional.of(SourceRole.PROGRAM), SourceRoleDetector.detectRole("file:///work/main.jovial"));
    }

    @Test
    void compoolExtension() {
        assertEquals(Optional.of(SourceRole.COMPOOL), SourceRoleDetector.detectRole(Paths.get("shared.cpl")));
    }

    @Test
    void otherFilesAreNotSources() {
        assertEquals(Optional.empty(), SourceRoleDetector.detectRole(Paths.get("README.md")));
        assertEquals(Optional.empty(), SourceRoleDetector.detectRole("notes.txt"));
    }

    @Test
    void openDocumentsDefaultToProgram() {
        assertEquals(SourceRole.PROGRAM, SourceRoleDetector.roleOf("untitled:1"));
        assertEquals(SourceRole.COMPOOL, SourceRoleDetector.roleOf("file:///work/shared.cpl"));
    }
}
