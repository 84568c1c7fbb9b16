package org.dxworks.jovialframe;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class SourceRoleDetector {

    public static Optional<SourceRole> detectRole(Path filePath) {
        Path fileName = filePath.getFileName();
        return fileName == null ? Optional.empty() : detectRole(fileName.toString());
    }

    /**
     * Role of a file name or document URI; empty when it is not a JOVIAL source.
     */
    public static Optional<SourceRole> detectRole(String name) {
        String lower = name.toLowerCase(Locale.ROOT);

        if (lower.endsWith(".jov") || lower.endsWith(".j73") || lower.endsWith(".jovial")) {
            return Optional.of(SourceRole.PROGRAM);
        } else if (lower.endsWith(".cpl")) {
            return Optional.of(SourceRole.COMPOOL);
        }

        return Optional.empty();
    }

    /**
     * Role of an open document; documents with other extensions are treated as programs.
     */
    public static SourceRole roleOf(String uri) {
        return detectRole(uri).orElse(SourceRole.PROGRAM);
    }
}
