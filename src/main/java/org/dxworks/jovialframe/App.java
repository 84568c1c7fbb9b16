package org.dxworks.jovialframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.jovialframe.analyzer.JovialFileAnalyzer;
import org.dxworks.jovialframe.model.Analysis;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static volatile JovialFileAnalyzer analyzer;

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar jovialframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to JOVIAL source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Recognized sources: .jov, .j73, .jovial (programs), .cpl (compools)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting JOVIAL analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        JovialframeConfig config = JovialframeConfig.load();
        analyzer = new JovialFileAnalyzer(config);
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                Optional<SourceRole> roleOpt = SourceRoleDetector.detectRole(file);
                if (roleOpt.isEmpty()) {
                    return;
                }

                SourceRole role = roleOpt.get();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing "
                            + role.getName() + ": " + file.getFileName());
                }

                try {
                    Analysis analysis = analyzeFile(file);

                    // one line per file, written as soon as it is ready
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(analysis));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("role", role.getName());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> SourceRoleDetector.detectRole(p).isPresent())
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (SourceRoleDetector.detectRole(input).isPresent() && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable here means unreadable in analyzeFile too, where it is reported
            return true;
        }
    }

    public static Analysis analyzeFile(Path filePath) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        return analyzer().analyze(filePath.toString(), sourceCode);
    }

    private static JovialFileAnalyzer analyzer() {
        JovialFileAnalyzer current = analyzer;
        if (current == null) {
            synchronized (App.class) {
                if (analyzer == null) {
                    analyzer = new JovialFileAnalyzer(JovialframeConfig.load());
                }
                current = analyzer;
            }
        }
        return current;
    }
}
