package org.dxworks.ommltex;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.ommltex.model.EquationConversion;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final OmmlToLatex CONVERTER = new OmmlToLatex();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar ommltex.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to an OMML file (.xml, .omml) or a directory of them");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting OMML conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        OmmlTexConfig config = OmmlTexConfig.load();
        List<Path> files = collectOmmlFiles(input, config.getMaxFileBytes());
        System.out.println("Found " + files.size() + " OMML files");

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
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
                }

                try {
                    EquationConversion conversion = convertFile(file, config);
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(conversion));
                        writer.newLine();
                        writer.flush();
                    }
                    if (EquationConversion.STATUS_OK.equals(conversion.status)) {
                        successCount.incrementAndGet();
                    } else {
                        errorCount.incrementAndGet();
                    }
                } catch (IOException e) {
                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(errorRecord(file, e)));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds",
                        java.time.Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectOmmlFiles(Path input, long maxFileBytes) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isOmmlFile)
                      .filter(p -> withinMaxBytes(p, maxFileBytes))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (isOmmlFile(input) && withinMaxBytes(input, maxFileBytes)) {
                files.add(input);
            }
        }

        return files;
    }

    static boolean isOmmlFile(Path path) {
        String fileName = path.getFileName().toString().toLowerCase();
        return fileName.endsWith(".xml") || fileName.endsWith(".omml");
    }

    private static boolean withinMaxBytes(Path path, long maxFileBytes) {
        try {
            return Files.size(path) <= maxFileBytes;
        } catch (IOException e) {
            return true;
        }
    }

    static Map<String, String> errorRecord(Path file, Exception e) {
        Map<String, String> error = new HashMap<>();
        error.put("kind", "error");
        error.put("filePath", file.toString());
        error.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        return error;
    }

    public static EquationConversion convertFile(Path filePath, OmmlTexConfig config) throws IOException {
        String xml = Files.readString(filePath, StandardCharsets.UTF_8);

        if (xml.startsWith("\uFEFF")) {
            xml = xml.substring(1);
        }

        String latex = CONVERTER.convert(xml);
        String status;
        if (OmmlToLatex.PARSE_ERROR.equals(latex)) {
            status = EquationConversion.STATUS_PARSE_ERROR;
        } else if (OmmlToLatex.CONVERSION_ERROR.equals(latex)) {
            status = EquationConversion.STATUS_CONVERSION_ERROR;
        } else {
            status = EquationConversion.STATUS_OK;
            latex = config.getMathWrapping().wrap(latex);
        }
        return new EquationConversion(filePath.toString(), latex, status);
    }
}
