package org.dxworks.omml2latex;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.omml2latex.converter.MathConverter;
import org.dxworks.omml2latex.model.ConversionResult;
import org.dxworks.omml2latex.model.EquationRecord;
import org.dxworks.omml2latex.model.ExtractedEquation;
import org.dxworks.omml2latex.reader.DocxMathExtractor;

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
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final DocxMathExtractor EXTRACTOR = new DocxMathExtractor();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar omml2latex.jar <input> <output-file>");
            System.err.println("  <input>:       Word document (.docx), OMML/XML file, or a directory of them");
            System.err.println("  <output-file>: Path to output JSONL file");
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

        System.out.println("Starting equation conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        Omml2LatexConfig config = Omml2LatexConfig.load();
        MathConverter converter = new MathConverter(config);
        List<Path> files = collectSourceFiles(input);
        System.out.println("Found " + files.size() + " documents");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger equationCount = new AtomicInteger(0);
        AtomicInteger advisoryCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        // Write metadata header
        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // Documents are independent, so they are converted in parallel
            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
                }

                try {
                    List<EquationRecord> records = convertFile(file, converter, config.isReportAdvisories());

                    // One file's equations stay contiguous in the output
                    synchronized (writer) {
                        for (EquationRecord record : records) {
                            writer.write(MAPPER.writeValueAsString(record));
                            writer.newLine();
                        }
                        writer.flush();
                    }

                    equationCount.addAndGet(records.size());
                    advisoryCount.addAndGet((int) records.stream().filter(r -> r.advisories != null).count());
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = errorRecord(file, e);

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
                        System.err.println("  Error converting " + file.getFileName() + ": " + error.get("error"));
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("equations", equationCount.get());
            doneInfo.put("equations_with_advisories", advisoryCount.get());
            doneInfo.put("duration_seconds",
                        java.time.Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Documents converted: " + successCount.get());
        System.out.println("Equations: " + equationCount.get());
        if (advisoryCount.get() > 0) {
            System.out.println("Equations to review: " + advisoryCount.get());
        }
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static List<Path> collectSourceFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> SourceDetector.detectFormat(p).isPresent())
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && SourceDetector.detectFormat(input).isPresent()) {
            files.add(input);
        }

        return files;
    }

    static Map<String, String> errorRecord(Path file, Exception e) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("error", e.getMessage() != null ? e.getMessage() : e.toString());
        return error;
    }

    public static List<EquationRecord> convertFile(Path filePath, MathConverter converter, boolean reportAdvisories) {
        SourceFormat format = SourceDetector.detectFormat(filePath)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported input: " + filePath));

        List<EquationRecord> records = new ArrayList<>();
        for (ExtractedEquation equation : EXTRACTOR.extract(filePath, format)) {
            ConversionResult result = converter.convert(equation.root, equation.mode);

            EquationRecord record = new EquationRecord();
            record.file = filePath.toString();
            record.index = equation.index;
            record.mode = equation.mode.getName();
            record.latex = result.latex;
            if (reportAdvisories && result.hasAdvisories()) {
                record.advisories = result.advisories;
            }
            records.add(record);
        }
        return records;
    }
}
