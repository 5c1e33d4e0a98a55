package com.amannm.pdftk.operation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amannm.pdftk.assembly.AssemblyMode;
import com.amannm.pdftk.assembly.OutputPage;
import com.amannm.pdftk.assembly.PageAssembler;
import com.amannm.pdftk.document.DocumentRegistry;
import com.amannm.pdftk.document.PdfSequenceWriter;
import com.amannm.pdftk.input.InputFiles;
import com.amannm.pdftk.input.PdfFiles;
import com.amannm.pdftk.range.PageRangeParser;
import com.amannm.pdftk.range.PageSpec;

/**
 * The page operations offered by the command line and the MCP server.
 * <p>
 * Inputs are validated, opened, parsed and assembled before the output is written; the first
 * problem aborts the operation with a {@link com.amannm.pdftk.PdftkException} and nothing is saved.
 */
public class PdfOperations {

    private static final Logger log = LoggerFactory.getLogger(PdfOperations.class);

    public static final String DEFAULT_BURST_PATTERN = "pg_%04d.pdf";
    public static final Path DEFAULT_BURST_DIR = Path.of(".");

    private final PdfSequenceWriter writer = new PdfSequenceWriter();

    /**
     * Writes every page of the input to its own file.
     *
     * @param input     PDF to split
     * @param pattern   printf style file name pattern receiving the 1-based page number
     * @param outputDir directory for the page files, created when missing
     * @return the files written, in page order
     */
    public List<Path> burst(Path input, String pattern, Path outputDir) throws IOException {
        PdfFiles.validate(input);
        Files.createDirectories(outputDir);
        log.info("Bursting {} into {}", input, outputDir);

        try (DocumentRegistry registry = DocumentRegistry.open(Map.of("A", input))) {
            int pageCount = registry.pageCount("A");
            List<Path> written = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                Path target = outputDir.resolve(String.format(pattern, page));
                writer.write(registry, List.of(new OutputPage("A", page, 0)), target);
                written.add(target);
            }
            return written;
        }
    }

    /**
     * Concatenates pages of the inputs. Without ranges every page of every input is taken.
     *
     * @param inputs {@code HANDLE=path} or bare paths; bare paths get the next free letter
     * @return number of pages written
     */
    public int cat(List<String> inputs, List<String> ranges, Path output) throws IOException {
        return run(AssemblyMode.CAT, InputFiles.parse(inputs).assignHandles(),
            ranges == null ? List.of() : ranges, output);
    }

    /**
     * Copies the input with the pages named by the ranges turned; page count and order stay the same.
     */
    public int rotate(String input, List<String> ranges, Path output) throws IOException {
        requireRanges("rotate", ranges);
        return run(AssemblyMode.ROTATE, InputFiles.parse(List.of(input)).assignHandles(), ranges, output);
    }

    /**
     * Interleaves the ranges one page at a time. Every range must name its document.
     */
    public int shuffle(List<String> inputs, List<String> ranges, Path output) throws IOException {
        requireRanges("shuffle", ranges);
        return run(AssemblyMode.SHUFFLE, InputFiles.parse(inputs).assignHandles(), ranges, output);
    }

    public int pageCount(Path input) throws IOException {
        PdfFiles.validate(input);
        try (DocumentRegistry registry = DocumentRegistry.open(Map.of("A", input))) {
            return registry.pageCount("A");
        }
    }

    private int run(AssemblyMode mode, Map<String, Path> files, List<String> ranges, Path output)
            throws IOException {
        PdfFiles.validateAll(files.values());
        log.info("Running {} over {} into {}", mode, files, output);

        try (DocumentRegistry registry = DocumentRegistry.open(files)) {
            List<PageSpec> specs = new PageRangeParser(registry).parse(ranges);
            log.debug("Parsed ranges {}: {}", ranges, specs);
            List<OutputPage> sequence = new PageAssembler(registry).assemble(mode, specs);
            return writer.write(registry, sequence, output);
        }
    }

    private static void requireRanges(String operation, List<String> ranges) {
        if (ranges == null || ranges.stream().allMatch(String::isBlank)) {
            throw new MissingRangesException(operation);
        }
    }
}
