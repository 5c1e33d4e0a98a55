package com.amannm.pdftk.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Mono;

import com.amannm.pdftk.PdftkException;
import com.amannm.pdftk.operation.PdfOperations;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * MCP server over stdio exposing the page operations as tools.
 */
public class PdftkMcpServer {

    static final String SERVER_NAME = "pdftk-mcp";
    static final String SERVER_VERSION = "1.0.0";

    private static final Logger log = LoggerFactory.getLogger(PdftkMcpServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final PdfOperations operations = new PdfOperations();

    private static final String RANGES_HELP = "Page ranges such as '1-5', 'A1-10east', 'Bend-1odd', 'r3-r1'; "
        + "rotations: north, east, south, west, left, right, down; qualifiers: even, odd";

    public static void main(String[] args) {
        serve();
    }

    /**
     * Starts the server on stdin/stdout and blocks until the process is stopped.
     */
    public static void serve() {
        StdioServerTransportProvider transport = new StdioServerTransportProvider(objectMapper);

        McpServer.sync(transport)
            .serverInfo(SERVER_NAME, SERVER_VERSION)
            .instructions("Select, reorder, rotate and interleave PDF pages. " + RANGES_HELP)
            .capabilities(ServerCapabilities.builder().tools(true).build())
            .tools(toolSpecifications())
            .build();
        log.info("{} {} listening on stdio", SERVER_NAME, SERVER_VERSION);

        // Keep the server running by blocking on a never-completing mono
        Mono.never().block();
    }

    static List<SyncToolSpecification> toolSpecifications() {
        return List.of(
            new SyncToolSpecification(createBurstTool(), (exchange, params) -> handleBurst(params).block()),
            new SyncToolSpecification(createCatTool(), (exchange, params) -> handleCat(params).block()),
            new SyncToolSpecification(createRotateTool(), (exchange, params) -> handleRotate(params).block()),
            new SyncToolSpecification(createShuffleTool(), (exchange, params) -> handleShuffle(params).block()),
            new SyncToolSpecification(createGetPageCountTool(), (exchange, params) -> handleGetPageCount(params).block())
        );
    }

    private static Tool createBurstTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("file_path", SchemaProperty.string("Path to the PDF file to split"));
        properties.put("output_dir", SchemaProperty.string("Directory for the page files (default: current directory)"));
        properties.put("pattern", SchemaProperty.string("File name pattern with a printf page number (default: "
            + PdfOperations.DEFAULT_BURST_PATTERN + ")"));
        return createTool("burst", "Split a PDF into one file per page", properties, List.of("file_path"));
    }

    private static Tool createCatTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("inputs", SchemaProperty.stringArray("Input PDF files, optionally with handles (A=a.pdf)"));
        properties.put("output_path", SchemaProperty.string("Path of the PDF to create"));
        properties.put("ranges", SchemaProperty.stringArray(RANGES_HELP + ". Omit to merge every page of every input"));
        return createTool("cat", "Concatenate pages of one or more PDFs", properties, List.of("inputs", "output_path"));
    }

    private static Tool createRotateTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("file_path", SchemaProperty.string("Path to the PDF file"));
        properties.put("output_path", SchemaProperty.string("Path of the PDF to create"));
        properties.put("ranges", SchemaProperty.stringArray("Pages to turn, e.g. '1east', '5-10south'"));
        return createTool("rotate", "Rotate pages of a PDF, keeping every page in place", properties,
            List.of("file_path", "output_path", "ranges"));
    }

    private static Tool createShuffleTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("inputs", SchemaProperty.stringArray("Input PDF files with handles (A=a.pdf B=b.pdf)"));
        properties.put("output_path", SchemaProperty.string("Path of the PDF to create"));
        properties.put("ranges", SchemaProperty.stringArray("Ranges to interleave, each with a handle, e.g. 'A1-10' 'B10-1'"));
        return createTool("shuffle", "Interleave pages of several ranges one page at a time", properties,
            List.of("inputs", "output_path", "ranges"));
    }

    private static Tool createGetPageCountTool() {
        Map<String, Object> properties = Map.of(
            "file_path", SchemaProperty.string("Path to the PDF file")
        );
        return createTool("get_page_count", "Get the number of pages in a PDF file", properties, List.of("file_path"));
    }

    private static Tool createTool(String name, String description, Map<String, Object> properties,
            List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        try {
            return new Tool(name, description, objectMapper.writeValueAsString(schema));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot build input schema of tool " + name, e);
        }
    }

    static Mono<CallToolResult> handleBurst(Map<String, Object> arguments) {
        return withOperation("burst", () -> {
            Path input = Path.of(requiredString(arguments, "file_path"));
            String pattern = optionalString(arguments, "pattern", PdfOperations.DEFAULT_BURST_PATTERN);
            Path outputDir = Path.of(optionalString(arguments, "output_dir", PdfOperations.DEFAULT_BURST_DIR.toString()));
            List<Path> files = operations.burst(input, pattern, outputDir);
            return new OperationSummary("burst", outputDir.toString(), files.size(),
                files.stream().map(Path::toString).toList());
        });
    }

    static Mono<CallToolResult> handleCat(Map<String, Object> arguments) {
        return withOperation("cat", () -> {
            Path output = Path.of(requiredString(arguments, "output_path"));
            int pages = operations.cat(requiredList(arguments, "inputs"), optionalList(arguments, "ranges"), output);
            return new OperationSummary("cat", output.toString(), pages);
        });
    }

    static Mono<CallToolResult> handleRotate(Map<String, Object> arguments) {
        return withOperation("rotate", () -> {
            String input = requiredString(arguments, "file_path");
            Path output = Path.of(requiredString(arguments, "output_path"));
            int pages = operations.rotate(input, requiredList(arguments, "ranges"), output);
            return new OperationSummary("rotate", output.toString(), pages);
        });
    }

    static Mono<CallToolResult> handleShuffle(Map<String, Object> arguments) {
        return withOperation("shuffle", () -> {
            Path output = Path.of(requiredString(arguments, "output_path"));
            int pages = operations.shuffle(requiredList(arguments, "inputs"), requiredList(arguments, "ranges"), output);
            return new OperationSummary("shuffle", output.toString(), pages);
        });
    }

    static Mono<CallToolResult> handleGetPageCount(Map<String, Object> arguments) {
        try {
            int pageCount = operations.pageCount(Path.of(requiredString(arguments, "file_path")));
            return Mono.just(createTextResult("Page count: " + pageCount));
        } catch (PdftkException | IllegalArgumentException e) {
            return Mono.just(createErrorResult(e.getMessage()));
        } catch (Exception e) {
            log.error("get_page_count failed", e);
            return Mono.just(createErrorResult("Error getting page count: " + e.getMessage()));
        }
    }

    /**
     * Utility to run an operation, turning its summary into a JSON result and its failure into an error result.
     */
    private static Mono<CallToolResult> withOperation(String name, Callable<OperationSummary> operation) {
        try {
            OperationSummary summary = operation.call();
            String json = objectMapper
                .writerWithDefaultPrettyPrinter()
                .writeValueAsString(summary);
            return Mono.just(createTextResult(json));
        } catch (PdftkException | IllegalArgumentException e) {
            log.debug("{} rejected: {}", name, e.getMessage());
            return Mono.just(createErrorResult(e.getMessage()));
        } catch (Exception e) {
            log.error("{} failed", name, e);
            return Mono.just(createErrorResult("Error running " + name + ": " + e.getMessage()));
        }
    }

    private static String requiredString(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null || String.valueOf(value).isBlank()) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return String.valueOf(value);
    }

    private static String optionalString(Map<String, Object> arguments, String name, String defaultValue) {
        Object value = arguments.get(name);
        return value == null ? defaultValue : String.valueOf(value);
    }

    private static List<String> requiredList(Map<String, Object> arguments, String name) {
        List<String> values = optionalList(arguments, name);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return values;
    }

    // clients send either a JSON array or one whitespace separated string
    private static List<String> optionalList(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? List.of() : Arrays.asList(text.split("\\s+"));
    }

    static CallToolResult createTextResult(String text) {
        TextContent content = new TextContent(text);
        return new CallToolResult(List.of(content), false);
    }

    static CallToolResult createErrorResult(String error) {
        TextContent content = new TextContent(error);
        return new CallToolResult(List.of(content), true);
    }
}
