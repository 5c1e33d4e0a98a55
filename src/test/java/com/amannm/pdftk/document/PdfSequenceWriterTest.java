package com.amannm.pdftk.document;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amannm.pdftk.TestDocuments;
import com.amannm.pdftk.assembly.OutputPage;

public class PdfSequenceWriterTest {

    @TempDir
    Path tempDir;

    private final PdfSequenceWriter writer = new PdfSequenceWriter();

    @Test
    void testWriteCopiesPagesInSequenceOrder() throws IOException {
        Path a = TestDocuments.createPdf(tempDir.resolve("a.pdf"), 3, 100);
        Path b = TestDocuments.createPdf(tempDir.resolve("b.pdf"), 2, 200);
        Path output = tempDir.resolve("out/result.pdf");

        try (DocumentRegistry registry = DocumentRegistry.open(Map.of("A", a, "B", b))) {
            int written = writer.write(registry, List.of(
                new OutputPage("B", 2, 0),
                new OutputPage("A", 1, 90),
                new OutputPage("A", 1, -90),
                new OutputPage("A", 3, 180)), output);
            assertEquals(4, written);
        }

        assertArrayEquals(new int[] {202, 101, 101, 103}, TestDocuments.pageWidths(output));
        assertArrayEquals(new int[] {0, 90, 270, 180}, TestDocuments.rotations(output));
    }

    @Test
    void testWriteAddsToExistingRotation() throws IOException {
        Path rotated = tempDir.resolve("rotated.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            page.setRotation(270);
            document.addPage(page);
            document.save(rotated.toFile());
        }
        Path output = tempDir.resolve("out.pdf");

        try (DocumentRegistry registry = DocumentRegistry.open(Map.of("A", rotated))) {
            writer.write(registry, List.of(new OutputPage("A", 1, 180), new OutputPage("A", 1, 0)), output);
        }

        assertArrayEquals(new int[] {90, 270}, TestDocuments.rotations(output));
    }

    @Test
    void testWriteRejectsMissingPageWithoutOutput() throws IOException {
        Path a = TestDocuments.createPdf(tempDir.resolve("a.pdf"), 3, 100);
        Path output = tempDir.resolve("never.pdf");

        try (DocumentRegistry registry = DocumentRegistry.open(Map.of("A", a))) {
            List<OutputPage> sequence = List.of(new OutputPage("A", 1, 0), new OutputPage("A", 4, 0));
            PageOutOfRangeException e = assertThrows(PageOutOfRangeException.class,
                () -> writer.write(registry, sequence, output));
            assertTrue(e.getMessage().contains("Page 4"));

            assertThrows(PageOutOfRangeException.class,
                () -> writer.write(registry, List.of(new OutputPage("A", 0, 0)), output));
        }
        assertFalse(Files.exists(output));
    }

    @Test
    void testWriteRejectsEmptySequence() {
        DocumentRegistry registry = TestDocuments.registry(Map.of("A", 1));
        Path output = tempDir.resolve("empty.pdf");

        assertThrows(EmptyOutputException.class, () -> writer.write(registry, List.of(), output));
        assertFalse(Files.exists(output));
    }
}
