package com.amannm.pdftk.operation;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amannm.pdftk.TestDocuments;
import com.amannm.pdftk.assembly.ShuffleRequiresHandlesException;
import com.amannm.pdftk.document.PageOutOfRangeException;
import com.amannm.pdftk.input.NotAPdfException;
import com.amannm.pdftk.input.PdfFileNotFoundException;
import com.amannm.pdftk.range.NoDefaultDocumentException;
import com.amannm.pdftk.range.UnknownHandleException;

/**
 * Runs the operations end to end on generated PDFs. Page {@code n} of {@code ten.pdf} is {@code 100 + n} points
 * wide and page {@code n} of {@code twenty.pdf} is {@code 200 + n}, which is how the tests follow pages around.
 */
public class PdfOperationsTest {

    @TempDir
    Path tempDir;

    private final PdfOperations operations = new PdfOperations();

    private Path one;
    private Path ten;
    private Path twenty;

    @BeforeEach
    void createFixtures() throws IOException {
        one = TestDocuments.createPdf(tempDir.resolve("one.pdf"), 1, 0);
        ten = TestDocuments.createPdf(tempDir.resolve("ten.pdf"), 10, 100);
        twenty = TestDocuments.createPdf(tempDir.resolve("twenty.pdf"), 20, 200);
    }

    @Test
    void testBurst() throws IOException {
        Path dir = tempDir.resolve("pages");
        List<Path> files = operations.burst(ten, PdfOperations.DEFAULT_BURST_PATTERN, dir);

        assertEquals(10, files.size());
        assertEquals(dir.resolve("pg_0001.pdf"), files.get(0));
        for (int i = 1; i <= 10; i++) {
            assertArrayEquals(new int[] {100 + i}, TestDocuments.pageWidths(dir.resolve(String.format("pg_%04d.pdf", i))));
        }
    }

    @Test
    void testBurstCustomPattern() throws IOException {
        operations.burst(ten, "page_%02d.pdf", tempDir);
        assertTrue(Files.exists(tempDir.resolve("page_01.pdf")));
        assertTrue(Files.exists(tempDir.resolve("page_10.pdf")));
    }

    @Test
    void testCatMergesEverything() throws IOException {
        Path output = tempDir.resolve("merged.pdf");
        int pages = operations.cat(List.of("A=" + one, "B=" + ten), List.of(), output);

        assertEquals(11, pages);
        assertArrayEquals(new int[] {1, 101, 102, 103, 104, 105, 106, 107, 108, 109, 110},
            TestDocuments.pageWidths(output));
    }

    @Test
    void testCatAssignsHandlesToBarePaths() throws IOException {
        Path output = tempDir.resolve("bare.pdf");
        operations.cat(List.of(twenty.toString(), ten.toString()), List.of("B2", "A1"), output);

        assertArrayEquals(new int[] {102, 201}, TestDocuments.pageWidths(output));
    }

    @Test
    void testCatWithRangesAndRotation() throws IOException {
        Path output = tempDir.resolve("ranges.pdf");
        int pages = operations.cat(List.of("A=" + ten, "b=" + twenty),
            List.of("A1-3east B5", "Bend-17odd", "A10-9"), output);

        assertEquals(8, pages);
        assertArrayEquals(new int[] {101, 102, 103, 205, 219, 217, 110, 109}, TestDocuments.pageWidths(output));
        assertArrayEquals(new int[] {90, 90, 90, 0, 0, 0, 0, 0}, TestDocuments.rotations(output));
    }

    @Test
    void testCatSingleFileWithoutHandles() throws IOException {
        Path output = tempDir.resolve("subset.pdf");
        assertEquals(6, operations.cat(List.of(ten.toString()), List.of("5-end"), output));
        assertEquals(3, operations.cat(List.of(ten.toString()), List.of("r3-r1"), output));
        assertArrayEquals(new int[] {108, 109, 110}, TestDocuments.pageWidths(output));
    }

    @Test
    void testCatFailuresLeaveNoOutput() {
        Path output = tempDir.resolve("failed.pdf");
        List<String> inputs = List.of("A=" + ten, "B=" + twenty);

        assertThrows(UnknownHandleException.class, () -> operations.cat(inputs, List.of("A1-5 C1-5"), output));
        assertThrows(NoDefaultDocumentException.class, () -> operations.cat(inputs, List.of("1-5"), output));
        assertThrows(PageOutOfRangeException.class, () -> operations.cat(inputs, List.of("A1 A999"), output));
        assertFalse(Files.exists(output));
    }

    @Test
    void testCatRejectsRangesOutsideDocument() {
        Path output = tempDir.resolve("failed.pdf");
        List<String> inputs = List.of(ten.toString());

        assertThrows(PageOutOfRangeException.class, () -> operations.cat(inputs, List.of("1-3", "r20-r15odd"), output));
        assertThrows(PageOutOfRangeException.class, () -> operations.cat(inputs, List.of("r20-r15even"), output));
        assertThrows(PageOutOfRangeException.class, () -> operations.cat(inputs, List.of("1-2000000000"), output));
        assertFalse(Files.exists(output));
    }

    @Test
    void testInputValidation() throws IOException {
        Path output = tempDir.resolve("out.pdf");
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "hello");

        assertThrows(PdfFileNotFoundException.class,
            () -> operations.cat(List.of(tempDir.resolve("nope.pdf").toString()), List.of(), output));
        assertThrows(NotAPdfException.class, () -> operations.cat(List.of(text.toString()), List.of(), output));
    }

    @Test
    void testRotate() throws IOException {
        Path output = tempDir.resolve("rotated.pdf");
        int pages = operations.rotate(ten.toString(), List.of("1-5south", "7-9west"), output);

        assertEquals(10, pages);
        assertArrayEquals(new int[] {101, 102, 103, 104, 105, 106, 107, 108, 109, 110},
            TestDocuments.pageWidths(output));
        assertArrayEquals(new int[] {180, 180, 180, 180, 180, 0, 270, 270, 270, 0}, TestDocuments.rotations(output));
    }

    @Test
    void testRotateLeftIsWest() throws IOException {
        Path output = tempDir.resolve("left.pdf");
        operations.rotate(ten.toString(), List.of("1left 2right 3down"), output);

        int[] rotations = TestDocuments.rotations(output);
        assertEquals(270, rotations[0]);
        assertEquals(90, rotations[1]);
        assertEquals(180, rotations[2]);
    }

    @Test
    void testRotateRejectsPagesOutsideDocument() {
        Path output = tempDir.resolve("rotated.pdf");

        assertThrows(PageOutOfRangeException.class, () -> operations.rotate(ten.toString(), List.of("999east"), output));
        assertThrows(PageOutOfRangeException.class, () -> operations.rotate(ten.toString(), List.of("8-12south"), output));
        assertFalse(Files.exists(output));
    }

    @Test
    void testRotateRequiresRanges() {
        Path output = tempDir.resolve("rotated.pdf");
        assertThrows(MissingRangesException.class, () -> operations.rotate(ten.toString(), List.of(), output));
        assertThrows(MissingRangesException.class, () -> operations.rotate(ten.toString(), List.of(" "), output));
    }

    @Test
    void testShuffle() throws IOException {
        Path output = tempDir.resolve("shuffled.pdf");
        int pages = operations.shuffle(List.of("A=" + ten, "B=" + twenty), List.of("A1-3", "B7-1"), output);

        assertEquals(10, pages);
        assertArrayEquals(new int[] {101, 207, 102, 206, 103, 205, 204, 203, 202, 201},
            TestDocuments.pageWidths(output));
    }

    @Test
    void testShuffleWithRotation() throws IOException {
        Path output = tempDir.resolve("shuffled.pdf");
        operations.shuffle(List.of("A=" + ten, "B=" + ten), List.of("A1-3east", "B1-3"), output);

        assertArrayEquals(new int[] {90, 0, 90, 0, 90, 0}, TestDocuments.rotations(output));
    }

    @Test
    void testShuffleRejectsRangesWithoutHandle() {
        Path output = tempDir.resolve("shuffled.pdf");
        assertThrows(ShuffleRequiresHandlesException.class,
            () -> operations.shuffle(List.of(ten.toString()), List.of("1-5", "5-1"), output));
        assertThrows(MissingRangesException.class,
            () -> operations.shuffle(List.of("A=" + ten), List.of(), output));
        assertFalse(Files.exists(output));
    }

    @Test
    void testPageCount() throws IOException {
        assertEquals(20, operations.pageCount(twenty));
    }
}
