package com.di.healthnova.ingest;

import com.di.healthnova.exception.RawFileReadException;
import com.di.healthnova.model.RawFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileSystemRawFileResolver Tests")
class FileSystemRawFileResolverTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Should read a file relative to the upload root")
    void testResolve_Relative() throws IOException {
        Files.createDirectories(root.resolve("u1"));
        Files.writeString(root.resolve("u1/steps-2024-01-01.json"), "[]", StandardCharsets.UTF_8);

        RawFile file = new FileSystemRawFileResolver(root).resolve("u1/steps-2024-01-01.json");

        assertEquals("steps-2024-01-01.json", file.getFileName());
        assertEquals("u1/steps-2024-01-01.json", file.getReference());
        assertEquals(2, file.size());
    }

    @Test
    @DisplayName("Should read absolute refs as given")
    void testResolve_Absolute() throws IOException {
        Path elsewhere = Files.writeString(root.resolve("abs.csv"), "a,b\n", StandardCharsets.UTF_8);

        RawFile file = new FileSystemRawFileResolver(root.resolve("nested")).resolve(elsewhere.toString());

        assertEquals("abs.csv", file.getFileName());
    }

    @Test
    @DisplayName("Should reject relative refs that leave the root")
    void testResolve_Escape() {
        FileSystemRawFileResolver resolver = new FileSystemRawFileResolver(root.resolve("uploads"));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve("../secrets.txt"));
    }

    @Test
    @DisplayName("Should report a missing file as a read error")
    void testResolve_Missing() {
        RawFileReadException e = assertThrows(RawFileReadException.class,
                () -> new FileSystemRawFileResolver(root).resolve("nope.csv"));
        assertTrue(e.getMessage().contains("not found"));
    }
}
