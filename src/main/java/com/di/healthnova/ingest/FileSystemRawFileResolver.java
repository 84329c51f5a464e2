package com.di.healthnova.ingest;

import com.di.healthnova.config.HealthNovaProperties;
import com.di.healthnova.exception.RawFileReadException;
import com.di.healthnova.model.RawFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves refs against {@code healthnova.ingestion.raw-file-root}. Relative refs must stay inside the root;
 * absolute refs come from the trusted dispatcher (or the command line) and are read as given.
 */
@Slf4j
@Component
public class FileSystemRawFileResolver implements RawFileResolver {

    private final Path root;

    @Autowired
    public FileSystemRawFileResolver(HealthNovaProperties properties) {
        this(Paths.get(properties.getIngestion().getRawFileRoot()));
    }

    public FileSystemRawFileResolver(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public RawFile resolve(String rawFileRef) {
        Path ref = Paths.get(rawFileRef.trim());
        Path path = ref.isAbsolute() ? ref.normalize() : root.resolve(ref).normalize();
        if (!ref.isAbsolute() && !path.startsWith(root)) {
            throw new IllegalArgumentException("Raw file ref escapes the upload root: " + rawFileRef);
        }
        try {
            byte[] content = Files.readAllBytes(path);
            log.debug("[INGEST] Read {} ({} bytes)", path, content.length);
            return new RawFile(rawFileRef, path.getFileName().toString(), content);
        } catch (NoSuchFileException e) {
            throw new RawFileReadException("Raw file not found: " + path, e);
        } catch (IOException e) {
            throw new RawFileReadException("Cannot read raw file " + path + ": " + e.getMessage(), e);
        }
    }
}
