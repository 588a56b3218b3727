package org.poridhi.infrastructure.util;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

/** Small file helpers shared by the static-file and template back ends. */
public final class FileAssets {
    private FileAssets() {}

    /**
     * Copies a bundled classpath resource to {@code target} unless the file exists.
     * Writes through a temp file and an atomic move so readers never see half a file.
     *
     * @return true if the file was written
     */
    public static boolean installIfAbsent(String resource, Path target) throws IOException {
        if (Files.exists(target)) return false;

        byte[] content;
        try (InputStream in = FileAssets.class.getResourceAsStream(resource)) {
            if (in == null) throw new FileNotFoundException("bundled resource missing: " + resource);
            content = in.readAllBytes();
        }

        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = dir.resolve(target.getFileName() + ".tmp");
        try (OutputStream os = Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            os.write(content);
            os.flush();
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return true;
    }

    /** Whole file as UTF-8, or {@code null} if it is not a regular file. */
    public static String readUtf8OrNull(Path file) throws IOException {
        if (!Files.isRegularFile(file)) return null;
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /** True if {@code candidate}, once normalized, still lies under {@code root}. */
    public static boolean isInside(Path root, Path candidate) {
        Path r = root.toAbsolutePath().normalize();
        Path c = candidate.toAbsolutePath().normalize();
        return c.startsWith(r) && !c.equals(r);
    }
}
