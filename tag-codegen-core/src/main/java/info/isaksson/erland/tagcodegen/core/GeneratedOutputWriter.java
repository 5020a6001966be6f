package info.isaksson.erland.tagcodegen.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/** Writes generated code to disk, leaving an identical existing file untouched. */
public final class GeneratedOutputWriter {

    private GeneratedOutputWriter() {}

    /**
     * @return true if the file was created or its content replaced, false if it already held {@code code}
     */
    public static boolean writeIfChanged(Path file, String code) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        if (code == null) throw new IllegalArgumentException("code must not be null");

        byte[] bytes = code.getBytes(StandardCharsets.UTF_8);
        if (Files.isRegularFile(file) && Arrays.equals(Files.readAllBytes(file), bytes)) {
            return false;
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.write(file, bytes);
        return true;
    }
}
