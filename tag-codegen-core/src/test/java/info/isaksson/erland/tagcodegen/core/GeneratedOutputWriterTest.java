package info.isaksson.erland.tagcodegen.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.junit.jupiter.api.Assertions.*;

public class GeneratedOutputWriterTest {

    @TempDir
    Path tmp;

    @Test
    void createsMissingFileAndParents() throws Exception {
        Path out = tmp.resolve("gen/Views/Index.g.cs");

        assertTrue(GeneratedOutputWriter.writeIfChanged(out, "Write(x);\n"));
        assertEquals("Write(x);\n", Files.readString(out));
    }

    @Test
    void identicalContentLeavesFileUntouched() throws Exception {
        Path out = tmp.resolve("Index.g.cs");
        Files.writeString(out, "Write(x);\n");
        FileTime stamp = FileTime.fromMillis(1_000_000_000L);
        Files.setLastModifiedTime(out, stamp);

        assertFalse(GeneratedOutputWriter.writeIfChanged(out, "Write(x);\n"));
        assertEquals(stamp, Files.getLastModifiedTime(out));
    }

    @Test
    void changedContentIsReplaced() throws Exception {
        Path out = tmp.resolve("Index.g.cs");
        Files.writeString(out, "Write(x);\n");

        assertTrue(GeneratedOutputWriter.writeIfChanged(out, "Write(y);\n"));
        assertEquals("Write(y);\n", Files.readString(out));
    }
}
