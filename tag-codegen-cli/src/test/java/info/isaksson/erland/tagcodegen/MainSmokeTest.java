package info.isaksson.erland.tagcodegen;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalErr;

    @BeforeEach
    void captureStderr() {
        originalErr = System.err;
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStderr() {
        System.setErr(originalErr);
    }

    @Test
    void writesRuntimeCodeIntoOutputDirectory() throws IOException {
        Path ir = fixture("tag-helper-mini.json");
        Path outDir = tmp.resolve("out");

        int code = Main.run(new String[] {"--ir", ir.toString(), "--output", outDir.toString(), "--unique-id", "test"});

        assertEquals(0, code);
        Path cs = outDir.resolve("tag-helper-mini.g.cs");
        assertTrue(Files.exists(cs), "generated code must be written: " + cs);
        String s = Files.readString(cs);
        assertTrue(s.contains("\"input\", global::Microsoft.AspNetCore.Razor.TagHelpers.TagMode.SelfClosing, \"test\""), s);
    }

    @Test
    void writesDesignTimeCodeToExplicitFile() throws IOException {
        Path ir = fixture("tag-helper-mini.json");
        Path cs = tmp.resolve("gen/Index.design.cs");

        int code = Main.run(new String[] {"--ir", ir.toString(), "--output", cs.toString(), "--design-time"});

        assertEquals(0, code);
        String s = Files.readString(cs);
        assertTrue(s.contains("__o = Model.CssClass;"), s);
        assertFalse(s.contains("__tagHelperRunner"));
    }

    @Test
    void diagnosticsArePrintedButDoNotFailByDefault() throws IOException {
        Path ir = fixture("code-block-in-attribute.json");

        int code = Main.run(new String[] {"--ir", ir.toString(), "--output", tmp.resolve("out").toString()});

        assertEquals(0, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Views/Home/Broken.cshtml(2,8): error TH1001: "));
    }

    @Test
    void diagnosticsFailWhenRequested() throws IOException {
        Path ir = fixture("code-block-in-attribute.json");
        Path outDir = tmp.resolve("out");

        int code = Main.run(new String[] {
                "--ir", ir.toString(),
                "--output", outDir.toString(),
                "--fail-on-diagnostics", "true"
        });

        assertEquals(3, code);
        assertTrue(Files.exists(outDir.resolve("code-block-in-attribute.g.cs")));
    }

    @Test
    void missingIrIsUsageError() {
        assertEquals(1, Main.run(new String[] {"--output", tmp.toString()}));
        assertEquals(1, Main.run(new String[] {"--ir", tmp.resolve("nope.json").toString()}));
    }

    @Test
    void unreadableIrIsIoError() throws IOException {
        Path ir = Files.writeString(tmp.resolve("broken.json"), "not json");

        assertEquals(2, Main.run(new String[] {"--ir", ir.toString(), "--output", tmp.resolve("out").toString()}));
    }

    private Path fixture(String name) throws IOException {
        Path target = tmp.resolve(name);
        try (var in = MainSmokeTest.class.getResourceAsStream("/ir/" + name)) {
            assertNotNull(in, "fixture must exist in test resources");
            Files.copy(in, target);
        }
        return target;
    }
}
