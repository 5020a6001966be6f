package info.isaksson.erland.tagcodegen;

import info.isaksson.erland.tagcodegen.core.GeneratedOutputWriter;
import info.isaksson.erland.tagcodegen.core.TagCodegenOptions;
import info.isaksson.erland.tagcodegen.core.TagCodegenResult;
import info.isaksson.erland.tagcodegen.core.TagCodegenService;
import info.isaksson.erland.tagcodegen.emitter.EmitterDiagnostic;
import info.isaksson.erland.tagcodegen.emitter.UniqueIdMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * CLI entrypoint: read an IR JSON document and write the generated C# tag helper code.
 */
public final class Main {

    private static final TagCodegenService SERVICE = new TagCodegenService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.ir == null) {
            System.err.println("Error: --ir is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path irPath = Paths.get(parsed.ir).toAbsolutePath().normalize();
        if (!Files.exists(irPath) || Files.isDirectory(irPath)) {
            System.err.println("Error: --ir must point to an existing IR JSON file: " + irPath);
            return 1;
        }

        final Path codeOut = resolveCodeOutput(parsed.output, irPath);

        final TagCodegenResult res;
        try {
            res = SERVICE.generateFromFile(irPath, toCoreOptions(parsed));
        } catch (IOException e) {
            System.err.println("Error: could not read IR JSON: " + irPath);
            System.err.println(e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            System.err.println("Error: code generation failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        for (EmitterDiagnostic d : res.diagnostics) {
            System.err.println(d);
        }

        final boolean written;
        try {
            written = GeneratedOutputWriter.writeIfChanged(codeOut, res.code);
        } catch (IOException e) {
            System.err.println("Error: could not write generated code to: " + codeOut);
            System.err.println(e.getMessage());
            return 2;
        }

        // Exit code rules
        if (parsed.failOnDiagnostics && res.hasDiagnostics()) {
            System.err.println("Diagnostics present (" + res.diagnostics.size() + ") and --fail-on-diagnostics is set.");
            return 3;
        }

        System.out.println(
                "tag-codegen\n" +
                "- IR: " + irPath + "\n" +
                "- Output: " + codeOut + (written ? "" : " (unchanged)") + "\n" +
                "- Mode: " + (parsed.designTime ? "design-time" : "runtime") + "\n" +
                "- Diagnostics: " + res.diagnostics.size() +
                (parsed.designTime ? "\n- Line mappings: " + res.lineMappings.size() : "")
        );
        return 0;
    }

    private static TagCodegenOptions toCoreOptions(CliArgs parsed) {
        TagCodegenOptions o = new TagCodegenOptions();
        o.designTime = parsed.designTime;
        o.uniqueIdMode = parsed.uniqueIdMode;
        o.fixedUniqueId = parsed.uniqueId;
        o.failOnDiagnostics = parsed.failOnDiagnostics;
        return o;
    }

    static Path resolveCodeOutput(String outputArg, Path irPath) {
        // A path ending with .cs is the output file; anything else is a directory.
        if (outputArg != null && outputArg.toLowerCase(Locale.ROOT).endsWith(".cs")) {
            return Paths.get(outputArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve(stripExtension(irPath.getFileName().toString()) + ".g.cs");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String ir;
        String output = "./output";
        boolean designTime = false;
        UniqueIdMode uniqueIdMode = UniqueIdMode.RANDOM;
        String uniqueId;
        boolean failOnDiagnostics = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--ir":
                        out.ir = requireValue(args, ++i, "--ir");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--design-time":
                        out.designTime = true;
                        break;
                    case "--unique-ids":
                        out.uniqueIdMode = UniqueIdMode.parseCli(requireValue(args, ++i, "--unique-ids"));
                        break;
                    case "--unique-id":
                        out.uniqueId = requireValue(args, ++i, "--unique-id");
                        break;
                    case "--fail-on-diagnostics":
                        out.failOnDiagnostics = parseBoolean(requireValue(args, ++i, "--fail-on-diagnostics"), "--fail-on-diagnostics");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --ir
                        if (out.ir == null) {
                            out.ir = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }
            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase(Locale.ROOT);
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "tag-codegen\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar tag-codegen.jar --ir <file.json> [--output <dir|file.cs>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --ir <file>            IR JSON document to generate from (required)\n" +
                    "  --output <path>        Output folder or .cs file (default: ./output,\n" +
                    "                         file name <ir name>.g.cs)\n" +
                    "  --design-time          Generate design-time code for editor tooling\n" +
                    "  --unique-ids <mode>    Tag helper occurrence ids. Modes:\n" +
                    "                         random | counter | hashed (default: random)\n" +
                    "  --unique-id <value>    Use one fixed id for every occurrence (overrides --unique-ids)\n" +
                    "  --fail-on-diagnostics <bool>  Exit with code 3 when diagnostics were reported.\n" +
                    "                         Default: false.\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/tag-codegen.jar --ir Index.ir.json --output out\n" +
                    "  java -jar target/tag-codegen.jar --ir Index.ir.json --design-time --output out/Index.design.cs\n"
            );
        }
    }

    private static String stripExtension(String fileName) {
        if (fileName == null) return "";
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0) return fileName;
        return fileName.substring(0, idx);
    }
}
