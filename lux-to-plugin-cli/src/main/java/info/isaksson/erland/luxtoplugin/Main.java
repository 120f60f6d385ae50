package info.isaksson.erland.luxtoplugin;

import info.isaksson.erland.luxtoplugin.core.BackendOutcome;
import info.isaksson.erland.luxtoplugin.core.LuxToPluginOptions;
import info.isaksson.erland.luxtoplugin.core.LuxToPluginResult;
import info.isaksson.erland.luxtoplugin.core.LuxToPluginService;
import info.isaksson.erland.luxtoplugin.core.check.CheckDiagnostic;
import info.isaksson.erland.luxtoplugin.core.check.IrChecker;
import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarning;
import info.isaksson.erland.luxtoplugin.ir.IrJson;
import info.isaksson.erland.luxtoplugin.ir.IrParseException;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrTopLevel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * CLI entrypoint: {@code build}, {@code check} and {@code parse} over an IR JSON file.
 *
 * <p>Exit codes: 0 success, 1 invalid input or a failed backend, 2 I/O problems.</p>
 */
public final class Main {

    private static final LuxToPluginService SERVICE = new LuxToPluginService();

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
        if (parsed.command == null) {
            System.err.println("Error: a command is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }
        if (parsed.input == null) {
            System.err.println("Error: " + parsed.command + " requires an IR JSON file.");
            return 1;
        }

        final Path irPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.exists(irPath) || Files.isDirectory(irPath)) {
            System.err.println("Error: IR file does not exist: " + irPath);
            return 1;
        }

        final IrProgram program;
        try {
            program = IrJson.read(irPath);
        } catch (IrParseException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Error: could not read IR JSON: " + irPath);
            System.err.println(e.getMessage());
            return 2;
        }

        switch (parsed.command) {
            case "parse":
                return parse(program);
            case "check":
                return check(program, irPath);
            default:
                return build(program, parsed);
        }
    }

    private static int parse(IrProgram program) {
        IrTopLevel decl = program.decl;
        String kind = decl == null ? "empty program" : decl.getClass().getSimpleName().toLowerCase();
        int items = decl == null ? 0 : decl.items().size();
        System.out.println("Parsed " + kind + " " + program.name()
                + " (" + items + " item(s), " + program.uses.size() + " import(s))");
        return 0;
    }

    private static int check(IrProgram program, Path irPath) {
        List<CheckDiagnostic> diagnostics = new IrChecker().check(program);
        long errors = IrChecker.errorCount(diagnostics);
        if (errors == 0) {
            System.out.println("Check passed: " + irPath.getFileName());
            diagnostics.forEach(d -> System.out.println(d.format()));
            return 0;
        }
        System.out.println("Check failed: " + errors + " error(s)");
        diagnostics.forEach(d -> System.out.println(d.format()));
        return 1;
    }

    private static int build(IrProgram program, CliArgs parsed) {
        if (program.decl == null) {
            System.err.println("Error: IR program has no top-level unit (run check for details)");
            return 1;
        }
        LuxToPluginOptions opts = new LuxToPluginOptions();
        opts.backends = parsed.targets;
        opts.parallel = parsed.parallel;
        opts.pluginName = parsed.name;

        LuxToPluginResult result = SERVICE.build(program, opts);
        Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();
        List<Path> written;
        try {
            written = SERVICE.writeOutputs(result, outDir);
        } catch (IOException e) {
            System.err.println("Error: could not write outputs to: " + outDir);
            System.err.println(e.getMessage());
            return 2;
        }

        StringBuilder sb = new StringBuilder("lux-to-plugin\n");
        sb.append("- Plugin: ").append(program.name()).append('\n');
        for (Path p : written) sb.append("- Wrote: ").append(p).append('\n');
        for (BackendOutcome o : result.outcomes.values()) {
            for (EmitterWarning w : o.warnings) {
                sb.append("- warning[").append(w.code).append("] (").append(o.backend.cliValue).append("): ")
                        .append(w.message).append('\n');
            }
        }
        System.out.print(sb);

        if (!result.succeeded()) {
            for (BackendOutcome o : result.failures()) {
                System.err.println("Error: " + o.backend.cliValue + " backend failed: " + o.error.getMessage());
            }
            return 1;
        }
        return 0;
    }

    static final class CliArgs {
        boolean help = false;
        String command;
        String input;
        String output = "./dist";
        String name;
        Set<Backend> targets = EnumSet.allOf(Backend.class);
        boolean parallel = false;

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
                    case "--output":
                    case "-o":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--name":
                        out.name = requireValue(args, ++i, "--name");
                        break;
                    case "--target":
                        out.targets = parseTarget(requireValue(args, ++i, "--target"));
                        break;
                    case "--parallel":
                        out.parallel = parseBoolean(requireValue(args, ++i, "--parallel"), "--parallel");
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        if (out.command == null) {
                            if (!a.equals("build") && !a.equals("check") && !a.equals("parse")) {
                                throw new IllegalArgumentException("Unknown command: " + a + " (expected one of: build|check|parse)");
                            }
                            out.command = a;
                        } else if (out.input == null) {
                            out.input = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static Set<Backend> parseTarget(String v) {
            if ("both".equalsIgnoreCase(v.trim())) return EnumSet.allOf(Backend.class);
            return EnumSet.of(Backend.parseCli(v));
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
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "lux-to-plugin\n" +
                    "\n" +
                    "Usage:\n" +
                    "  lux-to-plugin build <ir.json> [--output <dir>] [--target babel|swc|both] [--parallel <bool>] [--name <name>]\n" +
                    "  lux-to-plugin check <ir.json>\n" +
                    "  lux-to-plugin parse <ir.json>\n" +
                    "\n" +
                    "Commands:\n" +
                    "  build   Generate index.js (Babel) and/or lib.rs (SWC)\n" +
                    "  check   Validate the IR and dry-run both backends\n" +
                    "  parse   Load the IR and print a summary\n" +
                    "\n" +
                    "Options:\n" +
                    "  -o, --output <dir>   Output directory (default: ./dist)\n" +
                    "  --target <t>         babel, swc or both (default: both)\n" +
                    "  --parallel <bool>    Run the backends concurrently (default: false)\n" +
                    "  --name <name>        Override the plugin name from the IR\n" +
                    "  -h, --help           Show help\n"
            );
        }
    }
}
