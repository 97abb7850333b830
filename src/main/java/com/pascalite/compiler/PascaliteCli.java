package com.pascalite.compiler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pascalite.compiler.parser.CompileException;
import com.pascalite.compiler.vm.ProgramJsonFormat;
import com.pascalite.compiler.vm.ProgramTextFormat;
import com.pascalite.compiler.vm.VmProgram;
import com.pascalite.compiler.vm.VmRuntimeException;
import com.pascalite.debug.Debug;
import com.pascalite.debug.DebugLevel;
import com.pascalite.debug.DebugSink;
import com.pascalite.debug.PrintStreamDebugSink;

public final class PascaliteCli {
    private static final String TAG = "pascalite.cli";

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final Set<String> COMMANDS = Set.of("compile", "visualize", "run");

    private static final String USAGE =
            "Usage: PascaliteCli compile <file> [--format=text|json] [--out=<file>] [--verbose]\n"
          + "       PascaliteCli visualize <file> [--format=text|json] [--verbose]\n"
          + "       PascaliteCli run <file> [--verbose]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /** Entry point without System.exit; returns the process exit code. */
    public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        Map<String, String> flags = parseArgs(args);
        List<String> positional = positional(args);
        if (positional.size() != 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        String command = positional.get(0);
        if (!COMMANDS.contains(command)) {
            err.println("Unknown command: " + command);
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String format = flags.getOrDefault("format", "text");
        if (!format.equals("text") && !format.equals("json")) {
            err.println("Unknown format: " + format);
            err.println(USAGE);
            return EXIT_USAGE;
        }

        DebugSink previous = Debug.get().getSink();
        if (flags.containsKey("verbose")) {
            Debug.get().setSink(new PrintStreamDebugSink(err, DebugLevel.DEBUG));
        }
        try {
            final Path sourcePath = Path.of(positional.get(1));
            final String source;
            try {
                source = Files.readString(sourcePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Failed to read source file: " + sourcePath + " (" + e.getMessage() + ")");
                return EXIT_IO;
            }

            Pascalite engine = new Pascalite();
            switch (command) {
                case "compile":
                    return compile(engine, source, sourcePath, format, flags.get("out"), out, err);
                case "visualize":
                    return visualize(engine, source, format, out, err);
                case "run":
                    return execute(engine, source, stdin, out, err);
                default:
                    throw new IllegalStateException("unhandled command " + command);
            }
        } finally {
            Debug.get().setSink(previous);
        }
    }

    private static int compile(Pascalite engine, String source, Path sourcePath, String format,
                               String outFlag, PrintStream out, PrintStream err) {
        VmProgram program;
        try {
            program = engine.compile(source);
        } catch (CompileException e) {
            return report(e, err);
        }

        boolean json = format.equals("json");
        Path target = (outFlag != null) ? Path.of(outFlag) : defaultOutput(sourcePath, json);
        String text = json ? ProgramJsonFormat.write(program) : ProgramTextFormat.write(program);
        try {
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to write output file: " + target + " (" + e.getMessage() + ")");
            return EXIT_IO;
        }
        out.println("Wrote " + program.code().size() + " instructions to " + target);
        return EXIT_OK;
    }

    private static int visualize(Pascalite engine, String source, String format, PrintStream out, PrintStream err) {
        try {
            String rendering = format.equals("json") ? engine.visualizeJson(source) : engine.visualize(source);
            out.print(rendering);
            if (format.equals("json")) out.println();
            return EXIT_OK;
        } catch (CompileException e) {
            return report(e, err);
        }
    }

    private static int execute(Pascalite engine, String source, InputStream stdin, PrintStream out, PrintStream err) {
        BufferedReader in = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        try {
            engine.run(source, in, out);
            return EXIT_OK;
        } catch (CompileException e) {
            return report(e, err);
        } catch (VmRuntimeException e) {
            Debug.get().e(TAG, "runtime fault", e);
            out.flush();
            err.println("Runtime error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static int report(CompileException e, PrintStream err) {
        Debug.get().d(TAG, e.kind() + " error at " + e.getPosition());
        err.println(e.kind() + " error: " + e.getMessage());
        return EXIT_ERROR;
    }

    /** {@code prog.pas} becomes {@code prog.vm} (or {@code prog.vm.json}) in the same directory. */
    static Path defaultOutput(Path source, boolean json) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = (dot > 0) ? name.substring(0, dot) : name;
        return source.resolveSibling(stem + (json ? ".vm.json" : ".vm"));
    }

    private static List<String> positional(String[] args) {
        List<String> out = new ArrayList<>();
        for (String a : args) {
            if (!a.startsWith("--")) out.add(a);
        }
        return out;
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    private PascaliteCli() {}
}
