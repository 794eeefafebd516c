package com.gql2jsonschema.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gql2jsonschema.cli.config.CliSettings;
import com.gql2jsonschema.cli.config.SettingsLoader;
import com.gql2jsonschema.cli.introspect.IntrospectionException;
import com.gql2jsonschema.cli.introspect.IntrospectionFetcher;
import com.gql2jsonschema.cli.introspect.IntrospectionReader;
import com.gql2jsonschema.cli.output.SchemaWriter;
import com.gql2jsonschema.core.convert.ConvertOptions;
import com.gql2jsonschema.core.convert.InvalidOptionException;
import com.gql2jsonschema.core.convert.SchemaAssembler;
import com.gql2jsonschema.core.introspect.IntrospectionQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "gql2jsonschema",
        description = {
                "Convert a GraphQL schema to JSON Schema.",
                "The introspection result is read from a GraphQL endpoint (--endpoint), "
                        + "a file (--input) or stdin, in that order."
        },
        mixinStandardHelpOptions = true,
        version = "0.1.0"
)
public class Gql2JsonSchemaCli implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(Gql2JsonSchemaCli.class);

    @Option(names = {"--config"}, description = "Config file (default: $HOME/.gql2jsonschema.yaml)")
    private Path configFile;

    @Option(names = {"--input", "-i"}, description = "File containing a GraphQL introspection query result")
    private String input;

    @Option(names = {"--output", "-o"}, description = "Output file for the JSON Schema (default: stdout)")
    private String output;

    @Option(names = {"--endpoint", "-e"}, description = "GraphQL endpoint URL")
    private String endpoint;

    @Option(names = {"--header", "-H"}, description = "HTTP header for the endpoint, as 'Name: value' (repeatable)")
    private List<String> headers;

    @Option(names = {"--timeout", "-t"}, description = "Timeout in seconds for HTTP requests, 0 for none (default: 30)")
    private Integer timeout;

    @Option(names = {"--ignore-internals"}, arity = "0..1", fallbackValue = "true",
            description = "Leave out GraphQL internal (__) types (default: true)")
    private Boolean ignoreInternals;

    @Option(names = {"--nullable-array-items"}, arity = "0..1", fallbackValue = "true",
            description = "Allow null items in arrays whose GraphQL element type is nullable (default: false)")
    private Boolean nullableArrayItems;

    @Option(names = {"--id-type"}, description = "How to represent the ID type: string, number or both (default: string)")
    private String idType;

    private final SettingsLoader settingsLoader;
    private final InputStream stdin;
    private final boolean stdinIsTerminal;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public Gql2JsonSchemaCli() {
        this(SettingsLoader.fromSystem(), System.in, stdinIsTerminal(),
                utf8(new FileOutputStream(FileDescriptor.out)), utf8(new FileOutputStream(FileDescriptor.err)));
    }

    public Gql2JsonSchemaCli(SettingsLoader settingsLoader, InputStream stdin, boolean stdinIsTerminal,
                             PrintStream stdout, PrintStream stderr) {
        this.settingsLoader = settingsLoader;
        this.stdin = stdin;
        this.stdinIsTerminal = stdinIsTerminal;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    @Override
    public Integer call() {
        try {
            CliSettings settings = settingsLoader.load(commandLineSettings(), configFile);
            ConvertOptions options = settings.toConvertOptions();

            IntrospectionQuery introspection = readIntrospection(settings);
            ObjectNode schema = SchemaAssembler.convert(introspection, options);

            new SchemaWriter(stdout).write(schema, settings.output() == null ? null : Path.of(settings.output()));
            return 0;
        } catch (InvalidOptionException | IntrospectionException | IOException e) {
            logger.debug("Conversion failed", e);
            stderr.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private IntrospectionQuery readIntrospection(CliSettings settings) {
        if (settings.endpoint() != null) {
            URI uri;
            try {
                uri = URI.create(settings.endpoint());
            } catch (IllegalArgumentException e) {
                throw new InvalidOptionException("invalid endpoint: " + settings.endpoint(), e);
            }
            boolean web = "http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme());
            if (!web || uri.getHost() == null) {
                throw new InvalidOptionException("invalid endpoint: " + settings.endpoint());
            }
            return new IntrospectionFetcher(settings.timeoutDuration()).fetch(uri, settings.headers());
        }

        IntrospectionReader reader = new IntrospectionReader();
        if (settings.input() != null) {
            return reader.read(Path.of(settings.input()));
        }
        if (!stdinIsTerminal) {
            return reader.read(stdin, "stdin");
        }
        throw new IntrospectionException("no input provided: use --endpoint, --input, or pipe data to stdin");
    }

    private CliSettings commandLineSettings() {
        return new CliSettings(input, output, endpoint, headers, timeout, ignoreInternals, nullableArrayItems,
                idType);
    }

    /**
     * Stdin is interactive when file descriptor 0 links to a terminal device. Without {@code /proc}
     * this falls back to {@link System#console()}, which is also {@code null} when only stdout is
     * redirected.
     */
    static boolean stdinIsTerminal() {
        try {
            return isTerminalDevice(Files.readSymbolicLink(Path.of("/proc/self/fd/0")).toString());
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            logger.debug("Cannot inspect stdin, falling back to console detection: {}", e.toString());
            return System.console() != null;
        }
    }

    static boolean isTerminalDevice(String path) {
        return path.startsWith("/dev/pts/") || path.startsWith("/dev/tty") || path.equals("/dev/console");
    }

    static PrintStream utf8(OutputStream out) {
        return new PrintStream(out, true, StandardCharsets.UTF_8);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Gql2JsonSchemaCli()).execute(args);
        System.exit(exitCode);
    }
}
