package io.pagetree.standalone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.engine.DocumentService;
import io.pagetree.core.format.TreeFormatChain;
import io.pagetree.core.model.DocumentResult;
import io.pagetree.core.model.NodeId;
import io.pagetree.core.model.ValidationResult;
import io.pagetree.core.tree.TreeCanonicalizer;
import io.pagetree.core.validate.CanonicalTreeSchema;
import io.pagetree.core.validate.ElementTypeCatalog;
import io.pagetree.core.validate.TreeValidator;
import io.pagetree.standalone.config.ConfigLoader;
import io.pagetree.standalone.config.StandaloneConfig;
import io.pagetree.standalone.logging.LogbackConfigurator;
import io.pagetree.standalone.store.FileCacheInvalidator;
import io.pagetree.standalone.store.FileDocumentStore;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point over {@link DocumentService} backed by the file-system collaborators.
 *
 * <pre>
 * page-tree [--config page-tree.yaml] &lt;command&gt; [args]
 *
 *   validate &lt;file&gt;
 *   canonicalize &lt;file&gt;
 *   read &lt;id&gt; [--flatten]
 *   update &lt;id&gt; &lt;file&gt; [--regenerate-css]
 *   create &lt;id&gt;
 *   classes &lt;id&gt; &lt;elementId&gt;
 *   set-classes &lt;id&gt; &lt;elementId&gt; &lt;class&gt;...
 *   add-classes &lt;id&gt; &lt;elementId&gt; &lt;class&gt;...
 *   delete-class &lt;id&gt; &lt;elementId&gt; &lt;class&gt;
 *   regenerate-css &lt;id&gt;
 * </pre>
 *
 * <p>
 * Results are pretty-printed JSON on stdout; logs go to stderr. Exit codes: {@link #EXIT_OK},
 * {@link #EXIT_FAILURE} (invalid tree, not found, rejected, save failure, unreadable input),
 * {@link #EXIT_USAGE}.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage: page-tree [--config <file>] <command> [args]",
            "  validate <file>",
            "  canonicalize <file>",
            "  read <id> [--flatten]",
            "  update <id> <file> [--regenerate-css]",
            "  create <id>",
            "  classes <id> <elementId>",
            "  set-classes <id> <elementId> <class>...",
            "  add-classes <id> <elementId> <class>...",
            "  delete-class <id> <elementId> <class>",
            "  regenerate-css <id>");

    private final StandaloneConfig config;
    private final ObjectMapper mapper;
    private final DocumentService service;
    private final PrintStream out;
    private final PrintStream err;

    StandaloneMain(StandaloneConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.mapper = new ObjectMapper();
        this.out = out;
        this.err = err;
        this.service = new DocumentService(
                new FileDocumentStore(config.storageDir(), config.builderMode()),
                new FileCacheInvalidator(config.cacheDir()),
                new TreeValidator(ElementTypeCatalog.defaults(), config.validationLimits()),
                CanonicalTreeSchema.defaults(),
                config.canonicalCheck(),
                config.builderMode(),
                null,
                mapper);
    }

    /**
     * Application entry point.
     *
     * @param args {@code [--config <file>] <command> [args]}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int exitCode;
        try {
            StandaloneConfig config = ConfigLoader.resolve(args, System::getenv);
            LogbackConfigurator.configure(config.logFormat(), config.logLevel());
            exitCode = new StandaloneMain(config, System.out, System.err).run(stripConfigOption(args));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            exitCode = EXIT_USAGE;
        } catch (Exception e) {
            LOG.error("Command failed: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
        System.exit(exitCode);
    }

    /** Removes the {@code --config <file>} pair; the loader has already consumed it. */
    static List<String> stripConfigOption(String[] args) {
        List<String> remaining = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                i++;
            } else {
                remaining.add(args[i]);
            }
        }
        return remaining;
    }

    /**
     * Runs one command.
     *
     * @return the process exit code
     */
    int run(List<String> args) throws IOException {
        if (args.isEmpty()) {
            return usage("Missing command");
        }
        List<String> positional = new ArrayList<>();
        boolean flatten = false;
        boolean regenerateCss = false;
        for (String arg : args.subList(1, args.size())) {
            switch (arg) {
                case "--flatten" -> flatten = true;
                case "--regenerate-css" -> regenerateCss = true;
                default -> {
                    if (arg.startsWith("--")) {
                        return usage("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }

        String command = args.get(0);
        LOG.debug("cli.command command={} args={} builder={}", command, positional, config.builderMode());
        try {
            return switch (command) {
                case "validate" -> arity(positional, 1, 1)
                        ? validate(Path.of(positional.get(0)))
                        : wrongArity(command);
                case "canonicalize" -> arity(positional, 1, 1)
                        ? canonicalize(Path.of(positional.get(0)))
                        : wrongArity(command);
                case "read" -> arity(positional, 1, 1)
                        ? print(service.read(documentId(positional.get(0)), flatten))
                        : wrongArity(command);
                case "update" -> arity(positional, 2, 2)
                        ? update(documentId(positional.get(0)), Path.of(positional.get(1)), regenerateCss)
                        : wrongArity(command);
                case "create" -> arity(positional, 1, 1)
                        ? print(service.createEmpty(documentId(positional.get(0))))
                        : wrongArity(command);
                case "classes" -> arity(positional, 2, 2)
                        ? print(service.classes(documentId(positional.get(0)), NodeId.parse(positional.get(1))))
                        : wrongArity(command);
                case "set-classes" -> arity(positional, 2, Integer.MAX_VALUE)
                        ? print(service.setClasses(
                                documentId(positional.get(0)),
                                NodeId.parse(positional.get(1)),
                                positional.subList(2, positional.size())))
                        : wrongArity(command);
                case "add-classes" -> arity(positional, 3, Integer.MAX_VALUE)
                        ? print(service.addClasses(
                                documentId(positional.get(0)),
                                NodeId.parse(positional.get(1)),
                                positional.subList(2, positional.size())))
                        : wrongArity(command);
                case "delete-class" -> arity(positional, 3, 3)
                        ? print(service.deleteClass(
                                documentId(positional.get(0)), NodeId.parse(positional.get(1)), positional.get(2)))
                        : wrongArity(command);
                case "regenerate-css" -> arity(positional, 1, 1)
                        ? print(service.regenerateCss(documentId(positional.get(0))))
                        : wrongArity(command);
                default -> usage("Unknown command: " + command);
            };
        } catch (NumberFormatException e) {
            return usage("Document id must be an integer: " + e.getMessage());
        }
    }

    private int validate(Path file) throws IOException {
        Optional<JsonNode> tree = readJson(file);
        if (tree.isEmpty()) {
            return EXIT_FAILURE;
        }
        ValidationResult result = service.validate(tree.get());
        printJson(result.toJson());
        return result.valid() ? EXIT_OK : EXIT_FAILURE;
    }

    private int canonicalize(Path file) throws IOException {
        Optional<String> content = readFile(file);
        if (content.isEmpty()) {
            return EXIT_FAILURE;
        }
        Optional<JsonNode> decoded = TreeFormatChain.defaults(mapper).decode(content.get());
        if (decoded.isEmpty()) {
            return failure("invalid_json", "No recognised tree format in " + file);
        }
        printJson(new TreeCanonicalizer().ensureTreeIntegrity(decoded.get()));
        return EXIT_OK;
    }

    private int update(long documentId, Path file, boolean regenerateCss) throws IOException {
        Optional<JsonNode> tree = readJson(file);
        if (tree.isEmpty()) {
            return EXIT_FAILURE;
        }
        return print(service.update(documentId, tree.get(), regenerateCss));
    }

    private Optional<JsonNode> readJson(Path file) throws IOException {
        Optional<String> content = readFile(file);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(content.get()));
        } catch (JsonProcessingException e) {
            failure("invalid_json", "Invalid JSON in " + file + ": " + e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readFile(Path file) throws IOException {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            failure("file_not_found", "File not found: " + file);
            return Optional.empty();
        }
    }

    private int print(DocumentResult result) throws IOException {
        printJson(result.toJson());
        return result.isSuccess() ? EXIT_OK : EXIT_FAILURE;
    }

    private int failure(String code, String message) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("success", false);
        body.put("code", code);
        body.put("message", message);
        printJson(body);
        return EXIT_FAILURE;
    }

    private void printJson(JsonNode node) throws IOException {
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node));
    }

    private int usage(String problem) {
        err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private int wrongArity(String command) {
        return usage("Wrong number of arguments for '" + command + "'");
    }

    private static boolean arity(List<String> positional, int min, int max) {
        return positional.size() >= min && positional.size() <= max;
    }

    private static long documentId(String raw) {
        return Long.parseLong(raw.trim());
    }
}
