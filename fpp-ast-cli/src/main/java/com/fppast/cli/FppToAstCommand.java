package com.fppast.cli;

import ch.qos.logback.classic.Level;
import com.fppast.FppAstException;
import com.fppast.TranslationSession;
import com.fppast.ast.ModuleMember;
import com.fppast.ast.TransUnit;
import com.fppast.json.AstJsonException;
import com.fppast.json.AstJsonProvider;
import com.fppast.loc.LocationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Reads the AST and location map written by fpp-to-json and prints the decoded members.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * fpp-to-ast fpp-ast.json fpp-loc-map.json
 * fpp-to-ast --format=text --parallel fpp-ast.json fpp-loc-map.json
 * }</pre>
 *
 * <p>Exit codes: 0 on success, 1 when translation fails, 2 when an input file is missing.
 */
@Command(
    name = "fpp-to-ast",
    mixinStandardHelpOptions = true,
    version = "fpp-to-ast 1.0.0-SNAPSHOT",
    description = "Rebuild a typed FPP AST from fpp-to-json output"
)
public class FppToAstCommand implements Callable<Integer> {

    static final int EXIT_TRANSLATION_FAILED = 1;
    static final int EXIT_MISSING_INPUT = 2;

    private static final Logger log = LoggerFactory.getLogger(FppToAstCommand.class);

    enum Format { JSON, TEXT }

    @Parameters(index = "0", description = "AST JSON file written by fpp-to-json")
    private Path astFile;

    @Parameters(index = "1", description = "Location map JSON file written by fpp-to-json")
    private Path locationFile;

    @Option(names = "--format", defaultValue = "JSON", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Format format;

    @Option(names = "--parallel", description = "Decode sibling members in parallel")
    private boolean parallel;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Supplier<AstJsonProvider> providerLookup;

    public FppToAstCommand() {
        this(AstJsonProvider::getProvider);
    }

    FppToAstCommand(Supplier<AstJsonProvider> providerLookup) {
        this.providerLookup = providerLookup;
    }

    @Override
    public Integer call() {
        configureLogging();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        for (Path file : List.of(astFile, locationFile)) {
            if (!Files.exists(file)) {
                err.println("error: File \"" + file + "\" not found");
                return EXIT_MISSING_INPUT;
            }
        }

        try {
            AstJsonProvider provider = providerLookup.get();
            LocationRegistry locations = new LocationRegistry();
            provider.getLocationMapReader().load(locationFile, locations);

            TranslationSession session = TranslationSession.create(locations).withParallelMembers(parallel);
            List<TransUnit> units = provider.getDeserializer().deserializeTransUnits(astFile, session);
            log.info("Decoded {} translation unit(s) from {}", units.size(), astFile);

            for (TransUnit unit : units) {
                for (ModuleMember member : unit.members()) {
                    out.println(format == Format.JSON
                        ? provider.getSerializer().serializePretty(member)
                        : member.toString());
                }
            }
            out.flush();
            return 0;
        } catch (FppAstException | AstJsonException e) {
            log.debug("Translation failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_TRANSLATION_FAILED;
        } catch (IOException | IllegalStateException e) {
            log.debug("Translation failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_TRANSLATION_FAILED;
        }
    }

    private void configureLogging() {
        if (!(LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root)) {
            return;
        }
        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        }
    }

    static CommandLine commandLine() {
        return commandLine(new FppToAstCommand());
    }

    static CommandLine commandLine(FppToAstCommand command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
