package com.github.basking2.initiativedb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.github.basking2.initiative.StoreOpenException;
import com.github.basking2.initiative.Thing;
import com.github.basking2.initiative.db.InitiativeDbManager;
import com.github.basking2.initiative.db.InitiativeStore;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Command line access to a store.
 *
 * <pre>
 * initiativedb [-H dir] list | get UUID | find NAME | put JSON | delete UUID
 *                     | get-value KEY | set-value KEY JSON | delete-value KEY
 *                     | export | import FILE | version
 * </pre>
 */
public class InitiativeDbMain {
    private static final Logger LOG = LoggerFactory.getLogger(InitiativeDbMain.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(final String[] args) throws ConfigurationException {
        System.exit(run(new InitiativeDb(), args, System.out, System.err));
    }

    /**
     * Run one command.
     *
     * @return The process exit status.
     */
    static int run(final InitiativeDb app, final String[] args, final PrintStream out, final PrintStream err) {
        final Options cliOptions = new Options().
                addOption("H", "home", true, "Store directory. Defaults to initiativedb.home.").
                addOption("h", "help", false, "Help.");

        final CommandLine commandLine;
        try {
            final CommandLineParser cliParser = new DefaultParser();
            commandLine = cliParser.parse(cliOptions, args);
        }
        catch (final ParseException e) {
            err.println(e.getMessage());
            usage(cliOptions, err);
            return USAGE;
        }

        final List<String> command = commandLine.getArgList();

        if (commandLine.hasOption('h') || command.isEmpty()) {
            usage(cliOptions, err);
            return USAGE;
        }

        final String home = commandLine.hasOption("H") ? commandLine.getOptionValue("H") : app.getHome();

        try (final InitiativeDbManager db = app.open(home)) {
            return execute(db, command, out, err);
        }
        catch (final StoreOpenException e) {
            LOG.error("Opening store in {}.", home, e);
            err.println("Cannot open store in " + home + ": " + e.getMessage());
            return FAILED;
        }
        catch (final IOException e) {
            LOG.error("Running {}.", command, e);
            err.println(e.getMessage());
            return FAILED;
        }
    }

    private static int execute(final InitiativeDbManager db, final List<String> command, final PrintStream out, final PrintStream err)
            throws IOException
    {
        final InitiativeStore store = db.getStore();
        final ObjectWriter writer = MAPPER.writerWithDefaultPrettyPrinter();
        final String name = command.get(0);

        switch (name) {
            case "list":
                out.println(writer.writeValueAsString(store.getAllThings()));
                return OK;
            case "get":
                return print(writer, out, store.getThing(arg(command, 1)));
            case "find":
                return print(writer, out, store.getThingByName(arg(command, 1)));
            case "put":
                return status(store.saveThing(MAPPER.readValue(arg(command, 1), Thing.class)));
            case "delete":
                return status(store.deleteThing(arg(command, 1)));
            case "get-value":
                return print(writer, out, store.getValue(arg(command, 1)));
            case "set-value":
                return status(store.setValue(arg(command, 1), MAPPER.readTree(arg(command, 2))));
            case "delete-value":
                return status(store.deleteValue(arg(command, 1)));
            case "export":
                out.println(writer.writeValueAsString(store.export()));
                return OK;
            case "import":
                final JsonNode document = MAPPER.readTree(FileUtils.readFileToString(new File(arg(command, 1)), StandardCharsets.UTF_8));
                if (document == null || !document.isObject()) {
                    err.println("File " + arg(command, 1) + " is not an exported store document.");
                    return FAILED;
                }
                final InitiativeStore.ImportResult result = store.importDocument(document);
                out.println(result);
                return result.getRejected() == 0 ? OK : FAILED;
            case "version":
                out.println(db.getSchemaVersion());
                return OK;
            default:
                err.println("Unknown command " + name + ".");
                return USAGE;
        }
    }

    private static String arg(final List<String> command, final int i) throws IOException {
        if (command.size() <= i) {
            throw new IOException("Command " + command.get(0) + " needs " + i + " argument(s).");
        }
        return command.get(i);
    }

    private static int print(final ObjectWriter writer, final PrintStream out, final Object value) throws IOException {
        if (value == null) {
            return FAILED;
        }
        out.println(writer.writeValueAsString(value));
        return OK;
    }

    private static int status(final boolean success) {
        return success ? OK : FAILED;
    }

    private static void usage(final Options cliOptions, final PrintStream err) {
        final PrintWriter writer = new PrintWriter(err, true);
        final HelpFormatter helpFormatter = new HelpFormatter();
        helpFormatter.printHelp(
                writer,
                HelpFormatter.DEFAULT_WIDTH,
                "initiativedb [options] command [args]",
                "Commands: list, get, find, put, delete, get-value, set-value, delete-value, export, import, version.",
                cliOptions,
                HelpFormatter.DEFAULT_LEFT_PAD,
                HelpFormatter.DEFAULT_DESC_PAD,
                "",
                false);
        writer.flush();
    }
}
