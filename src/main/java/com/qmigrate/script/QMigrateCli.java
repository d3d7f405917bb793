package com.qmigrate.script;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.qmigrate.debug.Debug;
import com.qmigrate.debug.DebugLevel;
import com.qmigrate.debug.StdStreamDebugSink;
import com.qmigrate.script.parser.ParseError;
import com.qmigrate.script.scope.Scope;
import com.qmigrate.script.scope.StructuralError;

public final class QMigrateCli {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: qmigrate [--debug] [--debug-parser] [--debug-parse-result] [--debug-pro-structure]\n"
            + "                [--debug-full-pro-structure] [--json] [--subdirs] [--no-vpath] <file.pro>...\n"
            + "       qmigrate --simplify \"<condition>\"";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the command line and returns the process exit code. */
    public static int run(String[] args) {
        final QMigrateOptions options;
        try {
            options = QMigrateOptions.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        Debug.get().setSink(new StdStreamDebugSink(options.debug() ? DebugLevel.TRACE : DebugLevel.INFO));
        QMigrate qmigrate = new QMigrate(options);

        if (options.simplify() != null) {
            System.out.println(qmigrate.simplify(options.simplify()));
            return EXIT_OK;
        }
        if (options.files().isEmpty()) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        int status = EXIT_OK;
        for (String f : options.files()) {
            Path path = Path.of(f);
            try {
                Project project = qmigrate.load(path);
                if (options.dumpJson()) {
                    System.out.println(ScopeJson.pretty(ScopeJson.toJson(project)));
                } else {
                    printSummary(project, options, "");
                }
            } catch (IOException e) {
                System.err.println("Failed to read project file: " + path);
                e.printStackTrace(System.err);
                status = Math.max(status, EXIT_IO);
            } catch (ParseError e) {
                System.err.println(path + ": " + e.getMessage());
                status = Math.max(status, EXIT_ERROR);
            } catch (StructuralError e) {
                System.err.println(e.file() + ": " + e.getMessage());
                status = Math.max(status, EXIT_ERROR);
            }
        }
        return status;
    }

    private static void printSummary(Project project, QMigrateOptions options, String indent) {
        Scope root = project.root();
        System.out.println(indent + project.file().getFileName() + ": " + root.template() + " " + root.target()
                + (project.isExample() ? " (example)" : ""));
        printSources(root, options, indent);
        for (Subproject sub : project.subprojects()) {
            System.out.println(indent + "  SUBDIR " + sub);
            if (sub.project() != null) printSummary(sub.project(), options, indent + "    ");
        }
        if (!root.unvisitedKeys().isEmpty()) {
            System.out.println(indent + "  unused keys: " + root.unvisitedKeys());
        }
    }

    private static void printSources(Scope scope, QMigrateOptions options, String indent) {
        List<String> sources = scope.files("SOURCES", options.useVpath(), false);
        if (!sources.isEmpty()) {
            System.out.println(indent + "  [" + scope.totalCondition() + "] SOURCES " + String.join(" ", sources));
        }
        for (Scope child : scope.liveChildren()) {
            printSources(child, options, indent);
        }
    }

    private QMigrateCli() {}
}
