package com.qmigrate.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable loader and CLI options.
 */
public final class QMigrateOptions {

    private final boolean debug;
    private final boolean debugParser;
    private final boolean debugParseResult;
    private final boolean debugProStructure;
    private final boolean debugFullProStructure;
    private final boolean dumpJson;
    private final boolean resolveSubdirs;
    private final boolean useVpath;
    private final String simplify;
    private final List<String> files;

    private QMigrateOptions(Builder b) {
        this.debug = b.debug;
        this.debugParser = b.debugParser;
        this.debugParseResult = b.debugParseResult;
        this.debugProStructure = b.debugProStructure;
        this.debugFullProStructure = b.debugFullProStructure;
        this.dumpJson = b.dumpJson;
        this.resolveSubdirs = b.resolveSubdirs;
        this.useVpath = b.useVpath;
        this.simplify = b.simplify;
        this.files = Collections.unmodifiableList(new ArrayList<>(b.files));
    }

    public static QMigrateOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean debug() { return debug; }
    public boolean debugParser() { return debugParser || debug; }
    public boolean debugParseResult() { return debugParseResult || debug; }
    public boolean debugProStructure() { return debugProStructure || debug; }
    public boolean debugFullProStructure() { return debugFullProStructure || debug; }
    public boolean dumpJson() { return dumpJson; }
    public boolean resolveSubdirs() { return resolveSubdirs; }
    public boolean useVpath() { return useVpath; }

    /** Condition to simplify instead of loading files, or null. */
    public String simplify() { return simplify; }

    public List<String> files() { return files; }

    /**
     * Parses command line arguments:
     *   --debug --debug-parser --debug-parse-result
     *   --debug-pro-structure --debug-full-pro-structure
     *   --json --subdirs --no-vpath
     *   --simplify="WIN32 AND UNIX"  (or --simplify "WIN32 AND UNIX")
     * Anything not starting with "--" is a project file.
     *
     * @throws IllegalArgumentException on an unknown flag
     */
    public static QMigrateOptions fromArgs(String[] args) {
        Map<String, String> flags = new HashMap<>();
        List<String> files = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--") && a.contains("=")) {
                int eq = a.indexOf('=');
                flags.put(a.substring(2, eq), a.substring(eq + 1));
            } else if (a.equals("--simplify") && i + 1 < args.length) {
                flags.put("simplify", args[++i]);
            } else if (a.startsWith("--")) {
                flags.put(a.substring(2), "true");
            } else {
                files.add(a);
            }
        }

        Builder b = builder();
        for (Map.Entry<String, String> e : flags.entrySet()) {
            boolean on = !"false".equals(e.getValue());
            switch (e.getKey()) {
                case "debug": b.debug(on); break;
                case "debug-parser": b.debugParser(on); break;
                case "debug-parse-result": b.debugParseResult(on); break;
                case "debug-pro-structure": b.debugProStructure(on); break;
                case "debug-full-pro-structure": b.debugFullProStructure(on); break;
                case "json": b.dumpJson(on); break;
                case "subdirs": b.resolveSubdirs(on); break;
                case "no-vpath": b.useVpath(!on); break;
                case "simplify": b.simplify(e.getValue()); break;
                default:
                    throw new IllegalArgumentException("Unknown option --" + e.getKey());
            }
        }
        for (String f : files) b.addFile(f);
        return b.build();
    }

    public static final class Builder {
        private boolean debug;
        private boolean debugParser;
        private boolean debugParseResult;
        private boolean debugProStructure;
        private boolean debugFullProStructure;
        private boolean dumpJson;
        private boolean resolveSubdirs;
        private boolean useVpath = true;
        private String simplify;
        private final List<String> files = new ArrayList<>();

        private Builder() {}

        public Builder debug(boolean v) { this.debug = v; return this; }
        public Builder debugParser(boolean v) { this.debugParser = v; return this; }
        public Builder debugParseResult(boolean v) { this.debugParseResult = v; return this; }
        public Builder debugProStructure(boolean v) { this.debugProStructure = v; return this; }
        public Builder debugFullProStructure(boolean v) { this.debugFullProStructure = v; return this; }
        public Builder dumpJson(boolean v) { this.dumpJson = v; return this; }
        public Builder resolveSubdirs(boolean v) { this.resolveSubdirs = v; return this; }
        public Builder useVpath(boolean v) { this.useVpath = v; return this; }
        public Builder simplify(String condition) { this.simplify = condition; return this; }

        public Builder addFile(String file) {
            if (file == null || file.isEmpty()) throw new IllegalArgumentException("file is empty");
            files.add(file);
            return this;
        }

        public QMigrateOptions build() {
            return new QMigrateOptions(this);
        }
    }
}
