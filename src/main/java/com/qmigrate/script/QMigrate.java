package com.qmigrate.script;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.qmigrate.script.condition.ConditionMapper;
import com.qmigrate.script.condition.ConditionSimplifier;
import com.qmigrate.script.parser.Parser;
import com.qmigrate.script.parser.SourceNormalizer;
import com.qmigrate.script.parser.Statement.Stmt;

/**
 * Entry points for embedding: parse project text, simplify or map a
 * condition, or load a project file with its includes and subprojects.
 */
public final class QMigrate {

    private final QMigrateOptions options;
    private final ConditionMapper conditionMapper = new ConditionMapper();
    private final ConditionSimplifier simplifier = new ConditionSimplifier();

    public QMigrate() {
        this(QMigrateOptions.defaults());
    }

    public QMigrate(QMigrateOptions options) {
        if (options == null) throw new IllegalArgumentException("options is null");
        this.options = options;
    }

    /** Normalizes and parses project text. */
    public List<Stmt> parse(String source) {
        return new Parser(SourceNormalizer.normalize(source)).parse();
    }

    public String simplify(String condition) {
        return simplifier.simplify(condition);
    }

    /** Maps a qmake condition and simplifies the result. */
    public String mapCondition(String qmakeCondition) {
        return simplifier.simplify(conditionMapper.map(qmakeCondition));
    }

    public Project load(Path proFile) throws IOException {
        return new ProjectLoader(options, conditionMapper, simplifier, new QmakeConfRootLocator()).load(proFile);
    }
}
