package com.qmigrate.script.condition;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates a qmake scope condition ("!win32 &amp;&amp; qtConfig(opengl)") into the
 * CMake-flavored syntax the simplifier reads ("NOT WIN32 AND QT_FEATURE_opengl").
 *
 * Test functions become pseudo variables (contains(A, b) is "A___contains___b"),
 * platform scopes are mapped through {@link PlatformMapping}, and
 * qtConfig / qtHaveModule become feature flags and target checks.
 */
public class ConditionMapper {

    private static final Pattern GCC_VERSION =
            Pattern.compile("(equals|greaterThan|lessThan)\\(QT_GCC_([A-Z]+)_VERSION,[ ]*([0-9]+)\\)");
    private static final Pattern BUILD_TYPE = Pattern.compile("CONFIG\\((debug|release),debug\\|release\\)");
    private static final Pattern FEATURE = Pattern.compile("(qtConfig|qtHaveModule)\\(([a-zA-Z0-9_-]+)\\)");

    private final LibraryMapper libraries;

    public ConditionMapper(LibraryMapper libraries) {
        if (libraries == null) throw new IllegalArgumentException("libraries is null");
        this.libraries = libraries;
    }

    public ConditionMapper() {
        this(new QtLibraryMapper());
    }

    public String map(String condition) {
        String c = condition;

        // special cases that do not generalize
        c = c.replaceAll("qtConfig\\(opengl\\(es1\\|es2\\)\\?\\)",
                "QT_FEATURE_opengl OR QT_FEATURE_opengles2 OR QT_FEATURE_opengles3");
        c = c.replaceAll("qtConfig\\(opengl\\.\\*\\)", "QT_FEATURE_opengl");
        c = c.replaceAll("^win\\*$", "win");
        c = c.replaceAll("^no-png$", "NOT QT_FEATURE_png");
        c = c.replaceAll("contains\\(CONFIG, ?static\\)", "NOT QT_BUILD_SHARED_LIBS");
        c = c.replaceAll("contains\\(QT_CONFIG,\\w*shared\\)", "QT_BUILD_SHARED_LIBS");

        c = mapGccVersion(c);

        c = c.replaceAll("\\bif\\s*\\((.*?)\\)", "$1");
        c = c.replaceAll("\\bisEmpty\\s*\\((.*?)\\)", "$1_ISEMPTY");
        c = c.replaceAll("\\bcontains\\s*\\((.*?),\\s*\"?(.*?)\"?\\)", "$1___contains___$2");
        c = c.replaceAll("\\bequals\\s*\\((.*?),\\s*\"?(.*?)\"?\\)", "$1___equals___$2");
        c = c.replaceAll("\\bisEqual\\s*\\((.*?),\\s*\"?(.*?)\"?\\)", "$1___equals___$2");
        c = c.replaceAll("\\s*==\\s*", "___STREQUAL___");
        c = c.replaceAll("\\bexists\\s*\\((.*?)\\)", "EXISTS $1");

        Matcher buildType = BUILD_TYPE.matcher(c);
        if (buildType.lookingAt()) {
            String type = buildType.group(1).equals("debug") ? "Debug" : "Release";
            c = BUILD_TYPE.matcher(c).replaceAll("(CMAKE_BUILD_TYPE STREQUAL " + type + ")");
        }

        c = c.replace("*", "_x_");
        c = c.replace(".$$", "__ss_");
        c = c.replace("$$", "_ss_");

        c = c.replace("!", "NOT ");
        c = c.replace("&&", " AND ");
        c = c.replace("|", " OR ");

        StringBuilder out = new StringBuilder();
        for (String part : c.trim().split("\\s+")) {
            if (part.isEmpty()) continue;
            out.append(' ').append(mapPart(part));
        }
        return out.toString().trim();
    }

    private String mapPart(String part) {
        Matcher feature = FEATURE.matcher(part);
        String mapped;
        if (feature.lookingAt()) {
            String name = feature.group(2);
            if (feature.group(1).equals("qtHaveModule")) {
                mapped = "TARGET " + libraries.mapQtLibrary(name);
            } else {
                String featureName = featureName(name);
                if (featureName.startsWith("system_") && libraries.isKnownThirdParty(featureName.substring(7))) {
                    mapped = ConditionSimplifier.TRUE;
                } else if (featureName.equals("dlopen")) {
                    mapped = ConditionSimplifier.TRUE;
                } else {
                    mapped = "QT_FEATURE_" + featureName;
                }
            }
        } else {
            mapped = PlatformMapping.map(part);
        }

        if (mapped.equals("true")) return ConditionSimplifier.TRUE;
        if (mapped.equals("false")) return ConditionSimplifier.FALSE;
        return mapped;
    }

    private static String mapGccVersion(String condition) {
        Matcher m = GCC_VERSION.matcher(condition);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String op;
            switch (m.group(1)) {
                case "equals":
                    op = "STREQUAL";
                    break;
                case "greaterThan":
                    op = "STRGREATER";
                    break;
                default:
                    op = "STRLESS";
                    break;
            }
            String replacement = "(QT_COMPILER_VERSION_" + m.group(2) + " " + op + " " + m.group(3) + ")";
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Feature names as CMake variables: anything outside [a-zA-Z0-9_] becomes '_'. */
    static String featureName(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
