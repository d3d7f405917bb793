package com.qmigrate.script.condition;

import java.util.HashMap;
import java.util.Map;

/**
 * Default {@link LibraryMapper}: a table of Qt modules whose target name is not
 * the capitalized module name, plus the third-party libraries Qt builds against.
 */
public class QtLibraryMapper implements LibraryMapper {

    private static final String PRIVATE_SUFFIX = "-private";

    private static final Map<String, String> QT_MODULES = new HashMap<>();
    private static final Map<String, String> THIRD_PARTY = new HashMap<>();

    static {
        QT_MODULES.put("testlib", "Test");
        QT_MODULES.put("opengl", "OpenGL");
        QT_MODULES.put("openglextensions", "OpenGLExtensions");
        QT_MODULES.put("dbus", "DBus");
        QT_MODULES.put("printsupport", "PrintSupport");
        QT_MODULES.put("qml", "Qml");
        QT_MODULES.put("qmltest", "QuickTest");
        QT_MODULES.put("quickcontrols2", "QuickControls2");
        QT_MODULES.put("uitools", "UiTools");
        QT_MODULES.put("uiplugin", "UiPlugin");
        QT_MODULES.put("webengine", "WebEngine");
        QT_MODULES.put("webenginewidgets", "WebEngineWidgets");
        QT_MODULES.put("xmlpatterns", "XmlPatterns");
        QT_MODULES.put("3dcore", "3DCore");
        QT_MODULES.put("3drender", "3DRender");
        QT_MODULES.put("3dinput", "3DInput");
        QT_MODULES.put("3dextras", "3DExtras");
        QT_MODULES.put("bootstrap", "Bootstrap");
        QT_MODULES.put("edid_support", "EdidSupport");
        QT_MODULES.put("eventdispatcher_support", "EventDispatcherSupport");
        QT_MODULES.put("fontdatabase_support", "FontDatabaseSupport");
        QT_MODULES.put("theme_support", "ThemeSupport");

        THIRD_PARTY.put("zlib", "ZLIB::ZLIB");
        THIRD_PARTY.put("png", "PNG::PNG");
        THIRD_PARTY.put("libpng", "PNG::PNG");
        THIRD_PARTY.put("jpeg", "JPEG::JPEG");
        THIRD_PARTY.put("libjpeg", "JPEG::JPEG");
        THIRD_PARTY.put("freetype", "WrapFreetype::WrapFreetype");
        THIRD_PARTY.put("harfbuzz", "harfbuzz::harfbuzz");
        THIRD_PARTY.put("pcre2", "PCRE2::PCRE2");
        THIRD_PARTY.put("doubleconversion", "WrapDoubleConversion::WrapDoubleConversion");
        THIRD_PARTY.put("sqlite", "SQLite::SQLite3");
        THIRD_PARTY.put("sqlite3", "SQLite::SQLite3");
        THIRD_PARTY.put("libudev", "PkgConfig::Libudev");
        THIRD_PARTY.put("libdl", "${CMAKE_DL_LIBS}");
        THIRD_PARTY.put("dl", "${CMAKE_DL_LIBS}");
        THIRD_PARTY.put("openssl", "OpenSSL::SSL");
        THIRD_PARTY.put("icu", "ICU::i18n ICU::uc ICU::data");
        THIRD_PARTY.put("glib", "GLIB2::GLIB2");
        THIRD_PARTY.put("fontconfig", "Fontconfig::Fontconfig");
        THIRD_PARTY.put("dbus", "dbus-1");
        THIRD_PARTY.put("xcb", "XCB::XCB");
        THIRD_PARTY.put("xkbcommon", "XKB::XKB");
        THIRD_PARTY.put("libinput", "Libinput::Libinput");
        THIRD_PARTY.put("mtdev", "PkgConfig::Mtdev");
        THIRD_PARTY.put("tslib", "PkgConfig::Tslib");
        THIRD_PARTY.put("gbm", "gbm::gbm");
        THIRD_PARTY.put("drm", "Libdrm::Libdrm");
        THIRD_PARTY.put("egl", "EGL::EGL");
        THIRD_PARTY.put("opengl", "OpenGL::GL");
        THIRD_PARTY.put("atspi", "PkgConfig::ATSPI2");
        THIRD_PARTY.put("libproxy", "PkgConfig::Libproxy");
        THIRD_PARTY.put("gssapi", "PkgConfig::GSSAPI");
        THIRD_PARTY.put("journald", "PkgConfig::Libsystemd");
        THIRD_PARTY.put("lttng-ust", "LTTng::UST");
        THIRD_PARTY.put("vulkan", "Vulkan::Vulkan");
        THIRD_PARTY.put("mysql", "MySQL::MySQL");
        THIRD_PARTY.put("psql", "PostgreSQL::PostgreSQL");
        THIRD_PARTY.put("odbc", "ODBC::ODBC");
    }

    @Override
    public String mapQtLibrary(String name) {
        boolean isPrivate = name.endsWith(PRIVATE_SUFFIX);
        String module = isPrivate ? name.substring(0, name.length() - PRIVATE_SUFFIX.length()) : name;
        if (module.isEmpty()) return name;

        String mapped = QT_MODULES.get(module);
        if (mapped == null) {
            mapped = Character.toUpperCase(module.charAt(0)) + module.substring(1);
        }
        return "Qt::" + mapped + (isPrivate ? "Private" : "");
    }

    @Override
    public boolean isKnownThirdParty(String name) {
        return THIRD_PARTY.containsKey(name);
    }

    @Override
    public String mapLibrary(String name) {
        String mapped = THIRD_PARTY.get(name);
        return mapped == null ? name : mapped;
    }
}
