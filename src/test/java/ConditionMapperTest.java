import com.qmigrate.script.QMigrate;
import com.qmigrate.script.condition.ConditionMapper;
import com.qmigrate.script.condition.PlatformMapping;
import com.qmigrate.script.condition.QtLibraryMapper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionMapperTest {

    private final ConditionMapper mapper = new ConditionMapper(new QtLibraryMapper());

    @Test
    public void platforms_and_negation() {
        assertEquals("WIN32", mapper.map("win32"));
        assertEquals("NOT WIN32", mapper.map("!win32"));
        assertEquals("APPLE_OSX OR APPLE_IOS", mapper.map("macx | ios"));
        assertEquals("LINUX AND ANDROID", mapper.map("linux && android"));
        assertEquals("WIN32", mapper.map("win*"));
        assertEquals("(APPLE_OSX AND ICC)", mapper.map("macx-icc"));
        assertEquals("some_custom_config", PlatformMapping.map("some_custom_config"));
    }

    @Test
    public void features_and_modules() {
        assertEquals("QT_FEATURE_opengl", mapper.map("qtConfig(opengl)"));
        assertEquals("QT_FEATURE_opengl", mapper.map("qtConfig(opengl.*)"));
        assertEquals("QT_FEATURE_xcb_xlib", mapper.map("qtConfig(xcb-xlib)"));
        assertEquals("ON", mapper.map("qtConfig(system-zlib)"));
        assertEquals("ON", mapper.map("qtConfig(dlopen)"));
        assertEquals("TARGET Qt::Gui", mapper.map("qtHaveModule(gui)"));
        assertEquals("NOT TARGET Qt::Test", mapper.map("!qtHaveModule(testlib)"));
        assertEquals("NOT QT_FEATURE_png", mapper.map("no-png"));
    }

    @Test
    public void test_functions_become_pseudo_variables() {
        assertEquals("QT_CONFIG___contains___opengl", mapper.map("contains(QT_CONFIG,opengl)"));
        assertEquals("QT_BUILD_SHARED_LIBS", mapper.map("contains(QT_CONFIG,shared)"));
        assertEquals("NOT QT_BUILD_SHARED_LIBS", mapper.map("contains(CONFIG,static)"));
        assertEquals("TEMPLATE___equals___lib", mapper.map("equals(TEMPLATE,\"lib\")"));
        assertEquals("FOO_ISEMPTY", mapper.map("isEmpty(FOO)"));
        assertEquals("EXISTS config.h", mapper.map("exists(config.h)"));
        assertEquals("A___STREQUAL___b", mapper.map("A == b"));
    }

    @Test
    public void build_type_and_compiler_version() {
        assertEquals("(CMAKE_BUILD_TYPE STREQUAL Debug)", mapper.map("CONFIG(debug,debug|release)"));
        assertEquals("(CMAKE_BUILD_TYPE STREQUAL Release)", mapper.map("CONFIG(release,debug|release)"));
        assertEquals("(QT_COMPILER_VERSION_MAJOR STRGREATER 4)", mapper.map("greaterThan(QT_GCC_MAJOR_VERSION,4)"));
        assertEquals("(QT_COMPILER_VERSION_MINOR STREQUAL 9)", mapper.map("equals(QT_GCC_MINOR_VERSION, 9)"));
    }

    @Test
    public void wildcards_and_substitutions_become_identifier_safe() {
        assertEquals("linux_x_", mapper.map("linux*"));
        assertEquals("_ss_FOO", mapper.map("$$FOO"));
    }

    @Test
    public void library_names() {
        QtLibraryMapper libs = new QtLibraryMapper();
        assertEquals("Qt::Core", libs.mapQtLibrary("core"));
        assertEquals("Qt::GuiPrivate", libs.mapQtLibrary("gui-private"));
        assertEquals("Qt::DBus", libs.mapQtLibrary("dbus"));
        assertTrue(libs.isKnownThirdParty("zlib"));
        assertFalse(libs.isKnownThirdParty("qtcore"));
        assertEquals("ZLIB::ZLIB", libs.mapLibrary("zlib"));
        assertEquals("mylib", libs.mapLibrary("mylib"));
    }

    @Test
    public void mapped_conditions_simplify_through_the_facade() {
        QMigrate qm = new QMigrate();
        assertEquals("QT_BUILD_SHARED_LIBS AND WIN32", qm.mapCondition("win32 && !contains(CONFIG,static)"));
        assertEquals("OFF", qm.mapCondition("win32 && unix"));
        assertEquals("UNIX", qm.mapCondition("!win32"));
    }
}
