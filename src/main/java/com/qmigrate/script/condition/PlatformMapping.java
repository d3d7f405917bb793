package com.qmigrate.script.condition;

import java.util.HashMap;
import java.util.Map;

/**
 * qmake platform scope names and their CMake platform variables.
 */
public final class PlatformMapping {

    private static final Map<String, String> PLATFORMS = new HashMap<>();

    static {
        PLATFORMS.put("win32", "WIN32");
        PLATFORMS.put("win", "WIN32");
        PLATFORMS.put("unix", "UNIX");
        PLATFORMS.put("darwin", "APPLE");
        PLATFORMS.put("mac", "APPLE");
        PLATFORMS.put("macx", "APPLE_OSX");
        PLATFORMS.put("macos", "APPLE_OSX");
        PLATFORMS.put("osx", "APPLE_OSX");
        PLATFORMS.put("ios", "APPLE_IOS");
        PLATFORMS.put("uikit", "APPLE_UIKIT");
        PLATFORMS.put("tvos", "APPLE_TVOS");
        PLATFORMS.put("watchos", "APPLE_WATCHOS");
        PLATFORMS.put("linux", "LINUX");
        PLATFORMS.put("android", "ANDROID");
        PLATFORMS.put("android-embedded", "ANDROID_EMBEDDED");
        PLATFORMS.put("freebsd", "FREEBSD");
        PLATFORMS.put("openbsd", "OPENBSD");
        PLATFORMS.put("netbsd", "NETBSD");
        PLATFORMS.put("bsd", "BSD");
        PLATFORMS.put("haiku", "HAIKU");
        PLATFORMS.put("integrity", "INTEGRITY");
        PLATFORMS.put("qnx", "QNX");
        PLATFORMS.put("vxworks", "VXWORKS");
        PLATFORMS.put("hpux", "HPUX");
        PLATFORMS.put("nacl", "NACL");
        PLATFORMS.put("winrt", "WINRT");
        PLATFORMS.put("wasm", "WASM");
        PLATFORMS.put("emscripten", "EMSCRIPTEN");
        PLATFORMS.put("msvc", "MSVC");
        PLATFORMS.put("clang", "CLANG");
        PLATFORMS.put("gcc", "GCC");
        PLATFORMS.put("icc", "ICC");
        PLATFORMS.put("intel_icc", "ICC");
        PLATFORMS.put("macx-icc", "(APPLE_OSX AND ICC)");
    }

    private PlatformMapping() {}

    /** Mapped variable for a platform scope name, or the name unchanged. */
    public static String map(String platform) {
        String mapped = PLATFORMS.get(platform);
        return mapped == null ? platform : mapped;
    }
}
