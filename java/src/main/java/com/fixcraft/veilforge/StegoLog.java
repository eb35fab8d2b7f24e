package com.fixcraft.veilforge;

/**
 * Stderr logging for the codec. Debug lines carry the component that emitted them
 * ({@code [veilforge:video] ...}) and only print in verbose mode. Never pass passwords, keys or
 * payload bytes.
 */
public final class StegoLog {
    private static final String PREFIX = "veilforge";

    private static volatile Boolean cliVerbose = null;
    private static volatile Boolean cliNoLog = null;

    private StegoLog() {}

    public static void configureFromCli(boolean verbose, boolean noLog) {
        cliVerbose = Boolean.valueOf(verbose);
        cliNoLog = Boolean.valueOf(noLog);
        System.setProperty("veilforge.verbose", verbose ? "1" : "0");
        System.setProperty("veilforge.noLog", noLog ? "1" : "0");
    }

    public static boolean isVerbose() {
        if (cliVerbose != null) {
            return cliVerbose.booleanValue();
        }
        return flag("veilforge.verbose", "VEILFORGE_VERBOSE");
    }

    public static boolean isNoLog() {
        if (cliNoLog != null) {
            return cliNoLog.booleanValue();
        }
        return flag("veilforge.noLog", "VEILFORGE_NO_LOG");
    }

    public static void warn(String message) {
        if (isNoLog()) {
            return;
        }
        System.err.println("WARN: " + message);
    }

    public static void info(String message) {
        if (isNoLog()) {
            return;
        }
        System.err.println(message);
    }

    public static void debug(String component, String message) {
        if (isNoLog() || !isVerbose()) {
            return;
        }
        System.err.println(format(component, message));
    }

    static String format(String component, String message) {
        return "   [" + PREFIX + ":" + component + "] " + message;
    }

    private static boolean flag(String property, String env) {
        return StegoConfig.truthy(System.getProperty(property)) || StegoConfig.truthy(System.getenv(env));
    }
}
