package nl.nfi.djwordlist.common;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class HostUtils {

    public static String hostname() {
        try {
            final Process hostname = Runtime.getRuntime().exec(new String[]{"hostname"});
            return new BufferedReader(new InputStreamReader(hostname.getInputStream())).readLine();
        } catch (final IOException e) {
            throw new UnsupportedOperationException("Could not determine hostname", e);
        }
    }

    // the java launcher of the running JVM, used to start worker processes on the same runtime
    public static Path javaExecutable() {
        final String executable = System.getProperty("os.name").startsWith("Windows") ? "java.exe" : "java";
        return Paths.get(System.getProperty("java.home"), "bin", executable);
    }

    public static String classPath() {
        return System.getProperty("java.class.path");
    }
}
