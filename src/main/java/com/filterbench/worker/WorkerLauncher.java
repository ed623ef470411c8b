package com.filterbench.worker;

import com.filterbench.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarFile;

/**
 * Starts worker JVMs for the process-pool strategy.
 *
 * By default a worker runs {@link FilterWorkerMain} with the same Java
 * launcher and class path as the current JVM. Both can be overridden in
 * configuration.
 *
 * When the class path is a single repackaged Spring Boot jar (the
 * {@code java -jar} case), the application classes sit under
 * {@code BOOT-INF/classes} and cannot be loaded directly; the worker is then
 * started through Boot's {@code PropertiesLauncher} with
 * {@code loader.main} naming the worker class.
 */
public class WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(WorkerLauncher.class);

    static final String BOOT_LAUNCHER = "org.springframework.boot.loader.launch.PropertiesLauncher";
    private static final String BOOT_CLASSES_ENTRY = "BOOT-INF/classes/";

    private final String javaCommand;
    private final String classpath;
    private final String mainClass;
    private final long minLatencyMs;
    private final boolean bootArchive;

    public WorkerLauncher(String javaCommand, String classpath, String mainClass, long minLatencyMs) {
        this.javaCommand = javaCommand;
        this.classpath = classpath;
        this.mainClass = mainClass;
        this.minLatencyMs = minLatencyMs;
        this.bootArchive = isBootArchive(classpath);
        if (bootArchive) {
            log.info("Worker class path {} is a Spring Boot jar; workers start through {}", classpath,
                    BOOT_LAUNCHER);
        }
    }

    public static WorkerLauncher fromConfig(AppConfig appConfig) {
        return new WorkerLauncher(
                orDefault(appConfig.getWorkerJavaCommand(), currentJavaCommand()),
                orDefault(appConfig.getWorkerClasspath(), System.getProperty("java.class.path")),
                FilterWorkerMain.class.getName(),
                appConfig.getMinTaskLatencyMs());
    }

    /**
     * Same launcher and class path as the current JVM, with a custom main class.
     */
    public static WorkerLauncher forMainClass(String mainClass, long minLatencyMs) {
        return new WorkerLauncher(currentJavaCommand(), System.getProperty("java.class.path"),
                mainClass, minLatencyMs);
    }

    public WorkerProcess launch(int id) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command());
        builder.redirectError(ProcessBuilder.Redirect.INHERIT);
        return new WorkerProcess(id, builder.start());
    }

    List<String> command() {
        List<String> command = new ArrayList<>();
        command.add(javaCommand);
        command.add("-Djava.awt.headless=true");
        if (bootArchive) {
            command.add("-Dloader.main=" + mainClass);
            command.add("-cp");
            command.add(classpath);
            command.add(BOOT_LAUNCHER);
        } else {
            command.add("-cp");
            command.add(classpath);
            command.add(mainClass);
        }
        command.add(FilterWorkerMain.LATENCY_ARG + minLatencyMs);
        return command;
    }

    static String currentJavaCommand() {
        String executable = File.separatorChar == '\\' ? "java.exe" : "java";
        return Paths.get(System.getProperty("java.home"), "bin", executable).toString();
    }

    /**
     * True if the class path is exactly one jar laid out by the Spring Boot
     * repackager.
     */
    static boolean isBootArchive(String classpath) {
        if (classpath == null || classpath.contains(File.pathSeparator) || !classpath.endsWith(".jar")) {
            return false;
        }
        File jar = new File(classpath);
        if (!jar.isFile()) {
            return false;
        }
        try (JarFile jarFile = new JarFile(jar)) {
            return jarFile.getEntry(BOOT_CLASSES_ENTRY) != null;
        } catch (IOException e) {
            log.warn("Could not inspect worker class path {}: {}", classpath, e.getMessage());
            return false;
        }
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }
}
