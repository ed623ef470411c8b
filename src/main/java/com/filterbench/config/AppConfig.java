package com.filterbench.config;

import com.filterbench.actor.ShutdownPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    /** Folder where filtered images are written when a request names none */
    private String outputDir = "./output";

    /** Pool size / actor count / process count when a request names none */
    private int defaultWorkers = 4;

    /** Number of task executions the bounded gate admits at once */
    private int gateCapacity = 4;

    /** Latency floor applied before every task, in milliseconds */
    private long minTaskLatencyMs = 100;

    /** How long an idle actor waits on its inbox before polling again */
    private long actorPollTimeoutMs = 1000;

    /** What actors do with queued tasks when stopped: DRAIN or DISCARD */
    private ShutdownPolicy actorShutdownPolicy = ShutdownPolicy.DRAIN;

    /** How long teardown waits for actors or worker processes to exit */
    private long shutdownTimeoutMs = 5000;

    /** Wrap process-pool dispatches in the bounded gate as well */
    private boolean gateProcessPool = false;

    /** Java launcher for worker processes; blank uses the running JVM's */
    private String workerJavaCommand = "";

    /** Class path for worker processes; blank uses the running JVM's */
    private String workerClasspath = "";

    // ───────────── getters / setters ─────────────

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public int getDefaultWorkers() {
        return defaultWorkers;
    }

    public void setDefaultWorkers(int defaultWorkers) {
        this.defaultWorkers = defaultWorkers;
    }

    public int getGateCapacity() {
        return gateCapacity;
    }

    public void setGateCapacity(int gateCapacity) {
        this.gateCapacity = gateCapacity;
    }

    public long getMinTaskLatencyMs() {
        return minTaskLatencyMs;
    }

    public void setMinTaskLatencyMs(long minTaskLatencyMs) {
        this.minTaskLatencyMs = minTaskLatencyMs;
    }

    public long getActorPollTimeoutMs() {
        return actorPollTimeoutMs;
    }

    public void setActorPollTimeoutMs(long actorPollTimeoutMs) {
        this.actorPollTimeoutMs = actorPollTimeoutMs;
    }

    public ShutdownPolicy getActorShutdownPolicy() {
        return actorShutdownPolicy;
    }

    public void setActorShutdownPolicy(ShutdownPolicy actorShutdownPolicy) {
        this.actorShutdownPolicy = actorShutdownPolicy;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public boolean isGateProcessPool() {
        return gateProcessPool;
    }

    public void setGateProcessPool(boolean gateProcessPool) {
        this.gateProcessPool = gateProcessPool;
    }

    public String getWorkerJavaCommand() {
        return workerJavaCommand;
    }

    public void setWorkerJavaCommand(String workerJavaCommand) {
        this.workerJavaCommand = workerJavaCommand;
    }

    public String getWorkerClasspath() {
        return workerClasspath;
    }

    public void setWorkerClasspath(String workerClasspath) {
        this.workerClasspath = workerClasspath;
    }
}
