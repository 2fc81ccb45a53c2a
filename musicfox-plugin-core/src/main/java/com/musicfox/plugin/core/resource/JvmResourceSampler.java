package com.musicfox.plugin.core.resource;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;

/**
 * 基于 JVM 管理接口的进程级采样
 */
public class JvmResourceSampler implements ResourceSampler {

    private static final long MB = 1024L * 1024L;

    @Override
    public ResourceUsage sample() {
        Runtime runtime = Runtime.getRuntime();
        long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / MB;

        double cpu = 0.0;
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getProcessCpuLoad();
            if (load >= 0) {
                cpu = load * 100.0;
            }
        }

        int fileHandles = 0;
        if (os instanceof com.sun.management.UnixOperatingSystemMXBean unixOs) {
            fileHandles = (int) unixOs.getOpenFileDescriptorCount();
        }

        int threads = ManagementFactory.getThreadMXBean().getThreadCount();
        return new ResourceUsage(usedMb, cpu, threads, fileHandles, 0, Instant.now());
    }
}
