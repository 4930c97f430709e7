package io.borgqueue.worker;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Worker identity shown on claimed jobs.
 */
public final class WorkerIds {

    private static final int MAX_LENGTH = 128;

    private WorkerIds() {
    }

    /**
     * Returns {@code configured} when set, otherwise {@code <host>-<pid>-<uuid>}.
     */
    public static String resolve(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }

        String host = "borgqueue";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ignored) {
            // keep the fallback name
        }

        String pid = ManagementFactory.getRuntimeMXBean().getName().split("@")[0];

        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > MAX_LENGTH) {
            return generated.substring(0, MAX_LENGTH);
        }
        return generated;
    }
}
