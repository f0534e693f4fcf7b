package app.toolwatch.agent;

import java.net.InetAddress;
import java.net.UnknownHostException;

import lombok.extern.slf4j.Slf4j;

/**
 * User and host stamped on every tool call.
 */
@Slf4j
public record HostIdentity(String user, String hostname) {

    static final String UNKNOWN = "unknown";

    public static HostIdentity detect() {
        return new HostIdentity(detectUser(), detectHostname());
    }

    private static String detectUser() {
        String user = System.getProperty("user.name");
        return user != null && !user.isBlank() ? user : UNKNOWN;
    }

    private static String detectHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            String env = System.getenv("HOSTNAME");
            log.debug("Could not resolve local hostname, using {}: {}", env, ex.getMessage());
            return env != null && !env.isBlank() ? env : UNKNOWN;
        }
    }
}
