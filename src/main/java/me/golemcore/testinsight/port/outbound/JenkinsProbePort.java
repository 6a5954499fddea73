package me.golemcore.testinsight.port.outbound;

import me.golemcore.testinsight.domain.model.ProbeResult;

/**
 * Connectivity check against a Jenkins server.
 */
public interface JenkinsProbePort {

    /**
     * Authenticate against the server and confirm it answers. Implementations
     * report failures through the returned value.
     */
    ProbeResult probe(String url, String username, String apiToken, boolean verifySsl);
}
