package me.golemcore.testinsight.port.outbound;

import me.golemcore.testinsight.domain.model.ProbeResult;

/**
 * Connectivity check against the GitHub API.
 */
public interface GitHubProbePort {

    ProbeResult probe(String token);
}
