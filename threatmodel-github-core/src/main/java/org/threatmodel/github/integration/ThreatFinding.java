package org.threatmodel.github.integration;

/**
 * A threat to be reported as a GitHub issue.
 *
 * @param name short title
 * @param description what the threat is
 * @param severity severity level, e.g. {@code high}
 * @param mitigation recommended mitigation
 */
public record ThreatFinding(String name, String description, String severity, String mitigation) {

}
