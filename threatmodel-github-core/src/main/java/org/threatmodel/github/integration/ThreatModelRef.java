package org.threatmodel.github.integration;

import java.util.UUID;

/**
 * Reference to a threat model owned by the platform.
 *
 * @param id threat model id
 * @param name repository full name the model describes
 * @param createdBy id of the creating actor
 */
public record ThreatModelRef(UUID id, String name, UUID createdBy) {

}
