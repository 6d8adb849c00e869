/* (C)2026 */
package com.ammann.telemetry.model;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Identifier and display name of a monitored entity.
 *
 * @param id   entity identifier
 * @param name display name, falls back to the id when unknown
 */
@Schema(description = "Monitored entity reference")
public record EntityRef(
        @Schema(description = "Entity identifier") String id,
        @Schema(description = "Entity display name") String name) {

    public static EntityRef of(Series series) {
        return new EntityRef(series.entityId(), series.displayName());
    }
}
