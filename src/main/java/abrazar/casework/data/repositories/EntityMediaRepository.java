package abrazar.casework.data.repositories;

import abrazar.casework.jobs.UploadEntityType;

/**
 * Writes asset URLs onto entity records after an upload.
 */
public interface EntityMediaRepository {

    /**
     * Sets one media field on exactly one entity record of the given tenant. Writing the same URL again is a no-op; an
     * entity that belongs to another tenant is not touched.
     *
     * @param tenantId
     *            owning organization; for {@code organization} entities it equals {@code entityId}
     * @param fieldName
     *            column to update, e.g. {@code photoUrl}
     */
    void updateMediaField(String tenantId, UploadEntityType entityType, String entityId, String fieldName,
            String url);
}
