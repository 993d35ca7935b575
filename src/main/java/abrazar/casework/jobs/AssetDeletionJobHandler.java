package abrazar.casework.jobs;

import abrazar.casework.integration.storage.AssetStorage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Deletes a stored asset: {@code {publicId, resourceType?}} (default {@code image}). Deleting an asset that is already
 * gone completes normally.
 */
@ApplicationScoped
public class AssetDeletionJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(AssetDeletionJobHandler.class);

    @Inject
    AssetStorage assetStorage;

    @Override
    public Set<JobType> handlesTypes() {
        return EnumSet.of(JobType.DELETE_FILE);
    }

    @Override
    public Boolean execute(String jobId, Map<String, Object> payload) {
        String publicId = JobPayloads.requireString(payload, "publicId");
        String resourceType = JobPayloads.optionalString(payload, "resourceType").orElse("image");

        boolean deleted = assetStorage.delete(publicId, resourceType);
        if (!deleted) {
            LOG.infof("Asset %s (%s) was already gone", publicId, resourceType);
        }
        return deleted;
    }
}
