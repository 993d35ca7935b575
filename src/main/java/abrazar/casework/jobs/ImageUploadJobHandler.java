package abrazar.casework.jobs;

import abrazar.casework.api.types.StoredAssetType;
import abrazar.casework.data.repositories.EntityMediaRepository;
import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.integration.storage.AssetStorage;
import abrazar.casework.integration.storage.AssetUploadOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Base64;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Stores an uploaded image and attaches its URL to one entity.
 *
 * <p>
 * <b>Payload:</b> {@code {tenantId, entityType, entityId, fileBase64, fieldName?}}. The tenant and entity type are
 * validated before anything is stored, and the entity update is scoped to the tenant. The asset goes to {@code abrazar/{entityType}s} under the public id
 * {@code {entityType}_{entityId}_{jobId}}, so a replay of the same job overwrites the same asset, then
 * {@code fieldName} (default {@code photoUrl}) is set on exactly one record.
 */
@ApplicationScoped
public class ImageUploadJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ImageUploadJobHandler.class);

    static final String ASSET_ROOT = "abrazar";
    static final String DEFAULT_FIELD = "photoUrl";

    @Inject
    AssetStorage assetStorage;

    @Inject
    EntityMediaRepository entityMediaRepository;

    @Override
    public Set<JobType> handlesTypes() {
        return EnumSet.of(JobType.PROCESS_IMAGE);
    }

    @Override
    public StoredAssetType execute(String jobId, Map<String, Object> payload) {
        String tenantId = JobPayloads.requireString(payload, QueuedJob.TENANT_ID);
        String entityTypeKey = JobPayloads.requireString(payload, "entityType");
        UploadEntityType entityType = UploadEntityType.fromKey(entityTypeKey)
                .orElseThrow(() -> new PermanentJobFailureException("Unknown entity type: " + entityTypeKey));
        String entityId = JobPayloads.requireString(payload, "entityId");
        String fieldName = JobPayloads.optionalString(payload, "fieldName").orElse(DEFAULT_FIELD);
        byte[] content = decode(JobPayloads.requireString(payload, "fileBase64"));

        String publicId = entityType.getKey() + "_" + entityId + "_" + jobId;
        StoredAssetType asset = assetStorage.store(content,
                AssetUploadOptions.image(ASSET_ROOT + "/" + entityType.getFolderName(), publicId));

        entityMediaRepository.updateMediaField(tenantId, entityType, entityId, fieldName, asset.url());
        LOG.infof("Stored image %s (%d bytes) and set %s.%s on %s for tenant %s", asset.publicId(), asset.bytes(),
                entityType.getKey(), fieldName, entityId, tenantId);
        return asset;
    }

    static byte[] decode(String base64) {
        String data = base64;
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        try {
            return Base64.getDecoder().decode(data.replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new PermanentJobFailureException("Upload content is not valid base64", e);
        }
    }
}
