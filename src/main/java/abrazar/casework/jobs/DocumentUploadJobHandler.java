package abrazar.casework.jobs;

import abrazar.casework.api.types.StoredAssetType;
import abrazar.casework.integration.storage.AssetStorage;
import abrazar.casework.integration.storage.AssetUploadOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Stores a raw document under {@code abrazar/documents}. No entity is updated.
 *
 * <p>
 * <b>Payload:</b> {@code {fileBase64, fileName?}}. The public id is {@code document_{jobId}}, or
 * {@code document_{fileName}_{jobId}} when a file name is given.
 */
@ApplicationScoped
public class DocumentUploadJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(DocumentUploadJobHandler.class);

    static final String FOLDER = ImageUploadJobHandler.ASSET_ROOT + "/documents";

    @Inject
    AssetStorage assetStorage;

    @Override
    public Set<JobType> handlesTypes() {
        return EnumSet.of(JobType.PROCESS_DOCUMENT);
    }

    @Override
    public StoredAssetType execute(String jobId, Map<String, Object> payload) {
        byte[] content = ImageUploadJobHandler.decode(JobPayloads.requireString(payload, "fileBase64"));
        String publicId = JobPayloads.optionalString(payload, "fileName")
                .map(name -> "document_" + name.replaceAll("[^A-Za-z0-9._-]", "_") + "_" + jobId)
                .orElse("document_" + jobId);

        StoredAssetType asset = assetStorage.store(content, AssetUploadOptions.raw(FOLDER, publicId));
        LOG.infof("Stored document %s (%d bytes)", asset.publicId(), asset.bytes());
        return asset;
    }
}
