package abrazar.casework.integration.storage;

import abrazar.casework.api.types.StoredAssetType;

/**
 * Remote asset store (image CDN) used by upload jobs.
 */
public interface AssetStorage {

    /**
     * Stores content under {@code options.folder()/options.publicId()}, replacing any asset with the same id.
     */
    StoredAssetType store(byte[] content, AssetUploadOptions options);

    /**
     * Deletes an asset.
     *
     * @return false when no asset with that id existed
     */
    boolean delete(String publicId, String resourceType);
}
