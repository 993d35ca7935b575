package abrazar.casework.integration.storage;

/**
 * Storage parameters for one asset.
 *
 * @param folder
 *            target folder, e.g. {@code abrazar/cases}
 * @param publicId
 *            deterministic id so a replayed job overwrites the same asset
 * @param resourceType
 *            {@code image} or {@code raw}
 * @param maxWidth
 *            bounding box width for images, 0 for no transformation
 * @param maxHeight
 *            bounding box height for images, 0 for no transformation
 * @param quality
 *            quality directive, e.g. {@code auto:good}
 * @param format
 *            delivery format, e.g. {@code auto}
 */
public record AssetUploadOptions(String folder, String publicId, String resourceType, int maxWidth, int maxHeight,
        String quality, String format) {

    public static AssetUploadOptions image(String folder, String publicId) {
        return new AssetUploadOptions(folder, publicId, "image", 800, 800, "auto:good", "auto");
    }

    public static AssetUploadOptions raw(String folder, String publicId) {
        return new AssetUploadOptions(folder, publicId, "raw", 0, 0, null, null);
    }
}
