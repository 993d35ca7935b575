package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asset written by the storage integration.
 *
 * @param publicId
 *            storage-side identifier, used later for deletion
 * @param url
 *            HTTPS delivery URL
 * @param resourceType
 *            {@code image} or {@code raw}
 */
public record StoredAssetType(@JsonProperty("publicId") String publicId, @JsonProperty("url") String url,
        @JsonProperty("resourceType") String resourceType, @JsonProperty("bytes") long bytes) {
}
