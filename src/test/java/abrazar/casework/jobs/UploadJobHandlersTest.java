package abrazar.casework.jobs;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import abrazar.casework.api.types.StoredAssetType;
import abrazar.casework.data.repositories.EntityMediaRepository;
import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.integration.storage.AssetStorage;
import abrazar.casework.integration.storage.AssetUploadOptions;

/**
 * Unit tests for {@link ImageUploadJobHandler}, {@link DocumentUploadJobHandler} and
 * {@link AssetDeletionJobHandler}.
 */
class UploadJobHandlersTest {

    private static final byte[] CONTENT = "fake-png-bytes".getBytes(StandardCharsets.UTF_8);
    private static final String CONTENT_BASE64 = Base64.getEncoder().encodeToString(CONTENT);

    private AssetStorage assetStorage;
    private EntityMediaRepository entityMediaRepository;

    @BeforeEach
    void setUp() {
        assetStorage = mock(AssetStorage.class);
        entityMediaRepository = mock(EntityMediaRepository.class);
        when(assetStorage.store(any(), any())).thenAnswer(invocation -> {
            AssetUploadOptions options = invocation.getArgument(1);
            return new StoredAssetType(options.folder() + "/" + options.publicId(),
                    "https://cdn.example.org/" + options.publicId(), options.resourceType(), CONTENT.length);
        });
    }

    private ImageUploadJobHandler imageHandler() {
        ImageUploadJobHandler handler = new ImageUploadJobHandler();
        handler.assetStorage = assetStorage;
        handler.entityMediaRepository = entityMediaRepository;
        return handler;
    }

    @Test
    void testImage_storesTransformedAssetAndUpdatesOneField() {
        StoredAssetType asset = imageHandler().execute("42",
                Map.of("tenantId", "T1", "entityType", "case", "entityId", "c-9", "fileBase64", CONTENT_BASE64));

        ArgumentCaptor<AssetUploadOptions> options = ArgumentCaptor.forClass(AssetUploadOptions.class);
        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(assetStorage).store(bytes.capture(), options.capture());
        assertArrayEquals(CONTENT, bytes.getValue());
        assertEquals("abrazar/cases", options.getValue().folder());
        assertEquals("case_c-9_42", options.getValue().publicId());
        assertEquals(800, options.getValue().maxWidth());
        assertEquals(800, options.getValue().maxHeight());
        assertEquals("auto:good", options.getValue().quality());

        verify(entityMediaRepository).updateMediaField("T1", UploadEntityType.CASE, "c-9", "photoUrl", asset.url());
    }

    @Test
    void testImage_customFieldAndDataUri() {
        imageHandler().execute("7", Map.of("tenantId", "o-1", "entityType", "organization", "entityId", "o-1",
                "fieldName", "logoUrl", "fileBase64", "data:image/png;base64," + CONTENT_BASE64));

        verify(entityMediaRepository).updateMediaField(eq("o-1"), eq(UploadEntityType.ORGANIZATION), eq("o-1"),
                eq("logoUrl"), anyString());
    }

    @Test
    void testImage_missingTenantRejectedBeforeStoring() {
        assertThrows(PermanentJobFailureException.class, () -> imageHandler().execute("7",
                Map.of("entityType", "case", "entityId", "case-of-other-tenant", "fileBase64", CONTENT_BASE64)));

        verify(assetStorage, never()).store(any(), any());
        verify(entityMediaRepository, never()).updateMediaField(any(), any(), any(), any(), any());
    }

    @Test
    void testImage_unknownEntityTypeRejectedBeforeStoring() {
        assertThrows(PermanentJobFailureException.class, () -> imageHandler().execute("1",
                Map.of("tenantId", "T1", "entityType", "zone", "entityId", "z-1", "fileBase64", CONTENT_BASE64)));

        verify(assetStorage, never()).store(any(), any());
    }

    @Test
    void testImage_invalidBase64IsPermanent() {
        assertThrows(PermanentJobFailureException.class, () -> imageHandler().execute("1",
                Map.of("tenantId", "T1", "entityType", "user", "entityId", "u-1", "fileBase64", "%%%not-base64%%%")));
    }

    @Test
    void testDocument_storedRawWithoutEntityUpdate() {
        DocumentUploadJobHandler handler = new DocumentUploadJobHandler();
        handler.assetStorage = assetStorage;

        StoredAssetType asset = handler.execute("5", Map.of("fileBase64", CONTENT_BASE64, "fileName", "acta final.pdf"));

        assertEquals("raw", asset.resourceType());
        assertEquals("abrazar/documents/document_acta_final.pdf_5", asset.publicId());
    }

    @Test
    void testDelete_defaultsToImageAndToleratesMissingAsset() {
        AssetDeletionJobHandler handler = new AssetDeletionJobHandler();
        handler.assetStorage = assetStorage;

        assertFalse(handler.execute("3", Map.of("publicId", "abrazar/users/user_u-1_2")));
        verify(assetStorage).delete("abrazar/users/user_u-1_2", "image");

        assertThrows(PermanentJobFailureException.class, () -> handler.execute("4", Map.of()));
    }
}
