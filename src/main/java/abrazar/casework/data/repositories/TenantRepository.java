package abrazar.casework.data.repositories;

import java.util.List;

/**
 * Read access to tenants (organizations). Implemented by the host application's persistence layer.
 */
public interface TenantRepository {

    /**
     * Returns the ids of all tenants whose statistics should be kept warm.
     */
    List<String> findActiveTenantIds();
}
