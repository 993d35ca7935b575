package abrazar.casework.jobs;

import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.services.StatisticsService;
import abrazar.casework.services.StatsView;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Recomputes one cached statistics view of one tenant.
 *
 * <p>
 * <b>Payload:</b> {@code {tenantId, type}} where {@code type} is a recomputable {@link StatsView} key (default
 * {@code overview}). The result is written to {@code stats:{tenantId}:{type}} with the view's TTL. Running the job
 * twice only refreshes the same key.
 */
@ApplicationScoped
public class StatsRecomputeJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(StatsRecomputeJobHandler.class);

    @Inject
    StatisticsService statisticsService;

    @Override
    public Set<JobType> handlesTypes() {
        return EnumSet.of(JobType.RECALCULATE_STATS);
    }

    @Override
    public Object execute(String jobId, Map<String, Object> payload) {
        String tenantId = JobPayloads.requireString(payload, QueuedJob.TENANT_ID);
        String viewKey = JobPayloads.optionalString(payload, "type").orElse(StatsView.OVERVIEW.getKey());

        StatsView view = StatsView.fromKey(viewKey).filter(StatsView::isRecomputable)
                .orElseThrow(() -> new PermanentJobFailureException("Unsupported stats type: " + viewKey));

        LOG.infof("Recomputing %s stats for tenant %s (job %s)", view.getKey(), tenantId, jobId);
        return statisticsService.recompute(tenantId, view);
    }
}
