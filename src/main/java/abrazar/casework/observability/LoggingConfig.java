package abrazar.casework.observability;

import abrazar.casework.jobs.QueuedJob;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for job execution logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier of the {@code job.execute} span</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code job_id} - broker-assigned job id</li>
 * <li>{@code job_queue} - queue wire name ({@code recompute-stats}, ...)</li>
 * <li>{@code job_type} - dispatch key ({@code recalculate-stats}, ...)</li>
 * <li>{@code tenant_id} - tenant the job is scoped to, absent for tenant-independent jobs</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Worker Pools:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobContext(job);
 * try {
 *     handler.execute(job.id(), job.payload());
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Worker threads are pooled,
 * so every job execution must clear MDC when it finishes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_JOB_QUEUE = "job_queue";

    public static final String MDC_JOB_TYPE = "job_type";

    /**
     * Tenant (organization) id from the job payload. Only present for tenant-scoped jobs.
     */
    public static final String MDC_TENANT_ID = "tenant_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are used when no span
     * is active to keep a consistent log structure.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets job id, queue, type and (when present) tenant id.
     */
    public static void setJobContext(QueuedJob job) {
        MDC.put(MDC_JOB_ID, job.id());
        MDC.put(MDC_JOB_QUEUE, job.queueName().getKey());
        MDC.put(MDC_JOB_TYPE, job.jobType());
        setTenantId(job.tenantId());
    }

    public static void setTenantId(String tenantId) {
        if (tenantId != null) {
            MDC.put(MDC_TENANT_ID, tenantId);
        }
    }

    /**
     * Clears all job-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_QUEUE);
        MDC.remove(MDC_JOB_TYPE);
        MDC.remove(MDC_TENANT_ID);
    }
}
