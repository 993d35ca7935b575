package abrazar.casework.jobs;

import java.util.Map;
import java.util.Set;

/**
 * Contract for async job handler implementations.
 *
 * <p>
 * Handlers are CDI-managed beans annotated with {@code @ApplicationScoped}. At startup the
 * {@link abrazar.casework.services.WorkerSupervisor} discovers them and builds one dispatch table per queue, keyed by
 * {@link JobType#getKey()}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers run on the worker pool threads of their queue, up to the queue's concurrency at once</li>
 * <li>Delivery is at-least-once: a handler may see the same payload again after a crash or a retry, so every handler
 * must be idempotent</li>
 * <li>Each execution is wrapped in a {@code job.execute} OpenTelemetry span and carries job MDC fields</li>
 * <li>A per-queue deadline interrupts handlers that run too long; the attempt then counts as a transient failure</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class PushNotificationJobHandler implements JobHandler {
 *     @Override
 *     public Set<JobType> handlesTypes() {
 *         return EnumSet.of(JobType.SEND_PUSH);
 *     }
 *
 *     @Override
 *     public Object execute(String jobId, Map<String, Object> payload) {
 *         String userId = JobPayloads.requireString(payload, "userId");
 *         // deliver...
 *         return null;
 *     }
 * }
 * }</pre>
 *
 * @see abrazar.casework.services.WorkerSupervisor for dispatch table construction
 * @see WorkerPool for execution
 */
public interface JobHandler {

    /**
     * Returns the job types this handler processes. All of them must belong to the same queue.
     */
    Set<JobType> handlesTypes();

    /**
     * Executes the job with the given payload.
     *
     * <p>
     * <b>Thread Safety:</b> This method may be called concurrently by multiple worker threads.
     *
     * <p>
     * <b>Error Handling:</b> A thrown {@link abrazar.casework.exceptions.PermanentJobFailureException} fails the job
     * immediately. Any other exception schedules a retry with backoff until the job's attempts are exhausted.
     *
     * @param jobId
     *            broker-assigned job id
     * @param payload
     *            deserialized job parameters
     * @return a result that is logged on completion, or null
     * @throws Exception
     *             any error during execution
     */
    Object execute(String jobId, Map<String, Object> payload) throws Exception;
}
