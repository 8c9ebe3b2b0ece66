package foldrun.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import foldrun.coordinator.api.Controller;
import foldrun.coordinator.api.v1.dto.JobStatusResponse;
import foldrun.coordinator.api.v1.dto.SubmitJobRequest;
import foldrun.coordinator.api.v1.dto.SubmitJobResponse;
import foldrun.coordinator.model.ArtifactNotAvailableException;
import foldrun.coordinator.model.DispatchRejectedException;
import foldrun.coordinator.model.JobNotFoundException;
import foldrun.coordinator.model.StatusRecord;
import foldrun.coordinator.model.StatusUnreadableException;
import foldrun.coordinator.server.RouterHandler;
import foldrun.coordinator.service.JobService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for folding jobs (public API).
 *
 * POST /api/v1/jobs - Submit a job
 * GET /api/v1/jobs/{jobId} - Get job status
 * GET /api/v1/jobs/{jobId}/pdb - Download the structure
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs/?$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_PDB_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/pdb$");

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST) && JOBS_PATTERN.matcher(path).matches()) {
            return true;
        }
        if (method.equals(HttpMethod.GET)) {
            return JOB_BY_ID_PATTERN.matcher(path).matches() ||
                    JOB_PDB_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && JOBS_PATTERN.matcher(path).matches()) {
                return handleSubmit(req);
            }

            Matcher pdbMatcher = JOB_PDB_PATTERN.matcher(path);
            if (pdbMatcher.matches()) {
                return handleGetArtifact(pdbMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                return handleGetStatus(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JobNotFoundException | ArtifactNotAvailableException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (DispatchRejectedException e) {
            return ControllerResponse.unavailable(e.getMessage());
        } catch (StatusUnreadableException e) {
            log.error("Unreadable status record: {}", e.getMessage(), e);
            return ControllerResponse.error(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/jobs - Submit a job
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return ControllerResponse.badRequest("request body is required");
        }
        SubmitJobRequest request = RouterHandler.mapper().readValue(body, SubmitJobRequest.class);
        if (request == null) {
            return ControllerResponse.badRequest("request body is required");
        }

        String jobId = jobService.submit(
                request.jobId(),
                request.sequence(),
                request.directions(),
                request.params());

        return ControllerResponse.json(
                HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(SubmitJobResponse.queued(jobId)));
    }

    /**
     * GET /api/v1/jobs/{jobId} - Get job status
     */
    private ControllerResponse handleGetStatus(String jobId) throws JsonProcessingException {
        StatusRecord status = jobService.getStatus(jobId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobStatusResponse.from(status)));
    }

    /**
     * GET /api/v1/jobs/{jobId}/pdb - Download the structure
     */
    private ControllerResponse handleGetArtifact(String jobId) {
        byte[] artifact = jobService.getArtifact(jobId);
        return ControllerResponse.attachment(artifact, jobId + ".pdb");
    }
}
