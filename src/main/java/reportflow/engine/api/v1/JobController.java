package reportflow.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import reportflow.engine.api.Controller;
import reportflow.engine.api.RequestParams;
import reportflow.engine.api.v1.dto.CreateJobRequest;
import reportflow.engine.api.v1.dto.JobResponse;
import reportflow.engine.api.v1.dto.UpdateJobRequest;
import reportflow.engine.model.Job;
import reportflow.engine.scheduler.Scheduler;
import reportflow.engine.server.RouterHandler;
import reportflow.engine.service.JobService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for report job definitions (public API).
 *
 * POST /api/v1/jobs - Create a job
 * GET /api/v1/jobs - List jobs (offset, limit)
 * GET /api/v1/jobs/{jobId} - Get a job
 * PUT /api/v1/jobs/{jobId} - Partially update a job
 */
public class JobController implements Controller {

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs/?$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");

    private static final int DEFAULT_LIMIT = 100;

    private final JobService jobService;
    private final Scheduler scheduler;

    public JobController(JobService jobService, Scheduler scheduler) {
        this.jobService = jobService;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (JOB_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return req.method().equals(HttpMethod.POST) ? handleCreate(req) : handleList(req);
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (jobMatcher.matches()) {
            String jobId = jobMatcher.group(1);
            return req.method().equals(HttpMethod.PUT) ? handleUpdate(jobId, req) : handleGet(jobId);
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        CreateJobRequest request = RouterHandler.mapper().readValue(body(req), CreateJobRequest.class);

        Job job = jobService.createJob(
                request.name(),
                request.description(),
                request.query(),
                request.schedule(),
                request.outputFormat(),
                request.activeOrDefault());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(toResponse(job)));
    }

    /**
     * GET /api/v1/jobs
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        RequestParams params = RequestParams.of(req);
        int offset = params.intParam("offset", 0);
        int limit = params.intParam("limit", DEFAULT_LIMIT);

        List<JobResponse> jobs = jobService.listJobs(offset, limit).stream()
                .map(this::toResponse)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(jobs));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGet(String jobId) throws Exception {
        Job job = jobService.getJob(jobId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(toResponse(job)));
    }

    /**
     * PUT /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleUpdate(String jobId, FullHttpRequest req) throws Exception {
        UpdateJobRequest request = RouterHandler.mapper().readValue(body(req), UpdateJobRequest.class);
        Job job = jobService.updateJob(jobId, request.toChanges());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(toResponse(job)));
    }

    private JobResponse toResponse(Job job) {
        return JobResponse.from(job, scheduler.nextFireTime(job.id()).orElse(null));
    }

    private static String body(FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        return body;
    }
}
