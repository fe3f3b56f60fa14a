package reportflow.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import reportflow.engine.api.Controller;
import reportflow.engine.api.RequestParams;
import reportflow.engine.api.v1.dto.RunResponse;
import reportflow.engine.model.OutputFormat;
import reportflow.engine.model.Run;
import reportflow.engine.server.RouterHandler;
import reportflow.engine.service.RunService;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for runs (public API).
 *
 * POST /api/v1/jobs/{jobId}/run - Run a job now; blocks until the run is terminal
 * GET /api/v1/jobs/{jobId}/runs - Run history, newest first (offset, limit)
 * GET /api/v1/runs/{runId} - Get a run
 * GET /api/v1/runs/{runId}/download - Download the run's artifact
 */
public class RunController implements Controller {

    private static final Pattern MANUAL_RUN_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/run$");
    private static final Pattern JOB_RUNS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/runs$");
    private static final Pattern RUN_BY_ID_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)$");
    private static final Pattern DOWNLOAD_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/download$");

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return MANUAL_RUN_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOB_RUNS_PATTERN.matcher(path).matches()
                    || RUN_BY_ID_PATTERN.matcher(path).matches()
                    || DOWNLOAD_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher m = MANUAL_RUN_PATTERN.matcher(path);
        if (req.method().equals(HttpMethod.POST) && m.matches()) {
            Run run = runService.manualRun(m.group(1));
            return ControllerResponse.json(HttpResponseStatus.CREATED,
                    RouterHandler.mapper().writeValueAsString(RunResponse.from(run)));
        }

        m = JOB_RUNS_PATTERN.matcher(path);
        if (m.matches()) {
            return handleHistory(m.group(1), req);
        }

        m = DOWNLOAD_PATTERN.matcher(path);
        if (m.matches()) {
            return handleDownload(m.group(1));
        }

        m = RUN_BY_ID_PATTERN.matcher(path);
        if (m.matches()) {
            Run run = runService.getRun(m.group(1));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(RunResponse.from(run)));
        }

        return ControllerResponse.notFound("unknown run endpoint");
    }

    private ControllerResponse handleHistory(String jobId, FullHttpRequest req) throws Exception {
        RequestParams params = RequestParams.of(req);
        int offset = params.intParam("offset", 0);
        int limit = params.intParam("limit", RunService.DEFAULT_LIMIT);

        List<RunResponse> runs = runService.listRuns(jobId, offset, limit).stream()
                .map(RunResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(runs));
    }

    private ControllerResponse handleDownload(String runId) throws Exception {
        Path artifact = runService.fetchArtifact(runId);
        String fileName = artifact.getFileName().toString();
        return ControllerResponse.file(contentType(fileName), Files.readAllBytes(artifact), fileName);
    }

    private static String contentType(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (OutputFormat format : OutputFormat.values()) {
            if (lower.endsWith("." + format.extension())) {
                return format.contentType();
            }
        }
        return "application/octet-stream";
    }
}
