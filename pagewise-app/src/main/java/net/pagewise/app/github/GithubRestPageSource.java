package net.pagewise.app.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.pagewise.core.error.SchemaMismatchException;
import net.pagewise.core.error.UnsupportedJobTypeException;
import net.pagewise.core.error.UpstreamHttpException;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.PageWindow;
import net.pagewise.core.model.RateLimitSnapshot;
import net.pagewise.core.model.RawPage;
import net.pagewise.core.model.UpstreamItem;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.UpstreamPageSource;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST 목록 API 를 페이지 단위로 읽는다.
 * <ul>
 *   <li>targetId = "owner/repo", cursor = 지금까지 읽은 아이템 수 (null 이면 0). page/per_page 는 {@link PageWindow}</li>
 *   <li>다음 페이지 여부는 Link 헤더 rel="next", 전체 건수는 rel="last" 로 추정</li>
 *   <li>quota 는 X-RateLimit-* 헤더</li>
 * </ul>
 */
public class GithubRestPageSource implements UpstreamPageSource {

    static final String SOURCE = "github-rest";

    private static final Pattern LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"([a-z]+)\"");
    private static final Pattern PAGE_PARAM = Pattern.compile("[?&]page=(\\d+)");

    private final RestClient client;
    private final ObjectMapper mapper;
    private final Clock clock;

    public GithubRestPageSource(RestClient client, ObjectMapper mapper, Clock clock) {
        this.client = client;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public RawPage fetchPage(JobType jobType, String targetId, String cursor, int pageSize) throws Exception {
        String path = pathFor(jobType);
        String[] repo = splitRepo(targetId);
        PageWindow window = PageWindow.at(cursor, pageSize);

        Response res = client.get()
                .uri(b -> b.path(path)
                        .queryParam("state", "all")
                        .queryParam("per_page", window.perPage())
                        .queryParam("page", window.page())
                        .build(repo[0], repo[1]))
                .exchange((req, r) -> new Response(r.getStatusCode().value(), r.getHeaders(), r.bodyTo(String.class)));

        RateLimitSnapshot rl = rateLimit(res.headers());
        if (res.status() < 200 || res.status() >= 300) {
            throw new UpstreamHttpException(res.status(), errorMessage(res.body()),
                    rl == null ? null : rl.remaining(), resetAt(res.headers(), rl));
        }

        List<UpstreamItem> items = parseItems(res.body(), jobType, targetId);
        Map<String, Integer> links = links(res.headers().getFirst(HttpHeaders.LINK));

        Integer next = links.get("next");
        Integer last = links.get("last");
        if (next != null && items.isEmpty()) {
            throw new SchemaMismatchException("empty " + jobType.code() + " page with rel=next for " + targetId);
        }
        Long total;
        if (next == null) {
            total = window.offset() + items.size();
        } else if (last != null) {
            total = window.estimateTotal(last); // 마지막 페이지가 덜 찼을 수 있으니 상한 추정
        } else {
            total = null;
        }

        return new RawPage(items, next == null ? null : window.cursorAfter(items.size()), next != null, total, rl);
    }

    static String pathFor(JobType jobType) throws UnsupportedJobTypeException {
        return switch (jobType) {
            case PR_SYNC -> "/repos/{owner}/{repo}/pulls";
            case ISSUE_SYNC -> "/repos/{owner}/{repo}/issues";
            case REVIEW_SYNC -> "/repos/{owner}/{repo}/pulls/comments";
            case COMMENT_SYNC -> "/repos/{owner}/{repo}/issues/comments";
            case EMBEDDING_COMPUTE -> throw new UnsupportedJobTypeException(jobType, SOURCE);
        };
    }

    static String[] splitRepo(String targetId) {
        String[] parts = targetId == null ? new String[0] : targetId.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("invalid repository format: " + targetId);
        }
        return parts;
    }

    /** rel → page 번호 */
    static Map<String, Integer> links(String header) {
        Map<String, Integer> out = new HashMap<>();
        if (header == null) return out;
        Matcher m = LINK.matcher(header);
        while (m.find()) {
            Matcher p = PAGE_PARAM.matcher(m.group(1));
            if (p.find()) out.put(m.group(2), Integer.parseInt(p.group(1)));
        }
        return out;
    }

    private List<UpstreamItem> parseItems(String body, JobType jobType, String targetId) throws SchemaMismatchException {
        JsonNode root;
        try {
            root = body == null ? null : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SchemaMismatchException("unreadable " + jobType.code() + " page for " + targetId, e);
        }
        if (root == null || !root.isArray()) {
            throw new SchemaMismatchException("expected a JSON array for " + jobType.code() + " " + targetId);
        }

        List<UpstreamItem> items = new ArrayList<>(root.size());
        for (JsonNode n : root) {
            JsonNode id = n.get("id");
            if (id == null || id.isNull()) {
                throw new SchemaMismatchException(jobType.code() + " item without id in " + targetId);
            }
            items.add(new UpstreamItem(id.asText(), n.toString()));
        }
        return items;
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) return "(no body)";
        try {
            JsonNode n = mapper.readTree(body);
            if (n != null && n.hasNonNull("message")) return n.get("message").asText();
        } catch (JsonProcessingException ignored) {
            // JSON 이 아니면 본문 그대로
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    static RateLimitSnapshot rateLimit(HttpHeaders h) {
        Long remaining = longHeader(h, "X-RateLimit-Remaining");
        if (remaining == null) return null;
        Long limit = longHeader(h, "X-RateLimit-Limit");
        Long reset = longHeader(h, "X-RateLimit-Reset");
        return new RateLimitSnapshot(remaining.intValue(), limit == null ? 0 : limit.intValue(),
                reset == null ? null : Instant.ofEpochSecond(reset));
    }

    // secondary limit 은 X-RateLimit-Reset 없이 Retry-After 만 준다
    private Instant resetAt(HttpHeaders h, RateLimitSnapshot rl) {
        if (rl != null && rl.resetAt() != null) return rl.resetAt();
        Long retryAfter = longHeader(h, HttpHeaders.RETRY_AFTER);
        return retryAfter == null ? null : clock.now().plusSeconds(retryAfter);
    }

    private static Long longHeader(HttpHeaders h, String name) {
        String v = h.getFirst(name);
        if (v == null || v.isBlank()) return null;
        try {
            return Long.valueOf(v.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private record Response(int status, HttpHeaders headers, String body) {}
}
