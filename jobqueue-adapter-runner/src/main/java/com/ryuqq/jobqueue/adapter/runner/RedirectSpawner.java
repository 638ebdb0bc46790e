package com.ryuqq.jobqueue.adapter.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobType;
import com.ryuqq.jobqueue.core.model.Payload;
import com.ryuqq.jobqueue.core.model.ResponseSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * redirect 응답으로부터 파생 Job 1건 생성.
 *
 * <p>응답 본문은 다음 필드를 가진 JSON 객체입니다 (모두 선택):</p>
 * <pre>
 * {
 *   "job_type":    "POST",                  // 기본: 부모 Job 타입
 *   "url":         "https://next.example",  // 기본: Location 헤더
 *   "payload":     { ... },                 // 기본: 부모 payload
 *   "headers":     { "X-Trace": "abc" },    // 기본: 부모 헤더 (서명 헤더 제외)
 *   "retry_limit": 5                        // 기본: 부모 retry_limit
 * }
 * </pre>
 *
 * <p>owner, 인증, 서명 설정은 부모로부터 상속하며, 생성 시 새로 서명됩니다.
 * 파생 Job을 만들 수 없는 응답이어도 부모 Job은 REDIRECTED로 완료되며, 경고 로그만 남깁니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class RedirectSpawner {

    private static final Logger log = LoggerFactory.getLogger(RedirectSpawner.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JobSubmitter submitter;

    public RedirectSpawner(JobSubmitter submitter) {
        if (submitter == null) {
            throw new IllegalArgumentException("submitter cannot be null");
        }
        this.submitter = submitter;
    }

    /**
     * 파생 Job 생성.
     *
     * @param parent REDIRECTED로 완료된 부모 Job
     * @param response redirect 응답
     * @return 생성된 Job, 생성할 수 없으면 empty
     */
    public Optional<Job> spawn(Job parent, ResponseSnapshot response) {
        try {
            JobSpec spec = toSpec(parent, response);
            Job spawned = submitter.submit(spec, "redirect:" + parent.id().asText());
            log.info("Job {} redirected to new job {} ({})", parent.id(), spawned.id(), spawned.target());
            return Optional.of(spawned);
        } catch (IllegalArgumentException e) {
            log.warn("Job {} redirected but no job could be spawned: {}", parent.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private JobSpec toSpec(Job parent, ResponseSnapshot response) {
        JsonNode body = parseBody(response.content());

        JobType jobType = parent.jobType();
        if (body.hasNonNull("job_type")) {
            jobType = JobType.valueOf(body.get("job_type").asText().trim().toUpperCase(Locale.ROOT));
        }

        String target = body.hasNonNull("url")
            ? body.get("url").asText()
            : header(response, "Location").orElse(null);

        Payload payload = body.has("payload") ? Payload.of(body.get("payload")) : parent.payload();

        Map<String, String> headers = body.has("headers")
            ? toHeaders(body.get("headers"))
            : withoutSignature(parent);

        int retryLimit = body.hasNonNull("retry_limit")
            ? body.get("retry_limit").asInt(parent.retryLimit())
            : parent.retryLimit();

        return JobSpec.builder(jobType)
            .owner(parent.owner())
            .target(target)
            .payload(payload)
            .headers(headers)
            .auth(parent.auth())
            .signing(parent.signing())
            .retryLimit(retryLimit)
            .build();
    }

    private static JsonNode parseBody(String content) {
        if (content == null || content.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            JsonNode node = MAPPER.readTree(content);
            return node != null && node.isObject() ? node : MAPPER.createObjectNode();
        } catch (JsonProcessingException e) {
            log.debug("Redirect body is not JSON, falling back to Location header: {}", e.getOriginalMessage());
            return MAPPER.createObjectNode();
        }
    }

    private static Map<String, String> toHeaders(JsonNode node) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return headers;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            headers.put(field.getKey(), field.getValue().asText());
        }
        return headers;
    }

    private static Map<String, String> withoutSignature(Job parent) {
        Map<String, String> headers = new LinkedHashMap<>(parent.headers());
        if (parent.signing().isEnabled()) {
            headers.keySet().removeIf(name -> name.equalsIgnoreCase(parent.signing().headerName()));
        }
        return headers;
    }

    private static Optional<String> header(ResponseSnapshot response, String name) {
        return response.headers().entrySet().stream()
            .filter(entry -> entry.getKey().equalsIgnoreCase(name))
            .map(Map.Entry::getValue)
            .findFirst();
    }
}
