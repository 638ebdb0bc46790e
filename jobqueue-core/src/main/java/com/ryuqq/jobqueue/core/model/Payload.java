package com.ryuqq.jobqueue.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Job의 업무 데이터 (JSON 값).
 *
 * <p>생성 시점에 객체 키를 정렬한 정규(canonical) 형태로 복사하여 보관하므로,
 * 같은 내용의 payload는 항상 같은 텍스트로 직렬화됩니다.
 * 이 텍스트는 HMAC 서명 입력이자 POST 요청 body로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 내부 JSON 트리는 외부로 노출하지 않으며, {@link #asJson()}은 복사본을 반환합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Payload payload = Payload.parse("{\"b\":2,\"a\":1}");
 * payload.toCanonicalText(); // {"a":1,"b":2}
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class Payload {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Payload EMPTY = new Payload(NullNode.getInstance());

    private final JsonNode value;
    private final String canonicalText;

    private Payload(JsonNode value) {
        this.value = canonicalize(value);
        this.canonicalText = write(this.value);
    }

    /**
     * JSON 트리로 Payload 생성.
     *
     * @param value JSON 값 (null이면 JSON null)
     * @return Payload 인스턴스
     */
    public static Payload of(JsonNode value) {
        return value == null ? EMPTY : new Payload(value);
    }

    /**
     * Map으로 Payload 생성.
     *
     * @param fields 필드 (값은 Jackson이 변환 가능한 타입)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException 변환할 수 없는 값이 포함된 경우
     */
    public static Payload of(Map<String, ?> fields) {
        if (fields == null) {
            return EMPTY;
        }
        return new Payload(MAPPER.valueToTree(fields));
    }

    /**
     * JSON 텍스트를 파싱하여 Payload 생성.
     *
     * @param json JSON 텍스트 (null 또는 빈 문자열이면 빈 Payload)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException JSON 형식이 아닌 경우
     */
    public static Payload parse(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        try {
            return new Payload(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 빈 Payload (JSON null).
     *
     * @return 빈 Payload
     */
    public static Payload empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return value.isNull() || value.isMissingNode();
    }

    /**
     * JSON 트리 복사본 조회.
     *
     * @return JSON 트리 (복사본)
     */
    public JsonNode asJson() {
        return value.deepCopy();
    }

    /**
     * 정규 텍스트 (키 정렬, 공백 없음).
     *
     * @return 정규 JSON 텍스트
     */
    public String toCanonicalText() {
        return canonicalText;
    }

    /**
     * 최상위 객체의 key/value를 이름 있는 텍스트 인자로 변환.
     *
     * <p>문자열 값은 따옴표 없이, JSON null은 null로, 그 외 값은 JSON 텍스트로 변환합니다.
     * FUNC Job의 함수 호출 인자로 사용됩니다.</p>
     *
     * @return 키 순서(정렬)를 유지하는 인자 맵, 빈 Payload이면 빈 맵
     * @throws IllegalStateException payload가 JSON 객체가 아닌 경우
     */
    public Map<String, String> namedArguments() {
        if (isEmpty()) {
            return Collections.emptyMap();
        }
        if (!value.isObject()) {
            throw new IllegalStateException("Payload must be a JSON object to be used as named arguments (type: "
                + value.getNodeType() + ")");
        }
        Map<String, String> arguments = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            String text;
            if (node.isNull()) {
                text = null;
            } else if (node.isTextual()) {
                text = node.textValue();
            } else {
                text = write(node);
            }
            arguments.put(field.getKey(), text);
        }
        return Collections.unmodifiableMap(arguments);
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> array.add(canonicalize(element)));
            return array;
        }
        return node.deepCopy();
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return canonicalText.equals(payload.canonicalText);
    }

    @Override
    public int hashCode() {
        return canonicalText.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + canonicalText.length() + " chars}";
    }
}
