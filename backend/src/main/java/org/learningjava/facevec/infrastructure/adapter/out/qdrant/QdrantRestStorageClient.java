package org.learningjava.facevec.infrastructure.adapter.out.qdrant;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.learningjava.facevec.application.port.StorageClientPort;
import org.learningjava.facevec.domain.error.StoreOperationException;
import org.learningjava.facevec.domain.model.DistanceMetric;
import org.learningjava.facevec.domain.model.PointFilter;
import org.learningjava.facevec.domain.model.ScoredPoint;
import org.learningjava.facevec.domain.model.VectorPoint;
import org.learningjava.facevec.domain.options.VectorStoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Qdrant REST client covering the calls the vector store needs:
 * list/create collection, upsert, filtered search and retrieve by id.
 */
public class QdrantRestStorageClient implements StorageClientPort {

    private static final Logger log = LoggerFactory.getLogger(QdrantRestStorageClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    private final HttpUrl baseUrl;   // e.g. http://localhost:6333
    private final String apiKey;     // optional

    public QdrantRestStorageClient(VectorStoreOptions options) {
        this(options, new OkHttpClient.Builder()
                .connectTimeout(options.timeout())
                .readTimeout(options.timeout())
                .writeTimeout(options.timeout())
                .build());
    }

    public QdrantRestStorageClient(VectorStoreOptions options, OkHttpClient http) {
        this.baseUrl = HttpUrl.get(options.endpoint().toString());
        this.apiKey = options.apiKey();
        this.http = http;
    }

    // ---------- PORT IMPLEMENTATION ----------

    @Override
    public Set<String> listCollections() {
        JsonNode resp = request("GET", url("collections"), null);
        Set<String> names = new LinkedHashSet<>();
        JsonNode arr = resp.path("result").path("collections");
        if (arr.isArray()) {
            arr.forEach(c -> names.add(c.path("name").asText()));
        }
        return names;
    }

    @Override
    public void createCollection(String name, int vectorSize, DistanceMetric distance) {
        ObjectNode vectors = om.createObjectNode()
                .put("size", vectorSize)
                .put("distance", distance.wireName());
        ObjectNode body = om.createObjectNode();
        body.set("vectors", vectors);
        request("PUT", url("collections", name), body);
        log.info("Qdrant collection '{}' created (size={}, distance={})", name, vectorSize, distance.wireName());
    }

    @Override
    public void upsertPoints(String collectionName, List<VectorPoint> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        ArrayNode arr = om.createArrayNode();
        for (VectorPoint p : points) {
            ObjectNode obj = om.createObjectNode();
            obj.put("id", p.id());
            obj.set("vector", floatArray(p.vector()));
            obj.set("payload", om.valueToTree(p.payload()));
            arr.add(obj);
        }
        ObjectNode body = om.createObjectNode();
        body.set("points", arr);

        HttpUrl target = url("collections", collectionName, "points").newBuilder()
                .addQueryParameter("wait", "true")
                .build();
        request("PUT", target, body);
    }

    @Override
    public List<ScoredPoint> searchPoints(String collectionName, float[] vector, PointFilter filter,
                                          int limit, boolean withPayload, boolean withVectors) {
        ObjectNode body = om.createObjectNode();
        body.set("vector", floatArray(vector));
        body.put("limit", limit);
        body.put("with_payload", withPayload);
        body.put("with_vector", withVectors);
        if (filter != null && !filter.must().isEmpty()) {
            body.set("filter", filterNode(filter));
        }

        JsonNode resp = request("POST", url("collections", collectionName, "points", "search"), body);
        List<ScoredPoint> out = new ArrayList<>();
        JsonNode arr = resp.path("result");
        if (arr.isArray()) {
            for (JsonNode n : arr) {
                out.add(new ScoredPoint(readPoint(n), (float) n.path("score").asDouble()));
            }
        }
        return out;
    }

    @Override
    public List<VectorPoint> retrievePoints(String collectionName, List<String> ids,
                                            boolean withPayload, boolean withVectors) {
        ObjectNode body = om.createObjectNode();
        ArrayNode idArr = body.putArray("ids");
        ids.forEach(idArr::add);
        body.put("with_payload", withPayload);
        body.put("with_vector", withVectors);

        JsonNode resp = request("POST", url("collections", collectionName, "points"), body);
        List<VectorPoint> out = new ArrayList<>();
        JsonNode arr = resp.path("result");
        if (arr.isArray()) {
            arr.forEach(n -> out.add(readPoint(n)));
        }
        return out;
    }

    // ---------- INTERNALS ----------

    private ObjectNode filterNode(PointFilter filter) {
        ArrayNode must = om.createArrayNode();
        for (PointFilter.FieldMatch m : filter.must()) {
            ObjectNode cond = om.createObjectNode();
            cond.put("key", m.key());
            ObjectNode match = om.createObjectNode();
            match.set("value", om.valueToTree(m.value()));
            cond.set("match", match);
            must.add(cond);
        }
        ObjectNode node = om.createObjectNode();
        node.set("must", must);
        return node;
    }

    private VectorPoint readPoint(JsonNode n) {
        Map<String, Object> payload = n.hasNonNull("payload")
                ? om.convertValue(n.get("payload"), PAYLOAD_TYPE)
                : Map.of();
        return new VectorPoint(n.path("id").asText(), readVector(n.path("vector")), payload);
    }

    private float[] readVector(JsonNode node) {
        JsonNode arr = node;
        // named vectors come back as an object; take the first one
        if (node.isObject() && node.size() > 0) {
            arr = node.elements().next();
        }
        if (!arr.isArray()) {
            return new float[0];
        }
        float[] v = new float[arr.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = (float) arr.get(i).asDouble();
        }
        return v;
    }

    private ArrayNode floatArray(float[] v) {
        ArrayNode a = om.createArrayNode();
        for (float f : v) a.add(f);
        return a;
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder b = baseUrl.newBuilder();
        for (String s : segments) {
            b.addPathSegment(s);
        }
        return b.build();
    }

    private JsonNode request(String method, HttpUrl target, Object body) {
        try {
            Request.Builder b = new Request.Builder().url(target);
            if (apiKey != null && !apiKey.isBlank()) {
                b.addHeader("api-key", apiKey);
            }
            if (body != null) {
                byte[] json = om.writeValueAsBytes(body);
                b.method(method, RequestBody.create(json, JSON));
            } else {
                b.method(method, null);
            }

            try (Response resp = http.newCall(b.build()).execute()) {
                String respBody = resp.body() != null ? resp.body().string() : "";
                if (!resp.isSuccessful()) {
                    throw new StoreOperationException("Qdrant " + method + " " + target.encodedPath()
                            + " failed: " + resp.code() + " body=" + respBody);
                }
                return respBody.isEmpty() ? om.createObjectNode() : om.readTree(respBody);
            }
        } catch (IOException e) {
            throw new StoreOperationException("Qdrant " + method + " " + target.encodedPath()
                    + " failed: " + e.getMessage(), e);
        }
    }
}
