package org.learningjava.carbonengine.infrastructure.adapter.out.weaviate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.carbonengine.application.port.FactorStorePort;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.GhgBreakdown;
import org.learningjava.carbonengine.domain.model.factor.MatchCandidate;
import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.learningjava.carbonengine.domain.service.matching.Similarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Factor store on a Weaviate class with externally supplied vectors.
 * Similarity is Weaviate's {@code certainty}.
 */
public class WeaviateFactorStoreAdapter implements FactorStorePort {

    private static final Logger log = LoggerFactory.getLogger(WeaviateFactorStoreAdapter.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final String SCHEMA_RESOURCE = "weaviate.factor.schema.json";
    // candidates pulled for local term scoring
    private static final int TERM_CANDIDATES = 200;

    private static final String FIELDS = """
            factorId
            activity
            fuel
            region
            source
            unit
            value
            scope
            description
            co2
            ch4
            n2o""";

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    private final String baseUrl;     // e.g. http://localhost:8080
    private final String apiKey;      // optional
    private final String className;   // e.g. "EmissionFactor"

    public WeaviateFactorStoreAdapter(String baseUrl, String apiKey, String className) {
        this(baseUrl, apiKey, className, new OkHttpClient());
    }

    WeaviateFactorStoreAdapter(String baseUrl, String apiKey, String className, OkHttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.className = className;
        this.http = http;
    }

    // ---------- PORT IMPLEMENTATION ----------

    @Override
    public void ensureSchema() {
        JsonNode desired = loadDesiredClassFromClasspath(SCHEMA_RESOURCE, className);
        JsonNode live = getClassIfExists(className);
        if (live == null) {
            log.warn("Weaviate class '{}' missing → creating", className);
            request("POST", "/v1/schema", desired);
            return;
        }
        if (!normalizeClass(desired).equals(normalizeClass(live))) {
            log.warn("Weaviate class '{}' differs → dropping & recreating", className);
            request("DELETE", "/v1/schema/" + className, null);
            request("POST", "/v1/schema", desired);
        } else {
            log.info("Weaviate class '{}' is up to date", className);
        }
    }

    @Override
    public void upsertFactors(List<EmissionFactorRecord> factors, List<float[]> vectors) {
        if (factors == null || factors.isEmpty()) {
            log.info("No emission factors to upsert, skipping batch");
            return;
        }
        if (vectors == null || factors.size() != vectors.size()) {
            throw new IllegalArgumentException("factors and vectors must have same size");
        }

        ArrayNode objects = om.createArrayNode();
        for (int i = 0; i < factors.size(); i++) {
            EmissionFactorRecord f = factors.get(i);

            ObjectNode obj = om.createObjectNode();
            obj.put("class", className);
            // deterministic id, so re-ingesting replaces rows
            obj.put("id", UUID.nameUUIDFromBytes(f.id().getBytes(StandardCharsets.UTF_8)).toString());
            float[] v = vectors.get(i);
            boolean embedded = v != null && v.length > 0;
            obj.set("properties", toProperties(f).put("embedded", embedded));
            if (embedded) obj.set("vector", floatArray(v));
            objects.add(obj);
        }

        ObjectNode body = om.createObjectNode();
        body.set("objects", objects);
        request("POST", "/v1/batch/objects", body);
        log.info("Upserted {} emission factors into Weaviate class {}", factors.size(), className);
    }

    @Override
    public List<MatchCandidate> nearestByVector(float[] queryVec, double minSimilarity, int maxResults) {
        if (maxResults <= 0) return List.of();
        String gql = """
                {
                  Get {
                    %s(
                      nearVector: { vector: %s, certainty: %s },
                      limit: %d
                    ) {
                      %s
                      _additional { certainty }
                    }
                  }
                }""".formatted(className, toJsonArray(queryVec), Double.toString(minSimilarity), maxResults, FIELDS);

        List<MatchCandidate> out = new ArrayList<>();
        for (JsonNode n : query(gql)) {
            double certainty = n.path("_additional").path("certainty").asDouble(0.0);
            if (certainty >= minSimilarity) out.add(new MatchCandidate(fromNode(n), certainty));
        }
        out.sort(Comparator.comparingDouble(MatchCandidate::similarity).reversed());
        return List.copyOf(out);
    }

    @Override
    public List<MatchCandidate> searchByTerms(List<String> terms, double minSimilarity, int maxResults) {
        if (terms == null || terms.isEmpty() || maxResults <= 0) return List.of();
        return scoreTerms(termQuery(likeFilter(terms)), terms, minSimilarity, maxResults);
    }

    @Override
    public List<MatchCandidate> searchUnembeddedByTerms(List<String> terms, double minSimilarity, int maxResults) {
        if (terms == null || terms.isEmpty() || maxResults <= 0) return List.of();
        String where = "{ operator: And, operands: [{ path: [\"embedded\"], operator: Equal, valueBoolean: false }, %s] }"
                .formatted(likeFilter(terms));
        return scoreTerms(termQuery(where), terms, minSimilarity, maxResults);
    }

    @Override
    public int count() {
        String gql = "{ Aggregate { %s { meta { count } } } }".formatted(className);
        JsonNode resp = request("POST", "/v1/graphql", om.createObjectNode().put("query", gql));
        JsonNode arr = resp.path("data").path("Aggregate").path(className);
        return arr.isArray() && arr.size() > 0 ? arr.get(0).path("meta").path("count").asInt(0) : 0;
    }

    // ---------- INTERNALS ----------

    private String termQuery(String where) {
        return """
                {
                  Get {
                    %s(
                      where: %s,
                      limit: %d
                    ) {
                      %s
                    }
                  }
                }""".formatted(className, where, TERM_CANDIDATES, FIELDS);
    }

    // Weaviate only filters; similarity is the same local term score the in-memory store uses
    private List<MatchCandidate> scoreTerms(String gql, List<String> terms, double minSimilarity, int maxResults) {
        List<MatchCandidate> out = new ArrayList<>();
        for (JsonNode n : query(gql)) {
            EmissionFactorRecord f = fromNode(n);
            double s = Similarity.termScore(f, terms);
            if (s >= minSimilarity) out.add(new MatchCandidate(f, s));
        }
        out.sort(Comparator.comparingDouble(MatchCandidate::similarity).reversed());
        return List.copyOf(out.subList(0, Math.min(maxResults, out.size())));
    }

    private JsonNode query(String gql) {
        JsonNode resp = request("POST", "/v1/graphql", om.createObjectNode().put("query", gql));
        if (resp.has("errors") && resp.get("errors").size() > 0) {
            throw new BackendUnavailableException("Weaviate query failed: " + resp.get("errors"));
        }
        JsonNode arr = resp.path("data").path("Get").path(className);
        return arr.isArray() ? arr : om.createArrayNode();
    }

    String likeFilter(List<String> terms) {
        List<String> operands = new ArrayList<>();
        for (String t : terms) {
            String v = t.replace("\\", "").replace("\"", "");
            if (v.isBlank()) continue;
            for (String path : List.of("activity", "fuel", "description")) {
                operands.add("{ path: [\"%s\"], operator: Like, valueText: \"*%s*\" }".formatted(path, v));
            }
        }
        return "{ operator: Or, operands: [" + String.join(", ", operands) + "] }";
    }

    private ObjectNode toProperties(EmissionFactorRecord f) {
        ObjectNode p = om.createObjectNode();
        p.put("factorId", f.id());
        p.put("activity", orEmpty(f.activity()));
        p.put("fuel", orEmpty(f.fuel()));
        p.put("region", orEmpty(f.region()));
        p.put("source", orEmpty(f.source()));
        p.put("unit", orEmpty(f.unit()));
        p.put("value", f.value());
        p.put("scope", f.scope() == null ? "" : f.scope().label());
        p.put("description", orEmpty(f.description()));
        GhgBreakdown g = f.ghgBreakdown();
        if (g != null) {
            if (g.co2() != null) p.put("co2", g.co2());
            if (g.ch4() != null) p.put("ch4", g.ch4());
            if (g.n2o() != null) p.put("n2o", g.n2o());
        }
        return p;
    }

    EmissionFactorRecord fromNode(JsonNode n) {
        GhgBreakdown g = new GhgBreakdown(num(n, "co2"), num(n, "ch4"), num(n, "n2o"));
        return new EmissionFactorRecord(
                n.path("factorId").asText(),
                blankToNull(n.path("activity").asText(null)),
                blankToNull(n.path("fuel").asText(null)),
                blankToNull(n.path("region").asText(null)),
                blankToNull(n.path("source").asText(null)),
                n.path("unit").asText(""),
                n.path("value").asDouble(0.0),
                Scope.parse(n.path("scope").asText(null)),
                g.isEmpty() ? null : g,
                blankToNull(n.path("description").asText(null))
        );
    }

    private static Double num(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v != null && v.isNumber() ? v.asDouble() : null;
    }

    private ArrayNode floatArray(float[] v) {
        ArrayNode a = om.createArrayNode();
        for (float f : v) a.add(f);
        return a;
    }

    private String toJsonArray(float[] v) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < v.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(Double.toString(v[i]));
        }
        sb.append(']');
        return sb.toString();
    }

    private JsonNode getClassIfExists(String cname) {
        try {
            return request("GET", "/v1/schema/" + cname, null);
        } catch (BackendUnavailableException re) {
            var c = re.getCause();
            if (c instanceof IOException && c.getMessage() != null && c.getMessage().contains(" 404 ")) {
                return null;
            }
            throw re;
        }
    }

    private JsonNode loadDesiredClassFromClasspath(String resource, String expectedClassName) {
        try (var in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("Schema resource not found: " + resource);
            JsonNode root = om.readTree(in);
            if (root.has("classes") && root.get("classes").isArray()) {
                for (JsonNode c : root.get("classes")) {
                    if (expectedClassName.equals(c.path("class").asText())) return c;
                }
            } else if (expectedClassName.equals(root.path("class").asText())) {
                return root;
            }
            throw new IllegalStateException("Class '" + expectedClassName + "' not found in " + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + resource, e);
        }
    }

    private ObjectNode normalizeClass(JsonNode c) {
        ObjectNode out = om.createObjectNode();
        out.put("class", c.path("class").asText());
        out.put("vectorizer", c.path("vectorizer").asText("none"));

        Map<String, List<String>> props = new TreeMap<>();
        JsonNode arr = c.path("properties");
        if (arr.isArray()) {
            for (JsonNode p : arr) {
                List<String> types = new ArrayList<>();
                JsonNode dt = p.path("dataType");
                if (dt.isArray()) for (JsonNode t : dt) types.add(t.asText());
                props.put(p.path("name").asText(), types);
            }
        }
        ArrayNode propsArr = om.createArrayNode();
        for (var e : props.entrySet()) {
            ObjectNode pn = om.createObjectNode();
            pn.put("name", e.getKey());
            ArrayNode dts = om.createArrayNode();
            e.getValue().forEach(dts::add);
            pn.set("dataType", dts);
            propsArr.add(pn);
        }
        out.set("properties", propsArr);
        return out;
    }

    private JsonNode request(String method, String path, Object body) {
        try {
            Request.Builder b = new Request.Builder().url(baseUrl + path);
            if (apiKey != null && !apiKey.isBlank()) {
                b.addHeader("Authorization", "Bearer " + apiKey);
            }
            if (body != null) {
                b.method(method, RequestBody.create(om.writeValueAsBytes(body), JSON));
            } else {
                b.method(method, null);
            }

            try (Response resp = http.newCall(b.build()).execute()) {
                String respBody = resp.body() != null ? resp.body().string() : "";
                if (!resp.isSuccessful()) {
                    throw new IOException("Weaviate " + method + " " + path + " failed: " + resp.code()
                            + " body=" + respBody);
                }
                return respBody.isEmpty() ? om.createObjectNode() : om.readTree(respBody);
            }
        } catch (IOException e) {
            throw new BackendUnavailableException("Weaviate request failed: " + e.getMessage(), e);
        }
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
