package org.learningjava.carbonengine.infrastructure.adapter.out.fs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.carbonengine.application.port.FactorSeedReaderPort;
import org.learningjava.carbonengine.domain.exception.ValidationException;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.GhgBreakdown;
import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the reference dataset from a JSON array. Rows without an id, a unit or a
 * finite non-negative value are skipped with a warning; duplicate ids keep the first row.
 */
@Component
public class JsonFactorSeedReader implements FactorSeedReaderPort {

    private static final Logger log = LoggerFactory.getLogger(JsonFactorSeedReader.class);

    private final ResourceLoader resources;
    private final ObjectMapper om = new ObjectMapper();

    @Autowired
    public JsonFactorSeedReader(ResourceLoader resources) {
        this.resources = resources;
    }

    JsonFactorSeedReader() {
        this(new DefaultResourceLoader());
    }

    @Override
    public List<EmissionFactorRecord> read(String location) {
        if (location == null || location.isBlank()) {
            throw new ValidationException("factor seed location is blank");
        }
        Resource res = resources.getResource(location);
        if (!res.exists()) {
            throw new ValidationException("factor seed not found: " + location);
        }

        JsonNode root;
        try (InputStream in = res.getInputStream()) {
            root = om.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read factor seed " + location, e);
        }
        JsonNode rows = root.isArray() ? root : root.path("factors");
        if (!rows.isArray()) {
            throw new ValidationException("factor seed must be a JSON array or {\"factors\": [...]}: " + location);
        }

        List<EmissionFactorRecord> out = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        int index = 0;
        for (JsonNode n : rows) {
            EmissionFactorRecord r = toRecord(n);
            if (r == null) {
                log.warn("Skipping factor row {} in {}: missing id/unit or invalid value", index, location);
            } else if (!ids.add(r.id())) {
                log.warn("Skipping duplicate factor id {} in {}", r.id(), location);
            } else {
                out.add(r);
            }
            index++;
        }
        log.info("Read {} emission factors from {}", out.size(), location);
        return out;
    }

    static EmissionFactorRecord toRecord(JsonNode n) {
        String id = text(n, "id");
        String unit = text(n, "unit");
        JsonNode v = n.get("value");
        if (id == null || unit == null || v == null || !v.isNumber()) return null;
        double value = v.asDouble();
        if (!Double.isFinite(value) || value < 0) return null;

        GhgBreakdown ghg = null;
        JsonNode g = n.get("ghgBreakdown");
        if (g != null && g.isObject()) {
            ghg = new GhgBreakdown(number(g, "co2"), number(g, "ch4"), number(g, "n2o"));
            if (ghg.isEmpty()) ghg = null;
        }

        return new EmissionFactorRecord(
                id,
                text(n, "activity"),
                text(n, "fuel"),
                text(n, "region"),
                text(n, "source"),
                unit,
                value,
                Scope.parse(text(n, "scope")),
                ghg,
                text(n, "description")
        );
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static Double number(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v != null && v.isNumber() ? v.asDouble() : null;
    }
}
