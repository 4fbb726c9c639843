package org.learningjava.carbonengine.infrastructure.adapter.in.web;

import org.learningjava.carbonengine.domain.service.units.ConversionResult;
import org.learningjava.carbonengine.domain.service.units.UnitConverter;
import org.learningjava.carbonengine.domain.service.units.UnitFamily;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/units")
public class UnitController {

    private final UnitConverter converter;

    public UnitController(UnitConverter converter) {
        this.converter = converter;
    }

    @GetMapping("/convert")
    public ConversionResult convert(@RequestParam double value,
                                    @RequestParam String from,
                                    @RequestParam String to) {
        return converter.describe(value, from, to);
    }

    @GetMapping
    public Map<String, Object> vocabulary() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("version", UnitConverter.VOCABULARY_VERSION);
        for (UnitFamily f : UnitFamily.values()) {
            Set<String> units = f.multipliers().keySet();
            out.put(f.name(), units);
        }
        return out;
    }
}
