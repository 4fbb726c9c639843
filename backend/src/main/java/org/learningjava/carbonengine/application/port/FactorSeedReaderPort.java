package org.learningjava.carbonengine.application.port;

import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;

import java.util.List;

public interface FactorSeedReaderPort {
    // location is a Spring resource string, e.g. classpath:emission-factors.json or file:/data/factors.json
    List<EmissionFactorRecord> read(String location);
}
