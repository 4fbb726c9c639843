package org.learningjava.carbonengine.infrastructure.adapter.out.postgres;

import org.learningjava.carbonengine.application.port.CalculationStorePort;
import org.learningjava.carbonengine.domain.exception.PersistenceException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRecord;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.calculation.CalculationSummary;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Plain JDBC store for calculation results. */
public class PostgresCalculationStoreAdapter implements CalculationStorePort {

    private static final Logger log = LoggerFactory.getLogger(PostgresCalculationStoreAdapter.class);

    private static final String DDL = """
            CREATE TABLE IF NOT EXISTS emission_calculations (
                id                 BIGSERIAL PRIMARY KEY,
                company_id         TEXT,
                description        TEXT NOT NULL,
                category           TEXT,
                quantity           DOUBLE PRECISION NOT NULL,
                unit               TEXT NOT NULL,
                matched_factor_id  TEXT,
                emission_factor    DOUBLE PRECISION NOT NULL,
                total_emissions    DOUBLE PRECISION NOT NULL,
                emissions_unit     TEXT NOT NULL,
                scope              SMALLINT,
                confidence         DOUBLE PRECISION NOT NULL,
                backend_used       TEXT NOT NULL,
                processing_time_ms BIGINT NOT NULL,
                fallback_reasons   TEXT,
                created_at         TIMESTAMPTZ NOT NULL DEFAULT now()
            )""";

    private static final String IDX_COMPANY =
            "CREATE INDEX IF NOT EXISTS idx_emission_calculations_company ON emission_calculations (company_id, created_at DESC)";

    private static final String INSERT = """
            INSERT INTO emission_calculations (
                company_id, description, category, quantity, unit, matched_factor_id,
                emission_factor, total_emissions, emissions_unit, scope, confidence,
                backend_used, processing_time_ms, fallback_reasons
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String COLUMNS = """
            id, company_id, description, category, quantity, unit, matched_factor_id,
            emission_factor, total_emissions, emissions_unit, scope, confidence,
            backend_used, processing_time_ms, created_at""";

    private final DataSource dataSource;

    public PostgresCalculationStoreAdapter(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void ensureSchema() {
        try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
            st.execute(DDL);
            st.execute(IDX_COMPANY);
            log.info("Table emission_calculations is ready");
        } catch (SQLException e) {
            throw new PersistenceException("Could not create emission_calculations schema", e);
        }
    }

    @Override
    public long save(CalculationResult result, ParsedActivity activity, String companyId) {
        EmissionFactorRecord factor = result.matchedFactor();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(INSERT, Statement.RETURN_GENERATED_KEYS)) {
            int i = 1;
            ps.setString(i++, companyId);
            ps.setString(i++, activity.description());
            ps.setString(i++, activity.category());
            ps.setDouble(i++, activity.quantity());
            ps.setString(i++, activity.unit());
            ps.setString(i++, factor == null ? null : factor.id());
            ps.setDouble(i++, factor == null ? 0.0 : factor.value());
            ps.setDouble(i++, result.totalEmissions());
            ps.setString(i++, result.emissionsUnit());
            if (result.scope() == null) ps.setNull(i++, Types.SMALLINT);
            else ps.setShort(i++, (short) result.scope().number());
            ps.setDouble(i++, result.confidence());
            ps.setString(i++, result.backendUsed().name());
            ps.setLong(i++, result.processingTimeMs());
            ps.setString(i, result.fallbackReasons().isEmpty() ? null : String.join("\n", result.fallbackReasons()));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new PersistenceException("Insert returned no id", null);
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Could not save calculation: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<CalculationRecord> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM emission_calculations WHERE id = ?";
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Could not load calculation " + id, e);
        }
    }

    /** Newest first. A null companyId lists every company. */
    @Override
    public List<CalculationRecord> listByCompany(String companyId, int limit) {
        String sql = companyId == null
                ? "SELECT " + COLUMNS + " FROM emission_calculations ORDER BY created_at DESC, id DESC LIMIT ?"
                : "SELECT " + COLUMNS + " FROM emission_calculations WHERE company_id = ? ORDER BY created_at DESC, id DESC LIMIT ?";
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            if (companyId != null) ps.setString(i++, companyId);
            ps.setInt(i, Math.max(0, limit));
            List<CalculationRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Could not list calculations for " + companyId, e);
        }
    }

    @Override
    public CalculationSummary summarize(String companyId) {
        String sql = """
                SELECT backend_used, COUNT(*) AS n, SUM(confidence) AS confidence_sum, MAX(created_at) AS last_at
                FROM emission_calculations
                %s
                GROUP BY backend_used""".formatted(companyId == null ? "" : "WHERE company_id = ?");
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (companyId != null) ps.setString(1, companyId);

            Map<BackendType, Integer> perBackend = new EnumMap<>(BackendType.class);
            for (BackendType t : BackendType.values()) perBackend.put(t, 0);
            long total = 0;
            double confidenceSum = 0;
            OffsetDateTime last = null;
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int n = rs.getInt("n");
                    perBackend.put(BackendType.valueOf(rs.getString("backend_used")), n);
                    total += n;
                    confidenceSum += rs.getDouble("confidence_sum");
                    OffsetDateTime at = rs.getObject("last_at", OffsetDateTime.class);
                    if (at != null && (last == null || at.isAfter(last))) last = at;
                }
            }
            double avg = total == 0 ? 0.0 : confidenceSum / total;
            return new CalculationSummary((int) total, Map.copyOf(perBackend), avg, last);
        } catch (SQLException e) {
            throw new PersistenceException("Could not summarize calculations for " + companyId, e);
        }
    }

    private static CalculationRecord map(ResultSet rs) throws SQLException {
        short scope = rs.getShort("scope");
        Integer scopeNumber = rs.wasNull() ? null : (int) scope;
        return new CalculationRecord(
                rs.getLong("id"),
                rs.getString("company_id"),
                rs.getString("description"),
                rs.getString("category"),
                rs.getDouble("quantity"),
                rs.getString("unit"),
                rs.getString("matched_factor_id"),
                rs.getDouble("emission_factor"),
                rs.getDouble("total_emissions"),
                rs.getString("emissions_unit"),
                scopeNumber,
                rs.getDouble("confidence"),
                BackendType.valueOf(rs.getString("backend_used")),
                rs.getLong("processing_time_ms"),
                rs.getObject("created_at", OffsetDateTime.class)
        );
    }
}
