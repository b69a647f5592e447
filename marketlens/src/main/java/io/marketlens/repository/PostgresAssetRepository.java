package io.marketlens.repository;

import io.marketlens.domain.asset.AssetChangeType;
import io.marketlens.domain.asset.AssetSnapshot;
import io.marketlens.domain.asset.TrackedAsset;
import io.marketlens.domain.error.UpstreamUnavailableException;
import io.marketlens.domain.repository.AssetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of AssetRepository. Snapshot block times are joined from blocks.
 */
public final class PostgresAssetRepository implements AssetRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAssetRepository.class);

    private final DataSource dataSource;

    public PostgresAssetRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<TrackedAsset> findByAsset(String asset) {
        String currentSql = """
            SELECT a.asset, a.owner, a.description, a.divisible, a.locked, a.total_issued,
                   a.total_issued_normalized, a.change_type, a.at_block, b.block_time
            FROM assets a
            LEFT JOIN blocks b ON b.block_index = a.at_block
            WHERE a.asset = ?
            """;
        String historySql = """
            SELECT s.asset, s.owner, s.description, s.divisible, s.locked, s.total_issued,
                   s.total_issued_normalized, s.change_type, s.at_block, b.block_time
            FROM asset_snapshots s
            LEFT JOIN blocks b ON b.block_index = s.at_block
            WHERE s.asset = ?
            ORDER BY s.seq ASC
            """;

        try (Connection conn = dataSource.getConnection()) {
            AssetSnapshot current;
            try (PreparedStatement ps = conn.prepareStatement(currentSql)) {
                ps.setString(1, asset);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    current = mapRow(rs);
                }
            }

            List<AssetSnapshot> history = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(historySql)) {
                ps.setString(1, asset);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        history.add(mapRow(rs));
                    }
                }
            }

            return Optional.of(new TrackedAsset(asset, current, history));

        } catch (SQLException e) {
            log.error("Failed to find asset {}: {}", asset, e.getMessage());
            throw new UpstreamUnavailableException("record-store", "Failed to find asset " + asset, e);
        }
    }

    @Override
    public boolean exists(String asset) {
        String sql = "SELECT 1 FROM assets WHERE asset = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, asset);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }

        } catch (SQLException e) {
            log.error("Failed to check asset {}: {}", asset, e.getMessage());
            throw new UpstreamUnavailableException("record-store", "Failed to check asset " + asset, e);
        }
    }

    private AssetSnapshot mapRow(ResultSet rs) throws SQLException {
        Timestamp blockTime = rs.getTimestamp("block_time");
        Instant atBlockTime = blockTime != null ? blockTime.toInstant() : null;

        return new AssetSnapshot(
            rs.getString("asset"),
            rs.getString("owner"),
            rs.getString("description"),
            rs.getBoolean("divisible"),
            rs.getBoolean("locked"),
            rs.getLong("total_issued"),
            rs.getBigDecimal("total_issued_normalized"),
            AssetChangeType.fromTag(rs.getString("change_type")),
            rs.getLong("at_block"),
            atBlockTime
        );
    }
}
