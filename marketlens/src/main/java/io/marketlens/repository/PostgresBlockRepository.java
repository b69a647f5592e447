package io.marketlens.repository;

import io.marketlens.domain.error.UpstreamUnavailableException;
import io.marketlens.domain.repository.BlockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.Optional;

/**
 * PostgreSQL implementation of BlockRepository.
 */
public final class PostgresBlockRepository implements BlockRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresBlockRepository.class);

    private final DataSource dataSource;

    public PostgresBlockRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Instant> findBlockTime(long blockIndex) {
        String sql = """
            SELECT block_time
            FROM blocks
            WHERE block_index = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, blockIndex);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getTimestamp("block_time").toInstant());
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            log.error("Failed to find block {}: {}", blockIndex, e.getMessage());
            throw new UpstreamUnavailableException("record-store", "Failed to find block " + blockIndex, e);
        }
    }
}
