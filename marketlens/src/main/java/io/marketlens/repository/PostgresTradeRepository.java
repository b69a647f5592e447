package io.marketlens.repository;

import io.marketlens.domain.error.UpstreamUnavailableException;
import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.Trade;
import io.marketlens.domain.repository.TradeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of TradeRepository.
 */
public final class PostgresTradeRepository implements TradeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeRepository.class);

    private static final String COLUMNS = """
        base_asset, quote_asset, unit_price, base_quantity_normalized,
        quote_quantity_normalized, block_index, block_time
        """;

    private final DataSource dataSource;

    public PostgresTradeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Trade> findRecent(AssetPair pair, Instant since, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM trades
            WHERE base_asset = ? AND quote_asset = ? AND block_time >= ?
            ORDER BY block_time DESC, block_index DESC
            LIMIT ?
            """;

        return query(sql, "find recent trades", ps -> {
            ps.setString(1, pair.base());
            ps.setString(2, pair.quote());
            ps.setTimestamp(3, Timestamp.from(since));
            ps.setInt(4, limit);
        });
    }

    @Override
    public List<Trade> findByPair(AssetPair pair, Instant from, Instant to) {
        String sql = "SELECT " + COLUMNS + """
            FROM trades
            WHERE base_asset = ? AND quote_asset = ? AND block_time >= ? AND block_time <= ?
            ORDER BY block_time ASC, block_index ASC
            """;

        return query(sql, "find trades by pair", ps -> {
            ps.setString(1, pair.base());
            ps.setString(2, pair.quote());
            ps.setTimestamp(3, Timestamp.from(from));
            ps.setTimestamp(4, Timestamp.from(to));
        });
    }

    @Override
    public List<Trade> findByPairNewestFirst(AssetPair pair, Instant from, Instant to, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM trades
            WHERE base_asset = ? AND quote_asset = ? AND block_time >= ? AND block_time <= ?
            ORDER BY block_time DESC, block_index DESC
            LIMIT ?
            """;

        return query(sql, "find trades within dates", ps -> {
            ps.setString(1, pair.base());
            ps.setString(2, pair.quote());
            ps.setTimestamp(3, Timestamp.from(from));
            ps.setTimestamp(4, Timestamp.from(to));
            ps.setInt(5, limit);
        });
    }

    @Override
    public List<Trade> findLatest(AssetPair pair, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM trades
            WHERE base_asset = ? AND quote_asset = ?
            ORDER BY block_time DESC, block_index DESC
            LIMIT ?
            """;

        return query(sql, "find latest trades", ps -> {
            ps.setString(1, pair.base());
            ps.setString(2, pair.quote());
            ps.setInt(3, limit);
        });
    }

    @Override
    public List<Trade> findByBaseAsset(String asset, Instant since) {
        String sql = "SELECT " + COLUMNS + """
            FROM trades
            WHERE base_asset = ? AND block_time >= ?
            ORDER BY block_time ASC
            """;

        return query(sql, "find trades by base asset", ps -> {
            ps.setString(1, asset);
            ps.setTimestamp(2, Timestamp.from(since));
        });
    }

    @Override
    public List<Trade> findByQuoteAsset(String asset, Instant since) {
        String sql = "SELECT " + COLUMNS + """
            FROM trades
            WHERE quote_asset = ? AND block_time >= ?
            ORDER BY block_time ASC
            """;

        return query(sql, "find trades by quote asset", ps -> {
            ps.setString(1, asset);
            ps.setTimestamp(2, Timestamp.from(since));
        });
    }

    private List<Trade> query(String sql, String what, StatementBinder binder) {
        List<Trade> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to {}: {}", what, e.getMessage());
            throw new UpstreamUnavailableException("record-store", "Failed to " + what, e);
        }

        return result;
    }

    private Trade mapRow(ResultSet rs) throws SQLException {
        return new Trade(
            rs.getString("base_asset"),
            rs.getString("quote_asset"),
            rs.getBigDecimal("unit_price"),
            rs.getBigDecimal("base_quantity_normalized"),
            rs.getBigDecimal("quote_quantity_normalized"),
            rs.getLong("block_index"),
            rs.getTimestamp("block_time").toInstant()
        );
    }

    @FunctionalInterface
    interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
