package ch.so.arp.vectorsearch;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational {@link SimilaritySearch} implementation. Vectors are stored in a
 * single table {@code (id, vector)} using the pgvector text representation.
 * There is no approximate index: every query reads all rows and ranks them
 * client-side, which is only reasonable for small corpora.
 * <p>
 * Connections are borrowed from the {@code DataSource} per statement and
 * returned when the statement or transaction completes; the pool itself is
 * owned by the application context.
 */
class RelationalSimilaritySearch implements SimilaritySearch {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelationalSimilaritySearch.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final Pattern COLUMN_TYPE = Pattern.compile("[A-Za-z_][A-Za-z0-9_ ]*(\\(\\d+\\))?(\\[\\])?");
    private static final Pattern FLOAT_COLUMN_TYPE = Pattern.compile("(?i)(vector|real|float4)\\s*(\\(\\d+\\))?(\\[\\])?");

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, vector)
            VALUES (:id, CAST(:vector AS %s))
            """;

    private static final String SELECT_ALL_SQL = """
            SELECT id, vector
            FROM %s
            """;

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final String table;
    private final String insertSql;
    private final String selectAllSql;
    private final boolean floatPrecision;
    private final Ranking ranking;

    RelationalSimilaritySearch(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, String table,
            String vectorType, SimilarityMetric metric) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.table = requireMatch(TABLE_NAME, table, "table");
        this.insertSql = INSERT_SQL.formatted(this.table, requireMatch(COLUMN_TYPE, vectorType, "vectorType"));
        this.selectAllSql = SELECT_ALL_SQL.formatted(this.table);
        this.floatPrecision = FLOAT_COLUMN_TYPE.matcher(vectorType.trim()).matches();
        this.ranking = new Ranking(metric);
    }

    @Override
    public void indexVector(List<? extends Number> vector, Map<String, ?> metadata) {
        double[] values = columnPrecision(Vectors.requireVector(vector));
        String id = Vectors.requireId(metadata);
        try {
            transactionTemplate.executeWithoutResult(status -> jdbcClient.sql(insertSql)
                    .param("id", id)
                    .param("vector", Vectors.toLiteral(values))
                    .update());
        } catch (DataAccessException | TransactionException ex) {
            throw new StorageException("Failed to insert vector '" + id + "' into " + table + ": " + ex.getMessage(),
                    ex);
        }
        LOGGER.debug("Inserted vector '{}' with {} dimensions into {}", id, values.length, table);
    }

    @Override
    public List<ScoredResult> querySimilar(List<? extends Number> vector, int topK) {
        double[] query = columnPrecision(Vectors.requireVector(vector));
        List<StoredRow> rows;
        try {
            rows = jdbcClient.sql(selectAllSql)
                    .query(StoredRowMapper.INSTANCE)
                    .list();
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read vectors from " + table + ": " + ex.getMessage(), ex);
        }
        List<ScoredResult> scored = rows.stream()
                .map(row -> ranking.score(query, row.id(), Vectors.parseLiteral(row.vector())))
                .flatMap(Optional::stream)
                .toList();
        LOGGER.debug("Full scan of {} scored {} of {} rows (topK={})", table, scored.size(), rows.size(), topK);
        return ranking.topK(scored, topK);
    }

    @Override
    public void close() {
        LOGGER.debug("Relational similarity search on {} closed", table);
    }

    /**
     * Float backed columns ({@code vector}, {@code real[]}) keep 4 byte values,
     * so vectors are rounded the same way before they are written or compared.
     */
    private double[] columnPrecision(double[] values) {
        return floatPrecision ? Vectors.toFloatPrecision(values) : values;
    }

    boolean isFloatPrecision() {
        return floatPrecision;
    }

    private static String requireMatch(Pattern pattern, String value, String name) {
        if (value == null || !pattern.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
        return value;
    }

    private enum StoredRowMapper implements RowMapper<StoredRow> {
        INSTANCE;

        @Override
        public StoredRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new StoredRow(rs.getString("id"), rs.getString("vector"));
        }
    }

    private record StoredRow(String id, String vector) {
    }
}
