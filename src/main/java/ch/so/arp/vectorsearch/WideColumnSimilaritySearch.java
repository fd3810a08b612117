package ch.so.arp.vectorsearch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.data.CqlVector;

/**
 * {@link SimilaritySearch} on a Cassandra compatible wide-column store such as
 * Astra DB. Vectors live in a {@code vector<float, n>} column of
 * {@code keyspace.table (id text PRIMARY KEY, vector vector<float, n>)}, so
 * indexing an existing identifier overwrites its vector.
 * <p>
 * Queries use the store's {@code ORDER BY ... ANN OF} operator when it is
 * enabled and score the returned candidates client-side. Without ANN support
 * the whole table is scanned and ranked client-side. The session is owned by
 * this instance and closed by {@link #close()}.
 */
class WideColumnSimilaritySearch implements SimilaritySearch {

    private static final Logger LOGGER = LoggerFactory.getLogger(WideColumnSimilaritySearch.class);

    private static final String INSERT_CQL = "INSERT INTO %s.%s (id, vector) VALUES (?, ?)";
    private static final String ANN_CQL = "SELECT id, vector FROM %s.%s ORDER BY vector ANN OF ? LIMIT ?";
    private static final String SCAN_CQL = "SELECT id, vector FROM %s.%s";

    private final CqlSession session;
    private final String tableName;
    private final boolean annEnabled;
    private final AnnRankingPolicy rankingPolicy;
    private final Ranking ranking;
    private final PreparedStatement insertStatement;
    private final PreparedStatement selectStatement;

    WideColumnSimilaritySearch(CqlSession session, String keyspace, String table, boolean annEnabled,
            AnnRankingPolicy rankingPolicy, SimilarityMetric metric) {
        this.session = Objects.requireNonNull(session, "session");
        Objects.requireNonNull(keyspace, "keyspace");
        Objects.requireNonNull(table, "table");
        this.tableName = keyspace + "." + table;
        this.annEnabled = annEnabled;
        this.rankingPolicy = Objects.requireNonNull(rankingPolicy, "rankingPolicy");
        this.ranking = new Ranking(metric);
        this.insertStatement = session.prepare(INSERT_CQL.formatted(keyspace, table));
        this.selectStatement = session.prepare((annEnabled ? ANN_CQL : SCAN_CQL).formatted(keyspace, table));
        LOGGER.info("Wide-column similarity search on {} (ann={}, policy={})", tableName, annEnabled, rankingPolicy);
    }

    @Override
    public void indexVector(List<? extends Number> vector, Map<String, ?> metadata) {
        double[] values = Vectors.toFloatPrecision(Vectors.requireVector(vector));
        String id = Vectors.requireId(metadata);
        try {
            session.execute(insertStatement.bind(id, toCqlVector(values)));
        } catch (DriverException ex) {
            throw new StorageException("Failed to insert vector '" + id + "' into " + tableName + ": "
                    + ex.getMessage(), ex);
        }
        LOGGER.debug("Inserted vector '{}' with {} dimensions into {}", id, values.length, tableName);
    }

    @Override
    public List<ScoredResult> querySimilar(List<? extends Number> vector, int topK) {
        double[] query = Vectors.toFloatPrecision(Vectors.requireVector(vector));
        if (topK <= 0) {
            return List.of();
        }
        ResultSet rows;
        try {
            rows = annEnabled
                    ? session.execute(selectStatement.bind(toCqlVector(query), topK))
                    : session.execute(selectStatement.bind());
        } catch (DriverException ex) {
            throw new StorageException("Failed to query vectors from " + tableName + ": " + ex.getMessage(), ex);
        }
        List<ScoredResult> scored = new ArrayList<>();
        for (Row row : rows) {
            String id = row.getString("id");
            ranking.score(query, id, readVector(id, row.getObject("vector"))).ifPresent(scored::add);
        }
        LOGGER.debug("Scored {} candidates from {} (topK={})", scored.size(), tableName, topK);
        if (annEnabled && rankingPolicy == AnnRankingPolicy.STORE_ORDER) {
            return ranking.firstK(scored, topK);
        }
        return ranking.topK(scored, topK);
    }

    @Override
    public void close() {
        if (!session.isClosed()) {
            session.close();
            LOGGER.info("Closed session for {}", tableName);
        }
    }

    private static CqlVector<Float> toCqlVector(double[] values) {
        List<Float> floats = new ArrayList<>(values.length);
        for (double value : values) {
            floats.add((float) value);
        }
        return CqlVector.newInstance(floats);
    }

    private double[] readVector(String id, Object stored) {
        if (!(stored instanceof Iterable<?> elements)) {
            throw new StorageException("Stored vector of '" + id + "' in " + tableName + " is not a vector: " + stored);
        }
        List<Double> values = new ArrayList<>();
        for (Object element : elements) {
            if (!(element instanceof Number number)) {
                throw new StorageException("Stored vector of '" + id + "' in " + tableName
                        + " holds a non-numeric element: " + element);
            }
            values.add(number.doubleValue());
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
