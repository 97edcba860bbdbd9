package com.enterprise.sqltemplate.spring;

import com.enterprise.sqltemplate.template.RenderedSql;

import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Factory that bridges rendered script templates with Spring Batch readers.
 *
 * <p>Creates {@link JdbcCursorItemReader} instances from a {@link RenderedSql}.
 * The {@code $N} placeholders are converted to JDBC {@code ?} markers via
 * {@link RenderedSql#toJdbc()}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * @Bean
 * @StepScope
 * public JdbcCursorItemReader<Order> orderReader(
 *         ScriptReaderFactory factory, SqlScriptService scripts,
 *         @Value("#{jobParameters['status']}") String status) {
 *     RenderedSql sql = scripts.render("orders", "by_status", ScriptType.READ,
 *             Map.of("status", List.of(status)));
 *     return factory.cursorReader("orderReader", sql, orderRowMapper());
 * }
 * }</pre>
 */
public class ScriptReaderFactory {

    private final DataSource dataSource;
    private int fetchSize = 1000;
    private int queryTimeout = 0;

    public ScriptReaderFactory(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Creates a {@link JdbcCursorItemReader} for the rendered script. The
     * script is verified before the reader is built.
     *
     * @param <T>       row type
     * @param name      reader name (used for restart data and logging)
     * @param rendered  output of one render; not reused across readers
     * @param rowMapper maps each ResultSet row to a domain object
     */
    public <T> JdbcCursorItemReader<T> cursorReader(
            String name,
            RenderedSql rendered,
            RowMapper<T> rowMapper) {

        rendered.verify();
        RenderedSql.JdbcQuery jdbc = rendered.toJdbc();

        JdbcCursorItemReader<T> reader = new JdbcCursorItemReader<>();
        reader.setName(name);
        reader.setDataSource(dataSource);
        reader.setSql(jdbc.sql());
        reader.setRowMapper(rowMapper);
        reader.setFetchSize(fetchSize);
        if (queryTimeout > 0) {
            reader.setQueryTimeout(queryTimeout);
        }
        reader.setPreparedStatementSetter(
                new ArgumentPreparedStatementSetter(jdbc.values()));
        return reader;
    }

    /** Fetch size hint. Default 1000. */
    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }

    /** Query timeout in seconds. 0 = no timeout (default). */
    public void setQueryTimeout(int seconds) {
        this.queryTimeout = seconds;
    }
}
