package com.enterprise.sqltemplate.spring;

import com.enterprise.sqltemplate.template.RenderedSql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes rendered scripts through {@link JdbcTemplate}. Arguments are always
 * bound positionally from {@link RenderedSql#arguments()}, never re-derived
 * from the text.
 */
public class ScriptQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScriptQueryExecutor.class);

    private final JdbcTemplate jdbcTemplate;

    public ScriptQueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    /** Runs a read script; one map per row, column label to value. */
    public List<Map<String, Object>> query(RenderedSql rendered) {
        RenderedSql.JdbcQuery jdbc = prepare(rendered);
        return jdbcTemplate.queryForList(jdbc.sql(), jdbc.values());
    }

    /** Runs a write/update/delete script and returns the affected row count. */
    public int update(RenderedSql rendered) {
        RenderedSql.JdbcQuery jdbc = prepare(rendered);
        return jdbcTemplate.update(jdbc.sql(), jdbc.values());
    }

    private static RenderedSql.JdbcQuery prepare(RenderedSql rendered) {
        rendered.verify();
        RenderedSql.JdbcQuery jdbc = rendered.toJdbc();
        log.debug("Executing: {} ({} argument(s))", jdbc.sql(), jdbc.values().length);
        return jdbc;
    }
}
