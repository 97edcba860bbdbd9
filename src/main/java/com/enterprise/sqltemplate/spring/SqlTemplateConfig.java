package com.enterprise.sqltemplate.spring;

import com.enterprise.sqltemplate.script.ScriptTemplateLoader;
import com.enterprise.sqltemplate.script.SqlScriptService;
import com.enterprise.sqltemplate.template.SqlTemplateRenderer;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Spring wiring for SQL script templates. Import it or let component
 * scanning pick it up:
 * <pre>{@code
 * @Import(SqlTemplateConfig.class)
 * @Configuration
 * public class MyConfig { ... }
 * }</pre>
 *
 * <p>Registries are deliberately not beans: {@link SqlTemplateRenderer}
 * creates a new one for every render.
 */
@Configuration
@EnableConfigurationProperties(SqlTemplateProperties.class)
public class SqlTemplateConfig {

    @Bean
    public SqlTemplateRenderer sqlTemplateRenderer() {
        return new SqlTemplateRenderer();
    }

    @Bean
    public ScriptTemplateLoader scriptTemplateLoader(SqlTemplateProperties properties) {
        return new ScriptTemplateLoader(Path.of(properties.getQueries().getLocation()));
    }

    @Bean
    public SqlScriptService sqlScriptService(ScriptTemplateLoader loader, SqlTemplateRenderer renderer) {
        return new SqlScriptService(loader, renderer);
    }

    @Bean
    public ScriptQueryExecutor scriptQueryExecutor(DataSource dataSource, SqlTemplateProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setFetchSize(properties.getFetchSize());
        jdbcTemplate.setQueryTimeout(properties.getQueryTimeout());
        return new ScriptQueryExecutor(jdbcTemplate);
    }

    @Bean
    public ScriptReaderFactory scriptReaderFactory(DataSource dataSource, SqlTemplateProperties properties) {
        ScriptReaderFactory factory = new ScriptReaderFactory(dataSource);
        factory.setFetchSize(properties.getFetchSize());
        factory.setQueryTimeout(properties.getQueryTimeout());
        return factory;
    }
}
