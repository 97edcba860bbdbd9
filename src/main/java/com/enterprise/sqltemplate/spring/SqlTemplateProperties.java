package com.enterprise.sqltemplate.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code sqltemplate.*} settings.
 */
@ConfigurationProperties(prefix = "sqltemplate")
public class SqlTemplateProperties {

    private final Queries queries = new Queries();

    /** JDBC fetch size hint for script readers. */
    private int fetchSize = 1000;

    /** Query timeout in seconds. 0 = no timeout. */
    private int queryTimeout = 0;

    public Queries getQueries() { return queries; }

    public int getFetchSize() { return fetchSize; }
    public void setFetchSize(int fetchSize) { this.fetchSize = fetchSize; }

    public int getQueryTimeout() { return queryTimeout; }
    public void setQueryTimeout(int queryTimeout) { this.queryTimeout = queryTimeout; }

    public static class Queries {

        /** Root directory holding {@code <folder>/<script>.<type>.sql} files. */
        private String location = "./queries";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }
}
