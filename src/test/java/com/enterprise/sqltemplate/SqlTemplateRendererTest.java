package com.enterprise.sqltemplate;

import com.enterprise.sqltemplate.ident.InvalidIdentifierException;
import com.enterprise.sqltemplate.template.RenderedSql;
import com.enterprise.sqltemplate.template.SqlTemplateRenderer;
import com.enterprise.sqltemplate.template.TemplateRenderException;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class SqlTemplateRendererTest {

    private final SqlTemplateRenderer renderer = new SqlTemplateRenderer();

    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> data = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return data;
    }

    @Test
    void bindsValuesPositionally() {
        RenderedSql r = renderer.render(
                "SELECT * FROM {{ ident('table') }} WHERE id = {{ sqlVal('id') }} AND name IN {{ sqlList('names') }}",
                data("table", "public.users", "id", "7", "names", List.of("a", "b")));

        assertThat(r.sql()).isEqualTo(
                "SELECT * FROM \"public\".\"users\" WHERE id = $1 AND name IN ($2,$3)");
        assertThat(r.arguments()).containsExactly("7", "a", "b");
    }

    @Test
    void dollarDigitsInLiteralTextAreNotPlaceholders() {
        RenderedSql r = renderer.render(
                "SELECT '$1' AS \"label\", \"id\" FROM \"orders\" WHERE \"id\" = {{ sqlVal('id') }}",
                data("id", 1));

        assertThat(r.sql()).isEqualTo("SELECT '$1' AS \"label\", \"id\" FROM \"orders\" WHERE \"id\" = $1");
        assertThat(r.placeholders()).containsExactly(new RenderedSql.Placeholder(r.sql().lastIndexOf("$1"), 1));
        r.verify();

        RenderedSql.JdbcQuery jdbc = r.toJdbc();
        assertThat(jdbc.sql()).isEqualTo("SELECT '$1' AS \"label\", \"id\" FROM \"orders\" WHERE \"id\" = ?");
        assertThat(jdbc.values()).containsExactly(1);
    }

    @Test
    void dollarDigitsFromInlinedDataAreNotPlaceholders() {
        RenderedSql r = renderer.render(
                "SELECT * FROM t WHERE tag IN {{ inFormat('tag') }} AND id = {{ sqlVal('id') }}",
                data("tag", "$7", "id", "9"));

        assertThat(r.sql()).isEqualTo("SELECT * FROM t WHERE tag IN ('$7') AND id = $1");
        r.verify();
        assertThat(r.toJdbc().sql()).isEqualTo("SELECT * FROM t WHERE tag IN ('$7') AND id = ?");
        assertThat(r.toJdbc().values()).containsExactly("9");
        assertThat(r.toDebugString()).isEqualTo("SELECT * FROM t WHERE tag IN ('$7') AND id = '9'");
    }

    @Test
    void jdbcValuesAreTheArgumentsInOrder() {
        RenderedSql r = renderer.render(
                "{{ sqlVal('a') }} {{ sqlList('b') }} {{ sqlVal('c') }}",
                data("a", "x", "b", List.of("y", "z"), "c", "w"));

        assertThat(r.sql()).isEqualTo("$1 ($2,$3) $4");
        assertThat(r.toJdbc().sql()).isEqualTo("? (?,?) ?");
        assertThat(r.toJdbc().values()).containsExactlyElementsOf(r.arguments());
    }

    @Test
    void literalTextWithoutBlocksPassesThrough() {
        RenderedSql r = renderer.render("SELECT 1", data());
        assertThat(r.sql()).isEqualTo("SELECT 1");
        assertThat(r.arguments()).isEmpty();
    }

    @Test
    void conditionalBlockOnlyBindsWhenTaken() {
        String template = "SELECT * FROM t WHERE 1 = 1"
                + "{{ isSet('status') ? ' AND status = ' + sqlVal('status') : '' }}"
                + " AND id = {{ sqlVal('id') }}";

        RenderedSql without = renderer.render(template, data("id", "1"));
        assertThat(without.sql()).isEqualTo("SELECT * FROM t WHERE 1 = 1 AND id = $1");
        assertThat(without.arguments()).containsExactly("1");

        RenderedSql with = renderer.render(template, data("id", "1", "status", "open"));
        assertThat(with.sql()).isEqualTo("SELECT * FROM t WHERE 1 = 1 AND status = $1 AND id = $2");
        assertThat(with.arguments()).containsExactly("open", "1");
    }

    @Test
    void defaultsFeedPagination() {
        Map<String, Object> data = data("size", "20");
        RenderedSql r = renderer.render(
                "SELECT * FROM t {{ limitOffset(defaultOrValue('page', '1'), defaultOrValue('size', '10')) }}",
                data);

        assertThat(r.sql()).isEqualTo("SELECT * FROM t LIMIT 20 OFFSET(1 - 1) * 20");
        assertThat(data).containsEntry("page", "1");
    }

    @Test
    void badPaginationRendersEmpty() {
        RenderedSql r = renderer.render(
                "SELECT * FROM t {{ limitOffset('x', '10') }}", data());
        assertThat(r.sql()).isEqualTo("SELECT * FROM t ");
    }

    @Test
    void inFormatAndUnEscapeInline() {
        RenderedSql r = renderer.render(
                "SELECT * FROM t WHERE c IN {{ inFormat('codes') }} AND d = '{{ unEscape('a%20b') }}'",
                data("codes", List.of("x", "y")));
        assertThat(r.sql()).isEqualTo("SELECT * FROM t WHERE c IN ('x', 'y') AND d = 'a b'");
        assertThat(r.arguments()).isEmpty();
    }

    @Test
    void splitResultCanBeJoined() {
        RenderedSql r = renderer.render("{{ split('a-b-c', '-') }}", data());
        assertThat(r.sql()).isEqualTo("a,b,c");
    }

    @Test
    void invalidIdentifierAbortsRender() {
        assertThatThrownBy(() -> renderer.render(
                "SELECT * FROM t WHERE id = {{ sqlVal('id') }} ORDER BY {{ ident('sort') }}",
                data("id", "1", "sort", "name; DROP TABLE t")))
                .isInstanceOfSatisfying(InvalidIdentifierException.class,
                        e -> assertThat(e.identifier()).isEqualTo("name; DROP TABLE t"));
    }

    @Test
    void unregisteredMethodsAreNotCallable() {
        assertThatThrownBy(() -> renderer.render("{{ arguments() }}", data()))
                .isInstanceOf(TemplateRenderException.class);
        assertThatThrownBy(() -> renderer.render("{{ templateData() }}", data()))
                .isInstanceOf(TemplateRenderException.class);
        assertThatThrownBy(() -> renderer.render("{{ getClass() }}", data()))
                .isInstanceOf(TemplateRenderException.class);
    }

    @Test
    void typeReferencesAreRejected() {
        assertThatThrownBy(() -> renderer.render(
                "{{ T(java.lang.Runtime).getRuntime().exec('id') }}", data()))
                .isInstanceOf(TemplateRenderException.class);
        assertThatThrownBy(() -> renderer.render(
                "{{ new java.io.File('/tmp/x').delete() }}", data()))
                .isInstanceOf(TemplateRenderException.class);
    }

    @Test
    void syntaxErrorNamesTemplate() {
        assertThatThrownBy(() -> renderer.render("orders/list.read.sql", "SELECT {{ sqlVal('id' }}", data()))
                .isInstanceOfSatisfying(TemplateRenderException.class,
                        e -> assertThat(e.templateName()).isEqualTo("orders/list.read.sql"))
                .hasMessageContaining("orders/list.read.sql");
    }

    @Test
    void eachRenderStartsNumberingAtOne() {
        String template = "SELECT {{ sqlVal('a') }}, {{ sqlVal('a') }}";
        RenderedSql first = renderer.render(template, data("a", "x"));
        RenderedSql second = renderer.render(template, data("a", "y"));

        assertThat(first.sql()).isEqualTo("SELECT $1, $2");
        assertThat(second.sql()).isEqualTo("SELECT $1, $2");
        assertThat(second.arguments()).containsExactly("y", "y");
    }

    @Test
    void concurrentRendersDoNotInterleave() throws Exception {
        String template = "SELECT * FROM t WHERE a = {{ sqlVal('a') }} AND b IN {{ sqlList('b') }}";
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Map<String, RenderedSql> results = new ConcurrentHashMap<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        String key = thread + "-" + i;
                        results.put(key, renderer.render(template,
                                data("a", key, "b", List.of(key + "x", key + "y"))));
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(results).hasSize(threads * perThread);
        results.forEach((key, r) -> {
            assertThat(r.sql()).isEqualTo("SELECT * FROM t WHERE a = $1 AND b IN ($2,$3)");
            assertThat(r.arguments()).containsExactly(key, key + "x", key + "y");
        });
    }
}
