// file: engine/src/test/java/io/strata/engine/format/FormatAdaptersTest.java
package io.strata.engine.format;

import io.strata.core.value.Value;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FormatAdaptersTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void formats_are_chosen_by_extension() {
        assertEquals(FileFormat.JSON, FileFormat.forPath("a/b/settings.json"));
        assertEquals(FileFormat.YAML, FileFormat.forPath("config.YML"));
        assertEquals(FileFormat.YAML, FileFormat.forPath("config.yaml"));
        assertEquals(FileFormat.TOML, FileFormat.forPath("Cargo.toml"));
        assertEquals(FileFormat.PROPERTIES, FileFormat.forPath("app.properties"));
        assertEquals(FileFormat.INI, FileFormat.forPath("setup.cfg"));
        assertEquals(FileFormat.INI, FileFormat.forPath("etc/nginx.conf"));
        assertEquals(FileFormat.INI, FileFormat.forPath("tox.ini"));
        assertEquals(FileFormat.INI, FileFormat.forPath("src/.editorconfig"));
        assertEquals(FileFormat.TEXT, FileFormat.forPath("README.md"));
        assertEquals(FileFormat.TEXT, FileFormat.forPath(".env"));
        assertEquals(FileFormat.TEXT, FileFormat.forPath("Makefile"));
    }

    @Test
    void text_has_no_adapter() {
        assertTrue(FormatAdapters.forFormat(FileFormat.TEXT).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> FormatAdapters.require(FileFormat.TEXT));
    }

    @Test
    void json_numbers_keep_their_written_scale() {
        var json = FormatAdapters.require(FileFormat.JSON);

        Value parsed = json.parse("n.json", utf8("{\"a\": 30.0, \"b\": 30, \"big\": 12345678901234567890}"));

        var obj = (Value.ObjectValue) parsed;
        assertEquals(new BigDecimal("30.0"), ((Value.NumberValue) obj.get("a").orElseThrow()).value());
        assertEquals(new BigDecimal("30"), ((Value.NumberValue) obj.get("b").orElseThrow()).value());
        assertEquals(new BigDecimal("12345678901234567890"), ((Value.NumberValue) obj.get("big").orElseThrow()).value());

        String out = new String(json.serialize("n.json", parsed), StandardCharsets.UTF_8);
        assertTrue(out.contains("30.0"), out);
        assertTrue(out.contains("12345678901234567890"), out);
        assertTrue(out.endsWith("\n"));
        assertEquals(parsed, json.parse("n.json", utf8(out)));
    }

    @Test
    void malformed_json_reports_path_and_format() {
        var json = FormatAdapters.require(FileFormat.JSON);

        var e = assertThrows(FormatException.class, () -> json.parse("conf/bad.json", utf8("{\"a\": ")));

        assertEquals("conf/bad.json", e.path());
        assertEquals(FileFormat.JSON, e.format());
    }

    @Test
    void blank_json_is_an_error_but_blank_yaml_is_empty() {
        assertThrows(FormatException.class,
                () -> FormatAdapters.require(FileFormat.JSON).parse("e.json", utf8("  \n")));
        assertEquals(Value.ObjectValue.empty(),
                FormatAdapters.require(FileFormat.YAML).parse("e.yaml", utf8("\n")));
        assertEquals(Value.ObjectValue.empty(),
                FormatAdapters.require(FileFormat.TOML).parse("e.toml", new byte[0]));
    }

    @Test
    void yaml_parses_nested_maps_and_lists() {
        var yaml = FormatAdapters.require(FileFormat.YAML);

        Value v = yaml.parse("c.yaml", utf8("server:\n  port: 8080\n  hosts:\n    - a\n    - b\n"));

        Value expected = Value.object()
                .put("server", Value.object()
                        .put("port", 8080)
                        .put("hosts", Value.array(Value.of("a"), Value.of("b")))
                        .build())
                .build();
        assertEquals(expected, v);
        assertEquals(expected, yaml.parse("c.yaml", yaml.serialize("c.yaml", v)));
    }

    @Test
    void toml_round_trips_tables() {
        var toml = FormatAdapters.require(FileFormat.TOML);

        Value v = toml.parse("c.toml", utf8("name = \"svc\"\n\n[limits]\nretries = 3\n"));

        Value expected = Value.object()
                .put("name", "svc")
                .put("limits", Value.object().put("retries", 3).build())
                .build();
        assertEquals(expected, v);
        assertEquals(expected, toml.parse("c.toml", toml.serialize("c.toml", v)));
    }

    @Test
    void formats_without_null_reject_null_values() {
        Value withNull = Value.object().put("a", Value.NULL).build();

        var toml = assertThrows(FormatException.class,
                () -> FormatAdapters.require(FileFormat.TOML).serialize("c.toml", withNull));
        assertEquals(FileFormat.TOML, toml.format());
        assertThrows(FormatException.class,
                () -> FormatAdapters.require(FileFormat.PROPERTIES).serialize("c.properties", withNull));
    }

    @Test
    void table_formats_require_an_object_root() {
        assertThrows(FormatException.class,
                () -> FormatAdapters.require(FileFormat.PROPERTIES).serialize("c.properties", Value.of("x")));
        assertThrows(FormatException.class,
                () -> FormatAdapters.require(FileFormat.TOML).serialize("c.toml", Value.array(Value.of(1))));
    }

    @Test
    void properties_nest_dotted_keys() {
        var props = FormatAdapters.require(FileFormat.PROPERTIES);

        Value v = props.parse("app.properties", utf8("db.host=localhost\ndb.port=5432\n"));

        Value db = ((Value.ObjectValue) v).get("db").orElseThrow();
        assertEquals(Value.of("localhost"), ((Value.ObjectValue) db).get("host").orElseThrow());
        assertEquals(Value.of("5432"), ((Value.ObjectValue) db).get("port").orElseThrow());
    }

    @Test
    void content_after_the_json_document_is_rejected() {
        var json = FormatAdapters.require(FileFormat.JSON);

        assertThrows(FormatException.class, () -> json.parse("c.json", utf8("{\"a\":1} {\"b\":2")));
        assertThrows(FormatException.class, () -> json.parse("c.json", utf8("{\"a\":1} {\"b\":2}")));
        assertThrows(FormatException.class, () -> json.parse("c.json", utf8("{\"a\":1} x")));
        assertEquals(Value.object().put("a", 1).build(), json.parse("c.json", utf8("{\"a\":1}\n\n")));
    }

    @Test
    void second_yaml_document_is_rejected() {
        var yaml = FormatAdapters.require(FileFormat.YAML);

        var e = assertThrows(FormatException.class, () -> yaml.parse("c.yaml", utf8("a: 1\n---\nb: 2\n")));
        assertEquals("c.yaml", e.path());
        assertEquals(Value.object().put("a", 1).build(), yaml.parse("c.yaml", utf8("---\na: 1\n")));
    }

    @Test
    void ini_sections_become_objects_and_root_keys_stay_top_level() {
        var ini = FormatAdapters.require(FileFormat.INI);

        Value v = ini.parse("app.ini", utf8("""
                name=svc

                [database]
                host=localhost
                port=5432

                [logging]
                level=info
                """));

        Value expected = Value.object()
                .put("name", "svc")
                .put("database", Value.object().put("host", "localhost").put("port", "5432").build())
                .put("logging", Value.object().put("level", "info").build())
                .build();
        assertEquals(expected, v);
        assertEquals(expected, ini.parse("app.ini", ini.serialize("app.ini", v)));
    }

    @Test
    void ini_writes_scalars_as_text() {
        var ini = FormatAdapters.require(FileFormat.INI);
        Value v = Value.object()
                .put("server", Value.object().put("port", 8080).put("debug", true).build())
                .build();

        Value back = ini.parse("s.ini", ini.serialize("s.ini", v));

        Value server = ((Value.ObjectValue) back).get("server").orElseThrow();
        assertEquals(Value.of("8080"), ((Value.ObjectValue) server).get("port").orElseThrow());
        assertEquals(Value.of("true"), ((Value.ObjectValue) server).get("debug").orElseThrow());
    }

    @Test
    void ini_rejects_values_it_cannot_express() {
        var ini = FormatAdapters.require(FileFormat.INI);

        assertThrows(FormatException.class, () -> ini.serialize("a.ini",
                Value.object().put("s", Value.object().put("k", Value.NULL).build()).build()));
        assertThrows(FormatException.class, () -> ini.serialize("a.ini",
                Value.object().put("s", Value.object().put("k", Value.array(Value.of(1))).build()).build()));
        assertThrows(FormatException.class, () -> ini.serialize("a.ini",
                Value.object().put("s", Value.object().put("k", Value.object().put("deep", 1).build()).build()).build()));
        assertThrows(FormatException.class, () -> ini.serialize("a.ini", Value.object().put("k", Value.NULL).build()));
        assertThrows(FormatException.class, () -> ini.serialize("a.ini", Value.of("x")));
    }

    @Test
    void malformed_ini_reports_path_and_format() {
        var e = assertThrows(FormatException.class,
                () -> FormatAdapters.require(FileFormat.INI).parse("bad.ini", utf8("[broken\nkey=v\n")));

        assertEquals("bad.ini", e.path());
        assertEquals(FileFormat.INI, e.format());
    }
}
