// file: engine/src/main/java/io/strata/engine/format/IniFormatAdapter.java
package io.strata.engine.format;

import io.strata.core.value.Value;
import org.ini4j.Config;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * INI files through ini4j.
 * <p>
 * Mapping:
 *  - keys before the first section header become top-level string members;
 *  - each {@code [section]} becomes an object of string members.
 * INI has no types, so every parsed leaf is a string. Serializing accepts strings,
 * numbers and booleans at those two levels and rejects nulls, arrays and deeper nesting.
 */
final class IniFormatAdapter implements FormatAdapter {
    private static final String GLOBAL_SECTION = "?";

    @Override
    public FileFormat format() {
        return FileFormat.INI;
    }

    @Override
    public Value parse(String path, byte[] content) {
        Ini ini = newIni();
        try {
            ini.load(new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FormatException(path, FileFormat.INI, e.getMessage(), e);
        }

        Map<String, Value> root = new LinkedHashMap<>();
        Profile.Section global = ini.get(GLOBAL_SECTION);
        if (global != null) {
            root.putAll(members(global));
        }
        for (String name : ini.keySet()) {
            if (name.equals(GLOBAL_SECTION)) continue;
            root.put(name, new Value.ObjectValue(members(ini.get(name))));
        }
        return new Value.ObjectValue(root);
    }

    @Override
    public byte[] serialize(String path, Value value) {
        if (!(value instanceof Value.ObjectValue root)) {
            throw new FormatException(path, FileFormat.INI, "INI documents must be an object at the root, got " + value.typeName());
        }
        Ini ini = newIni();
        // root-level keys first so they are written before any section header
        root.members().forEach((key, v) -> {
            if (!(v instanceof Value.ObjectValue)) {
                ini.put(GLOBAL_SECTION, key, scalar(path, key, v));
            }
        });
        root.members().forEach((name, v) -> {
            if (v instanceof Value.ObjectValue section) {
                Profile.Section s = ini.add(name);
                section.members().forEach((key, leaf) -> s.put(key, scalar(path, name + "." + key, leaf)));
            }
        });

        var out = new ByteArrayOutputStream();
        try (Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            ini.store(w);
        } catch (IOException e) {
            throw new FormatException(path, FileFormat.INI, e.getMessage(), e);
        }
        return out.toByteArray();
    }

    private static Map<String, Value> members(Profile.Section section) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (String key : section.keySet()) {
            String v = section.get(key);
            out.put(key, Value.of(v == null ? "" : v));
        }
        return out;
    }

    private static String scalar(String path, String key, Value v) {
        String text;
        if (v instanceof Value.StringValue s) {
            text = s.value();
        } else if (v instanceof Value.NumberValue || v instanceof Value.BoolValue) {
            text = v.toString();
        } else if (v instanceof Value.NullValue) {
            throw new FormatException(path, FileFormat.INI, "INI does not support null values (" + key + ")");
        } else if (v instanceof Value.ArrayValue) {
            throw new FormatException(path, FileFormat.INI, "INI does not support arrays (" + key + ")");
        } else {
            throw new FormatException(path, FileFormat.INI, "INI does not support nesting below sections (" + key + ")");
        }
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw new FormatException(path, FileFormat.INI, "INI values cannot span lines (" + key + ")");
        }
        return text;
    }

    private static Ini newIni() {
        Config config = new Config();
        config.setGlobalSection(true);
        config.setGlobalSectionName(GLOBAL_SECTION);
        config.setEscape(false);
        config.setMultiOption(false);
        config.setMultiSection(false);
        config.setTree(false);
        Ini ini = new Ini();
        ini.setConfig(config);
        return ini;
    }
}
