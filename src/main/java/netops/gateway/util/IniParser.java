package netops.gateway.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class IniParser {

    public static IniConfig parse(Path iniPath) throws IOException {
        return parse(Files.readAllLines(iniPath, StandardCharsets.UTF_8));
    }

    public static IniConfig parse(List<String> lines) {
        var cfg = new IniConfig();
        String section = "";
        for (var raw : lines) {
            var line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) continue;
            if (line.startsWith("[") && line.endsWith("]")) {
                section = line.substring(1, line.length() - 1).trim().toLowerCase();
                continue;
            }
            if (!line.contains("=")) continue;
            var kv = line.split("=", 2);
            var k = kv[0].trim().toLowerCase();
            var v = unquote(kv[1].trim());
            cfg.put(section.isEmpty() ? k : section + "." + k, v);
        }
        return cfg;
    }

    private static String unquote(String v) {
        if (v.length() >= 2 && ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'")))) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }
}
