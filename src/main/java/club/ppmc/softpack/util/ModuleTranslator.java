/**
 * ModuleTranslator.java
 *
 * 将 shpc 风格的旧式模块文件（Tcl 环境模块）转换为 softpack.yml 清单。
 *
 * 模块文件中 "module-whatis" 行给出 "Name: "、"Version: " 以及可选的 "Packages: "（逗号或空白分隔）；
 * "proc ModulesHelp { } { ... }" 块中的 "puts stderr" 行依次成为清单描述的各行。
 * 这是一个纯函数，不访问仓库和网络。
 */
package club.ppmc.softpack.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

public final class ModuleTranslator {

    private static final String HELP_START = "proc ModulesHelp";
    private static final String HELP_END = "}";
    private static final String HELP_LINE = "puts stderr ";
    private static final String WHATIS = "module-whatis ";
    private static final Pattern PACKAGE_SEPARATOR = Pattern.compile("[,\\s]+");
    private static final String README_TEMPLATE = "templates/readme.tmpl";

    private ModuleTranslator() {}

    /**
     * 将模块文件转换为清单。
     *
     * @param declaredName 环境名称，模块文件中没有 "Name:" 时使用。
     * @param contents 模块文件的原始字节。
     * @return softpack.yml 的字节内容。
     */
    public static byte[] toManifest(String declaredName, byte[] contents) {
        String name = declaredName;
        String version = "";
        List<String> packages = new ArrayList<>();
        var description = new StringBuilder();
        boolean inHelp = false;

        for (String rawLine : new String(contents, StandardCharsets.UTF_8).split("\\R")) {
            String line = rawLine.stripLeading();
            if (inHelp) {
                if (line.equals(HELP_END)) {
                    inHelp = false;
                } else if (line.startsWith(HELP_LINE)) {
                    String text = unquote(unescape(line.substring(HELP_LINE.length()).stripLeading()).replace("\\$", "$"));
                    description.append("  ").append(text).append('\n');
                }
                continue;
            }
            if (line.startsWith(HELP_START)) {
                inHelp = true;
            } else if (line.startsWith(WHATIS)) {
                String field = unquote(unescape(line.substring(WHATIS.length()).stripLeading())).stripLeading();
                if (field.startsWith("Name:")) {
                    String[] nameValue = Arrays.stream(field.substring("Name:".length()).split(":"))
                            .map(String::strip)
                            .toArray(String[]::new);
                    if (nameValue.length > 0 && !nameValue[0].isEmpty()) {
                        name = nameValue[0];
                    }
                    if (nameValue.length > 1 && !nameValue[1].isEmpty()) {
                        version = nameValue[1];
                    }
                } else if (field.startsWith("Version:")) {
                    String value = field.substring("Version:".length()).strip();
                    if (!value.isEmpty()) {
                        version = value;
                    }
                } else if (field.startsWith("Packages:")) {
                    packages = Arrays.stream(PACKAGE_SEPARATOR.split(field.substring("Packages:".length())))
                            .map(String::strip)
                            .filter(p -> !p.isEmpty())
                            .collect(Collectors.toCollection(ArrayList::new));
                }
            }
        }

        if (!version.isEmpty()) {
            name = name + "@" + version;
        }
        packages.add(0, name);

        String manifest = "description: |\n" + description + "packages:\n  - " + String.join("\n  - ", packages) + "\n";
        return manifest.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 为模块环境生成 README，内容说明如何用 module load 加载它。
     *
     * @param modulePath module 命令使用的模块路径。
     */
    public static byte[] generateReadme(String modulePath) {
        try {
            String template = StreamUtils.copyToString(
                    new ClassPathResource(README_TEMPLATE).getInputStream(), StandardCharsets.UTF_8);
            return template.replace("$module_path", modulePath).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取 README 模板: " + README_TEMPLATE, e);
        }
    }

    private static String unquote(String value) {
        String result = value;
        if (result.startsWith("\"")) {
            result = result.substring(1);
        }
        if (result.endsWith("\"")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * 处理 Tcl 字符串中的反斜杠转义。未知的转义序列原样保留（包括 "\$"，由调用方决定如何处理）。
     */
    static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        var out = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 >= value.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = value.charAt(i + 1);
            switch (next) {
                case '\\' -> out.append('\\');
                case '"' -> out.append('"');
                case '\'' -> out.append('\'');
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'u', 'x' -> {
                    int digits = next == 'u' ? 4 : 2;
                    if (i + 2 + digits <= value.length() && isHex(value, i + 2, digits)) {
                        out.append((char) Integer.parseInt(value.substring(i + 2, i + 2 + digits), 16));
                        i += 2 + digits;
                        continue;
                    }
                    out.append(c).append(next);
                }
                default -> out.append(c).append(next);
            }
            i += 2;
        }
        return out.toString();
    }

    private static boolean isHex(String value, int from, int length) {
        for (int i = from; i < from + length; i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
