/**
 * SpackHtmlParser.java
 *
 * 流式解析 "spack list --format html" 的输出。
 * 每个包是一个 &lt;div class="section" id="包名"&gt;，其中的 &lt;dt&gt;/&lt;dd&gt; 成对出现：
 * "Versions:" 对应逗号分隔的版本列表，"Description:" 对应描述文本。其他字段被忽略。
 */
package club.ppmc.softpack.util;

import club.ppmc.softpack.model.CatalogPackage;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.swing.text.MutableAttributeSet;
import javax.swing.text.html.HTML;
import javax.swing.text.html.HTMLEditorKit;
import javax.swing.text.html.parser.ParserDelegator;

public final class SpackHtmlParser {

    private static final String VERSIONS_TERM = "Versions:";
    private static final String DESCRIPTION_TERM = "Description:";

    private SpackHtmlParser() {}

    public static List<CatalogPackage> parse(Reader html) throws IOException {
        var callback = new PackageCollector();
        new ParserDelegator().parse(html, callback, true);
        callback.emitPackage();
        return callback.packages;
    }

    private static final class PackageCollector extends HTMLEditorKit.ParserCallback {

        private final List<CatalogPackage> packages = new ArrayList<>();

        private String name;
        private List<String> versions = new ArrayList<>();
        private String description = "";
        private boolean hasFields;

        private StringBuilder term;
        private StringBuilder definition;
        private String currentTerm = "";

        @Override
        public void handleStartTag(HTML.Tag tag, MutableAttributeSet attributes, int pos) {
            if (tag == HTML.Tag.DIV && isSection(attributes)) {
                emitPackage();
                name = String.valueOf(attributes.getAttribute(HTML.Attribute.ID));
            } else if (tag == HTML.Tag.DT) {
                endDefinition();
                term = new StringBuilder();
            } else if (tag == HTML.Tag.DD) {
                endTerm();
                endDefinition();
                definition = new StringBuilder();
            }
        }

        @Override
        public void handleEndTag(HTML.Tag tag, int pos) {
            if (tag == HTML.Tag.DT) {
                endTerm();
            } else if (tag == HTML.Tag.DD || tag == HTML.Tag.DL) {
                endDefinition();
            }
        }

        @Override
        public void handleText(char[] data, int pos) {
            if (definition != null) {
                definition.append(data).append(' ');
            } else if (term != null) {
                term.append(data);
            }
        }

        private static boolean isSection(MutableAttributeSet attributes) {
            Object cssClass = attributes.getAttribute(HTML.Attribute.CLASS);
            Object id = attributes.getAttribute(HTML.Attribute.ID);
            return cssClass != null
                    && id != null
                    && Arrays.asList(cssClass.toString().split("\\s+")).contains("section");
        }

        private void endTerm() {
            if (term != null) {
                currentTerm = term.toString().strip();
                term = null;
            }
        }

        private void endDefinition() {
            if (definition == null) {
                return;
            }
            String text = definition.toString().strip().replaceAll("\\s+", " ");
            definition = null;
            if (name == null) {
                return;
            }
            if (VERSIONS_TERM.equals(currentTerm)) {
                hasFields = true;
                versions = Arrays.stream(text.split(","))
                        .map(String::strip)
                        .filter(v -> !v.isEmpty())
                        .toList();
            } else if (DESCRIPTION_TERM.equals(currentTerm)) {
                hasFields = true;
                description = text;
            }
            currentTerm = "";
        }

        void emitPackage() {
            endTerm();
            endDefinition();
            // 页首的 "package-list" 等章节没有 Versions/Description
            if (name != null && !name.isBlank() && hasFields) {
                packages.add(new CatalogPackage(name, List.copyOf(versions), description));
            }
            name = null;
            versions = new ArrayList<>();
            description = "";
            hasFields = false;
            currentTerm = "";
        }
    }
}
