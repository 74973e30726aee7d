package club.ppmc.softpack.util;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.softpack.model.CatalogPackage;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class SpackHtmlParserTest {

    private static List<CatalogPackage> parseFixture() throws Exception {
        try (var reader = new InputStreamReader(
                new ClassPathResource("spack/list.html").getInputStream(), StandardCharsets.UTF_8)) {
            return SpackHtmlParser.parse(reader);
        }
    }

    @Test
    void parsesEveryPackageSectionAndSkipsHeader() throws Exception {
        List<CatalogPackage> packages = parseFixture();

        assertThat(packages).extracting(CatalogPackage::name).containsExactly("py-numpy", "r-dplyr", "zlib");
    }

    @Test
    void readsVersionsInListedOrder() throws Exception {
        List<CatalogPackage> packages = parseFixture();

        assertThat(packages.get(0).versions()).containsExactly("1.26.4", "1.25.2", "1.24.4");
        assertThat(packages.get(1).versions()).containsExactly("1.1.4");
        assertThat(packages.get(2).versions()).containsExactly("1.3.1", "1.2.13", "1.2.12");
    }

    @Test
    void collapsesWhitespaceInDescriptions() throws Exception {
        List<CatalogPackage> packages = parseFixture();

        assertThat(packages.get(0).description()).isEqualTo("Fundamental package for array computing in Python.");
        assertThat(packages.get(1).description())
                .isEqualTo("A Grammar of Data Manipulation. A fast, consistent tool for working with "
                        + "data frame like objects, both in memory and out of memory.");
        assertThat(packages.get(2).description())
                .isEqualTo("A free, general-purpose, legally unencumbered lossless data-compression library.");
    }

    @Test
    void emptyInputYieldsNoPackages() throws Exception {
        assertThat(SpackHtmlParser.parse(new StringReader(""))).isEmpty();
    }
}
