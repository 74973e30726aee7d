/**
 * Manifest.java
 *
 * 环境清单文件 (softpack.yml) 的映射对象，由 Jackson YAML 读写。
 */
package club.ppmc.softpack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Manifest {

    private String description = "";

    /** 每一项为 "name" 或 "name@version"。 */
    private List<String> packages = new ArrayList<>();

    /**
     * @throws IllegalArgumentException packages 缺失，或某一项为空、没有包名。
     */
    public List<PackageSpec> packageSpecs() {
        if (packages == null) {
            throw new IllegalArgumentException("清单缺少 packages。");
        }
        return packages.stream().map(PackageSpec::parse).toList();
    }
}
