/**
 * EnvironmentMetadata.java
 *
 * 环境元数据文件 (meta.yml) 的映射对象。
 * 它是可变的，以便于 Jackson 反序列化以及在标签、隐藏标记更新时原地修改后重新写回。
 */
package club.ppmc.softpack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnvironmentMetadata {

    /** 有序且不重复。 */
    private List<String> tags = new ArrayList<>();

    @JsonProperty("force_hidden")
    private boolean forceHidden;

    /** 请求构建的用户；构建结束并通知后会被移除。 */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String username;

    /**
     * 添加一个标签并保持有序、去重。
     *
     * @return 如果标签原本不存在则返回 true。
     */
    public boolean addTag(String tag) {
        var sorted = new TreeSet<>(tags);
        boolean added = sorted.add(tag);
        this.tags = new ArrayList<>(sorted);
        return added;
    }
}
