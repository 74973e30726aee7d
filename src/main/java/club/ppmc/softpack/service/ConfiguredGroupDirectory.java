/**
 * ConfiguredGroupDirectory.java
 *
 * GroupDirectory 的默认实现，读取配置中的静态 用户名 -> 组 对照表
 * (softpack.groups.members.&lt;用户名&gt;=组1,组2)。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ConfiguredGroupDirectory implements GroupDirectory {

    private final SoftpackSettings.Groups groups;

    public ConfiguredGroupDirectory(SoftpackSettings settings) {
        this.groups = settings.getGroups();
    }

    @Override
    public List<String> groupsOf(String username) {
        return List.copyOf(groups.getMembers().getOrDefault(username, List.of()));
    }
}
