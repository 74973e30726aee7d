/**
 * GroupService.java
 *
 * 该服务包装目录服务的组查询：只保留匹配配置正则的组，排序后返回。
 * 遇到 GroupLookupException 时以固定间隔重试，超过次数后返回空列表。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import club.ppmc.softpack.exception.GroupLookupException;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class GroupService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GroupService.class);

    private final GroupDirectory directory;
    private final SoftpackSettings.Groups settings;
    private final Pattern pattern;

    public GroupService(GroupDirectory directory, SoftpackSettings settings) {
        this.directory = directory;
        this.settings = settings.getGroups();
        this.pattern = Pattern.compile(this.settings.getPattern());
    }

    /**
     * @param username 用户名。
     * @return 该用户所属、且匹配配置正则的组，按字母排序。
     */
    public List<String> groups(String username) {
        int attempts = Math.max(1, settings.getRetries());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return directory.groupsOf(username).stream()
                        .filter(group -> pattern.matcher(group).matches())
                        .sorted()
                        .toList();
            } catch (GroupLookupException e) {
                LOGGER.warn("查询用户 {} 的组失败 (第 {}/{} 次): {}", username, attempt, attempts, e.getMessage());
                if (attempt < attempts && !pause()) {
                    break;
                }
            }
        }
        LOGGER.error("多次查询用户 {} 的组均失败，按无组处理", username);
        return List.of();
    }

    private boolean pause() {
        try {
            Thread.sleep(settings.getBackoffMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
