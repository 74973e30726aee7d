/**
 * GroupDirectory.java
 *
 * 目录服务的查询接口：返回某个用户所属的全部组。
 * 查询失败（例如目录服务暂时不可达）时抛出 GroupLookupException，由 GroupService 负责重试。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.exception.GroupLookupException;
import java.util.List;

public interface GroupDirectory {

    List<String> groupsOf(String username) throws GroupLookupException;
}
