/**
 * GroupLookupException.java
 *
 * 目录服务查询用户组时发生的暂时性失败（例如服务器断开）。GroupService 会对它进行有限次重试。
 */
package club.ppmc.softpack.exception;

public class GroupLookupException extends Exception {

    public GroupLookupException(String message) {
        super(message);
    }

    public GroupLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
