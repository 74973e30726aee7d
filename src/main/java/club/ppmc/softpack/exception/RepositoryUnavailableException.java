/**
 * RepositoryUnavailableException.java
 *
 * 一个自定义的运行时异常，表示制品仓库无法打开：本地克隆不存在且从远程克隆失败。
 * 在启动阶段它是致命的；启动之后如果再次出现，会被上层转换为错误结果而不会终止进程。
 */
package club.ppmc.softpack.exception;

import lombok.Getter;

@Getter
public class RepositoryUnavailableException extends RuntimeException {

    /** 尝试打开或克隆的本地路径。 */
    private final String localPath;

    /** (可选) 远程仓库地址。 */
    private final String remoteUrl;

    public RepositoryUnavailableException(String message, String localPath, String remoteUrl, Throwable cause) {
        super(message, cause);
        this.localPath = localPath;
        this.remoteUrl = remoteUrl;
    }
}
