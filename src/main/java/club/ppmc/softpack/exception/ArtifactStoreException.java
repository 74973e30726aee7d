/**
 * ArtifactStoreException.java
 *
 * ArtifactStore 所有可恢复失败的统一受检异常。
 * 具体原因由 {@link Reason} 区分，调用方据此决定是重试、转换为错误结果还是直接放弃。
 */
package club.ppmc.softpack.exception;

import lombok.Getter;

@Getter
public class ArtifactStoreException extends Exception {

    public enum Reason {
        /** 路径在当前树中不存在。 */
        NOT_FOUND,
        /** 乐观并发检查失败，调用方需要重新读取后重试。 */
        CONCURRENT_MODIFICATION,
        /** 新树与快照完全相同，或目标文件夹已经存在。 */
        NO_CHANGES,
        /** 文件已存在且不允许覆盖。 */
        FILE_EXISTS,
        /** 要提交的树与当前 head 的树相同。 */
        NOTHING_TO_COMMIT,
        /** 远程拒绝了非快进推送。 */
        PUSH_REJECTED,
        /** 所有者路径或环境路径不合法。 */
        INVALID_PATH,
        /** 底层读写失败。 */
        IO_FAILURE
    }

    private final Reason reason;

    public ArtifactStoreException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ArtifactStoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public boolean isRetryable() {
        return reason == Reason.CONCURRENT_MODIFICATION || reason == Reason.PUSH_REJECTED;
    }
}
