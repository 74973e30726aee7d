/**
 * EnvironmentResult.java
 *
 * 环境操作的所有可能结果。每个公开操作都返回其中之一，而不是抛出异常：
 * 成功变体实现 {@link Success}，错误变体实现 {@link Error}。
 * 调用方使用 instanceof 逐一检查。
 */
package club.ppmc.softpack.model;

public sealed interface EnvironmentResult {

    String message();

    sealed interface Success extends EnvironmentResult {}

    sealed interface Error extends EnvironmentResult {}

    // --- 成功 ---

    /**
     * 环境已写入仓库并处于排队状态。
     *
     * @param builderError 发送构建请求失败时的错误；成功发送时为 null。本地持久化不受其影响。
     */
    record CreateEnvironmentSuccess(String message, String path, String name, BuilderError builderError)
            implements Success {

        public boolean dispatched() {
            return builderError == null;
        }
    }

    record UpdateEnvironmentSuccess(String message, BuilderError builderError) implements Success {}

    record DeleteEnvironmentSuccess(String message) implements Success {}

    record AddTagSuccess(String message) implements Success {}

    record HiddenSuccess(String message) implements Success {}

    record WriteArtifactSuccess(String message, String commitOid) implements Success {}

    /** 配方请求的创建、完成或移除。 */
    record RecipeSuccess(String message) implements Success {}

    // --- 错误 ---

    record InvalidInputError(String message) implements Error {}

    record EnvironmentNotFoundError(String message, String path, String name) implements Error {}

    record EnvironmentAlreadyExistsError(String message, String path, String name) implements Error {}

    /** 乐观并发检查在有限次重试后仍然失败。 */
    record ConcurrentModificationError(String message) implements Error {}

    /** 构建服务不可达或返回了非 2xx。 */
    record BuilderError(String message) implements Error {}

    /** 制品仓库无法读写。 */
    record RepositoryUnavailableError(String message) implements Error {}
}
