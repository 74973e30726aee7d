/**
 * FailureReason.java
 *
 * 构建失败的诊断分类：依赖解析（concretization）失败，或一般的构建失败。
 */
package club.ppmc.softpack.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FailureReason {
    CONCRETIZATION("concretization"),
    BUILD("build");

    /** 构建输出中标志依赖解析失败的横幅。 */
    public static final String CONCRETIZATION_BANNER = "concretization failed for the following reasons:";

    private final String label;

    FailureReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static FailureReason fromBuilderOutput(String output) {
        return output.contains(CONCRETIZATION_BANNER) ? CONCRETIZATION : BUILD;
    }
}
