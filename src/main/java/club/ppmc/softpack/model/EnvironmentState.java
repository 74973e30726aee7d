/**
 * EnvironmentState.java
 *
 * 环境的构建生命周期状态，完全由环境文件夹中标记文件的存在与否推导得出。
 * READY 和 FAILED 是终态；READY 优先于 FAILED 和 QUEUED。
 * 清单中仍有请求中的配方（"*name@version"）时为 WAITING，此时不会发送构建请求。
 */
package club.ppmc.softpack.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EnvironmentState {
    QUEUED("queued"),
    WAITING("waiting"),
    FAILED("failed"),
    READY("ready");

    private final String label;

    EnvironmentState(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
