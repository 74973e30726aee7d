/**
 * EnvironmentType.java
 *
 * 环境的来源：由本系统调度构建，或者由旧式模块文件转换生成。
 */
package club.ppmc.softpack.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EnvironmentType {
    SOFTPACK("softpack"),
    MODULE("module");

    private final String label;

    EnvironmentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
