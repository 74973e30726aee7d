/**
 * BuildStatus.java
 *
 * 构建服务报告的一条构建状态。buildStart、buildDone 可能为 null。
 */
package club.ppmc.softpack.model;

import java.time.OffsetDateTime;

public record BuildStatus(String name, OffsetDateTime requested, OffsetDateTime buildStart, OffsetDateTime buildDone) {}
