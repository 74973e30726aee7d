/**
 * BuildStatusSummary.java
 *
 * 构建状态汇总。
 *
 * @param avg 已完成构建的平均等待秒数（从请求到完成）；没有已完成的构建时为 null。
 * @param statuses 已开始构建的环境 -> 开始时间。
 */
package club.ppmc.softpack.model;

import java.time.OffsetDateTime;
import java.util.Map;

public record BuildStatusSummary(Double avg, Map<String, OffsetDateTime> statuses) {}
