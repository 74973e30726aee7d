/**
 * CatalogPackage.java
 *
 * 包目录中的一个可安装包：名称、可用版本（按 spack 输出的顺序）以及描述。
 */
package club.ppmc.softpack.model;

import java.util.List;

public record CatalogPackage(String name, List<String> versions, String description) {}
