/**
 * Interpreters.java
 *
 * 从锁文件中提取出的解释器版本。缺失的解释器为 null。
 */
package club.ppmc.softpack.model;

public record Interpreters(String python, String r) {

    public static final Interpreters NONE = new Interpreters(null, null);
}
