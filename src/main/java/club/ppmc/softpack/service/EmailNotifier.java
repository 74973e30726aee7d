/**
 * EmailNotifier.java
 *
 * 发送邮件通知的接口。地址中的 "{}" 会被替换为用户名。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;

public interface EmailNotifier {

    /**
     * @param config 发件人、收件人模板和管理员地址。
     * @param message 正文。
     * @param subject 主题。
     * @param username 收件用户。
     * @param notifyAdmin 是否抄送管理员。
     */
    void send(SoftpackSettings.Email config, String message, String subject, String username, boolean notifyAdmin);
}
