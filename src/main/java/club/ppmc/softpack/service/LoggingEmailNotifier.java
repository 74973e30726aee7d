/**
 * LoggingEmailNotifier.java
 *
 * EmailNotifier 的默认实现：格式化收件地址并把邮件写入日志，不连接真正的 SMTP 服务器。
 * 发件人、收件人模板或 smtp 任一未配置时什么也不做。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class LoggingEmailNotifier implements EmailNotifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingEmailNotifier.class);

    @Override
    public void send(SoftpackSettings.Email config, String message, String subject, String username, boolean notifyAdmin) {
        if (!isConfigured(config)) {
            return;
        }
        List<String> recipients = recipients(config, username, notifyAdmin);
        LOGGER.info(
                "邮件 [{}] 通过 {} 从 {} 发送给 {}:\n{}",
                subject,
                config.getSmtp(),
                config.getFromAddr().replace("{}", username),
                recipients,
                message);
    }

    static boolean isConfigured(SoftpackSettings.Email config) {
        return config != null
                && StringUtils.hasText(config.getFromAddr())
                && StringUtils.hasText(config.getToAddr())
                && StringUtils.hasText(config.getSmtp());
    }

    static List<String> recipients(SoftpackSettings.Email config, String username, boolean notifyAdmin) {
        var recipients = new ArrayList<String>();
        recipients.add(config.getToAddr().replace("{}", username));
        if (notifyAdmin && StringUtils.hasText(config.getAdminAddr())) {
            recipients.add(config.getAdminAddr());
        }
        return recipients;
    }
}
