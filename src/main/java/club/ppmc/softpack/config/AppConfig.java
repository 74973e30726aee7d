/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 负责启用 SoftpackSettings 的属性绑定，并定义与构建服务通信所用的 RestTemplate。
 */
package club.ppmc.softpack.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(SoftpackSettings.class)
public class AppConfig {

    /**
     * 定义一个全局的 RestTemplate Bean。
     * 对构建服务的所有调用都必须有明确的连接和读取超时，超时按可重试的失败处理。
     *
     * @param settings 服务配置。
     * @return 一个带超时的 RestTemplate 实例。
     */
    @Bean
    public RestTemplate restTemplate(SoftpackSettings settings) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.getBuilder().getConnectTimeoutMillis());
        requestFactory.setReadTimeout(settings.getBuilder().getReadTimeoutMillis());
        return new RestTemplate(requestFactory);
    }
}
