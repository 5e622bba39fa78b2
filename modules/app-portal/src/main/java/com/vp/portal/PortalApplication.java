package com.vp.portal;

import com.vp.client.VpClientAutoConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@Import(VpClientAutoConfiguration.class)
@SpringBootApplication(scanBasePackages = "com.vp")
public class PortalApplication {
    public static void main(String[] args) {
        SpringApplication.run(PortalApplication.class, args);
    }
}
