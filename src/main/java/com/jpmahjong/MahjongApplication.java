package com.jpmahjong;

import com.jpmahjong.config.RuleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 立直麻将规则引擎主入口
 */
@SpringBootApplication
public class MahjongApplication implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(MahjongApplication.class);

    private final RuleProperties rules;

    public MahjongApplication(RuleProperties rules) {
        this.rules = rules;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(MahjongApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        log.info("立直麻将引擎启动成功，规则：{}", rules);
    }
}
