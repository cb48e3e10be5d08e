package com.bit.werewolf;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.werewolf")
public class WerewolfVoteApplication {
    public static void main(String[] args) {
        long start = System.currentTimeMillis();
        SpringApplication.run(WerewolfVoteApplication.class, args);
        log.info("投票引擎启动耗时{}ms", System.currentTimeMillis() - start);
    }
    //玩家ID统一为非负整数
    //同一时刻只存在一轮进行中的投票
}
