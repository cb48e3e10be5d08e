package com.bit.werewolf.config;

import com.bit.werewolf.runoff.TieBreaker;
import com.bit.werewolf.runoff.impl.RandomTieBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Slf4j
@Configuration
public class VoteConfig {

    // 配置了种子时随机决胜可复现，便于回放对局
    @Bean
    public TieBreaker tieBreaker(VoteProperties properties) {
        Long seed = properties.getTieBreakSeed();
        if (seed != null) {
            log.info("随机决胜使用固定种子{}", seed);
            return new RandomTieBreaker(new Random(seed));
        }
        return new RandomTieBreaker(new Random());
    }
}
