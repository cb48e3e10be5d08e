package com.bit.werewolf.runoff.impl;

import com.bit.werewolf.runoff.TieBreaker;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;

/**
 * 均匀随机选择
 */
@Slf4j
public class RandomTieBreaker implements TieBreaker {

    private final Random random;

    public RandomTieBreaker(Random random) {
        this.random = random;
    }

    @Override
    public synchronized Integer pick(List<Integer> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        Integer picked = candidates.get(random.nextInt(candidates.size()));
        log.debug("随机决胜 候选={} 选中={}", candidates, picked);
        return picked;
    }
}
