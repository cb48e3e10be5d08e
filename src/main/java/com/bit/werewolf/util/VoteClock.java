package com.bit.werewolf.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 选票时间戳：毫秒级，同一毫秒内连续取值时递增，保证后一次一定大于前一次
 */
public class VoteClock {

    private static final AtomicLong LAST = new AtomicLong(0);

    private VoteClock() {
    }

    public static long next() {
        long now = System.currentTimeMillis();
        return LAST.updateAndGet(prev -> Math.max(now, prev + 1));
    }

    /**
     * 最近一次发出的时间戳
     */
    public static long last() {
        return LAST.get();
    }
}
