package com.bit.werewolf.event;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 投票子系统对外发布的事件
 * 同一操作的 before/after 事件顺序发布，监听方同步执行
 */
@Getter
public class VoteEvent {

    private final VoteEventType type;

    private final int turn;

    /**
     * 事件数据，值允许为null（如 execution.none 的 target）
     */
    private final Map<String, Object> payload;

    public VoteEvent(VoteEventType type, int turn, Map<String, Object> payload) {
        this.type = type;
        this.turn = turn;
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public String getName() {
        return type.getEventName();
    }

    public Object get(String key) {
        return payload.get(key);
    }

    /**
     * 按 key, value, key, value... 组装事件数据
     */
    public static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("事件数据必须成对出现");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    @Override
    public String toString() {
        return "VoteEvent{" + type.getEventName() + ", turn=" + turn + ", payload=" + payload + "}";
    }
}
