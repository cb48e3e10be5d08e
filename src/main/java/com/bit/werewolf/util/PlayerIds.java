package com.bit.werewolf.util;

import com.bit.werewolf.structure.player.PlayerInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class PlayerIds {

    private PlayerIds() {
    }

    //玩家ID必须为非负整数
    public static boolean isValid(int id) {
        return id >= 0;
    }

    /**
     * 把玩家列表统一成ID列表，元素可以是数字ID或 PlayerInfo
     */
    public static List<Integer> extract(Collection<?> players) {
        List<Integer> ids = new ArrayList<>();
        if (players == null) {
            return ids;
        }
        for (Object player : players) {
            if (player instanceof PlayerInfo) {
                ids.add(((PlayerInfo) player).getId());
            } else if (player instanceof Number) {
                ids.add(((Number) player).intValue());
            } else {
                throw new IllegalArgumentException("无法识别的玩家: " + player);
            }
        }
        return ids;
    }
}
