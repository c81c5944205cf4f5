package com.jpmahjong.config;

/**
 * 杠宝牌的翻开时机
 */
public enum KanDoraTiming {
    BEFORE_REPLACEMENT, // 岭上摸牌之前
    AFTER_REPLACEMENT,  // 岭上摸牌之后
    AFTER_DISCARD       // 明杠/加杠在杠者打牌后翻开（暗杠仍立即翻开）
}
