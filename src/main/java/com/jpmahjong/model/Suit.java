package com.jpmahjong.model;

/**
 * 牌的花色
 */
public enum Suit {
    MAN('m'),    // 万子（1-9）
    PIN('p'),    // 筒子（1-9）
    SOU('s'),    // 索子（1-9）
    WIND('z'),   // 风牌（东南西北：1-4）
    DRAGON('z'); // 三元牌（白发中：5-7z）

    private final char code;

    Suit(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * 是否为数牌（万筒索）
     */
    public boolean isNumber() {
        return this == MAN || this == PIN || this == SOU;
    }
}
