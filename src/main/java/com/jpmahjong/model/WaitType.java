package com.jpmahjong.model;

/**
 * 听牌形（决定符数中的听牌符与平和）
 */
public enum WaitType {
    RYANMEN, // 两面
    KANCHAN, // 坎张
    PENCHAN, // 边张
    SHANPON, // 双碰
    TANKI    // 单骑
}
