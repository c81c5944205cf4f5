package com.jpmahjong.model;

/**
 * 对局阶段
 */
public enum GamePhase {
    GAME_START,           // 整场开始
    HAND_START,           // 单局开始（重置牌墙与手牌）
    DEALING,              // 配牌
    PLAYER_DRAW,          // 摸牌
    PLAYER_DISCARD,       // 等待当前玩家打牌（或自摸/杠/立直）
    WAITING_FOR_RESPONSE, // 等待其他玩家对打出的牌表态
    ACTION_PROCESSING,    // 处理杠后的岭上摸牌与翻宝牌
    HAND_OVER_SCORES,     // 单局结束，已结算
    GAME_OVER             // 整场结束
}
