package com.jpmahjong.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 规则配置（application.yml 中 mahjong.rules.*）
 * <p>
 * 不经 Spring 时也可以直接 new 出来，得到默认规则。
 */
@Component
@ConfigurationProperties(prefix = "mahjong.rules")
public class RuleProperties {
    private GameLength gameLength = GameLength.HANCHAN;                       // 对局长度
    private int initialScore = 25000;                                         // 起始点数
    private int redFivesPerSuit = 1;                                          // 每种数牌的赤五张数
    private KanDoraTiming kanDoraTiming = KanDoraTiming.AFTER_REPLACEMENT;    // 杠宝牌翻开时机
    private boolean openTanyao = false;                                       // 食断（副露断幺九）
    private int riichiCost = 1000;                                            // 立直棒
    private boolean bustingEndsGame = true;                                   // 击飞即终局
    private boolean autoNextHand = true;                                      // 结算后自动开下一局

    public GameLength getGameLength() {
        return gameLength;
    }

    public void setGameLength(GameLength gameLength) {
        this.gameLength = gameLength;
    }

    public int getInitialScore() {
        return initialScore;
    }

    public void setInitialScore(int initialScore) {
        this.initialScore = initialScore;
    }

    public int getRedFivesPerSuit() {
        return redFivesPerSuit;
    }

    public void setRedFivesPerSuit(int redFivesPerSuit) {
        if (redFivesPerSuit < 0 || redFivesPerSuit > 4) {
            throw new IllegalArgumentException("赤五张数必须在 0-4 之间：" + redFivesPerSuit);
        }
        this.redFivesPerSuit = redFivesPerSuit;
    }

    public KanDoraTiming getKanDoraTiming() {
        return kanDoraTiming;
    }

    public void setKanDoraTiming(KanDoraTiming kanDoraTiming) {
        this.kanDoraTiming = kanDoraTiming;
    }

    public boolean isOpenTanyao() {
        return openTanyao;
    }

    public void setOpenTanyao(boolean openTanyao) {
        this.openTanyao = openTanyao;
    }

    public int getRiichiCost() {
        return riichiCost;
    }

    public void setRiichiCost(int riichiCost) {
        this.riichiCost = riichiCost;
    }

    public boolean isBustingEndsGame() {
        return bustingEndsGame;
    }

    public void setBustingEndsGame(boolean bustingEndsGame) {
        this.bustingEndsGame = bustingEndsGame;
    }

    public boolean isAutoNextHand() {
        return autoNextHand;
    }

    public void setAutoNextHand(boolean autoNextHand) {
        this.autoNextHand = autoNextHand;
    }

    @Override
    public String toString() {
        return "RuleProperties{gameLength=" + gameLength + ", initialScore=" + initialScore
            + ", redFivesPerSuit=" + redFivesPerSuit + ", kanDoraTiming=" + kanDoraTiming
            + ", openTanyao=" + openTanyao + ", riichiCost=" + riichiCost
            + ", bustingEndsGame=" + bustingEndsGame + ", autoNextHand=" + autoNextHand + "}";
    }
}
