package com.jpmahjong.model;

/**
 * 役种（门清番数 / 副露番数，副露为 0 表示必须门清）
 */
public enum Yaku {
    // 场况役
    RIICHI("立直", 1, 0),
    DOUBLE_RIICHI("两立直", 2, 0),
    IPPATSU("一发", 1, 0),
    MENZEN_TSUMO("门前清自摸和", 1, 0),
    HAITEI("海底摸月", 1, 1),
    HOUTEI("河底捞鱼", 1, 1),
    RINSHAN_KAIHOU("岭上开花", 1, 1),
    CHANKAN("抢杠", 1, 1),

    // 牌形役
    TANYAO("断幺九", 1, 1),
    YAKUHAI_WHITE("役牌 白", 1, 1),
    YAKUHAI_GREEN("役牌 发", 1, 1),
    YAKUHAI_RED("役牌 中", 1, 1),
    YAKUHAI_SEAT_WIND("自风牌", 1, 1),
    YAKUHAI_ROUND_WIND("场风牌", 1, 1),
    PINFU("平和", 1, 0),
    IIPEIKOU("一杯口", 1, 0),
    SANSHOKU_DOUJUN("三色同顺", 2, 1),
    SANSHOKU_DOUKOU("三色同刻", 2, 2),
    ITTSUU("一气通贯", 2, 1),
    CHANTA("混全带幺九", 2, 1),
    CHIITOITSU("七对子", 2, 0),
    TOITOI("对对和", 2, 2),
    SANANKOU("三暗刻", 2, 2),
    SANKANTSU("三杠子", 2, 2),
    HONROUTOU("混老头", 2, 2),
    SHOUSANGEN("小三元", 2, 2),
    JUNCHAN("纯全带幺九", 3, 2),
    RYANPEIKOU("二杯口", 3, 0),
    HONITSU("混一色", 3, 2),
    CHINITSU("清一色", 6, 5),

    // 役满
    KOKUSHI_MUSOU("国士无双", 13, 0, true),
    SUUANKOU("四暗刻", 13, 0, true),
    DAISANGEN("大三元", 13, 13, true),
    SHOUSUUSHII("小四喜", 13, 13, true),
    DAISUUSHII("大四喜", 13, 13, true),
    TSUUIISOU("字一色", 13, 13, true),
    CHINROUTOU("清老头", 13, 13, true),
    RYUUIISOU("绿一色", 13, 13, true),
    CHUUREN_POUTOU("九莲宝灯", 13, 0, true),
    SUUKANTSU("四杠子", 13, 13, true),
    TENHOU("天和", 13, 0, true),
    CHIIHOU("地和", 13, 0, true);

    private final String displayName;
    private final int closedHan;
    private final int openHan;
    private final boolean yakuman;

    Yaku(String displayName, int closedHan, int openHan) {
        this(displayName, closedHan, openHan, false);
    }

    Yaku(String displayName, int closedHan, int openHan, boolean yakuman) {
        this.displayName = displayName;
        this.closedHan = closedHan;
        this.openHan = openHan;
        this.yakuman = yakuman;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getClosedHan() {
        return closedHan;
    }

    public int getOpenHan() {
        return openHan;
    }

    public int han(boolean menzen) {
        return menzen ? closedHan : openHan;
    }

    public boolean isYakuman() {
        return yakuman;
    }
}
