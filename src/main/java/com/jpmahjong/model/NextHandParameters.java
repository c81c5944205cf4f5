package com.jpmahjong.model;

/**
 * 下一局的庄家、场风、局数、本场与立直棒
 */
public final class NextHandParameters {
    private final int dealer;
    private final int roundWind;
    private final int roundNumber;
    private final int honba;
    private final int riichiSticks;

    public NextHandParameters(int dealer, int roundWind, int roundNumber, int honba, int riichiSticks) {
        this.dealer = dealer;
        this.roundWind = roundWind;
        this.roundNumber = roundNumber;
        this.honba = honba;
        this.riichiSticks = riichiSticks;
    }

    public int getDealer() {
        return dealer;
    }

    public int getRoundWind() {
        return roundWind;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public int getHonba() {
        return honba;
    }

    public int getRiichiSticks() {
        return riichiSticks;
    }

    @Override
    public String toString() {
        return "NextHand{dealer=" + dealer + ", round=" + roundWind + "-" + roundNumber
            + ", honba=" + honba + ", sticks=" + riichiSticks + "}";
    }
}
