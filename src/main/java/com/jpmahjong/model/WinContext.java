package com.jpmahjong.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 和牌时的场况（算分的输入）
 */
public class WinContext {
    private int winnerSeat;                          // 和牌者
    private int loserSeat = -1;                      // 放铳者（自摸为 -1）
    private int dealerSeat;                          // 庄家
    private int seatWind;                            // 自风（0-3）
    private int roundWind;                           // 场风（0-3）
    private boolean tsumo;                           // 自摸
    private boolean riichi;                          // 立直
    private boolean doubleRiichi;                    // 两立直
    private boolean ippatsu;                         // 一发
    private boolean haitei;                          // 海底摸月
    private boolean houtei;                          // 河底捞鱼
    private boolean rinshan;                         // 岭上开花
    private boolean chankan;                         // 抢杠
    private boolean tenhou;                          // 天和
    private boolean chiihou;                         // 地和
    private boolean openTanyao;                      // 食断
    private int honba;                               // 本场数
    private int riichiSticks;                        // 场上立直棒
    private List<Tile> doraIndicators = new ArrayList<>(); // 宝牌指示牌
    private List<Tile> uraIndicators = new ArrayList<>();  // 里宝牌指示牌

    public int getWinnerSeat() {
        return winnerSeat;
    }

    public void setWinnerSeat(int winnerSeat) {
        this.winnerSeat = winnerSeat;
    }

    public int getLoserSeat() {
        return loserSeat;
    }

    public void setLoserSeat(int loserSeat) {
        this.loserSeat = loserSeat;
    }

    public int getDealerSeat() {
        return dealerSeat;
    }

    public void setDealerSeat(int dealerSeat) {
        this.dealerSeat = dealerSeat;
    }

    public boolean isDealer() {
        return winnerSeat == dealerSeat;
    }

    public int getSeatWind() {
        return seatWind;
    }

    public void setSeatWind(int seatWind) {
        this.seatWind = seatWind;
    }

    public int getRoundWind() {
        return roundWind;
    }

    public void setRoundWind(int roundWind) {
        this.roundWind = roundWind;
    }

    public boolean isTsumo() {
        return tsumo;
    }

    public void setTsumo(boolean tsumo) {
        this.tsumo = tsumo;
    }

    public boolean isRiichi() {
        return riichi;
    }

    public void setRiichi(boolean riichi) {
        this.riichi = riichi;
    }

    public boolean isDoubleRiichi() {
        return doubleRiichi;
    }

    public void setDoubleRiichi(boolean doubleRiichi) {
        this.doubleRiichi = doubleRiichi;
    }

    public boolean isIppatsu() {
        return ippatsu;
    }

    public void setIppatsu(boolean ippatsu) {
        this.ippatsu = ippatsu;
    }

    public boolean isHaitei() {
        return haitei;
    }

    public void setHaitei(boolean haitei) {
        this.haitei = haitei;
    }

    public boolean isHoutei() {
        return houtei;
    }

    public void setHoutei(boolean houtei) {
        this.houtei = houtei;
    }

    public boolean isRinshan() {
        return rinshan;
    }

    public void setRinshan(boolean rinshan) {
        this.rinshan = rinshan;
    }

    public boolean isChankan() {
        return chankan;
    }

    public void setChankan(boolean chankan) {
        this.chankan = chankan;
    }

    public boolean isTenhou() {
        return tenhou;
    }

    public void setTenhou(boolean tenhou) {
        this.tenhou = tenhou;
    }

    public boolean isChiihou() {
        return chiihou;
    }

    public void setChiihou(boolean chiihou) {
        this.chiihou = chiihou;
    }

    public boolean isOpenTanyao() {
        return openTanyao;
    }

    public void setOpenTanyao(boolean openTanyao) {
        this.openTanyao = openTanyao;
    }

    public int getHonba() {
        return honba;
    }

    public void setHonba(int honba) {
        this.honba = honba;
    }

    public int getRiichiSticks() {
        return riichiSticks;
    }

    public void setRiichiSticks(int riichiSticks) {
        this.riichiSticks = riichiSticks;
    }

    public List<Tile> getDoraIndicators() {
        return doraIndicators;
    }

    public void setDoraIndicators(List<Tile> doraIndicators) {
        this.doraIndicators = doraIndicators;
    }

    public List<Tile> getUraIndicators() {
        return uraIndicators;
    }

    public void setUraIndicators(List<Tile> uraIndicators) {
        this.uraIndicators = uraIndicators;
    }
}
