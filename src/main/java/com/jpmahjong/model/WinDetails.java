package com.jpmahjong.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 和牌算分结果
 */
public class WinDetails {
    private boolean valid;                                  // 是否成立（有形且有役）
    private Map<Yaku, Integer> yaku = new LinkedHashMap<>(); // 役种 -> 番数
    private int han;                                        // 总番数（含宝牌）
    private int fu;                                         // 符数
    private int doraCount;                                  // 宝牌
    private int akaDoraCount;                               // 赤宝牌
    private int uraDoraCount;                               // 里宝牌
    private int yakumanCount;                               // 役满倍数
    private int basePoints;                                 // 基本点
    private int points;                                     // 和牌者从其他家收取的点数（含本场，不含立直棒）
    private Map<Integer, Integer> payments = new TreeMap<>(); // 座位 -> 点数变动（含立直棒）
    private WinForm winForm;                                // 采用的拆解
    private WaitType waitType;                              // 采用的听牌形

    public static WinDetails invalid() {
        return new WinDetails();
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public Map<Yaku, Integer> getYaku() {
        return yaku;
    }

    public void setYaku(Map<Yaku, Integer> yaku) {
        this.yaku = yaku;
    }

    public int getHan() {
        return han;
    }

    public void setHan(int han) {
        this.han = han;
    }

    public int getFu() {
        return fu;
    }

    public void setFu(int fu) {
        this.fu = fu;
    }

    public int getDoraCount() {
        return doraCount;
    }

    public void setDoraCount(int doraCount) {
        this.doraCount = doraCount;
    }

    public int getAkaDoraCount() {
        return akaDoraCount;
    }

    public void setAkaDoraCount(int akaDoraCount) {
        this.akaDoraCount = akaDoraCount;
    }

    public int getUraDoraCount() {
        return uraDoraCount;
    }

    public void setUraDoraCount(int uraDoraCount) {
        this.uraDoraCount = uraDoraCount;
    }

    public int getYakumanCount() {
        return yakumanCount;
    }

    public void setYakumanCount(int yakumanCount) {
        this.yakumanCount = yakumanCount;
    }

    public int getBasePoints() {
        return basePoints;
    }

    public void setBasePoints(int basePoints) {
        this.basePoints = basePoints;
    }

    public int getPoints() {
        return points;
    }

    public void setPoints(int points) {
        this.points = points;
    }

    public Map<Integer, Integer> getPayments() {
        return Collections.unmodifiableMap(payments);
    }

    public void setPayments(Map<Integer, Integer> payments) {
        this.payments = new TreeMap<>(payments);
    }

    public WinForm getWinForm() {
        return winForm;
    }

    public void setWinForm(WinForm winForm) {
        this.winForm = winForm;
    }

    public WaitType getWaitType() {
        return waitType;
    }

    public void setWaitType(WaitType waitType) {
        this.waitType = waitType;
    }

    @Override
    public String toString() {
        if (!valid) {
            return "WinDetails{invalid}";
        }
        return "WinDetails{yaku=" + yaku + ", han=" + han + ", fu=" + fu
            + ", dora=" + doraCount + "/" + akaDoraCount + "/" + uraDoraCount
            + ", points=" + points + ", payments=" + payments + "}";
    }
}
