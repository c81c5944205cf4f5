package com.jpmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 玩家（座位）在对局中的状态
 */
public class Player {
    private final int seat;                     // 座位（0-3，整局固定）
    private int score;                          // 当前点数
    private int seatWind;                       // 自风（0=东 1=南 2=西 3=北，每局随庄家轮换）
    private List<Tile> handTiles;               // 手牌（不含摸到的牌，保持有序）
    private List<Meld> melds;                   // 副露
    private List<Tile> discards;                // 牌河（被鸣走的牌会移到对方副露）
    private Set<Integer> discardedValues;       // 本局打出过的所有牌值（振听判定用）
    private Tile drawnTile;                     // 刚摸到的牌（0 或 1 张）
    private boolean riichi;                     // 是否立直
    private boolean doubleRiichi;               // 是否两立直
    private int riichiTurn;                     // 立直宣言时的巡目（未立直为 -1）
    private boolean ippatsu;                    // 一发是否仍有效
    private boolean temporaryFuriten;           // 同巡振听（放过和了牌，直到自己下次摸牌）
    private boolean riichiFuriten;              // 立直后振听（永久）

    public Player(int seat, int score) {
        this.seat = seat;
        this.score = score;
        this.handTiles = new ArrayList<>();
        this.melds = new ArrayList<>();
        this.discards = new ArrayList<>();
        this.discardedValues = new HashSet<>();
        this.riichiTurn = -1;
    }

    public int getSeat() {
        return seat;
    }

    public int getScore() {
        return score;
    }

    public void setScore(int score) {
        this.score = score;
    }

    public void addScore(int delta) {
        this.score += delta;
    }

    public int getSeatWind() {
        return seatWind;
    }

    public void setSeatWind(int seatWind) {
        this.seatWind = seatWind;
    }

    public List<Tile> getHandTiles() {
        return handTiles;
    }

    public List<Meld> getMelds() {
        return melds;
    }

    public List<Tile> getDiscards() {
        return discards;
    }

    public Set<Integer> getDiscardedValues() {
        return discardedValues;
    }

    public Tile getDrawnTile() {
        return drawnTile;
    }

    public void setDrawnTile(Tile drawnTile) {
        this.drawnTile = drawnTile;
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

    public int getRiichiTurn() {
        return riichiTurn;
    }

    public void setRiichiTurn(int riichiTurn) {
        this.riichiTurn = riichiTurn;
    }

    public boolean isIppatsu() {
        return ippatsu;
    }

    public void setIppatsu(boolean ippatsu) {
        this.ippatsu = ippatsu;
    }

    public boolean isTemporaryFuriten() {
        return temporaryFuriten;
    }

    public void setTemporaryFuriten(boolean temporaryFuriten) {
        this.temporaryFuriten = temporaryFuriten;
    }

    public boolean isRiichiFuriten() {
        return riichiFuriten;
    }

    public void setRiichiFuriten(boolean riichiFuriten) {
        this.riichiFuriten = riichiFuriten;
    }

    /**
     * 开始新一局前重置与“本局”相关的数据
     * （点数/座位不在此重置）
     */
    public void resetForNewHand(int seatWind) {
        this.seatWind = seatWind;
        handTiles.clear();
        melds.clear();
        discards.clear();
        discardedValues.clear();
        drawnTile = null;
        riichi = false;
        doubleRiichi = false;
        riichiTurn = -1;
        ippatsu = false;
        temporaryFuriten = false;
        riichiFuriten = false;
    }

    /**
     * 添加手牌
     */
    public void addTile(Tile tile) {
        handTiles.add(tile);
    }

    /**
     * 移除一张完全相同的手牌（区分赤牌）
     */
    public boolean removeTile(Tile tile) {
        return handTiles.remove(tile);
    }

    public void sortHand() {
        Collections.sort(handTiles);
    }

    /**
     * 门前清：没有明副露（暗杠不算）
     */
    public boolean isMenzen() {
        for (Meld meld : melds) {
            if (meld.isOpen()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 手牌 + 摸到的牌（用于自摸、暗杠、打牌判断）
     */
    public List<Tile> getConcealedTiles() {
        List<Tile> all = new ArrayList<>(handTiles);
        if (drawnTile != null) {
            all.add(drawnTile);
        }
        Collections.sort(all);
        return all;
    }

    /**
     * 该玩家持有的所有牌张数（手牌 + 摸牌 + 副露 + 牌河），用于牌数守恒校验
     */
    public int getTileCount() {
        int count = handTiles.size() + discards.size() + (drawnTile != null ? 1 : 0);
        for (Meld meld : melds) {
            count += meld.getTiles().size();
        }
        return count;
    }

    public int getKanCount() {
        int count = 0;
        for (Meld meld : melds) {
            if (meld.isKan()) {
                count++;
            }
        }
        return count;
    }
}
