package com.jpmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 对局状态（由 GameEngine 独占修改）
 */
public class GameState {
    public static final int PLAYER_COUNT = 4;

    private final List<Player> players;         // 4 个座位
    private final Wall wall;                    // 牌山
    private int roundWind;                      // 场风（0=东 1=南 2=西 3=北）
    private int roundNumber;                    // 局数（1-4）
    private int honba;                          // 本场数
    private int riichiSticks;                   // 场上立直棒
    private int dealerSeat;                     // 庄家座位
    private int currentSeat;                    // 当前行动座位
    private GamePhase phase;                    // 阶段
    private Tile lastDiscardedTile;             // 最后打出的牌
    private int lastDiscardSeat;                // 最后打牌的座位
    private ResponseWindow responseWindow;      // 等待响应阶段的数据（其他阶段为 null）
    private boolean firstGoAround;              // 第一巡且无人鸣牌（两立直/天和/地和/九种九牌）
    private int turnCount;                      // 本局已打出的牌数
    private int kanCount;                       // 本局杠的次数
    private int pendingKanDora;                 // 待打牌后翻开的杠宝牌数
    private boolean rinshanDraw;                // 当前摸到的牌是否岭上牌
    private int pendingRiichiSeat;              // 立直宣言牌尚未通过的座位（-1 表示无）
    private HandOutcome handOutcome;            // 本局结果（仅单局结束后有值）
    private NextHandParameters nextHandParameters; // 下一局参数（仅单局结束后有值）
    private boolean gameOver;                   // 整场是否结束
    private int handCount;                      // 已开始的局数

    public GameState(int initialScore) {
        List<Player> list = new ArrayList<>();
        for (int seat = 0; seat < PLAYER_COUNT; seat++) {
            list.add(new Player(seat, initialScore));
        }
        this.players = Collections.unmodifiableList(list);
        this.wall = new Wall();
        this.roundNumber = 1;
        this.phase = GamePhase.GAME_START;
        this.lastDiscardSeat = -1;
        this.pendingRiichiSeat = -1;
    }

    public List<Player> getPlayers() {
        return players;
    }

    public Player getPlayer(int seat) {
        if (seat < 0 || seat >= PLAYER_COUNT) {
            throw new IllegalArgumentException("座位越界：" + seat);
        }
        return players.get(seat);
    }

    public Wall getWall() {
        return wall;
    }

    public int getRoundWind() {
        return roundWind;
    }

    public void setRoundWind(int roundWind) {
        this.roundWind = roundWind;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public void setRoundNumber(int roundNumber) {
        this.roundNumber = roundNumber;
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

    public int getDealerSeat() {
        return dealerSeat;
    }

    public void setDealerSeat(int dealerSeat) {
        this.dealerSeat = dealerSeat;
    }

    public Player getDealer() {
        return players.get(dealerSeat);
    }

    public int getCurrentSeat() {
        return currentSeat;
    }

    public void setCurrentSeat(int currentSeat) {
        this.currentSeat = currentSeat;
    }

    public Player getCurrentPlayer() {
        return players.get(currentSeat);
    }

    public GamePhase getPhase() {
        return phase;
    }

    public void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    public Tile getLastDiscardedTile() {
        return lastDiscardedTile;
    }

    public void setLastDiscardedTile(Tile lastDiscardedTile) {
        this.lastDiscardedTile = lastDiscardedTile;
    }

    public int getLastDiscardSeat() {
        return lastDiscardSeat;
    }

    public void setLastDiscardSeat(int lastDiscardSeat) {
        this.lastDiscardSeat = lastDiscardSeat;
    }

    public ResponseWindow getResponseWindow() {
        return responseWindow;
    }

    public void setResponseWindow(ResponseWindow responseWindow) {
        this.responseWindow = responseWindow;
    }

    public boolean isFirstGoAround() {
        return firstGoAround;
    }

    public void setFirstGoAround(boolean firstGoAround) {
        this.firstGoAround = firstGoAround;
    }

    public int getTurnCount() {
        return turnCount;
    }

    public void setTurnCount(int turnCount) {
        this.turnCount = turnCount;
    }

    public int getKanCount() {
        return kanCount;
    }

    public void setKanCount(int kanCount) {
        this.kanCount = kanCount;
    }

    public int getPendingKanDora() {
        return pendingKanDora;
    }

    public void setPendingKanDora(int pendingKanDora) {
        this.pendingKanDora = pendingKanDora;
    }

    public boolean isRinshanDraw() {
        return rinshanDraw;
    }

    public void setRinshanDraw(boolean rinshanDraw) {
        this.rinshanDraw = rinshanDraw;
    }

    public int getPendingRiichiSeat() {
        return pendingRiichiSeat;
    }

    public void setPendingRiichiSeat(int pendingRiichiSeat) {
        this.pendingRiichiSeat = pendingRiichiSeat;
    }

    public HandOutcome getHandOutcome() {
        return handOutcome;
    }

    public void setHandOutcome(HandOutcome handOutcome) {
        this.handOutcome = handOutcome;
    }

    public NextHandParameters getNextHandParameters() {
        return nextHandParameters;
    }

    public void setNextHandParameters(NextHandParameters nextHandParameters) {
        this.nextHandParameters = nextHandParameters;
    }

    public boolean isGameOver() {
        return gameOver;
    }

    public void setGameOver(boolean gameOver) {
        this.gameOver = gameOver;
    }

    public int getHandCount() {
        return handCount;
    }

    public void setHandCount(int handCount) {
        this.handCount = handCount;
    }

    /**
     * 座位相对庄家的自风
     */
    public int seatWindOf(int seat) {
        return (seat - dealerSeat + PLAYER_COUNT) % PLAYER_COUNT;
    }

    /**
     * 牌数守恒：活牌 + 王牌剩余 + 所有玩家持有 == 136
     */
    public int countAllTiles() {
        int total = wall.getLiveCount() + wall.getDeadWallRemaining();
        for (Player player : players) {
            total += player.getTileCount();
        }
        return total;
    }
}
