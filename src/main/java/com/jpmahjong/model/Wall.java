package com.jpmahjong.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Random;

/**
 * 牌山：活牌墙（从头摸牌）+ 王牌 14 张
 * <p>
 * 王牌布局：0-3 为岭上牌，4 起每两张一组为（宝牌指示牌，里宝牌指示牌），最多 5 组。
 */
public class Wall {

    private static final Logger log = LoggerFactory.getLogger(Wall.class);

    public static final int TOTAL_TILES = 136;
    public static final int DEAD_WALL_SIZE = 14;
    public static final int REPLACEMENT_SLOTS = 4;
    public static final int MAX_INDICATORS = 5;

    private final LinkedList<Tile> liveTiles = new LinkedList<>(); // 活牌墙
    private final List<Tile> deadWall = new ArrayList<>();         // 王牌（固定 14 个位置）
    private int replacementsDrawn;                                 // 已摸走的岭上牌数
    private int revealedIndicators;                                // 已翻开的宝牌指示牌数

    /**
     * 洗牌并切分活牌墙与王牌，翻开第一张宝牌指示牌
     */
    public void shuffleAndSetup(List<Tile> fullSet, Random random) {
        List<Tile> tiles = new ArrayList<>(fullSet);
        Collections.shuffle(tiles, random);
        setupFromOrder(tiles);
    }

    /**
     * 按给定顺序建立牌山：前 122 张为活牌墙，最后 14 张为王牌
     */
    public void setupFromOrder(List<Tile> orderedTiles) {
        if (orderedTiles == null || orderedTiles.size() != TOTAL_TILES) {
            throw new IllegalStateException("牌山必须为 " + TOTAL_TILES + " 张，实际："
                + (orderedTiles == null ? 0 : orderedTiles.size()));
        }
        int liveSize = TOTAL_TILES - DEAD_WALL_SIZE;
        liveTiles.clear();
        liveTiles.addAll(orderedTiles.subList(0, liveSize));
        deadWall.clear();
        deadWall.addAll(orderedTiles.subList(liveSize, TOTAL_TILES));
        replacementsDrawn = 0;
        revealedIndicators = 1;
        log.debug("牌山建立完成，活牌{}张，宝牌指示牌：{}", liveTiles.size(), getDoraIndicators());
    }

    /**
     * 从牌头摸一张牌；牌墙摸完返回 null（荒牌流局的信号）
     */
    public Tile drawTile() {
        return liveTiles.pollFirst();
    }

    /**
     * 摸一张岭上牌；4 张用完返回 null
     */
    public Tile drawReplacementTile() {
        if (replacementsDrawn >= REPLACEMENT_SLOTS) {
            log.warn("岭上牌已用尽");
            return null;
        }
        Tile tile = deadWall.get(replacementsDrawn);
        replacementsDrawn++;
        return tile;
    }

    /**
     * 翻开下一组宝牌/里宝牌指示牌；已满 5 组时不做任何事
     */
    public void revealNewDora() {
        if (revealedIndicators >= MAX_INDICATORS) {
            return;
        }
        revealedIndicators++;
        log.debug("翻开新的宝牌指示牌：{}", deadWall.get(indicatorIndex(revealedIndicators - 1)));
    }

    public int getLiveCount() {
        return liveTiles.size();
    }

    /**
     * 王牌中尚未被摸走的张数
     */
    public int getDeadWallRemaining() {
        return DEAD_WALL_SIZE - replacementsDrawn;
    }

    public int getReplacementsRemaining() {
        return REPLACEMENT_SLOTS - replacementsDrawn;
    }

    public int getRevealedIndicatorCount() {
        return revealedIndicators;
    }

    public List<Tile> getDoraIndicators() {
        List<Tile> result = new ArrayList<>();
        for (int i = 0; i < revealedIndicators; i++) {
            result.add(deadWall.get(indicatorIndex(i)));
        }
        return result;
    }

    /**
     * 里宝牌指示牌（与已翻开的宝牌指示牌数量相同）
     */
    public List<Tile> getUraIndicators() {
        List<Tile> result = new ArrayList<>();
        for (int i = 0; i < revealedIndicators; i++) {
            result.add(deadWall.get(indicatorIndex(i) + 1));
        }
        return result;
    }

    /**
     * 指示牌对应的宝牌：数牌 9→1 循环，风牌 东→南→西→北→东，三元牌 白→发→中→白
     */
    public static int doraFromIndicator(int indicatorValue) {
        if (indicatorValue < 27) {
            int suitStart = indicatorValue / 9 * 9;
            return suitStart + (indicatorValue - suitStart + 1) % 9;
        }
        if (indicatorValue <= Tile.NORTH) {
            return Tile.EAST + (indicatorValue - Tile.EAST + 1) % 4;
        }
        return Tile.WHITE + (indicatorValue - Tile.WHITE + 1) % 3;
    }

    private static int indicatorIndex(int n) {
        return REPLACEMENT_SLOTS + n * 2;
    }
}
