package com.jpmahjong.engine;

import com.jpmahjong.model.GameState;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.Wall;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * 预设牌山（仅用于测试特定牌局）。
 * <p>
 * 指定各家配牌、庄家第一张摸牌、之后依次摸到的牌和王牌开头若干张，其余位置用剩下的牌按标准顺序补齐，
 * 得到一个 136 张的牌山顺序，交给 {@link GameEngine#setPresetWall(List)}。
 * <p>
 * 牌码格式同 {@link TileFactory#parse(String)}：123m456p789s1234567z，0m/0p/0s 为赤五。
 * 发牌顺序：从庄家起每人 4 张 × 3 轮，再每人 1 张，最后庄家摸第 14 张，共 53 张；
 * 王牌 14 张中，0～3 为岭上牌，4 为第一张宝牌指示牌。
 */
public final class WallPreset {

    private static final int HAND_SIZE = 13;
    private static final int DEALT_TILES = HAND_SIZE * GameState.PLAYER_COUNT + 1;

    private final int dealer;
    private final String[] hands = new String[GameState.PLAYER_COUNT];
    private String dealerDraw;
    private String draws = "";
    private String deadWall = "";
    private int redFivesPerSuit = 1;

    public WallPreset(int dealer) {
        this.dealer = dealer;
    }

    /** 某座位的 13 张配牌 */
    public WallPreset hand(int seat, String codes) {
        hands[seat] = codes;
        return this;
    }

    /** 庄家的第 14 张 */
    public WallPreset dealerDraw(String code) {
        this.dealerDraw = code;
        return this;
    }

    /** 发牌后从庄家下家起依次摸到的牌 */
    public WallPreset draws(String codes) {
        this.draws = codes;
        return this;
    }

    /** 王牌开头若干张 */
    public WallPreset deadWall(String codes) {
        this.deadWall = codes;
        return this;
    }

    public WallPreset redFives(int redFivesPerSuit) {
        this.redFivesPerSuit = redFivesPerSuit;
        return this;
    }

    /**
     * 生成 136 张牌山顺序
     *
     * @throws IllegalArgumentException 预设的牌超出一副牌的数量
     */
    public List<Tile> build() {
        List<Tile> pool = new ArrayList<>(TileFactory.createFullSet(redFivesPerSuit));

        // 先取走所有指定的牌，再用剩余的牌补齐
        List<List<Tile>> handTiles = new ArrayList<>();
        for (String codes : hands) {
            handTiles.add(take(pool, codes));
        }
        List<Tile> dealerDrawTile = take(pool, dealerDraw);
        List<Tile> drawTiles = take(pool, draws);
        List<Tile> deadTiles = take(pool, deadWall);

        for (int seat = 0; seat < GameState.PLAYER_COUNT; seat++) {
            List<Tile> hand = handTiles.get(seat);
            if (hand.size() > HAND_SIZE) {
                throw new IllegalArgumentException("座位 " + seat + " 配牌超过 13 张：" + hands[seat]);
            }
            fill(pool, hand, HAND_SIZE);
        }
        fill(pool, dealerDrawTile, 1);
        if (deadTiles.size() > Wall.DEAD_WALL_SIZE) {
            throw new IllegalArgumentException("王牌超过 14 张：" + deadWall);
        }
        int liveRest = Wall.TOTAL_TILES - Wall.DEAD_WALL_SIZE - DEALT_TILES - drawTiles.size();
        if (liveRest < 0) {
            throw new IllegalArgumentException("预设摸牌超过活牌墙张数：" + draws);
        }
        List<Tile> restLive = new ArrayList<>();
        fill(pool, restLive, liveRest);
        fill(pool, deadTiles, Wall.DEAD_WALL_SIZE);

        List<Tile> order = new ArrayList<>(Wall.TOTAL_TILES);
        List<Iterator<Tile>> dealing = new ArrayList<>();
        for (List<Tile> hand : handTiles) {
            dealing.add(hand.iterator());
        }
        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < GameState.PLAYER_COUNT; i++) {
                Iterator<Tile> it = dealing.get((dealer + i) % GameState.PLAYER_COUNT);
                for (int k = 0; k < 4; k++) {
                    order.add(it.next());
                }
            }
        }
        for (int i = 0; i < GameState.PLAYER_COUNT; i++) {
            order.add(dealing.get((dealer + i) % GameState.PLAYER_COUNT).next());
        }
        order.addAll(dealerDrawTile);
        order.addAll(drawTiles);
        order.addAll(restLive);
        order.addAll(deadTiles);
        return order;
    }

    private static List<Tile> take(List<Tile> pool, String codes) {
        List<Tile> taken = new ArrayList<>();
        if (codes == null || codes.isEmpty()) {
            return taken;
        }
        for (Tile tile : TileFactory.parse(codes)) {
            if (!pool.remove(tile)) {
                throw new IllegalArgumentException("预设的牌不足：" + tile + "（" + codes + "）");
            }
            taken.add(tile);
        }
        return taken;
    }

    private static void fill(List<Tile> pool, List<Tile> target, int size) {
        while (target.size() < size) {
            target.add(pool.remove(0));
        }
    }

    @Override
    public String toString() {
        return "WallPreset{dealer=" + dealer + ", hands=" + Arrays.toString(hands)
            + ", dealerDraw=" + dealerDraw + ", draws=" + draws + ", deadWall=" + deadWall + "}";
    }
}
